/*
 * どこで: Monitor 起動処理
 * 何を: 起動引数の callback を EnforcementAgent へ振り分ける
 * なぜ: callback 境界で例外を止め、失敗時も「変更なし」で正常終了させるため
 */
package com.example.monitor.worker;

import com.example.common.TraceIds;
import com.example.common.model.InvalidWindowIdException;
import com.example.common.model.WindowId;
import com.example.monitor.model.CallbackOutcome;
import com.example.monitor.model.CallbackType;
import com.example.monitor.service.EnforcementAgent;
import com.example.monitor.service.MonitorMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "monitor.dispatcher-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class CallbackDispatcher implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(CallbackDispatcher.class);
  private static final String CALLBACK_OPTION = "callback";
  private static final String WINDOW_ID_OPTION = "window-id";

  private final EnforcementAgent agent;
  private final MonitorMetrics metrics;
  private final Clock clock;

  public CallbackDispatcher(EnforcementAgent agent, MonitorMetrics metrics, Clock clock) {
    this.agent = agent;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public void run(ApplicationArguments args) {
    dispatch(firstOption(args, CALLBACK_OPTION), firstOption(args, WINDOW_ID_OPTION));
  }

  /**
   * 役割: 1 件の callback を同期的に処理する。
   * 動作: 引数が不正なら記録して無視する。処理中の RuntimeException はログとメトリクスに残し、
   *       NO_CHANGE を返す。
   * 前提: 例外をこのメソッドの外へ出さない。
   */
  public CallbackOutcome dispatch(String rawCallback, String rawWindowId) {
    MDC.put(TraceIds.MDC_KEY, TraceIds.currentOrNew());
    putIfPresent("callback", rawCallback);
    putIfPresent("window_id", rawWindowId);
    final Instant startedAt = Instant.now(clock);
    final String callbackTag = rawCallback == null ? "unknown" : rawCallback;
    try {
      final CallbackType type = CallbackType.fromValue(rawCallback);
      final WindowId windowId = WindowId.parse(rawWindowId);
      final CallbackOutcome outcome =
          switch (type) {
            case START -> agent.onStart(windowId);
            case END -> agent.onEnd(windowId);
            case WARNING_START, WARNING_END -> agent.onWarning(type, windowId);
          };
      metrics.recordCallback(type.value(), outcome.name().toLowerCase(Locale.ROOT));
      return outcome;
    } catch (InvalidWindowIdException | IllegalArgumentException ex) {
      logger.warn("callback ignored invalid arguments reason={}", ex.getMessage());
      metrics.recordCallback(callbackTag, "invalid");
      return CallbackOutcome.NO_CHANGE;
    } catch (RuntimeException ex) {
      logger.error("callback failed no restriction change applied", ex);
      metrics.recordCallbackError(callbackTag);
      return CallbackOutcome.NO_CHANGE;
    } finally {
      metrics.recordCallbackDuration(callbackTag, Duration.between(startedAt, Instant.now(clock)));
      MDC.remove("window_id");
      MDC.remove("callback");
      MDC.remove(TraceIds.MDC_KEY);
    }
  }

  private static String firstOption(ApplicationArguments args, String name) {
    final List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  private static void putIfPresent(String key, String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
    }
  }
}

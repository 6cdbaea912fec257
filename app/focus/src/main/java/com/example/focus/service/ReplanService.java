/*
 * どこで: Focus サービス層
 * 何を: 設定と礼拝時刻から計画を作り直し host 登録へ反映する
 * なぜ: 日付更新・設定変更・前面復帰など複数の契機を 1 つの手順に集約するため
 */
package com.example.focus.service;

import com.example.common.TraceIds;
import com.example.common.model.PrayerName;
import com.example.common.model.Window;
import com.example.focus.config.FocusProperties;
import com.example.focus.host.PrayerTimeSource;
import com.example.focus.model.PrayerOccurrence;
import com.example.focus.model.ReconcileResult;
import com.example.focus.model.ReplanTrigger;
import com.example.focus.repository.BlockingStateRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class ReplanService {

  private static final Logger logger = LoggerFactory.getLogger(ReplanService.class);
  private static final Duration BACK_TO_BACK_THRESHOLD = Duration.ofSeconds(3);

  private final PrayerTimeSource prayerTimeSource;
  private final PrayerWindowPlanner planner;
  private final ScheduleRegistrar registrar;
  private final BlockingStateRepository repository;
  private final FocusProperties properties;
  private final FocusMetrics metrics;
  private final Clock clock;
  private Instant lastReplanAt;

  public ReplanService(
      PrayerTimeSource prayerTimeSource,
      PrayerWindowPlanner planner,
      ScheduleRegistrar registrar,
      BlockingStateRepository repository,
      FocusProperties properties,
      FocusMetrics metrics,
      Clock clock) {
    this.prayerTimeSource = prayerTimeSource;
    this.planner = planner;
    this.registrar = registrar;
    this.repository = repository;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: 計画を作り直し、登録を突き合わせる。
   * 動作: FORCED は全解除してから登録し直す。それ以外は差分のみ反映する。
   * 前提: スケジューラと設定変更の双方から呼ばれるため直列化する。
   */
  public synchronized ReconcileResult replan(ReplanTrigger trigger) {
    final boolean ownsTrace = MDC.get(TraceIds.MDC_KEY) == null;
    if (ownsTrace) {
      MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    }
    try {
      final Instant now = Instant.now(clock);
      warnIfBackToBack(trigger, now);
      lastReplanAt = now;

      final LocalDate today = LocalDate.ofInstant(now, properties.zone());
      final List<PrayerOccurrence> occurrences =
          prayerTimeSource.upcoming(today, properties.planDays());
      final Set<PrayerName> enabledPrayers = repository.enabledPrayers();
      final Duration duration = repository.windowDuration();
      final List<Window> plan = planner.plan(occurrences, enabledPrayers, duration, now);

      final ReconcileResult result =
          trigger == ReplanTrigger.FORCED
              ? registrar.forceReschedule(plan)
              : registrar.reconcile(plan);
      metrics.recordReplan(trigger.name(), Duration.between(now, Instant.now(clock)));
      logger.info(
          "replan completed trigger={} occurrences={} enabled={} planned={} {}",
          trigger,
          occurrences.size(),
          enabledPrayers.size(),
          plan.size(),
          result.summary());
      return result;
    } finally {
      if (ownsTrace) {
        MDC.remove(TraceIds.MDC_KEY);
      }
    }
  }

  /** 登録をすべて止める。計画は次の replan まで空になる。 */
  public synchronized ReconcileResult stopAll() {
    return registrar.unregisterAll();
  }

  private void warnIfBackToBack(ReplanTrigger trigger, Instant now) {
    if (lastReplanAt == null) {
      return;
    }
    final Duration sinceLast = Duration.between(lastReplanAt, now);
    if (sinceLast.compareTo(BACK_TO_BACK_THRESHOLD) < 0) {
      logger.warn(
          "back-to-back replan trigger={} sinceLastMillis={}", trigger, sinceLast.toMillis());
    }
  }
}

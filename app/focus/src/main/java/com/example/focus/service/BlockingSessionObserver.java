/*
 * どこで: Focus サービス層
 * 何を: ストア変更通知と低頻度の tick でセッションを再計算し、変化を通知する
 * なぜ: ポーリングに頼らず agent の書き込みを画面状態へ反映するため
 */
package com.example.focus.service;

import com.example.common.state.StateChangeFeed;
import com.example.common.state.StateSubscription;
import com.example.focus.model.BlockingSession;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class BlockingSessionObserver {

  private static final Logger logger = LoggerFactory.getLogger(BlockingSessionObserver.class);

  private final BlockingSessionService sessionService;
  private final FocusMetrics metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateChangeFeed/ApplicationEventPublisher は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StateChangeFeed changeFeed;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateChangeFeed/ApplicationEventPublisher は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ApplicationEventPublisher eventPublisher;

  private final AtomicReference<BlockingSession> lastSession = new AtomicReference<>();
  private StateSubscription subscription;

  public BlockingSessionObserver(
      BlockingSessionService sessionService,
      FocusMetrics metrics,
      StateChangeFeed changeFeed,
      ApplicationEventPublisher eventPublisher) {
    this.sessionService = sessionService;
    this.metrics = metrics;
    this.changeFeed = changeFeed;
    this.eventPublisher = eventPublisher;
  }

  @PostConstruct
  public void start() {
    subscription = changeFeed.subscribe(this::onStateChanged);
    refresh();
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.close();
      subscription = null;
    }
  }

  @Scheduled(fixedDelayString = "${focus.observer-tick}")
  public void tick() {
    refresh();
  }

  /**
   * 役割: セッションを再計算し、利用者に見える状態が変わった場合だけイベントを発行する。
   * 動作: 読み取りに失敗した場合は直前のセッションを返し、次の通知か tick で再試行する。
   * 前提: 変更通知スレッドとスケジューラスレッドから並行に呼ばれうる。
   */
  public BlockingSession refresh() {
    final BlockingSession current;
    try {
      current = sessionService.currentSession();
    } catch (RuntimeException ex) {
      logger.warn("blocking session refresh failed", ex);
      metrics.recordDependencyError("session_refresh");
      return lastSession.get();
    }
    final BlockingSession previous = lastSession.getAndSet(current);
    if (!current.sameStatusAs(previous)) {
      metrics.recordSessionTransition(current.state().name());
      logger.info(
          "blocking session changed from={} to={} windowId={} blocking={}",
          previous == null ? null : previous.state(),
          current.state(),
          current.windowId(),
          current.blocking());
      eventPublisher.publishEvent(new BlockingSessionChangedEvent(previous, current));
    }
    return current;
  }

  public BlockingSession lastSession() {
    return lastSession.get();
  }

  private void onStateChanged(String keyName) {
    logger.debug("shared state changed key={}", keyName);
    refresh();
  }
}

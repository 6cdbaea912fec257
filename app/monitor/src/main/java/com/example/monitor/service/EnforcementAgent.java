/*
 * どこで: Monitor サービス層
 * 何を: window の開始/終了/警告 callback ごとに制限を適用・解除し、実施事実を書く
 * なぜ: main process の生存を前提にせず、ストアと id だけから判断を完結させるため
 */
package com.example.monitor.service;

import com.example.common.host.RestrictionEnforcementService;
import com.example.common.host.SelectionProvider;
import com.example.common.model.AwaitingConfirmation;
import com.example.common.model.BlockingMode;
import com.example.common.model.ClearReason;
import com.example.common.model.EnforcementOutcome;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.NoSelectionWarning;
import com.example.common.model.RestrictionSelection;
import com.example.common.model.Window;
import com.example.common.model.WindowId;
import com.example.monitor.model.CallbackOutcome;
import com.example.monitor.model.CallbackType;
import com.example.monitor.repository.EnforcementStateRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EnforcementAgent {

  private static final Logger logger = LoggerFactory.getLogger(EnforcementAgent.class);
  private static final String NO_SELECTION_TITLE = "Prayer block skipped";
  private static final String NO_SELECTION_BODY =
      "No apps were selected, so nothing was blocked for this prayer.";

  private final EnforcementStateRepository repository;
  private final RestrictionEnforcementService restrictionEnforcementService;
  private final SelectionProvider selectionProvider;
  private final IntentReconciler intentReconciler;
  private final MonitoredWindowTracker monitoredWindowTracker;
  private final LocalNotifier localNotifier;
  private final MonitorMetrics metrics;
  private final Clock clock;

  /**
   * 役割: window 開始時に制限を適用する。
   * 動作: 今この時点の設定で礼拝が無効ならスキップを記録し、選択が空なら警告と通知だけ行う。
   *       適用時は先行する適用中の記録と確認待ちを置き換える。
   *       終了時刻を過ぎてから届いた開始 callback では制限に触れずスキップを記録する。
   * 前提: 同じ window の再実行は既存記録があれば何もしない。
   */
  public CallbackOutcome onStart(WindowId windowId) {
    final Instant now = Instant.now(clock);
    intentReconciler.consume(now);

    final Optional<EnforcementRecord> existing = repository.record(windowId);
    if (existing.isPresent() && !existing.get().isSkipped()) {
      logger.info(
          "window start replay ignored windowId={} active={}", windowId, existing.get().isActive());
      return CallbackOutcome.NO_CHANGE;
    }

    final BlockingMode mode = repository.mode();
    final Window window = repository.windowFor(windowId);
    if (!now.isBefore(window.endTime())) {
      repository.saveRecord(
          EnforcementRecord.skipped(windowId, EnforcementOutcome.SKIPPED_EXPIRED, mode, now), now);
      logger.warn(
          "window start arrived after window end nothing applied windowId={} end={}",
          windowId,
          window.endTime());
      return CallbackOutcome.SKIPPED_EXPIRED;
    }

    if (!repository.enabledPrayers().contains(windowId.prayerName())) {
      repository.saveRecord(
          EnforcementRecord.skipped(
              windowId, EnforcementOutcome.SKIPPED_DESELECTED, mode, now),
          now);
      monitoredWindowTracker.add(windowId, now);
      logger.info("window skipped prayer deselected windowId={}", windowId);
      return CallbackOutcome.SKIPPED_DESELECTED;
    }

    final RestrictionSelection selection = selectionProvider.currentSelection();
    if (selection.isEmpty()) {
      return skipForEmptySelection(windowId, mode, now);
    }

    restrictionEnforcementService.apply(selection);
    supersedeEarlierWindows(windowId, now);
    if (repository.noSelectionWarning().map(NoSelectionWarning::active).orElse(false)) {
      repository.removeNoSelectionWarning();
    }
    repository.saveRecord(EnforcementRecord.applied(windowId, now, mode), now);
    repository.saveEnforcementStartTime(now);
    repository.saveCurrentlyEnforced(true);
    monitoredWindowTracker.add(windowId, now);
    logger.info(
        "window restrictions applied windowId={} mode={} {}", windowId, mode, selection.summary());
    return CallbackOutcome.APPLIED;
  }

  /**
   * 役割: window 終了時に制限を解除する、または確認待ちへ移す。
   * 動作: 終了時点のモードが NORMAL なら即時解除、STRICT なら適用したまま確認待ちを書く。
   *       適用されなかった window や解除済みの window では制限に触れない。
   * 前提: 監視中 id からは常に取り除く。
   */
  public CallbackOutcome onEnd(WindowId windowId) {
    final Instant now = Instant.now(clock);
    intentReconciler.consume(now);
    monitoredWindowTracker.remove(windowId, now);

    final Optional<EnforcementRecord> record = repository.record(windowId);
    if (record.isEmpty() || !record.get().isActive()) {
      logger.info(
          "window end without active restrictions windowId={} outcome={}",
          windowId,
          record.map(EnforcementRecord::outcome).orElse(null));
      return CallbackOutcome.NO_CHANGE;
    }

    final BlockingMode mode = repository.mode();
    if (mode == BlockingMode.NORMAL) {
      restrictionEnforcementService.clear();
      repository.saveRecord(record.get().cleared(now, ClearReason.WINDOW_END), now);
      repository.saveCurrentlyEnforced(false);
      logger.info("window restrictions cleared windowId={}", windowId);
      return CallbackOutcome.CLEARED;
    }

    final boolean alreadyAwaiting =
        repository
            .awaitingConfirmation()
            .map(AwaitingConfirmation::windowId)
            .filter(windowId::equals)
            .isPresent();
    if (!alreadyAwaiting) {
      repository.saveAwaitingConfirmation(new AwaitingConfirmation(windowId, now));
    }
    logger.info("window ended in strict mode awaiting confirmation windowId={}", windowId);
    return CallbackOutcome.AWAITING_CONFIRMATION;
  }

  /** 計画と実際の適用状況をログに出す。ストアにも制限にも書き込まない。 */
  public CallbackOutcome onWarning(CallbackType type, WindowId windowId) {
    final boolean planned =
        repository.plannedWindows().stream().anyMatch(window -> window.id().equals(windowId));
    final RestrictionSelection selection = selectionProvider.currentSelection();
    final Optional<RestrictionSelection> applied = restrictionEnforcementService.currentlyApplied();
    logger.info(
        "window warning callback={} windowId={} planned={} selection=[{}] applied=[{}]",
        type.value(),
        windowId,
        planned,
        selection.summary(),
        applied.map(RestrictionSelection::summary).orElse("none"));
    return CallbackOutcome.DIAGNOSTICS;
  }

  private CallbackOutcome skipForEmptySelection(WindowId windowId, BlockingMode mode, Instant now) {
    final boolean alreadyNotified =
        repository
            .noSelectionWarning()
            .filter(NoSelectionWarning::active)
            .map(NoSelectionWarning::windowId)
            .filter(windowId::equals)
            .isPresent();
    repository.saveNoSelectionWarning(new NoSelectionWarning(true, now, windowId));
    repository.saveRecord(
        EnforcementRecord.skipped(windowId, EnforcementOutcome.SKIPPED_NO_SELECTION, mode, now),
        now);
    monitoredWindowTracker.add(windowId, now);
    if (!alreadyNotified) {
      localNotifier.notify("no-selection-" + windowId.value(), NO_SELECTION_TITLE, NO_SELECTION_BODY);
      metrics.recordNotification();
    }
    logger.warn("window start with empty selection nothing applied windowId={}", windowId);
    return CallbackOutcome.SKIPPED_NO_SELECTION;
  }

  private void supersedeEarlierWindows(WindowId windowId, Instant now) {
    for (EnforcementRecord record : repository.records()) {
      if (record.isActive() && !record.windowId().equals(windowId)) {
        repository.saveRecord(record.cleared(now, ClearReason.SUPERSEDED), now);
        logger.info(
            "earlier window superseded windowId={} by={}", record.windowId(), windowId);
      }
    }
    repository
        .awaitingConfirmation()
        .filter(awaiting -> !awaiting.windowId().equals(windowId))
        .ifPresent(
            awaiting -> {
              repository.removeAwaitingConfirmation();
              logger.info(
                  "strict hold overwritten by next window windowId={} by={}",
                  awaiting.windowId(),
                  windowId);
            });
  }
}

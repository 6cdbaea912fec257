/*
 * どこで: Focus サービス層
 * 何を: ストアの事実と現在時刻からブロック状態を導出する
 * なぜ: 2 プロセスがオブジェクトを共有できないため、状態を追跡せず毎回再計算するため
 */
package com.example.focus.service;

import com.example.common.model.AwaitingConfirmation;
import com.example.common.model.BlockingMode;
import com.example.common.model.ClearReason;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.Window;
import com.example.focus.config.FocusProperties;
import com.example.focus.model.BlockingFacts;
import com.example.focus.model.BlockingSession;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BlockingStateMachine {

  private final FocusProperties properties;

  /**
   * 役割: now 時点のセッションを返す。
   * 動作: 確認待ち → 適用中の記録 → 次の計画 window の順に判定する。適用中でも
   *       早期解除トークンや確認が同じ window を指していれば解除済みとして扱う。
   * 前提: 副作用なし。facts は古い可能性のあるスナップショットでよい。
   */
  public BlockingSession evaluate(Instant now, BlockingFacts facts) {
    final AwaitingConfirmation awaiting = facts.awaiting();
    if (awaiting != null && !facts.confirmedFor(awaiting.windowId())) {
      return BlockingSession.awaitingConfirmation(awaiting.windowId());
    }
    final Optional<EnforcementRecord> latest = facts.latestRecordStartedBy(now);
    if (latest.isPresent()) {
      final EnforcementRecord record = latest.get();
      final Window window = facts.windowFor(record.windowId());
      if (record.isActive()) {
        return evaluateApplied(now, facts, window);
      }
      if (releasedByUser(record) && window.contains(now)) {
        return BlockingSession.cleared(window);
      }
    }
    return scheduledOrIdle(now, facts);
  }

  /** 早期解除が可能になるまでに window 開始から必要な経過時間。 */
  public Duration earlyUnlockDelay(Duration windowDuration) {
    final Duration byFraction =
        Duration.ofMillis((long) (windowDuration.toMillis() * properties.earlyUnlockThreshold()));
    final Duration minimum = properties.earlyUnlockMinimumDelay();
    return byFraction.compareTo(minimum) > 0 ? byFraction : minimum;
  }

  private BlockingSession evaluateApplied(Instant now, BlockingFacts facts, Window window) {
    if (facts.earlyUnlockUsedFor(window.id()) || facts.confirmedFor(window.id())) {
      return window.contains(now) ? BlockingSession.cleared(window) : scheduledOrIdle(now, facts);
    }
    if (!now.isBefore(window.endTime())) {
      // agent の end callback 前でも、終了時刻を過ぎたら現在のモードに従って扱う
      return facts.mode() == BlockingMode.STRICT
          ? BlockingSession.awaitingConfirmation(window.id())
          : scheduledOrIdle(now, facts);
    }
    final Duration remaining = Duration.between(now, window.endTime());
    if (facts.mode() != BlockingMode.NORMAL) {
      return BlockingSession.active(window, remaining, false, Duration.ZERO);
    }
    final Duration required = earlyUnlockDelay(window.duration());
    final Duration elapsed = Duration.between(window.startTime(), now);
    final boolean available = elapsed.compareTo(required) >= 0;
    return BlockingSession.active(
        window, remaining, available, available ? Duration.ZERO : required.minus(elapsed));
  }

  private BlockingSession scheduledOrIdle(Instant now, BlockingFacts facts) {
    return facts
        .nextWindowAfter(now)
        .map(BlockingSession::scheduled)
        .orElseGet(BlockingSession::idle);
  }

  private boolean releasedByUser(EnforcementRecord record) {
    return record.clearedAt() != null
        && (record.clearReason() == ClearReason.EARLY_UNLOCK
            || record.clearReason() == ClearReason.CONFIRMED);
  }
}

/*
 * どこで: Monitor サービス層
 * 何を: main process が書いた確認/早期解除の意図を実施事実へ反映する
 * なぜ: 解除の事実(clearedAt など)を agent 所有キーの単一書き込み者として記録するため
 */
package com.example.monitor.service;

import com.example.common.host.RestrictionEnforcementService;
import com.example.common.model.AwaitingConfirmation;
import com.example.common.model.ClearReason;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.WindowId;
import com.example.monitor.repository.EnforcementStateRepository;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IntentReconciler {

  private static final Logger logger = LoggerFactory.getLogger(IntentReconciler.class);

  private final EnforcementStateRepository repository;
  private final RestrictionEnforcementService restrictionEnforcementService;

  /**
   * 役割: 未反映の意図を取り込む。
   * 動作: 意図が指す window の記録が適用中なら解除し、同じ window の確認待ちを消す。
   *       既に解除済みであれば何もしないため、何度呼んでも結果は同じ。
   * 前提: start/end callback の処理前に呼ぶ。
   */
  public void consume(Instant now) {
    repository
        .confirmation()
        .ifPresent(intent -> release(intent.windowId(), ClearReason.CONFIRMED, now));
    repository
        .earlyUnlockToken()
        .ifPresent(token -> release(token.windowId(), ClearReason.EARLY_UNLOCK, now));
  }

  private void release(WindowId windowId, ClearReason reason, Instant now) {
    final Optional<EnforcementRecord> record = repository.record(windowId);
    final boolean awaitingThisWindow =
        repository
            .awaitingConfirmation()
            .map(AwaitingConfirmation::windowId)
            .filter(windowId::equals)
            .isPresent();
    if (record.isEmpty() || !record.get().isActive()) {
      if (awaitingThisWindow) {
        repository.removeAwaitingConfirmation();
      }
      return;
    }
    restrictionEnforcementService.clear();
    repository.saveRecord(record.get().cleared(now, reason), now);
    repository.saveCurrentlyEnforced(false);
    if (awaitingThisWindow) {
      repository.removeAwaitingConfirmation();
    }
    logger.info("user release applied windowId={} reason={}", windowId, reason);
  }
}

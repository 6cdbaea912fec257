/*
 * どこで: 共通ドメインモデル
 * 何を: window ごとに agent が実際に行った制限の事実を表現する
 * なぜ: 計画ではなく実施結果を main process の判定材料にするため
 */
package com.example.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

public record EnforcementRecord(
    WindowId windowId,
    EnforcementOutcome outcome,
    Instant appliedAt,
    Instant clearedAt,
    ClearReason clearReason,
    BlockingMode mode,
    Instant recordedAt) {

  public static EnforcementRecord applied(WindowId windowId, Instant appliedAt, BlockingMode mode) {
    return new EnforcementRecord(
        windowId, EnforcementOutcome.APPLIED, appliedAt, null, null, mode, appliedAt);
  }

  public static EnforcementRecord skipped(
      WindowId windowId, EnforcementOutcome outcome, BlockingMode mode, Instant recordedAt) {
    return new EnforcementRecord(windowId, outcome, null, null, null, mode, recordedAt);
  }

  public EnforcementRecord cleared(Instant clearedAt, ClearReason reason) {
    return new EnforcementRecord(
        windowId, outcome, appliedAt, clearedAt, reason, mode, recordedAt);
  }

  /** 適用済みかつ未解除であれば true。 */
  @JsonIgnore
  public boolean isActive() {
    return outcome == EnforcementOutcome.APPLIED && appliedAt != null && clearedAt == null;
  }

  @JsonIgnore
  public boolean isSkipped() {
    return outcome != EnforcementOutcome.APPLIED;
  }
}

/*
 * どこで: Focus ドメインモデル
 * 何を: 状態判定に必要なストア値のスナップショットを束ねる
 * なぜ: 判定を読み取りから切り離し、時刻とスナップショットだけの純粋関数にするため
 */
package com.example.focus.model;

import com.example.common.model.AwaitingConfirmation;
import com.example.common.model.BlockingMode;
import com.example.common.model.ConfirmationIntent;
import com.example.common.model.EarlyUnlockToken;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.Window;
import com.example.common.model.WindowId;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public record BlockingFacts(
    List<Window> plannedWindows,
    List<EnforcementRecord> records,
    BlockingMode mode,
    Duration windowDuration,
    AwaitingConfirmation awaiting,
    ConfirmationIntent confirmation,
    EarlyUnlockToken earlyUnlockToken) {

  public BlockingFacts {
    plannedWindows = plannedWindows == null ? List.of() : List.copyOf(plannedWindows);
    records = records == null ? List.of() : List.copyOf(records);
  }

  /** now 以前に開始した window の記録のうち、開始が最も遅いもの。 */
  public Optional<EnforcementRecord> latestRecordStartedBy(Instant now) {
    return records.stream()
        .filter(record -> !record.windowId().startTime().isAfter(now))
        .max(Comparator.comparing(record -> record.windowId().startTime()));
  }

  public Optional<Window> plannedWindow(WindowId windowId) {
    return plannedWindows.stream().filter(window -> window.id().equals(windowId)).findFirst();
  }

  public Optional<Window> nextWindowAfter(Instant now) {
    return plannedWindows.stream()
        .filter(window -> window.startTime().isAfter(now))
        .min(Comparator.comparing(Window::startTime));
  }

  /** 計画から外れた window でも id と現在の長さ設定から区間を復元する。 */
  public Window windowFor(WindowId windowId) {
    return plannedWindow(windowId)
        .orElseGet(
            () ->
                new Window(windowId, windowId.prayerName(), windowId.startTime(), windowDuration));
  }

  public boolean confirmedFor(WindowId windowId) {
    return confirmation != null && windowId.equals(confirmation.windowId());
  }

  public boolean earlyUnlockUsedFor(WindowId windowId) {
    return earlyUnlockToken != null && earlyUnlockToken.isUsedFor(windowId);
  }
}

/*
 * どこで: Monitor リポジトリ
 * 何を: agent から見た共有状態の読み書きを型付きで提供する
 * なぜ: 記録の置き換え・保持期間の刈り込みを 1 箇所にまとめ、callback の再実行を安全にするため
 */
package com.example.monitor.repository;

import com.example.common.model.AwaitingConfirmation;
import com.example.common.model.BlockingMode;
import com.example.common.model.ConfirmationIntent;
import com.example.common.model.EarlyUnlockToken;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.NoSelectionWarning;
import com.example.common.model.PrayerName;
import com.example.common.model.Window;
import com.example.common.model.WindowId;
import com.example.common.state.SharedStateStore;
import com.example.common.state.StateKeys;
import com.example.monitor.config.MonitorProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EnforcementStateRepository {

  private final SharedStateStore store;
  private final MonitorProperties properties;

  // FOCUS 所有キー (読み取りのみ)

  public BlockingMode mode() {
    return store.read(StateKeys.MODE).orElse(BlockingMode.NORMAL);
  }

  public Set<PrayerName> enabledPrayers() {
    return store
        .read(StateKeys.ENABLED_PRAYERS)
        .<Set<PrayerName>>map(prayers -> prayers.isEmpty() ? Set.of() : EnumSet.copyOf(prayers))
        .orElseGet(() -> EnumSet.allOf(PrayerName.class));
  }

  public List<Window> plannedWindows() {
    return store.read(StateKeys.PLANNED_WINDOWS).orElseGet(List::of);
  }

  public Duration windowDuration() {
    return store.read(StateKeys.WINDOW_DURATION).orElse(properties.defaultWindowDuration());
  }

  /** 計画から外れた window でも id と現在の長さ設定から区間を復元する。 */
  public Window windowFor(WindowId windowId) {
    return plannedWindows().stream()
        .filter(window -> window.id().equals(windowId))
        .findFirst()
        .orElseGet(
            () ->
                new Window(
                    windowId, windowId.prayerName(), windowId.startTime(), windowDuration()));
  }

  public Optional<ConfirmationIntent> confirmation() {
    return store.read(StateKeys.CONFIRMATION);
  }

  public Optional<EarlyUnlockToken> earlyUnlockToken() {
    return store.read(StateKeys.EARLY_UNLOCK_TOKEN);
  }

  // MONITOR 所有キー

  public List<EnforcementRecord> records() {
    return store.read(StateKeys.ENFORCEMENT_RECORDS).orElseGet(List::of);
  }

  public Optional<EnforcementRecord> record(WindowId windowId) {
    return records().stream().filter(record -> record.windowId().equals(windowId)).findFirst();
  }

  /**
   * 役割: window 単位で記録を置き換える。
   * 動作: 同じ windowId の既存記録を差し替え、保持期間を過ぎた解除済み/スキップ記録を刈り込む。
   *       適用中の記録は期間に関わらず残す。
   * 前提: now は呼び出し側の時計で取得した時刻。
   */
  public void saveRecord(EnforcementRecord record, Instant now) {
    final Instant cutoff = now.minus(properties.retention().recordRetention());
    final List<EnforcementRecord> records = new ArrayList<>();
    for (EnforcementRecord existing : records()) {
      if (existing.windowId().equals(record.windowId())) {
        continue;
      }
      if (!existing.isActive() && existing.recordedAt().isBefore(cutoff)) {
        continue;
      }
      records.add(existing);
    }
    records.add(record);
    records.sort(Comparator.comparing(existing -> existing.windowId().startTime()));
    store.write(StateKeys.ENFORCEMENT_RECORDS, records);
  }

  public void saveCurrentlyEnforced(boolean enforced) {
    store.write(StateKeys.CURRENTLY_ENFORCED, enforced);
  }

  public Optional<AwaitingConfirmation> awaitingConfirmation() {
    return store.read(StateKeys.AWAITING_CONFIRMATION);
  }

  public void saveAwaitingConfirmation(AwaitingConfirmation awaiting) {
    store.write(StateKeys.AWAITING_CONFIRMATION, awaiting);
  }

  public void removeAwaitingConfirmation() {
    store.remove(StateKeys.AWAITING_CONFIRMATION);
  }

  public void saveEnforcementStartTime(Instant startedAt) {
    store.write(StateKeys.ENFORCEMENT_START_TIME, startedAt);
  }

  public Optional<NoSelectionWarning> noSelectionWarning() {
    return store.read(StateKeys.NO_SELECTION_WARNING);
  }

  public void saveNoSelectionWarning(NoSelectionWarning warning) {
    store.write(StateKeys.NO_SELECTION_WARNING, warning);
  }

  public void removeNoSelectionWarning() {
    store.remove(StateKeys.NO_SELECTION_WARNING);
  }

  public List<WindowId> monitoredWindowIds() {
    return store.read(StateKeys.CURRENTLY_MONITORED_WINDOW_IDS).orElseGet(List::of);
  }

  public void saveMonitoredWindowIds(List<WindowId> windowIds) {
    store.write(StateKeys.CURRENTLY_MONITORED_WINDOW_IDS, List.copyOf(windowIds));
  }
}

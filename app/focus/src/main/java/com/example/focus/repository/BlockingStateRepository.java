/*
 * どこで: Focus リポジトリ
 * 何を: main process から見た共有状態の読み書きを型付きで提供する
 * なぜ: キー定義と既定値の扱いをサービス層から隠すため
 */
package com.example.focus.repository;

import com.example.common.model.AuthorizationFlag;
import com.example.common.model.AwaitingConfirmation;
import com.example.common.model.BlockingMode;
import com.example.common.model.ConfirmationIntent;
import com.example.common.model.EarlyUnlockToken;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.NoSelectionWarning;
import com.example.common.model.PrayerName;
import com.example.common.model.RestrictionSelection;
import com.example.common.model.Window;
import com.example.common.model.WindowId;
import com.example.common.state.SharedStateStore;
import com.example.common.state.StateKeys;
import com.example.focus.config.FocusProperties;
import com.example.focus.model.BlockingFacts;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class BlockingStateRepository {

  private final SharedStateStore store;
  private final FocusProperties properties;

  public BlockingFacts snapshot() {
    return new BlockingFacts(
        plannedWindows(),
        enforcementRecords(),
        mode(),
        windowDuration(),
        awaitingConfirmation().orElse(null),
        confirmation().orElse(null),
        earlyUnlockToken().orElse(null));
  }

  // 設定 (FOCUS 所有)

  public BlockingMode mode() {
    return store.read(StateKeys.MODE).orElse(BlockingMode.NORMAL);
  }

  public void saveMode(BlockingMode mode) {
    store.write(StateKeys.MODE, mode);
  }

  /** 未設定なら全礼拝を有効とみなす。 */
  public Set<PrayerName> enabledPrayers() {
    return store
        .read(StateKeys.ENABLED_PRAYERS)
        .<Set<PrayerName>>map(prayers -> prayers.isEmpty() ? Set.of() : EnumSet.copyOf(prayers))
        .orElseGet(() -> EnumSet.allOf(PrayerName.class));
  }

  public void saveEnabledPrayers(Set<PrayerName> prayers) {
    store.write(StateKeys.ENABLED_PRAYERS, Set.copyOf(prayers));
  }

  public Duration windowDuration() {
    return store.read(StateKeys.WINDOW_DURATION).orElse(properties.defaultWindowDuration());
  }

  public void saveWindowDuration(Duration duration) {
    store.write(StateKeys.WINDOW_DURATION, duration);
  }

  public RestrictionSelection selection() {
    return store.read(StateKeys.SELECTION).orElseGet(RestrictionSelection::empty);
  }

  public void saveSelection(RestrictionSelection selection) {
    store.write(StateKeys.SELECTION, selection);
  }

  // 計画と登録 (FOCUS 所有)

  public List<Window> plannedWindows() {
    return store.read(StateKeys.PLANNED_WINDOWS).orElseGet(List::of);
  }

  public void savePlannedWindows(List<Window> windows) {
    store.write(StateKeys.PLANNED_WINDOWS, List.copyOf(windows));
  }

  public List<WindowId> registeredWindowIds() {
    return store.read(StateKeys.REGISTERED_WINDOW_IDS).orElseGet(List::of);
  }

  public void saveRegisteredWindowIds(List<WindowId> windowIds) {
    store.write(StateKeys.REGISTERED_WINDOW_IDS, List.copyOf(windowIds));
  }

  public AuthorizationFlag authorizationFlag() {
    return store.read(StateKeys.NEEDS_AUTHORIZATION).orElseGet(AuthorizationFlag::notRequired);
  }

  public void saveAuthorizationFlag(AuthorizationFlag flag) {
    store.write(StateKeys.NEEDS_AUTHORIZATION, flag);
  }

  // 意図 (FOCUS 所有、agent が次回起動時に反映)

  public Optional<ConfirmationIntent> confirmation() {
    return store.read(StateKeys.CONFIRMATION);
  }

  public void saveConfirmation(ConfirmationIntent intent) {
    store.write(StateKeys.CONFIRMATION, intent);
  }

  public Optional<EarlyUnlockToken> earlyUnlockToken() {
    return store.read(StateKeys.EARLY_UNLOCK_TOKEN);
  }

  public void saveEarlyUnlockToken(EarlyUnlockToken token) {
    store.write(StateKeys.EARLY_UNLOCK_TOKEN, token);
  }

  // 実施事実 (MONITOR 所有、読み取りのみ)

  public List<EnforcementRecord> enforcementRecords() {
    return store.read(StateKeys.ENFORCEMENT_RECORDS).orElseGet(List::of);
  }

  public Optional<AwaitingConfirmation> awaitingConfirmation() {
    return store.read(StateKeys.AWAITING_CONFIRMATION);
  }

  /** agent が最後に書いた値。確認や早期解除は次の callback まで反映されない。 */
  public boolean currentlyEnforced() {
    return store.read(StateKeys.CURRENTLY_ENFORCED).orElse(false);
  }

  public Optional<NoSelectionWarning> noSelectionWarning() {
    return store.read(StateKeys.NO_SELECTION_WARNING);
  }

  public List<WindowId> monitoredWindowIds() {
    return store.read(StateKeys.CURRENTLY_MONITORED_WINDOW_IDS).orElseGet(List::of);
  }
}

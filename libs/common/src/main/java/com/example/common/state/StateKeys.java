/*
 * どこで: 共有状態ストア
 * 何を: 2 プロセス間で共有するキーのスキーマを定義する
 * なぜ: キーごとの書き込み者と値の型を 1 箇所で管理するため
 */
package com.example.common.state;

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
import com.fasterxml.jackson.core.type.TypeReference;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

public final class StateKeys {

  public static final int SCHEMA_VERSION = 1;
  public static final String KEY_PREFIX = "pb:v" + SCHEMA_VERSION + ":";
  public static final String CHANGE_CHANNEL = KEY_PREFIX + "changes";

  // FOCUS (main process) が書き込むキー
  public static final StateKey<List<Window>> PLANNED_WINDOWS =
      StateKey.of("planned-windows", StateOwner.FOCUS, new TypeReference<>() {});
  public static final StateKey<BlockingMode> MODE =
      StateKey.of("mode", StateOwner.FOCUS, new TypeReference<>() {});
  public static final StateKey<Set<PrayerName>> ENABLED_PRAYERS =
      StateKey.of("enabled-prayers", StateOwner.FOCUS, new TypeReference<>() {});
  public static final StateKey<Duration> WINDOW_DURATION =
      StateKey.of("window-duration", StateOwner.FOCUS, new TypeReference<>() {});
  public static final StateKey<RestrictionSelection> SELECTION =
      StateKey.of("selection", StateOwner.FOCUS, new TypeReference<>() {});
  public static final StateKey<EarlyUnlockToken> EARLY_UNLOCK_TOKEN =
      StateKey.of("early-unlock-used-for-window-id", StateOwner.FOCUS, new TypeReference<>() {});
  public static final StateKey<ConfirmationIntent> CONFIRMATION =
      StateKey.of("confirmation", StateOwner.FOCUS, new TypeReference<>() {});
  public static final StateKey<AuthorizationFlag> NEEDS_AUTHORIZATION =
      StateKey.of("needs-authorization", StateOwner.FOCUS, new TypeReference<>() {});
  public static final StateKey<List<WindowId>> REGISTERED_WINDOW_IDS =
      StateKey.of("registered-window-ids", StateOwner.FOCUS, new TypeReference<>() {});

  // MONITOR (agent process) が書き込むキー
  public static final StateKey<List<EnforcementRecord>> ENFORCEMENT_RECORDS =
      StateKey.of("enforcement-records", StateOwner.MONITOR, new TypeReference<>() {});
  public static final StateKey<Boolean> CURRENTLY_ENFORCED =
      StateKey.of("currently-enforced", StateOwner.MONITOR, new TypeReference<>() {});
  public static final StateKey<AwaitingConfirmation> AWAITING_CONFIRMATION =
      StateKey.of("awaiting-confirmation", StateOwner.MONITOR, new TypeReference<>() {});
  public static final StateKey<Instant> ENFORCEMENT_START_TIME =
      StateKey.of("enforcement-start-time", StateOwner.MONITOR, new TypeReference<>() {});
  public static final StateKey<NoSelectionWarning> NO_SELECTION_WARNING =
      StateKey.of("no-selection-warning", StateOwner.MONITOR, new TypeReference<>() {});
  public static final StateKey<List<WindowId>> CURRENTLY_MONITORED_WINDOW_IDS =
      StateKey.of("currently-monitored-window-ids", StateOwner.MONITOR, new TypeReference<>() {});

  private StateKeys() {}
}

/*
 * どこで: Focus ドメインモデル
 * 何を: 画面へ提示するブロック状態の導出結果を表現する
 * なぜ: 保存せず毎回導出する読み取りモデルとして不変値で扱うため
 */
package com.example.focus.model;

import com.example.common.model.PrayerName;
import com.example.common.model.Window;
import com.example.common.model.WindowId;
import java.time.Duration;
import java.util.Objects;

public record BlockingSession(
    SessionState state,
    WindowId windowId,
    PrayerName prayerName,
    boolean blocking,
    boolean waitingConfirmation,
    Duration timeRemaining,
    boolean earlyUnlockAvailable,
    Duration earlyUnlockAvailableIn) {

  public static BlockingSession idle() {
    return new BlockingSession(
        SessionState.IDLE, null, null, false, false, Duration.ZERO, false, Duration.ZERO);
  }

  public static BlockingSession scheduled(Window next) {
    return new BlockingSession(
        SessionState.SCHEDULED,
        next.id(),
        next.prayerName(),
        false,
        false,
        Duration.ZERO,
        false,
        Duration.ZERO);
  }

  public static BlockingSession active(
      Window window, Duration timeRemaining, boolean unlockAvailable, Duration unlockIn) {
    return new BlockingSession(
        SessionState.ACTIVE,
        window.id(),
        window.prayerName(),
        true,
        false,
        timeRemaining,
        unlockAvailable,
        unlockIn);
  }

  public static BlockingSession awaitingConfirmation(WindowId windowId) {
    return new BlockingSession(
        SessionState.AWAITING_CONFIRMATION,
        windowId,
        windowId.prayerName(),
        true,
        true,
        Duration.ZERO,
        false,
        Duration.ZERO);
  }

  public static BlockingSession cleared(Window window) {
    return new BlockingSession(
        SessionState.CLEARED,
        window.id(),
        window.prayerName(),
        false,
        false,
        Duration.ZERO,
        false,
        Duration.ZERO);
  }

  /** 残り時間の変化を無視して、利用者に見える状態が同じかを判定する。 */
  public boolean sameStatusAs(BlockingSession other) {
    return other != null
        && state == other.state
        && Objects.equals(windowId, other.windowId)
        && blocking == other.blocking
        && waitingConfirmation == other.waitingConfirmation
        && earlyUnlockAvailable == other.earlyUnlockAvailable;
  }
}

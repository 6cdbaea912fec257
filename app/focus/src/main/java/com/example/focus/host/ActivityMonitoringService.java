/*
 * どこで: host 連携ポート
 * 何を: window 境界で agent を起動させる監視登録を抽象化する
 * なぜ: OS の監視機構と登録上限を Registrar から切り離してテスト可能にするため
 */
package com.example.focus.host;

import com.example.common.model.WindowId;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ActivityMonitoringService {

  /**
   * 役割: window を host に登録し、開始/終了/警告の callback を予約する。
   * 動作: 同じ id の再登録は置き換えとして扱う。拒否時は ActivityRegistrationException を送出する。
   * 前提: start は end より前であること。
   */
  void register(WindowId windowId, Instant start, Instant end, Duration warningOffset);

  /** 未登録の id は無視する。 */
  void unregister(Collection<WindowId> windowIds);

  /** 診断用。 */
  List<WindowId> registeredWindowIds();
}

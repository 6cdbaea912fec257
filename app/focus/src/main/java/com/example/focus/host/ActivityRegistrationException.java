/*
 * どこで: host 連携ポート
 * 何を: host による監視登録の拒否を表現する
 * なぜ: 認可取り消し/上限到達を致命扱いせず再認可フラグへ変換するため
 */
package com.example.focus.host;

import com.example.common.model.WindowId;

public class ActivityRegistrationException extends RuntimeException {

  private final WindowId windowId;

  public ActivityRegistrationException(WindowId windowId, String reason) {
    super("activity registration rejected windowId=" + windowId + " reason=" + reason);
    this.windowId = windowId;
  }

  public WindowId windowId() {
    return windowId;
  }
}

/*
 * どこで: 共通ドメインモデル
 * 何を: host 登録拒否時に立てる再認可要求フラグ
 * なぜ: 登録失敗を致命扱いせず UI へ伝えるため
 */
package com.example.common.model;

import java.time.Instant;

public record AuthorizationFlag(boolean required, Instant flaggedAt, String reason) {

  public static AuthorizationFlag notRequired() {
    return new AuthorizationFlag(false, null, null);
  }
}

/*
 * どこで: 共通ドメインモデル
 * 何を: window 単位で 1 回だけ使える早期解除の使用記録
 * なぜ: 同一 window での再解除を防ぎ、次 window では自動で再武装させるため
 */
package com.example.common.model;

import java.time.Instant;

public record EarlyUnlockToken(WindowId windowId, Instant usedAt) {

  public boolean isUsedFor(WindowId other) {
    return windowId.equals(other);
  }
}

/*
 * どこで: 共通ドメインモデル
 * 何を: 制限が解除された経路を定義する
 * なぜ: 終了/確認/早期解除/次 window 上書きを記録で区別するため
 */
package com.example.common.model;

public enum ClearReason {
  WINDOW_END,
  CONFIRMED,
  EARLY_UNLOCK,
  SUPERSEDED
}

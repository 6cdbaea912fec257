/*
 * どこで: 共通ドメインモデル
 * 何を: window 終了時の振る舞いを決めるモードを定義する
 * なぜ: NORMAL は即時解除、STRICT は確認待ちに分岐させるため
 */
package com.example.common.model;

public enum BlockingMode {
  NORMAL,
  STRICT
}

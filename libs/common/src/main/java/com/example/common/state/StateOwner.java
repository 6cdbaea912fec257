/*
 * どこで: 共有状態ストア
 * 何を: 各キーの唯一の書き込み者となるプロセスを定義する
 * なぜ: ロックを持たないストアで書き込み競合を構造的に排除するため
 */
package com.example.common.state;

public enum StateOwner {
  /** 計画・登録・ユーザー操作を扱うメインプロセス。 */
  FOCUS,
  /** host から window 境界で起動される短命プロセス。 */
  MONITOR
}

/*
 * どこで: 共有状態ストア
 * 何を: 2 プロセス間の唯一の通信路となる型付きキー/値ストアを定義する
 * なぜ: トランザクションもロックもない前提で読み書き契約を明示するため
 */
package com.example.common.state;

import java.util.Optional;

public interface SharedStateStore {

  /**
   * 役割: キーの現在値を読む。
   * 動作: 値がなければ empty。読み取り値は他プロセスの直近書き込みより古い可能性がある。
   * 前提: なし。どのプロセスもすべてのキーを読める。
   */
  <V> Optional<V> read(StateKey<V> key);

  /**
   * 役割: キーへ値を書き込み、変更通知を送る。
   * 動作: 自プロセスが所有者でなければ StateOwnershipException を送出する。
   * 前提: value は null でないこと。削除は remove を使う。
   */
  <V> void write(StateKey<V> key, V value);

  /** 所有者チェックは write と同じ。 */
  void remove(StateKey<?> key);

  StateOwner owner();
}

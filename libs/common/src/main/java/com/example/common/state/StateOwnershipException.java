/*
 * どこで: 共有状態ストア
 * 何を: 所有者以外のプロセスによる書き込みを表現する
 * なぜ: 単一書き込み者の規約違反を実行時に即座に検出するため
 */
package com.example.common.state;

public class StateOwnershipException extends RuntimeException {
  public StateOwnershipException(StateKey<?> key, StateOwner writer) {
    super("state key " + key.name() + " is owned by " + key.owner() + ", not " + writer);
  }
}

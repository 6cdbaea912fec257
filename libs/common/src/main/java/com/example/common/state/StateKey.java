/*
 * どこで: 共有状態ストア
 * 何を: 論理キー名・値の型・所有プロセスを束ねた型付きキー
 * なぜ: 読み書きの型と書き込み権限をキー定義側で固定するため
 */
package com.example.common.state;

import com.fasterxml.jackson.core.type.TypeReference;

public final class StateKey<V> {

  private final String name;
  private final StateOwner owner;
  private final TypeReference<V> type;

  private StateKey(String name, StateOwner owner, TypeReference<V> type) {
    this.name = name;
    this.owner = owner;
    this.type = type;
  }

  public static <V> StateKey<V> of(String name, StateOwner owner, TypeReference<V> type) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("state key name is required");
    }
    return new StateKey<>(name, owner, type);
  }

  public String name() {
    return name;
  }

  public StateOwner owner() {
    return owner;
  }

  public TypeReference<V> type() {
    return type;
  }

  /** バックエンド上の物理キー。スキーマバージョンを接頭辞に持つ。 */
  public String physicalName() {
    return StateKeys.KEY_PREFIX + name;
  }

  @Override
  public String toString() {
    return name + "(" + owner + ")";
  }
}

/*
 * どこで: 共有状態ストア
 * 何を: 値の JSON 変換失敗を表現する
 * なぜ: 破損した値を呼び出し側で「変更なし」に縮退させる判断に使うため
 */
package com.example.common.state;

public class StateSerializationException extends RuntimeException {
  public StateSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}

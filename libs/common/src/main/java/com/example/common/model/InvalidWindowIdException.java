/*
 * どこで: 共通ドメインモデル
 * 何を: window id の解析失敗を表現する
 * なぜ: host から届いた不正な id を callback 境界で判別するため
 */
package com.example.common.model;

public class InvalidWindowIdException extends RuntimeException {
  public InvalidWindowIdException(String rawId) {
    super("invalid window id: " + rawId);
  }
}

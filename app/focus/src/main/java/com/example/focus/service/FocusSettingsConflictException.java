/*
 * どこで: Focus サービス層
 * 何を: 現在のブロック状態と矛盾する設定変更を表現する
 * なぜ: 適用中の window に後から STRICT を掛ける操作を拒否するため
 */
package com.example.focus.service;

public class FocusSettingsConflictException extends RuntimeException {
  public FocusSettingsConflictException(String message) {
    super(message);
  }
}

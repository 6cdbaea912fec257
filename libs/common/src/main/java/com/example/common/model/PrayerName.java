/*
 * どこで: 共通ドメインモデル
 * 何を: ブロック対象となる 5 つの礼拝名を定義する
 * なぜ: window id・設定・記録で同じ名前表記を使うため
 */
package com.example.common.model;

public enum PrayerName {
  FAJR("Fajr"),
  DHUHR("Dhuhr"),
  ASR("Asr"),
  MAGHRIB("Maghrib"),
  ISHA("Isha");

  private final String value;

  PrayerName(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: 外部から受け取った礼拝名を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: name は null でないこと。
   */
  public static PrayerName fromValue(String name) {
    for (PrayerName prayerName : values()) {
      if (prayerName.value.equalsIgnoreCase(name)) {
        return prayerName;
      }
    }
    throw new IllegalArgumentException("unsupported prayer: " + name);
  }
}

package com.example.monitor.model;

public enum CallbackType {
  START("start"),
  END("end"),
  WARNING_START("warning-start"),
  WARNING_END("warning-end");

  private final String value;

  CallbackType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: host から渡された callback 名を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: value は null でないこと。
   */
  public static CallbackType fromValue(String value) {
    for (CallbackType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported callback: " + value);
  }

  public boolean isWarning() {
    return this == WARNING_START || this == WARNING_END;
  }
}

/*
 * どこで: 共通ドメインモデル
 * 何を: 礼拝名と開始時刻から決まる決定的な window id を表現する
 * なぜ: 再登録を冪等にし、agent が id 単体から文脈を復元できるようにするため
 */
package com.example.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public record WindowId(String value) implements Comparable<WindowId> {

  private static final String PREFIX = "Prayer";
  private static final char SEPARATOR = '_';

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public WindowId {
    if (value == null || value.isBlank()) {
      throw new InvalidWindowIdException(String.valueOf(value));
    }
  }

  /**
   * 役割: 礼拝名と開始時刻から id を生成する。
   * 動作: 開始時刻を分単位に切り捨てた epoch 秒を埋め込み、秒ずれによる重複登録を防ぐ。
   * 前提: startTime は null でないこと。
   */
  public static WindowId of(PrayerName prayerName, Instant startTime) {
    final long epochSeconds = normalize(startTime).getEpochSecond();
    return new WindowId(PREFIX + SEPARATOR + prayerName.value() + SEPARATOR + epochSeconds);
  }

  /**
   * 役割: host から受け取った文字列を id として検証する。
   * 動作: "Prayer_<Name>_<epochSeconds>" 形式でない場合は InvalidWindowIdException を送出する。
   * 前提: なし。
   */
  public static WindowId parse(String raw) {
    final WindowId id = new WindowId(raw);
    id.prayerName();
    id.startTime();
    return id;
  }

  public static Instant normalize(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MINUTES);
  }

  public PrayerName prayerName() {
    final String[] parts = parts();
    try {
      return PrayerName.fromValue(parts[1]);
    } catch (IllegalArgumentException ex) {
      throw new InvalidWindowIdException(value);
    }
  }

  public Instant startTime() {
    final String[] parts = parts();
    try {
      return Instant.ofEpochSecond(Long.parseLong(parts[2]));
    } catch (NumberFormatException ex) {
      throw new InvalidWindowIdException(value);
    }
  }

  @JsonValue
  @Override
  public String value() {
    return value;
  }

  @Override
  public int compareTo(WindowId other) {
    final int byStart = startTime().compareTo(other.startTime());
    return byStart != 0 ? byStart : value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }

  private String[] parts() {
    final String[] parts = value.split(String.valueOf(SEPARATOR));
    if (parts.length != 3 || !PREFIX.equals(parts[0])) {
      throw new InvalidWindowIdException(value);
    }
    return parts;
  }
}

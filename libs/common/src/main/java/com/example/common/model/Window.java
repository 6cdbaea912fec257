/*
 * どこで: 共通ドメインモデル
 * 何を: 1 回分の礼拝ブロック区間を表現する
 * なぜ: 計画・登録・判定で同じ区間定義を共有するため
 */
package com.example.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.time.Instant;

public record Window(WindowId id, PrayerName prayerName, Instant startTime, Duration duration) {

  public static Window of(PrayerName prayerName, Instant startTime, Duration duration) {
    final Instant normalizedStart = WindowId.normalize(startTime);
    return new Window(
        WindowId.of(prayerName, normalizedStart), prayerName, normalizedStart, duration);
  }

  @JsonIgnore
  public Instant endTime() {
    return startTime.plus(duration);
  }

  /** 開始時刻を含み終了時刻を含まない区間判定。 */
  public boolean contains(Instant instant) {
    return !instant.isBefore(startTime) && instant.isBefore(endTime());
  }
}

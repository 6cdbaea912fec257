package com.example.focus.model;

import com.example.common.model.PrayerName;
import java.time.LocalDateTime;

/** 時刻ソースが返す 1 回分の礼拝時刻。タイムゾーンは計画側で解決する。 */
public record PrayerOccurrence(PrayerName prayerName, LocalDateTime localDateTime) {}

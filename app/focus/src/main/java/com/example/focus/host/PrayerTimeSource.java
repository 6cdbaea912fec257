package com.example.focus.host;

import com.example.focus.model.PrayerOccurrence;
import java.time.LocalDate;
import java.util.List;

/** 礼拝時刻の供給元。計算方法は問わない。 */
public interface PrayerTimeSource {

  /**
   * 役割: from から days 日分の礼拝時刻を返す。
   * 動作: 日付・時刻の昇順。欠落した礼拝はそのまま欠落させてよい。
   * 前提: days は 1 以上。
   */
  List<PrayerOccurrence> upcoming(LocalDate from, int days);
}

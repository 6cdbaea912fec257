package com.example.focus.host;

import com.example.common.model.PrayerName;
import com.example.focus.config.FocusProperties;
import com.example.focus.model.PrayerOccurrence;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class ConfiguredPrayerTimeSource implements PrayerTimeSource {

  private final FocusProperties properties;

  public ConfiguredPrayerTimeSource(FocusProperties properties) {
    this.properties = properties;
  }

  @Override
  public List<PrayerOccurrence> upcoming(LocalDate from, int days) {
    final List<PrayerOccurrence> occurrences = new ArrayList<>();
    for (int offset = 0; offset < days; offset++) {
      final LocalDate date = from.plusDays(offset);
      for (PrayerName prayerName : PrayerName.values()) {
        occurrences.add(
            new PrayerOccurrence(
                prayerName,
                LocalDateTime.of(date, properties.timetable().timeOf(prayerName))));
      }
    }
    return occurrences;
  }
}

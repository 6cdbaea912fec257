/*
 * どこで: Focus サービス層
 * 何を: 礼拝時刻と設定から登録すべき window 列を計画する
 * なぜ: host の登録上限内で直近の window を決定的な id で並べるため
 */
package com.example.focus.service;

import com.example.common.model.PrayerName;
import com.example.common.model.Window;
import com.example.common.model.WindowId;
import com.example.focus.config.FocusProperties;
import com.example.focus.model.PrayerOccurrence;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PrayerWindowPlanner {

  private final FocusProperties properties;

  /**
   * 役割: 今後の礼拝時刻から window 列を作る。
   * 動作: now + guardEpsilon より後に始まる有効な礼拝だけを開始時刻順に並べ、
   *       (ローカル日付, 礼拝) ごとに 1 件へ絞り、上限件数で打ち切る(遠い側を捨てる)。
   * 前提: 副作用なし。同じ入力と同じ now に対して同じ id 列を返す。
   */
  public List<Window> plan(
      List<PrayerOccurrence> occurrences,
      Set<PrayerName> enabledPrayers,
      Duration duration,
      Instant now) {
    final Instant threshold = now.plus(properties.guardEpsilon());
    final List<Candidate> candidates = new ArrayList<>();
    for (PrayerOccurrence occurrence : occurrences) {
      if (!enabledPrayers.contains(occurrence.prayerName())) {
        continue;
      }
      final Window window =
          Window.of(
              occurrence.prayerName(),
              occurrence.localDateTime().atZone(properties.zone()).toInstant(),
              duration);
      if (window.startTime().isAfter(threshold)) {
        candidates.add(new Candidate(occurrence.localDateTime().toLocalDate(), window));
      }
    }
    candidates.sort(
        Comparator.comparing((Candidate candidate) -> candidate.window().startTime())
            .thenComparing(candidate -> candidate.window().prayerName()));

    final Set<Map.Entry<LocalDate, PrayerName>> seenDays = new HashSet<>();
    final Set<WindowId> seenIds = new HashSet<>();
    final List<Window> plan = new ArrayList<>();
    for (Candidate candidate : candidates) {
      if (plan.size() >= properties.registrationCeiling()) {
        break;
      }
      final Window window = candidate.window();
      if (!seenDays.add(Map.entry(candidate.localDate(), window.prayerName()))
          || !seenIds.add(window.id())) {
        continue;
      }
      plan.add(window);
    }
    return List.copyOf(plan);
  }

  private record Candidate(LocalDate localDate, Window window) {}
}

package com.example.focus.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.model.PrayerName;
import com.example.common.model.Window;
import com.example.focus.FocusFixtures;
import com.example.focus.host.ConfiguredPrayerTimeSource;
import com.example.focus.model.PrayerOccurrence;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PrayerWindowPlannerTest {

  private static final Duration DURATION = Duration.ofMinutes(15);
  private static final Set<PrayerName> ALL = EnumSet.allOf(PrayerName.class);

  private final List<PrayerOccurrence> twoDays =
      new ConfiguredPrayerTimeSource(FocusFixtures.properties())
          .upcoming(LocalDate.parse("2026-03-01"), 2);

  @Test
  void plansFutureWindowsInStartOrder() {
    final Instant now = Instant.parse("2026-03-01T04:00:00Z");
    final PrayerWindowPlanner planner = new PrayerWindowPlanner(FocusFixtures.properties());

    final List<Window> plan = planner.plan(twoDays, ALL, DURATION, now);

    assertThat(plan).hasSize(10);
    assertThat(plan).allSatisfy(window -> assertThat(window.startTime()).isAfter(now));
    assertThat(plan).isSortedAccordingTo((a, b) -> a.startTime().compareTo(b.startTime()));
    assertThat(plan.get(0).id().value())
        .isEqualTo("Prayer_Fajr_" + Instant.parse("2026-03-01T05:00:00Z").getEpochSecond());
    assertThat(plan.get(0).endTime()).isEqualTo(Instant.parse("2026-03-01T05:15:00Z"));
  }

  @Test
  void truncatesToCeilingKeepingNearestWindows() {
    final PrayerWindowPlanner planner = new PrayerWindowPlanner(FocusFixtures.properties(3, 0.0));

    final List<Window> plan =
        planner.plan(twoDays, ALL, DURATION, Instant.parse("2026-03-01T04:00:00Z"));

    assertThat(plan)
        .extracting(Window::prayerName)
        .containsExactly(PrayerName.FAJR, PrayerName.DHUHR, PrayerName.ASR);
  }

  @Test
  void excludesWindowsStartingWithinGuardEpsilon() {
    final PrayerWindowPlanner planner = new PrayerWindowPlanner(FocusFixtures.properties());

    final List<Window> tooClose =
        planner.plan(twoDays, ALL, DURATION, Instant.parse("2026-03-01T04:59:45Z"));
    final List<Window> justInTime =
        planner.plan(twoDays, ALL, DURATION, Instant.parse("2026-03-01T04:59:00Z"));

    assertThat(tooClose.get(0).prayerName()).isEqualTo(PrayerName.DHUHR);
    assertThat(justInTime.get(0).prayerName()).isEqualTo(PrayerName.FAJR);
  }

  @Test
  void keepsOnlyEnabledPrayers() {
    final PrayerWindowPlanner planner = new PrayerWindowPlanner(FocusFixtures.properties());

    final List<Window> plan =
        planner.plan(
            twoDays, EnumSet.of(PrayerName.ISHA), DURATION, Instant.parse("2026-03-01T04:00:00Z"));

    assertThat(plan).hasSize(2).allMatch(window -> window.prayerName() == PrayerName.ISHA);
  }

  @Test
  void noEnabledPrayersYieldsEmptyPlan() {
    final PrayerWindowPlanner planner = new PrayerWindowPlanner(FocusFixtures.properties());

    assertThat(planner.plan(twoDays, Set.of(), DURATION, Instant.parse("2026-03-01T04:00:00Z")))
        .isEmpty();
  }

  @Test
  void keepsOneOccurrencePerPrayerAndDay() {
    final PrayerWindowPlanner planner = new PrayerWindowPlanner(FocusFixtures.properties());
    final List<PrayerOccurrence> duplicated =
        List.of(
            new PrayerOccurrence(PrayerName.FAJR, LocalDateTime.parse("2026-03-01T05:02:00")),
            new PrayerOccurrence(PrayerName.FAJR, LocalDateTime.parse("2026-03-01T05:00:00")),
            new PrayerOccurrence(PrayerName.FAJR, LocalDateTime.parse("2026-03-02T05:01:00")));

    final List<Window> plan =
        planner.plan(duplicated, ALL, DURATION, Instant.parse("2026-03-01T04:00:00Z"));

    assertThat(plan)
        .extracting(Window::startTime)
        .containsExactly(
            Instant.parse("2026-03-01T05:00:00Z"), Instant.parse("2026-03-02T05:01:00Z"));
  }

  @Test
  void replanningWithSameInputsYieldsSameIds() {
    final PrayerWindowPlanner planner = new PrayerWindowPlanner(FocusFixtures.properties());
    final Instant now = Instant.parse("2026-03-01T13:00:00Z");

    assertThat(planner.plan(twoDays, ALL, DURATION, now))
        .isEqualTo(planner.plan(twoDays, ALL, DURATION, now));
  }
}

package com.example.monitor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.common.host.LocalRestrictionEnforcementService;
import com.example.common.host.StoredSelectionProvider;
import com.example.common.model.BlockingMode;
import com.example.common.model.ClearReason;
import com.example.common.model.ConfirmationIntent;
import com.example.common.model.EarlyUnlockToken;
import com.example.common.model.EnforcementOutcome;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.PrayerName;
import com.example.common.model.RestrictionSelection;
import com.example.common.model.Window;
import com.example.common.model.WindowId;
import com.example.common.state.InMemoryStateBackend;
import com.example.common.state.JsonSharedStateStore;
import com.example.common.state.StateKeys;
import com.example.common.state.StateObjectMappers;
import com.example.common.state.StateOwner;
import com.example.monitor.config.MonitorProperties;
import com.example.monitor.model.CallbackOutcome;
import com.example.monitor.model.CallbackType;
import com.example.monitor.repository.EnforcementStateRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class EnforcementAgentTest {

  private static final Instant FAJR_START = Instant.parse("2026-03-01T05:00:00Z");
  private static final WindowId FAJR = WindowId.of(PrayerName.FAJR, FAJR_START);
  private static final WindowId DHUHR =
      WindowId.of(PrayerName.DHUHR, Instant.parse("2026-03-01T12:30:00Z"));

  private final ObjectMapper objectMapper = StateObjectMappers.create();
  private final InMemoryStateBackend backend = new InMemoryStateBackend();
  private final JsonSharedStateStore focusStore =
      new JsonSharedStateStore(backend, objectMapper, StateOwner.FOCUS);
  private final JsonSharedStateStore monitorStore =
      new JsonSharedStateStore(backend, objectMapper, StateOwner.MONITOR);
  private final MonitorProperties properties =
      new MonitorProperties(
          new MonitorProperties.Retention(Duration.ofDays(7)), 30, 25, Duration.ofHours(24),
          Duration.ofMinutes(15));
  private final EnforcementStateRepository repository =
      new EnforcementStateRepository(monitorStore, properties);
  private final LocalRestrictionEnforcementService restrictions =
      new LocalRestrictionEnforcementService(backend, objectMapper);
  private final LocalNotifier notifier = Mockito.mock(LocalNotifier.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

  @BeforeEach
  void setUp() {
    focusStore.write(StateKeys.SELECTION, RestrictionSelection.ofApplications("app-a"));
    focusStore.write(StateKeys.MODE, BlockingMode.NORMAL);
  }

  @Test
  void startAppliesSelectionAndRecordsFacts() {
    final CallbackOutcome outcome = agentAt("2026-03-01T05:00:00Z").onStart(FAJR);

    assertThat(outcome).isEqualTo(CallbackOutcome.APPLIED);
    assertThat(restrictions.currentlyApplied())
        .contains(RestrictionSelection.ofApplications("app-a"));
    assertThat(repository.record(FAJR))
        .hasValueSatisfying(
            record -> {
              assertThat(record.isActive()).isTrue();
              assertThat(record.appliedAt()).isEqualTo(FAJR_START);
              assertThat(record.mode()).isEqualTo(BlockingMode.NORMAL);
            });
    assertThat(monitorStore.read(StateKeys.CURRENTLY_ENFORCED)).contains(true);
    assertThat(monitorStore.read(StateKeys.ENFORCEMENT_START_TIME)).contains(FAJR_START);
    assertThat(repository.monitoredWindowIds()).containsExactly(FAJR);
  }

  @Test
  void startSkipsPrayerDeselectedAfterPlanning() {
    focusStore.write(StateKeys.ENABLED_PRAYERS, EnumSet.of(PrayerName.DHUHR, PrayerName.ASR));

    final CallbackOutcome outcome = agentAt("2026-03-01T05:00:00Z").onStart(FAJR);

    assertThat(outcome).isEqualTo(CallbackOutcome.SKIPPED_DESELECTED);
    assertThat(repository.record(FAJR).map(EnforcementRecord::outcome))
        .contains(EnforcementOutcome.SKIPPED_DESELECTED);
    assertThat(monitorStore.read(StateKeys.CURRENTLY_ENFORCED)).isEmpty();
    assertThat(restrictions.currentlyApplied()).isEmpty();
  }

  @Test
  void startWithEmptySelectionWarnsAndNotifiesOnce() {
    focusStore.write(StateKeys.SELECTION, RestrictionSelection.empty());

    final CallbackOutcome first = agentAt("2026-03-01T05:00:00Z").onStart(FAJR);
    final CallbackOutcome replay = agentAt("2026-03-01T05:00:04Z").onStart(FAJR);

    assertThat(first).isEqualTo(CallbackOutcome.SKIPPED_NO_SELECTION);
    assertThat(replay).isEqualTo(CallbackOutcome.SKIPPED_NO_SELECTION);
    assertThat(restrictions.currentlyApplied()).isEmpty();
    assertThat(repository.noSelectionWarning())
        .hasValueSatisfying(
            warning -> {
              assertThat(warning.active()).isTrue();
              assertThat(warning.windowId()).isEqualTo(FAJR);
            });
    verify(notifier, times(1)).notify(eq("no-selection-" + FAJR.value()), anyString(), anyString());
    assertThat(registry.get("monitor.notification.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void startClearsPreviousNoSelectionWarning() {
    focusStore.write(StateKeys.SELECTION, RestrictionSelection.empty());
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);
    focusStore.write(StateKeys.SELECTION, RestrictionSelection.ofApplications("app-a"));

    agentAt("2026-03-01T12:30:00Z").onStart(DHUHR);

    assertThat(repository.noSelectionWarning()).isEmpty();
  }

  @Test
  void startReplayKeepsOriginalRecord() {
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);

    final CallbackOutcome replay = agentAt("2026-03-01T05:00:30Z").onStart(FAJR);

    assertThat(replay).isEqualTo(CallbackOutcome.NO_CHANGE);
    assertThat(repository.record(FAJR).map(EnforcementRecord::appliedAt)).contains(FAJR_START);
    assertThat(repository.records()).hasSize(1);
  }

  @Test
  void startArrivingAfterEndLeavesRestrictionsOff() {
    final CallbackOutcome end = agentAt("2026-03-01T05:15:00Z").onEnd(FAJR);

    final CallbackOutcome start = agentAt("2026-03-01T05:16:00Z").onStart(FAJR);
    final CallbackOutcome replay = agentAt("2026-03-01T05:16:05Z").onStart(FAJR);

    assertThat(end).isEqualTo(CallbackOutcome.NO_CHANGE);
    assertThat(start).isEqualTo(CallbackOutcome.SKIPPED_EXPIRED);
    assertThat(replay).isEqualTo(CallbackOutcome.SKIPPED_EXPIRED);
    assertThat(restrictions.currentlyApplied()).isEmpty();
    assertThat(monitorStore.read(StateKeys.CURRENTLY_ENFORCED)).isEmpty();
    assertThat(repository.record(FAJR).map(EnforcementRecord::outcome))
        .contains(EnforcementOutcome.SKIPPED_EXPIRED);
    assertThat(repository.monitoredWindowIds()).isEmpty();
  }

  @Test
  void lateStartUsesPlannedDurationForWindowEnd() {
    focusStore.write(
        StateKeys.PLANNED_WINDOWS,
        List.of(Window.of(PrayerName.FAJR, FAJR_START, Duration.ofMinutes(30))));

    final CallbackOutcome withinPlanned = agentAt("2026-03-01T05:20:00Z").onStart(FAJR);

    assertThat(withinPlanned).isEqualTo(CallbackOutcome.APPLIED);
    assertThat(restrictions.currentlyApplied()).isPresent();
  }

  @Test
  void lateStartFallsBackToStoredWindowDuration() {
    focusStore.write(StateKeys.WINDOW_DURATION, Duration.ofMinutes(10));

    final CallbackOutcome outcome = agentAt("2026-03-01T05:12:00Z").onStart(FAJR);

    assertThat(outcome).isEqualTo(CallbackOutcome.SKIPPED_EXPIRED);
    assertThat(restrictions.currentlyApplied()).isEmpty();
  }

  @Test
  void endInNormalModeClearsWithinOneInvocation() {
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);

    final CallbackOutcome outcome = agentAt("2026-03-01T05:15:00Z").onEnd(FAJR);

    assertThat(outcome).isEqualTo(CallbackOutcome.CLEARED);
    assertThat(restrictions.currentlyApplied()).isEmpty();
    assertThat(monitorStore.read(StateKeys.CURRENTLY_ENFORCED)).contains(false);
    assertThat(repository.record(FAJR))
        .hasValueSatisfying(
            record -> {
              assertThat(record.clearedAt()).isEqualTo(Instant.parse("2026-03-01T05:15:00Z"));
              assertThat(record.clearReason()).isEqualTo(ClearReason.WINDOW_END);
            });
    assertThat(repository.monitoredWindowIds()).isEmpty();
  }

  @Test
  void endInStrictModeKeepsRestrictionsAndAwaitsConfirmation() {
    focusStore.write(StateKeys.MODE, BlockingMode.STRICT);
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);

    final CallbackOutcome outcome = agentAt("2026-03-01T05:15:00Z").onEnd(FAJR);
    agentAt("2026-03-01T05:15:10Z").onEnd(FAJR);

    assertThat(outcome).isEqualTo(CallbackOutcome.AWAITING_CONFIRMATION);
    assertThat(restrictions.currentlyApplied()).isPresent();
    assertThat(monitorStore.read(StateKeys.CURRENTLY_ENFORCED)).contains(true);
    assertThat(repository.awaitingConfirmation())
        .hasValueSatisfying(
            awaiting -> {
              assertThat(awaiting.windowId()).isEqualTo(FAJR);
              assertThat(awaiting.since()).isEqualTo(Instant.parse("2026-03-01T05:15:00Z"));
            });
  }

  @Test
  void endForSkippedWindowLeavesRestrictionsAlone() {
    focusStore.write(StateKeys.ENABLED_PRAYERS, Set.of(PrayerName.ISHA));
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);
    restrictions.apply(RestrictionSelection.ofApplications("manual"));

    final CallbackOutcome outcome = agentAt("2026-03-01T05:15:00Z").onEnd(FAJR);

    assertThat(outcome).isEqualTo(CallbackOutcome.NO_CHANGE);
    assertThat(restrictions.currentlyApplied())
        .contains(RestrictionSelection.ofApplications("manual"));
  }

  @Test
  void nextWindowStartOverwritesStrictHold() {
    focusStore.write(StateKeys.MODE, BlockingMode.STRICT);
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);
    agentAt("2026-03-01T05:15:00Z").onEnd(FAJR);
    focusStore.write(StateKeys.SELECTION, RestrictionSelection.ofApplications("app-b"));

    final CallbackOutcome outcome = agentAt("2026-03-01T12:30:00Z").onStart(DHUHR);

    assertThat(outcome).isEqualTo(CallbackOutcome.APPLIED);
    assertThat(repository.awaitingConfirmation()).isEmpty();
    assertThat(repository.record(FAJR).map(EnforcementRecord::clearReason))
        .contains(ClearReason.SUPERSEDED);
    assertThat(restrictions.currentlyApplied())
        .contains(RestrictionSelection.ofApplications("app-b"));
  }

  @Test
  void confirmationIntentIsConsumedOnNextInvocation() {
    focusStore.write(StateKeys.MODE, BlockingMode.STRICT);
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);
    agentAt("2026-03-01T05:15:00Z").onEnd(FAJR);
    focusStore.write(
        StateKeys.CONFIRMATION, new ConfirmationIntent(FAJR, Instant.parse("2026-03-01T06:00:00Z")));

    agentAt("2026-03-01T12:30:00Z").onStart(DHUHR);

    assertThat(repository.record(FAJR).map(EnforcementRecord::clearReason))
        .contains(ClearReason.CONFIRMED);
    assertThat(repository.awaitingConfirmation()).isEmpty();
    assertThat(monitorStore.read(StateKeys.CURRENTLY_ENFORCED)).contains(true);
  }

  @Test
  void earlyUnlockTokenTurnsEndIntoNoChange() {
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);
    focusStore.write(
        StateKeys.EARLY_UNLOCK_TOKEN,
        new EarlyUnlockToken(FAJR, Instant.parse("2026-03-01T05:06:00Z")));

    final CallbackOutcome outcome = agentAt("2026-03-01T05:15:00Z").onEnd(FAJR);

    assertThat(outcome).isEqualTo(CallbackOutcome.NO_CHANGE);
    assertThat(repository.record(FAJR))
        .hasValueSatisfying(
            record -> {
              assertThat(record.clearReason()).isEqualTo(ClearReason.EARLY_UNLOCK);
              assertThat(record.clearedAt()).isEqualTo(Instant.parse("2026-03-01T05:15:00Z"));
            });
    assertThat(monitorStore.read(StateKeys.CURRENTLY_ENFORCED)).contains(false);
  }

  @Test
  void warningCallbacksDoNotWrite() {
    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);
    final int keysBefore = backend.size();
    final List<String> changes = new ArrayList<>();
    backend.subscribe(changes::add);

    final CallbackOutcome outcome =
        agentAt("2026-03-01T05:10:00Z").onWarning(CallbackType.WARNING_END, FAJR);

    assertThat(outcome).isEqualTo(CallbackOutcome.DIAGNOSTICS);
    assertThat(backend.size()).isEqualTo(keysBefore);
    assertThat(changes).isEmpty();
    verify(notifier, never()).notify(anyString(), anyString(), anyString());
  }

  @Test
  void recordsPastRetentionArePrunedOnWrite() {
    final WindowId old = WindowId.of(PrayerName.ISHA, Instant.parse("2026-02-20T19:45:00Z"));
    monitorStore.write(
        StateKeys.ENFORCEMENT_RECORDS,
        List.of(
            EnforcementRecord.applied(old, Instant.parse("2026-02-20T19:45:00Z"), BlockingMode.NORMAL)
                .cleared(Instant.parse("2026-02-20T20:00:00Z"), ClearReason.WINDOW_END)));

    agentAt("2026-03-01T05:00:00Z").onStart(FAJR);

    assertThat(repository.records()).extracting(EnforcementRecord::windowId).containsExactly(FAJR);
  }

  private EnforcementAgent agentAt(String instant) {
    final Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
    return new EnforcementAgent(
        repository,
        restrictions,
        new StoredSelectionProvider(monitorStore),
        new IntentReconciler(repository, restrictions),
        new MonitoredWindowTracker(repository, properties),
        notifier,
        new MonitorMetrics(registry),
        clock);
  }
}

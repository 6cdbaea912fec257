package com.example.focus.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.common.host.LocalRestrictionEnforcementService;
import com.example.common.model.AuthorizationFlag;
import com.example.common.model.BlockingMode;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.NoSelectionWarning;
import com.example.common.model.PrayerName;
import com.example.common.model.RestrictionSelection;
import com.example.common.model.Window;
import com.example.common.state.InMemoryStateBackend;
import com.example.common.state.JsonSharedStateStore;
import com.example.common.state.StateKeys;
import com.example.common.state.StateObjectMappers;
import com.example.focus.FocusFixtures;
import com.example.focus.host.ActivityMonitoringService;
import com.example.focus.model.BlockingSession;
import com.example.focus.model.EarlyUnlockResult;
import com.example.focus.model.SetupReport;
import com.example.focus.repository.BlockingStateRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BlockingSetupDiagnosticsTest {

  private static final Window FAJR =
      Window.of(PrayerName.FAJR, Instant.parse("2026-03-01T05:00:00Z"), Duration.ofMinutes(15));

  @Mock private ActivityMonitoringService activityMonitoringService;
  @Mock private BlockingSessionService sessionService;

  private final InMemoryStateBackend backend = new InMemoryStateBackend();
  private final BlockingStateRepository repository =
      new BlockingStateRepository(FocusFixtures.focusStore(backend), FocusFixtures.properties());

  @Test
  void healthyWhenSelectionPlanAndRegistrationsLineUp() {
    repository.saveSelection(RestrictionSelection.ofApplications("app-a"));
    repository.savePlannedWindows(List.of(FAJR));
    when(activityMonitoringService.registeredWindowIds()).thenReturn(List.of(FAJR.id()));
    when(sessionService.currentSession()).thenReturn(BlockingSession.scheduled(FAJR));

    final SetupReport report = diagnostics().report();

    assertThat(report.healthy()).isTrue();
    assertThat(report.selectionSize()).isEqualTo(1);
    assertThat(report.windowActiveNow()).isFalse();
  }

  @Test
  void reportsEveryReasonNothingWouldBeBlocked() {
    repository.saveAuthorizationFlag(
        new AuthorizationFlag(true, Instant.parse("2026-03-01T04:00:00Z"), "not authorized"));
    FocusFixtures.monitorStore(backend)
        .write(
            StateKeys.NO_SELECTION_WARNING,
            new NoSelectionWarning(true, FAJR.startTime(), FAJR.id()));
    when(activityMonitoringService.registeredWindowIds()).thenReturn(List.of());
    when(sessionService.currentSession()).thenReturn(BlockingSession.idle());

    final SetupReport report = diagnostics().report();

    assertThat(report.healthy()).isFalse();
    assertThat(report.issues())
        .containsExactly(
            "no apps, categories or domains selected",
            "no windows planned",
            "host authorization required",
            "a recent window started with an empty selection");
  }

  @Test
  void disabledPrayersAreReportedInsteadOfMissingPlan() {
    repository.saveSelection(RestrictionSelection.ofApplications("app-a"));
    repository.saveEnabledPrayers(EnumSet.noneOf(PrayerName.class));
    when(activityMonitoringService.registeredWindowIds()).thenReturn(List.of());
    when(sessionService.currentSession()).thenReturn(BlockingSession.idle());

    assertThat(diagnostics().report().issues()).containsExactly("no prayers enabled");
  }

  @Test
  void missingHostRegistrationsAreFlagged() {
    repository.saveSelection(RestrictionSelection.ofApplications("app-a"));
    repository.savePlannedWindows(List.of(FAJR));
    when(activityMonitoringService.registeredWindowIds()).thenReturn(List.of());
    when(sessionService.currentSession()).thenReturn(BlockingSession.scheduled(FAJR));

    assertThat(diagnostics().report().issues())
        .containsExactly("planned windows missing from host registrations");
  }

  @Test
  void enforcedFlagFollowsSessionAfterEarlyUnlock() {
    repository.saveSelection(RestrictionSelection.ofApplications("app-a"));
    repository.savePlannedWindows(List.of(FAJR));
    final JsonSharedStateStore monitorStore = FocusFixtures.monitorStore(backend);
    monitorStore.write(
        StateKeys.ENFORCEMENT_RECORDS,
        List.of(EnforcementRecord.applied(FAJR.id(), FAJR.startTime(), BlockingMode.NORMAL)));
    monitorStore.write(StateKeys.CURRENTLY_ENFORCED, true);
    final LocalRestrictionEnforcementService restrictions =
        new LocalRestrictionEnforcementService(backend, StateObjectMappers.create());
    restrictions.apply(RestrictionSelection.ofApplications("app-a"));
    final BlockingSessionService realSessionService =
        new BlockingSessionService(
            repository,
            new BlockingStateMachine(FocusFixtures.properties()),
            restrictions,
            new FocusMetrics(new SimpleMeterRegistry()),
            FocusFixtures.clockAt("2026-03-01T05:06:00Z"));
    when(activityMonitoringService.registeredWindowIds()).thenReturn(List.of(FAJR.id()));

    assertThat(realSessionService.requestEarlyUnlock()).isEqualTo(EarlyUnlockResult.GRANTED);
    final SetupReport report =
        new BlockingSetupDiagnostics(repository, activityMonitoringService, realSessionService)
            .report();

    assertThat(repository.currentlyEnforced()).isTrue();
    assertThat(report.currentlyEnforced()).isFalse();
    assertThat(report.windowActiveNow()).isFalse();
  }

  @Test
  void startupLoggingSurvivesFailures() {
    when(activityMonitoringService.registeredWindowIds())
        .thenThrow(new IllegalStateException("host unavailable"));

    diagnostics().logOnStartup();
  }

  private BlockingSetupDiagnostics diagnostics() {
    return new BlockingSetupDiagnostics(repository, activityMonitoringService, sessionService);
  }
}

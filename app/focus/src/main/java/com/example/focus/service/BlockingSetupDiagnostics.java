/*
 * どこで: Focus サービス層
 * 何を: ブロック機能が動作する前提が揃っているかを診断する
 * なぜ: 何もブロックされない原因(未選択・未認可・未計画)を利用者と運用に示すため
 */
package com.example.focus.service;

import com.example.common.model.NoSelectionWarning;
import com.example.common.model.RestrictionSelection;
import com.example.focus.host.ActivityMonitoringService;
import com.example.focus.model.BlockingSession;
import com.example.focus.model.SessionState;
import com.example.focus.model.SetupReport;
import com.example.focus.repository.BlockingStateRepository;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BlockingSetupDiagnostics {

  private static final Logger logger = LoggerFactory.getLogger(BlockingSetupDiagnostics.class);

  private final BlockingStateRepository repository;
  private final ActivityMonitoringService activityMonitoringService;
  private final BlockingSessionService sessionService;

  public SetupReport report() {
    final RestrictionSelection selection = repository.selection();
    final int plannedCount = repository.plannedWindows().size();
    final int hostCount = activityMonitoringService.registeredWindowIds().size();
    final boolean authorizationRequired = repository.authorizationFlag().required();
    final boolean noSelectionWarning =
        repository.noSelectionWarning().map(NoSelectionWarning::active).orElse(false);
    final BlockingSession session = sessionService.currentSession();

    final List<String> issues = new ArrayList<>();
    if (selection.isEmpty()) {
      issues.add("no apps, categories or domains selected");
    }
    if (repository.enabledPrayers().isEmpty()) {
      issues.add("no prayers enabled");
    } else if (plannedCount == 0) {
      issues.add("no windows planned");
    }
    if (authorizationRequired) {
      issues.add("host authorization required");
    }
    if (noSelectionWarning) {
      issues.add("a recent window started with an empty selection");
    }
    if (hostCount < plannedCount) {
      issues.add("planned windows missing from host registrations");
    }
    return new SetupReport(
        !selection.isEmpty(),
        selection.size(),
        plannedCount,
        hostCount,
        session.state() == SessionState.ACTIVE
            || session.state() == SessionState.AWAITING_CONFIRMATION,
        authorizationRequired,
        noSelectionWarning,
        // 保存済みの currently-enforced は agent の次の callback まで確認や早期解除を反映しない
        session.blocking(),
        repository.monitoredWindowIds().size(),
        issues);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void logOnStartup() {
    try {
      final SetupReport report = report();
      if (report.healthy()) {
        logger.info(
            "blocking setup ok selection={} planned={} registered={}",
            report.selectionSize(),
            report.plannedWindowCount(),
            report.hostRegistrationCount());
      } else {
        logger.warn("blocking setup incomplete issues={}", report.issues());
      }
    } catch (RuntimeException ex) {
      logger.warn("blocking setup diagnostics failed", ex);
    }
  }
}

package com.example.focus.worker;

import com.example.focus.config.FocusProperties;
import com.example.focus.model.ReplanTrigger;
import com.example.focus.service.FocusMetrics;
import com.example.focus.service.ReplanService;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "focus.replan-enabled", havingValue = "true", matchIfMissing = true)
public class ReplanWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReplanWorker.class);

  private final ReplanService replanService;
  private final FocusProperties properties;
  private final FocusMetrics metrics;
  private final Clock clock;
  private LocalDate lastPlannedDate;

  public ReplanWorker(
      ReplanService replanService, FocusProperties properties, FocusMetrics metrics, Clock clock) {
    this.replanService = replanService;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** 初回は起動時の計画、日付が変わった回は日替わり、それ以外は定期の契機として扱う。 */
  @Scheduled(fixedDelayString = "${focus.replan-interval}")
  public void run() {
    final LocalDate today = LocalDate.now(clock.withZone(properties.zone()));
    final ReplanTrigger trigger;
    if (lastPlannedDate == null) {
      trigger = ReplanTrigger.FOREGROUND;
    } else if (today.isAfter(lastPlannedDate)) {
      trigger = ReplanTrigger.DAY_ROLLOVER;
    } else {
      trigger = ReplanTrigger.PERIODIC;
    }
    try {
      replanService.replan(trigger);
      lastPlannedDate = today;
    } catch (RuntimeException ex) {
      logger.warn("replan worker loop failed trigger={}", trigger, ex);
      metrics.recordDependencyError("replan_worker");
    }
  }
}

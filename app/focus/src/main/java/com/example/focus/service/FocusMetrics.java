package com.example.focus.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class FocusMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer replanTimer;
  private final AtomicLong plannedWindows = new AtomicLong(0);
  private final AtomicLong authorizationRequired = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> replanCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> registrationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> earlyUnlockCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sessionTransitionCounters =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();
  private final Counter confirmationCounter;

  public FocusMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.replanTimer =
        Timer.builder("focus.replan.duration")
            .description("Time spent planning and reconciling host registrations")
            .register(meterRegistry);
    this.confirmationCounter =
        Counter.builder("focus.confirmation.total")
            .description("Strict mode confirmations accepted")
            .register(meterRegistry);
    Gauge.builder("focus.planned_windows", plannedWindows, AtomicLong::get)
        .register(meterRegistry);
    Gauge.builder("focus.authorization_required", authorizationRequired, AtomicLong::get)
        .register(meterRegistry);
  }

  public void recordReplan(String trigger, Duration elapsed) {
    replanCounters
        .computeIfAbsent(
            trigger,
            key ->
                Counter.builder("focus.replan.total")
                    .tags(Tags.of("trigger", key))
                    .register(meterRegistry))
        .increment();
    replanTimer.record(elapsed);
  }

  public void recordRegistrations(String result, int count) {
    if (count <= 0) {
      return;
    }
    registrationCounters
        .computeIfAbsent(
            result,
            key ->
                Counter.builder("focus.registration.total")
                    .tags(Tags.of("result", key))
                    .register(meterRegistry))
        .increment(count);
  }

  public void updatePlannedWindows(int count) {
    plannedWindows.set(Math.max(0, count));
  }

  public void updateAuthorizationRequired(boolean required) {
    authorizationRequired.set(required ? 1 : 0);
  }

  public void recordEarlyUnlock(String result) {
    earlyUnlockCounters
        .computeIfAbsent(
            result,
            key ->
                Counter.builder("focus.early_unlock.total")
                    .tags(Tags.of("result", key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordConfirmation() {
    confirmationCounter.increment();
  }

  public void recordSessionTransition(String state) {
    sessionTransitionCounters
        .computeIfAbsent(
            state,
            key ->
                Counter.builder("focus.session.transition.total")
                    .tags(Tags.of("state", key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(
            errorType,
            key ->
                Counter.builder("focus.dependency.error.total")
                    .tags(Tags.of("type", key))
                    .register(meterRegistry))
        .increment();
  }
}

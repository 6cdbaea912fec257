package com.example.monitor.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class MonitorMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> callbackCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> callbackTimers = new ConcurrentHashMap<>();
  private final Counter notificationCounter;

  public MonitorMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.notificationCounter =
        Counter.builder("monitor.notification.total")
            .description("Local notifications raised by the agent")
            .register(meterRegistry);
  }

  public void recordCallback(String callback, String outcome) {
    callbackCounters
        .computeIfAbsent(
            callback + ":" + outcome,
            key ->
                Counter.builder("monitor.callback.total")
                    .tags(Tags.of("callback", callback, "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCallbackError(String callback) {
    errorCounters
        .computeIfAbsent(
            callback,
            key ->
                Counter.builder("monitor.callback.error.total")
                    .tags(Tags.of("callback", key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCallbackDuration(String callback, Duration elapsed) {
    if (elapsed.isNegative()) {
      return;
    }
    callbackTimers
        .computeIfAbsent(
            callback,
            key ->
                Timer.builder("monitor.callback.duration")
                    .tags(Tags.of("callback", key))
                    .register(meterRegistry))
        .record(elapsed);
  }

  public void recordNotification() {
    notificationCounter.increment();
  }
}

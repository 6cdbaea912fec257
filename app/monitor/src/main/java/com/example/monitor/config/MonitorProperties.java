/*
 * どこで: Monitor 設定
 * 何を: 記録の保持期間と監視中 id の上限を保持する
 * なぜ: agent が書くキーの肥大化を設定値で抑えるため
 */
package com.example.monitor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "monitor")
public record MonitorProperties(
    @Valid @NotNull Retention retention,
    @Min(1) int monitoredIdsMax,
    @Min(1) int monitoredIdsKeep,
    @NotNull Duration monitoredIdsRetention,
    @NotNull Duration defaultWindowDuration) {

  /** 刈り込み後の件数は上限以下でなければならない。 */
  @AssertTrue(message = "monitored-ids-keep must not exceed monitored-ids-max")
  public boolean isMonitoredIdsKeepWithinMax() {
    return monitoredIdsKeep <= monitoredIdsMax;
  }

  public record Retention(@NotNull Duration recordRetention) {}
}

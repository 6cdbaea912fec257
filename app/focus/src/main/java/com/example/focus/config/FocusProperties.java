/*
 * どこで: Focus 設定
 * 何を: 計画・登録・早期解除・時刻表のドメイン設定を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.example.focus.config;

import com.example.common.model.PrayerName;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "focus")
public record FocusProperties(
    @Min(1) @Max(14) int planDays,
    @NotNull Duration guardEpsilon,
    @Min(1) int registrationCeiling,
    @NotNull Duration warningOffset,
    @NotNull Duration replanInterval,
    @NotNull Duration observerTick,
    @NotNull Duration registeredIdsRetention,
    @Min(1) int registeredIdsMax,
    @NotNull Duration defaultWindowDuration,
    @NotNull Duration minimumWindowDuration,
    @DecimalMin("0.0") @DecimalMax("1.0") double earlyUnlockThreshold,
    @NotNull Duration earlyUnlockMinimumDelay,
    @NotNull ZoneId zone,
    @Valid @NotNull Timetable timetable,
    boolean replanEnabled) {

  /** 1 日分の固定時刻表。値は HH:mm 形式。 */
  public record Timetable(
      @NotBlank @Pattern(regexp = TIME_PATTERN) String fajr,
      @NotBlank @Pattern(regexp = TIME_PATTERN) String dhuhr,
      @NotBlank @Pattern(regexp = TIME_PATTERN) String asr,
      @NotBlank @Pattern(regexp = TIME_PATTERN) String maghrib,
      @NotBlank @Pattern(regexp = TIME_PATTERN) String isha) {

    public LocalTime timeOf(PrayerName prayerName) {
      final String raw =
          switch (prayerName) {
            case FAJR -> fajr;
            case DHUHR -> dhuhr;
            case ASR -> asr;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
          };
      return LocalTime.parse(raw);
    }
  }

  static final String TIME_PATTERN = "([01]\\d|2[0-3]):[0-5]\\d";
}

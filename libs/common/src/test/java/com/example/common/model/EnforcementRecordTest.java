package com.example.common.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class EnforcementRecordTest {

  private static final WindowId WINDOW_ID =
      WindowId.of(PrayerName.ASR, Instant.parse("2026-03-01T15:30:00Z"));

  @Test
  void appliedRecordIsActiveUntilCleared() {
    final Instant appliedAt = Instant.parse("2026-03-01T15:30:00Z");
    final EnforcementRecord applied =
        EnforcementRecord.applied(WINDOW_ID, appliedAt, BlockingMode.NORMAL);

    final EnforcementRecord cleared =
        applied.cleared(Instant.parse("2026-03-01T15:50:00Z"), ClearReason.WINDOW_END);

    assertThat(applied.isActive()).isTrue();
    assertThat(cleared.isActive()).isFalse();
    assertThat(cleared.appliedAt()).isEqualTo(appliedAt);
    assertThat(cleared.clearReason()).isEqualTo(ClearReason.WINDOW_END);
  }

  @Test
  void skippedRecordIsNeverActive() {
    final EnforcementRecord skipped =
        EnforcementRecord.skipped(
            WINDOW_ID,
            EnforcementOutcome.SKIPPED_DESELECTED,
            BlockingMode.STRICT,
            Instant.parse("2026-03-01T15:30:00Z"));

    assertThat(skipped.isSkipped()).isTrue();
    assertThat(skipped.isActive()).isFalse();
    assertThat(skipped.appliedAt()).isNull();
  }
}

package com.example.common.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.common.model.BlockingMode;
import com.example.common.model.EnforcementRecord;
import com.example.common.model.PrayerName;
import com.example.common.model.WindowId;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JsonSharedStateStoreTest {

  private final InMemoryStateBackend backend = new InMemoryStateBackend();
  private final JsonSharedStateStore focusStore =
      new JsonSharedStateStore(backend, StateObjectMappers.create(), StateOwner.FOCUS);
  private final JsonSharedStateStore monitorStore =
      new JsonSharedStateStore(backend, StateObjectMappers.create(), StateOwner.MONITOR);

  @Test
  void writesAreVisibleToOtherProcessStore() {
    focusStore.write(StateKeys.MODE, BlockingMode.STRICT);
    focusStore.write(StateKeys.ENABLED_PRAYERS, Set.of(PrayerName.FAJR, PrayerName.ISHA));

    assertThat(monitorStore.read(StateKeys.MODE)).contains(BlockingMode.STRICT);
    assertThat(monitorStore.read(StateKeys.ENABLED_PRAYERS))
        .hasValueSatisfying(
            prayers -> assertThat(prayers).containsExactlyInAnyOrder(PrayerName.FAJR, PrayerName.ISHA));
  }

  @Test
  void physicalKeysCarrySchemaVersion() {
    monitorStore.write(StateKeys.CURRENTLY_ENFORCED, true);

    assertThat(backend.get("pb:v1:currently-enforced")).contains("true");
  }

  @Test
  void rejectsWritesToKeysOwnedByOtherProcess() {
    assertThatThrownBy(() -> focusStore.write(StateKeys.CURRENTLY_ENFORCED, false))
        .isInstanceOf(StateOwnershipException.class)
        .hasMessageContaining("currently-enforced");
    assertThatThrownBy(() -> monitorStore.remove(StateKeys.CONFIRMATION))
        .isInstanceOf(StateOwnershipException.class);
    assertThat(backend.size()).isZero();
  }

  @Test
  void roundTripsRecordsWithNullableFields() {
    final WindowId windowId = WindowId.of(PrayerName.ASR, Instant.parse("2026-03-01T15:30:00Z"));
    final EnforcementRecord record =
        EnforcementRecord.applied(windowId, Instant.parse("2026-03-01T15:30:02Z"), BlockingMode.NORMAL);

    monitorStore.write(StateKeys.ENFORCEMENT_RECORDS, List.of(record));

    assertThat(focusStore.read(StateKeys.ENFORCEMENT_RECORDS)).contains(List.of(record));
  }

  @Test
  void corruptValueRaisesSerializationException() {
    backend.set(StateKeys.MODE.physicalName(), "{not-json");

    assertThatThrownBy(() -> monitorStore.read(StateKeys.MODE))
        .isInstanceOf(StateSerializationException.class);
  }

  @Test
  void publishesKeyNameOnWriteAndRemove() {
    final List<String> changes = new ArrayList<>();
    try (StateSubscription ignored = backend.subscribe(changes::add)) {
      focusStore.write(StateKeys.MODE, BlockingMode.NORMAL);
      focusStore.remove(StateKeys.CONFIRMATION);
    }
    focusStore.write(StateKeys.MODE, BlockingMode.STRICT);

    assertThat(changes).containsExactly("mode", "confirmation");
  }

  @Test
  void missingKeyReadsEmpty() {
    assertThat(focusStore.read(StateKeys.AWAITING_CONFIRMATION)).isEmpty();
  }
}

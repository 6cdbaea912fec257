/*
 * どこで: host 連携アダプタ
 * 何を: 監視登録を host 名前空間のキーへ保持するローカル実装
 * なぜ: 実機の監視機構なしで登録上限と認可拒否を再現するため
 */
package com.example.focus.host;

import com.example.common.model.WindowId;
import com.example.common.state.StateBackend;
import com.example.common.state.StateSerializationException;
import com.example.focus.config.HostProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalActivityMonitoringService implements ActivityMonitoringService {

  static final String ACTIVITIES_KEY = "host:activities";

  private static final Logger logger =
      LoggerFactory.getLogger(LocalActivityMonitoringService.class);
  private static final TypeReference<TreeMap<String, ActivityRegistration>> REGISTRATIONS =
      new TypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateBackend/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StateBackend backend;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateBackend/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final HostProperties properties;

  public LocalActivityMonitoringService(
      StateBackend backend, ObjectMapper objectMapper, HostProperties properties) {
    this.backend = backend;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public synchronized void register(
      WindowId windowId, Instant start, Instant end, Duration warningOffset) {
    if (!properties.authorized()) {
      throw new ActivityRegistrationException(windowId, "not authorized");
    }
    final TreeMap<String, ActivityRegistration> registrations = load();
    if (!registrations.containsKey(windowId.value())
        && registrations.size() >= properties.registrationCeiling()) {
      throw new ActivityRegistrationException(
          windowId, "registration ceiling reached ceiling=" + properties.registrationCeiling());
    }
    registrations.put(
        windowId.value(), new ActivityRegistration(windowId, start, end, warningOffset));
    save(registrations);
    logger.debug("activity registered windowId={} start={} end={}", windowId, start, end);
  }

  @Override
  public synchronized void unregister(Collection<WindowId> windowIds) {
    if (windowIds.isEmpty()) {
      return;
    }
    final TreeMap<String, ActivityRegistration> registrations = load();
    boolean changed = false;
    for (WindowId windowId : windowIds) {
      changed |= registrations.remove(windowId.value()) != null;
    }
    if (changed) {
      save(registrations);
    }
  }

  @Override
  public List<WindowId> registeredWindowIds() {
    return load().values().stream().map(ActivityRegistration::windowId).sorted().toList();
  }

  public Optional<ActivityRegistration> registration(WindowId windowId) {
    return Optional.ofNullable(load().get(windowId.value()));
  }

  private TreeMap<String, ActivityRegistration> load() {
    final Optional<String> raw = backend.get(ACTIVITIES_KEY);
    if (raw.isEmpty()) {
      return new TreeMap<>();
    }
    try {
      return objectMapper.readValue(raw.get(), REGISTRATIONS);
    } catch (JsonProcessingException ex) {
      throw new StateSerializationException("failed to read host activities", ex);
    }
  }

  private void save(Map<String, ActivityRegistration> registrations) {
    try {
      backend.set(ACTIVITIES_KEY, objectMapper.writeValueAsString(registrations));
    } catch (JsonProcessingException ex) {
      throw new StateSerializationException("failed to write host activities", ex);
    }
  }

  /** host 側に保持される 1 件の監視予約。 */
  public record ActivityRegistration(
      WindowId windowId, Instant start, Instant end, Duration warningOffset) {}
}

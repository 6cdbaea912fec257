package com.example.common.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JsonSharedStateStore implements SharedStateStore {

  private static final Logger logger = LoggerFactory.getLogger(JsonSharedStateStore.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateBackend/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StateBackend backend;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateBackend/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final StateOwner owner;

  public JsonSharedStateStore(StateBackend backend, ObjectMapper objectMapper, StateOwner owner) {
    this.backend = backend;
    this.objectMapper = objectMapper;
    this.owner = Objects.requireNonNull(owner, "owner");
  }

  @Override
  public <V> Optional<V> read(StateKey<V> key) {
    final Optional<String> raw = backend.get(key.physicalName());
    if (raw.isEmpty() || raw.get().isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(raw.get(), key.type()));
    } catch (JsonProcessingException ex) {
      throw new StateSerializationException("failed to read state key " + key.name(), ex);
    }
  }

  @Override
  public <V> void write(StateKey<V> key, V value) {
    ensureOwner(key);
    if (value == null) {
      throw new IllegalArgumentException("value is required; use remove for key " + key.name());
    }
    final String json;
    try {
      json = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new StateSerializationException("failed to write state key " + key.name(), ex);
    }
    backend.set(key.physicalName(), json);
    notifyChanged(key);
  }

  @Override
  public void remove(StateKey<?> key) {
    ensureOwner(key);
    backend.delete(key.physicalName());
    notifyChanged(key);
  }

  @Override
  public StateOwner owner() {
    return owner;
  }

  private void ensureOwner(StateKey<?> key) {
    if (key.owner() != owner) {
      throw new StateOwnershipException(key, owner);
    }
  }

  private void notifyChanged(StateKey<?> key) {
    // 通知は再計算の契機にすぎないため、失敗しても書き込み自体は成立させる
    try {
      backend.publish(StateKeys.CHANGE_CHANNEL, key.name());
    } catch (RuntimeException ex) {
      logger.warn("state change notification failed key={}", key.name(), ex);
    }
  }
}

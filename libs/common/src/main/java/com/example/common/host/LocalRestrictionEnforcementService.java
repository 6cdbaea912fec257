/*
 * どこで: host 連携アダプタ
 * 何を: 制限状態(shield)を host 名前空間のキーに保持するローカル実装
 * なぜ: 実機の制限機構なしで 2 プロセスから同じ shield を操作できるようにするため
 */
package com.example.common.host;

import com.example.common.model.RestrictionSelection;
import com.example.common.state.StateBackend;
import com.example.common.state.StateSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@RequiredArgsConstructor
public class LocalRestrictionEnforcementService implements RestrictionEnforcementService {

  static final String SHIELD_KEY = "host:shield";

  private static final Logger logger =
      LoggerFactory.getLogger(LocalRestrictionEnforcementService.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateBackend/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StateBackend backend;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateBackend/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  @Override
  public void apply(RestrictionSelection selection) {
    try {
      backend.set(SHIELD_KEY, objectMapper.writeValueAsString(selection));
    } catch (JsonProcessingException ex) {
      throw new StateSerializationException("failed to write shield", ex);
    }
    logger.info("restrictions applied {}", selection.summary());
  }

  @Override
  public void clear() {
    backend.delete(SHIELD_KEY);
    logger.info("restrictions cleared");
  }

  @Override
  public Optional<RestrictionSelection> currentlyApplied() {
    final Optional<String> raw = backend.get(SHIELD_KEY);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(raw.get(), RestrictionSelection.class));
    } catch (JsonProcessingException ex) {
      throw new StateSerializationException("failed to read shield", ex);
    }
  }
}

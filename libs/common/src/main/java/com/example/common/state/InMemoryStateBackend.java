/*
 * どこで: 共有状態ストア
 * 何を: Redis を使わないプロセス内バックエンドと変更通知を提供する
 * なぜ: ローカル起動とテストで外部依存なしに 2 プロセス分のストアを共有するため
 */
package com.example.common.state;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InMemoryStateBackend implements StateBackend, StateChangeFeed {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryStateBackend.class);

  private final Map<String, String> values = new ConcurrentHashMap<>();
  private final CopyOnWriteArrayList<StateChangeListener> listeners = new CopyOnWriteArrayList<>();

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public void set(String key, String value) {
    values.put(key, value);
  }

  @Override
  public void delete(String key) {
    values.remove(key);
  }

  @Override
  public void publish(String channel, String message) {
    if (!StateKeys.CHANGE_CHANNEL.equals(channel)) {
      return;
    }
    for (StateChangeListener listener : listeners) {
      try {
        listener.onChange(message);
      } catch (RuntimeException ex) {
        logger.warn("state change listener failed key={}", message, ex);
      }
    }
  }

  @Override
  public StateSubscription subscribe(StateChangeListener listener) {
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public int size() {
    return values.size();
  }
}

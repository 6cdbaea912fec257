package com.example.common.state;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

public class RedisStateChangeFeed implements StateChangeFeed {

  private static final Logger logger = LoggerFactory.getLogger(RedisStateChangeFeed.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RedisMessageListenerContainer は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RedisMessageListenerContainer container;

  private final ChannelTopic topic = new ChannelTopic(StateKeys.CHANGE_CHANNEL);

  public RedisStateChangeFeed(RedisMessageListenerContainer container) {
    this.container = container;
  }

  @Override
  public StateSubscription subscribe(StateChangeListener listener) {
    final MessageListener messageListener =
        (message, pattern) -> {
          final String keyName = new String(message.getBody(), StandardCharsets.UTF_8);
          try {
            listener.onChange(keyName);
          } catch (RuntimeException ex) {
            logger.warn("state change listener failed key={}", keyName, ex);
          }
        };
    container.addMessageListener(messageListener, topic);
    return () -> container.removeMessageListener(messageListener, topic);
  }
}

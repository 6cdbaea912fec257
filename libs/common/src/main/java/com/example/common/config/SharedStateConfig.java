/*
 * どこで: Common 共通設定
 * 何を: 共有状態ストアと host アダプタの Bean を組み立てる
 * なぜ: 2 プロセスが同じキー定義・同じバックエンド選択規則でストアへ接続するため
 */
package com.example.common.config;

import com.example.common.host.LocalRestrictionEnforcementService;
import com.example.common.host.RestrictionEnforcementService;
import com.example.common.host.SelectionProvider;
import com.example.common.host.StoredSelectionProvider;
import com.example.common.state.InMemoryStateBackend;
import com.example.common.state.JsonSharedStateStore;
import com.example.common.state.RedisStateBackend;
import com.example.common.state.RedisStateChangeFeed;
import com.example.common.state.SharedStateStore;
import com.example.common.state.StateBackend;
import com.example.common.state.StateObjectMappers;
import com.example.common.state.StateOwner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

@Configuration
public class SharedStateConfig {

  @Configuration
  @ConditionalOnProperty(
      name = "blocking.store.type",
      havingValue = "redis",
      matchIfMissing = true)
  static class RedisStoreConfig {

    @Bean
    StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
      return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    RedisStateBackend redisStateBackend(StringRedisTemplate stringRedisTemplate) {
      return new RedisStateBackend(stringRedisTemplate);
    }

    @Bean
    RedisMessageListenerContainer stateChangeListenerContainer(
        RedisConnectionFactory connectionFactory) {
      final RedisMessageListenerContainer container = new RedisMessageListenerContainer();
      container.setConnectionFactory(connectionFactory);
      return container;
    }

    @Bean
    RedisStateChangeFeed redisStateChangeFeed(RedisMessageListenerContainer container) {
      return new RedisStateChangeFeed(container);
    }
  }

  @Configuration
  @ConditionalOnProperty(name = "blocking.store.type", havingValue = "memory")
  static class InMemoryStoreConfig {

    @Bean
    InMemoryStateBackend inMemoryStateBackend() {
      return new InMemoryStateBackend();
    }
  }

  @Bean
  SharedStateStore sharedStateStore(
      StateBackend backend, ObjectProvider<ObjectMapper> objectMapper, StateOwner owner) {
    return new JsonSharedStateStore(
        backend, objectMapper.getIfAvailable(StateObjectMappers::create), owner);
  }

  @Bean
  @ConditionalOnMissingBean
  RestrictionEnforcementService restrictionEnforcementService(
      StateBackend backend, ObjectProvider<ObjectMapper> objectMapper) {
    return new LocalRestrictionEnforcementService(
        backend, objectMapper.getIfAvailable(StateObjectMappers::create));
  }

  @Bean
  @ConditionalOnMissingBean
  SelectionProvider selectionProvider(SharedStateStore sharedStateStore) {
    return new StoredSelectionProvider(sharedStateStore);
  }
}

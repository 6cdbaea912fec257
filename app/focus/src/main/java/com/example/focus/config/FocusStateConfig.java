/*
 * どこで: Focus インフラ設定
 * 何を: ストアの書き込み者と host アダプタを提供する
 * なぜ: main process が FOCUS 所有キーのみを書けるように束縛するため
 */
package com.example.focus.config;

import com.example.common.state.StateBackend;
import com.example.common.state.StateObjectMappers;
import com.example.common.state.StateOwner;
import com.example.focus.host.ActivityMonitoringService;
import com.example.focus.host.ConfiguredPrayerTimeSource;
import com.example.focus.host.LocalActivityMonitoringService;
import com.example.focus.host.PrayerTimeSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FocusStateConfig {

  @Bean
  StateOwner stateOwner() {
    return StateOwner.FOCUS;
  }

  @Bean
  @ConditionalOnMissingBean
  ActivityMonitoringService activityMonitoringService(
      StateBackend backend, ObjectProvider<ObjectMapper> objectMapper, HostProperties properties) {
    return new LocalActivityMonitoringService(
        backend, objectMapper.getIfAvailable(StateObjectMappers::create), properties);
  }

  @Bean
  @ConditionalOnMissingBean
  PrayerTimeSource prayerTimeSource(FocusProperties properties) {
    return new ConfiguredPrayerTimeSource(properties);
  }
}

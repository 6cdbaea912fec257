package com.example.monitor.config;

import com.example.common.state.StateOwner;
import com.example.monitor.service.LocalNotifier;
import com.example.monitor.service.LoggingLocalNotifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MonitorStateConfig {

  /** agent は MONITOR 所有キーのみを書き込める。 */
  @Bean
  StateOwner stateOwner() {
    return StateOwner.MONITOR;
  }

  @Bean
  @ConditionalOnMissingBean
  LocalNotifier localNotifier() {
    return new LoggingLocalNotifier();
  }
}

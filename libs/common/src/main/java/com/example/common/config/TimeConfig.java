/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: main process と agent で同一の時刻注入を使い、テストで固定時刻へ差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}

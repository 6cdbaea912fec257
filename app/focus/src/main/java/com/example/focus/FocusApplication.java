/*
 * どこで: Focus アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: 計画・登録・状態判定・ユーザー操作を常駐する main process として起動するため
 */
package com.example.focus;

import com.example.common.config.SharedStateConfig;
import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import({TimeConfig.class, SharedStateConfig.class})
public class FocusApplication {

  public static void main(String[] args) {
    SpringApplication.run(FocusApplication.class, args);
  }
}

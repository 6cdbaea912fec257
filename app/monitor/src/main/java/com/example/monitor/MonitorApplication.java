/*
 * どこで: Monitor アプリのエントリポイント
 * 何を: host から渡された 1 件の callback を処理して終了する
 * なぜ: agent は常駐せず、起動ごとにストアから文脈を復元して完結させるため
 */
package com.example.monitor;

import com.example.common.config.SharedStateConfig;
import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import({TimeConfig.class, SharedStateConfig.class})
public class MonitorApplication {

  public static void main(String[] args) {
    final ConfigurableApplicationContext context =
        new SpringApplicationBuilder(MonitorApplication.class)
            .web(WebApplicationType.NONE)
            .run(args);
    System.exit(SpringApplication.exit(context));
  }
}

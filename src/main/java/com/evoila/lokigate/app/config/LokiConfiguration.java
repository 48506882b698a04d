package com.evoila.lokigate.app.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan(
    basePackages = {
      "com.evoila.lokigate.loki",
      "com.evoila.lokigate.store",
      "com.evoila.lokigate.common"
    })
public class LokiConfiguration {

  /** Wall clock used for lookback checks, instant query defaults and tail windows. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}

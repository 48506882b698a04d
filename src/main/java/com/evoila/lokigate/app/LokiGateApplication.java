package com.evoila.lokigate.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication()
@EnableConfigurationProperties
public class LokiGateApplication {

  public static void main(String[] args) {
    SpringApplication.run(LokiGateApplication.class, args);
  }
}

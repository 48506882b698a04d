package com.evoila.lokigate.common.controller;

import com.evoila.lokigate.loki.LokiService;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Liveness and readiness checks, both backed by the store ping. */
@RestController
@RequiredArgsConstructor
public class HealthController {

  static final String READY = "ready";
  static final String NOT_READY = "not ready";

  private final LokiService lokiService;

  @GetMapping(value = "/ready", produces = MediaType.TEXT_PLAIN_VALUE)
  public Mono<ResponseEntity<String>> ready() {
    return lokiService
        .ready()
        .map(
            up ->
                Boolean.TRUE.equals(up)
                    ? ResponseEntity.ok(READY)
                    : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(NOT_READY));
  }

  @GetMapping("/health")
  public Mono<ResponseEntity<Map<String, String>>> health() {
    return lokiService
        .ready()
        .map(
            up -> {
              Map<String, String> body = new LinkedHashMap<>();
              body.put("status", Boolean.TRUE.equals(up) ? "ok" : "degraded");
              body.put("clickhouse", Boolean.TRUE.equals(up) ? "connected" : "disconnected");
              return Boolean.TRUE.equals(up)
                  ? ResponseEntity.ok(body)
                  : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
            });
  }

  @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  public Mono<String> index() {
    return Mono.just("Loki API gateway for ClickHouse. Query API under /loki/api/v1");
  }
}

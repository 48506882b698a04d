package com.evoila.lokigate.common.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.evoila.lokigate.loki.LokiService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

  @Mock private LokiService lokiService;

  @InjectMocks private HealthController healthController;

  @Test
  void ready_ShouldAnswerOkWhenStoreResponds() {
    // Given
    when(lokiService.ready()).thenReturn(Mono.just(true));

    // When / Then
    StepVerifier.create(healthController.ready())
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
              assertThat(response.getBody()).isEqualTo(HealthController.READY);
            })
        .verifyComplete();
  }

  @Test
  void ready_ShouldAnswerServiceUnavailableWhenStoreIsDown() {
    when(lokiService.ready()).thenReturn(Mono.just(false));

    StepVerifier.create(healthController.ready())
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
              assertThat(response.getBody()).isEqualTo(HealthController.NOT_READY);
            })
        .verifyComplete();
  }

  @Test
  void health_ShouldReportDegradedStore() {
    when(lokiService.ready()).thenReturn(Mono.just(false));

    StepVerifier.create(healthController.health())
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
              assertThat(response.getBody())
                  .containsEntry("status", "degraded")
                  .containsEntry("clickhouse", "disconnected");
            })
        .verifyComplete();
  }

  @Test
  void health_ShouldReportConnectedStore() {
    when(lokiService.ready()).thenReturn(Mono.just(true));

    StepVerifier.create(healthController.health())
        .assertNext(
            response -> {
              assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
              assertThat(response.getBody())
                  .containsEntry("status", "ok")
                  .containsEntry("clickhouse", "connected");
            })
        .verifyComplete();
  }
}

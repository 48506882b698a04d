package com.evoila.lokigate.common.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.lokigate.common.model.GatewayValidationException;
import com.evoila.lokigate.common.model.LokiResponse;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

class ErrorHandlerTest {

  private final ErrorHandler errorHandler = new ErrorHandler();

  @Test
  void toErrorResponse_ShouldMapValidationFailuresToBadData() {
    // When
    LokiResponse<List<String>> response =
        errorHandler.toErrorResponse(
            new GatewayValidationException("query parameter is required"), "labels", List.of());

    // Then
    assertThat(response.status()).isEqualTo(LokiResponse.STATUS_ERROR);
    assertThat(response.errorType()).isEqualTo(LokiResponse.ERROR_TYPE_BAD_DATA);
    assertThat(response.error()).isEqualTo("query parameter is required");
    assertThat(response.data()).isEmpty();
  }

  @Test
  void toErrorResponse_ShouldTreatIllegalArgumentsAsBadData() {
    LokiResponse<String> response =
        errorHandler.toErrorResponse(
            new IllegalArgumentException("invalid timestamp: yesterday"), "query", "");

    assertThat(response.errorType()).isEqualTo(LokiResponse.ERROR_TYPE_BAD_DATA);
  }

  @Test
  void toErrorResponse_ShouldUseStoreResponseBody() {
    WebClientResponseException exception =
        WebClientResponseException.create(
            500,
            "Internal Server Error",
            new HttpHeaders(),
            "Code: 62. Syntax error\n".getBytes(StandardCharsets.UTF_8),
            StandardCharsets.UTF_8);

    LokiResponse<String> response = errorHandler.toErrorResponse(exception, "query", "");

    assertThat(response.errorType()).isEqualTo(LokiResponse.ERROR_TYPE_INTERNAL);
    assertThat(response.error()).isEqualTo("ClickHouse error: Code: 62. Syntax error");
  }

  @Test
  void toErrorResponse_ShouldFallBackToStatusTextForEmptyBody() {
    WebClientResponseException exception =
        WebClientResponseException.create(
            503, "Service Unavailable", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);

    assertThat(errorHandler.toErrorResponse(exception, "query", "").error())
        .isEqualTo("ClickHouse error: Service Unavailable");
  }

  @Test
  void toErrorResponse_ShouldReportUnreachableStore() {
    WebClientRequestException exception =
        new WebClientRequestException(
            new ConnectException("Connection refused"),
            HttpMethod.POST,
            URI.create("http://localhost:8123/"),
            new HttpHeaders());

    LokiResponse<String> response = errorHandler.toErrorResponse(exception, "query", "");

    assertThat(response.errorType()).isEqualTo(LokiResponse.ERROR_TYPE_INTERNAL);
    assertThat(response.error()).startsWith("ClickHouse error: ").contains("Connection refused");
  }

  @Test
  void toErrorResponse_ShouldHandleExceptionsWithoutMessage() {
    LokiResponse<String> response =
        errorHandler.toErrorResponse(new NullPointerException(), "query", "");

    assertThat(response.error()).isEqualTo("ClickHouse error: Unknown error");
  }
}

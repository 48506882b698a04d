package com.evoila.lokigate.common.service;

import com.evoila.lokigate.common.model.GatewayValidationException;
import com.evoila.lokigate.common.model.LokiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Centralized error mapping for gateway operations. Turns any failure into an error envelope so
 * nothing escapes the service boundary.
 */
@Slf4j
@Service
public class ErrorHandler {

  static final String STORE_SOURCE = "ClickHouse";

  /**
   * Maps a failure to an error envelope carrying the given empty payload.
   *
   * @param e the failure
   * @param operation operation name for the log line
   * @param emptyData empty payload of the operation's shape
   * @return {@code bad_data} for validation failures, {@code internal} otherwise
   */
  public <T> LokiResponse<T> toErrorResponse(Throwable e, String operation, T emptyData) {
    if (e instanceof GatewayValidationException || e instanceof IllegalArgumentException) {
      log.warn("Rejected {} request: {}", operation, e.getMessage());
      return LokiResponse.badData(e.getMessage(), emptyData);
    }
    if (e instanceof WebClientResponseException webEx) {
      log.error(
          "{} failed: store responded {} - {}",
          operation,
          webEx.getStatusCode(),
          webEx.getResponseBodyAsString());
      return LokiResponse.internal(storeError(storeMessage(webEx)), emptyData);
    }
    if (e instanceof WebClientRequestException) {
      log.error("{} failed: store unreachable - {}", operation, e.getMessage());
      return LokiResponse.internal(storeError(e.getMessage()), emptyData);
    }
    log.error("{} failed: {}", operation, e.getMessage(), e);
    return LokiResponse.internal(
        storeError(e.getMessage() != null ? e.getMessage() : "Unknown error"), emptyData);
  }

  private String storeMessage(WebClientResponseException webEx) {
    String body = webEx.getResponseBodyAsString().trim();
    return body.isEmpty() ? webEx.getStatusText() : body;
  }

  private String storeError(String message) {
    return STORE_SOURCE + " error: " + message;
  }
}

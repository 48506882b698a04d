package com.evoila.lokigate.common.controller;

import com.evoila.lokigate.common.model.LokiResponse;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Shared request handling for the Loki API controllers: request logging and the mapping of the
 * status-tagged envelope onto HTTP status codes.
 *
 * <p>Envelopes with {@code errorType=bad_data} become 400, {@code internal} becomes 500, anything
 * else is returned with 200.
 */
@Slf4j
public abstract class BaseLokiController {

  protected <T> Mono<ResponseEntity<LokiResponse<T>>> respond(
      ServerWebExchange exchange, Mono<LokiResponse<T>> response) {
    logIncomingRequest(exchange);
    return response.map(this::toResponseEntity);
  }

  /**
   * Reads the form body of a POST request and hands the merged parameters to {@code handler}.
   * Query string parameters take precedence over form fields of the same name.
   */
  protected <T> Mono<ResponseEntity<LokiResponse<T>>> respondToForm(
      ServerWebExchange exchange,
      Function<MultiValueMap<String, String>, Mono<LokiResponse<T>>> handler) {
    logIncomingRequest(exchange);
    return exchange
        .getFormData()
        .doOnNext(this::logFormData)
        .map(
            formData -> {
              LinkedMultiValueMap<String, String> merged = new LinkedMultiValueMap<>(formData);
              merged.putAll(exchange.getRequest().getQueryParams());
              return merged;
            })
        .flatMap(handler)
        .map(this::toResponseEntity);
  }

  <T> ResponseEntity<LokiResponse<T>> toResponseEntity(LokiResponse<T> response) {
    if (response.isSuccess()) {
      return ResponseEntity.ok(response);
    }
    HttpStatus status =
        LokiResponse.ERROR_TYPE_BAD_DATA.equals(response.errorType())
            ? HttpStatus.BAD_REQUEST
            : HttpStatus.INTERNAL_SERVER_ERROR;
    log.warn("Responding {} ({}): {}", status.value(), response.errorType(), response.error());
    return ResponseEntity.status(status).body(response);
  }

  protected void logIncomingRequest(ServerWebExchange exchange) {
    log.info(
        "Incoming {} {}",
        exchange.getRequest().getMethod(),
        exchange.getRequest().getPath().value());

    if (log.isDebugEnabled()) {
      log.debug("Query String: {}", exchange.getRequest().getURI().getRawQuery());
      Map<String, String> headers =
          exchange.getRequest().getHeaders().headerSet().stream()
              .filter(entry -> !isSensitiveHeader(entry.getKey()))
              .collect(
                  Collectors.toMap(
                      Map.Entry::getKey, entry -> String.join(", ", entry.getValue())));
      log.debug("Headers: {}", headers);
    }
  }

  private void logFormData(MultiValueMap<String, String> formData) {
    if (formData != null && !formData.isEmpty()) {
      formData.forEach((key, values) -> log.debug("Form Data '{}': {}", key, values));
    }
  }

  /** Headers that never reach the log. */
  private boolean isSensitiveHeader(String headerName) {
    String lowerHeader = headerName.toLowerCase(Locale.ROOT);
    return lowerHeader.contains("authorization")
        || lowerHeader.contains("cookie")
        || lowerHeader.contains("x-id-token")
        || lowerHeader.contains("x-forwarded-for")
        || lowerHeader.contains("x-real-ip");
  }
}

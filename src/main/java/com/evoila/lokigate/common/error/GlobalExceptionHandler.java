package com.evoila.lokigate.common.error;

import com.evoila.lokigate.common.model.GatewayValidationException;
import com.evoila.lokigate.common.model.GlobalErrorResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.webflux.error.ErrorWebExceptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.server.MethodNotAllowedException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Last-resort handler for anything a controller lets escape. Gateway operations report their own
 * failures in the Loki envelope, so this mostly sees routing and parameter binding errors.
 */
@Slf4j
@Configuration
@Order(-2) // Higher priority than DefaultErrorWebExceptionHandler
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

  private final JsonMapper jsonMapper;
  private final Clock clock;

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
    logRequestDetails(exchange, ex);

    ErrorInfo errorInfo = determineErrorResponse(exchange, ex);

    log.warn(
        "Returning error response: {} {} - {}",
        errorInfo.status().value(),
        errorInfo.status().getReasonPhrase(),
        errorInfo.message());

    return writeErrorResponse(exchange, errorInfo);
  }

  private void logRequestDetails(ServerWebExchange exchange, Throwable ex) {
    String path = exchange.getRequest().getPath().value();
    String method = exchange.getRequest().getMethod().name();
    String query = exchange.getRequest().getURI().getQuery();

    log.error(
        "Unhandled {} on {} {}{}: {}",
        ex.getClass().getSimpleName(),
        method,
        path,
        query != null ? "?" + query : "",
        ex.getMessage());
    log.debug("Full exception: ", ex);
  }

  /** Determines the appropriate error response based on exception type */
  ErrorInfo determineErrorResponse(ServerWebExchange exchange, Throwable ex) {
    if (ex instanceof MethodNotAllowedException e) {
      return handleMethodNotAllowedException(exchange, e);
    }
    if (ex instanceof UnsupportedMediaTypeStatusException e) {
      log.warn("Unsupported media type: {}", e.getMessage());
      return new ErrorInfo(
          HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type", "UNSUPPORTED_MEDIA_TYPE");
    }
    if (ex instanceof WebClientResponseException e) {
      return handleWebClientResponseException(e);
    }
    if (ex instanceof JacksonException e) {
      log.warn("JSON processing error: {}", e.getMessage());
      return new ErrorInfo(HttpStatus.BAD_REQUEST, "Invalid JSON format", "INVALID_JSON");
    }
    if (ex instanceof GatewayValidationException || ex instanceof IllegalArgumentException) {
      return new ErrorInfo(
          HttpStatus.BAD_REQUEST,
          "Invalid request parameters: " + ex.getMessage(),
          "INVALID_PARAMS");
    }
    if (ex instanceof ResponseStatusException e) {
      return handleResponseStatusException(e);
    }
    log.error("Unhandled internal server error", ex);
    return new ErrorInfo(
        HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR");
  }

  private ErrorInfo handleMethodNotAllowedException(
      ServerWebExchange exchange, MethodNotAllowedException ex) {
    log.warn(
        "Method not allowed: {} for {}",
        ex.getHttpMethod(),
        exchange.getRequest().getPath().value());
    return new ErrorInfo(
        HttpStatus.METHOD_NOT_ALLOWED,
        "Method " + ex.getHttpMethod() + " not allowed",
        "METHOD_NOT_ALLOWED");
  }

  private ErrorInfo handleWebClientResponseException(WebClientResponseException ex) {
    log.error(
        "ClickHouse error: {} {} - {}",
        ex.getStatusCode(),
        ex.getStatusText(),
        ex.getResponseBodyAsString());
    return new ErrorInfo(
        HttpStatus.BAD_GATEWAY, "ClickHouse error: " + ex.getStatusText(), "BACKEND_ERROR");
  }

  private ErrorInfo handleResponseStatusException(ResponseStatusException ex) {
    HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
    if (status == HttpStatus.NOT_FOUND) {
      return new ErrorInfo(status, "Not found", "NOT_FOUND");
    }
    String message = ex.getReason() != null ? ex.getReason() : "Request failed";
    log.warn("Response status exception: {} - {}", ex.getStatusCode(), message);
    return new ErrorInfo(status, message, "RESPONSE_STATUS_ERROR");
  }

  record ErrorInfo(HttpStatus status, String message, String errorCode) {}

  private Mono<Void> writeErrorResponse(ServerWebExchange exchange, ErrorInfo errorInfo) {
    HttpStatus status = errorInfo.status();
    exchange.getResponse().setStatusCode(status);
    exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

    GlobalErrorResponse errorResponse =
        GlobalErrorResponse.of(
            status,
            errorInfo.message(),
            errorInfo.errorCode(),
            exchange.getRequest().getPath().value(),
            clock.instant());

    String errorJson;
    try {
      errorJson = jsonMapper.writeValueAsString(errorResponse);
    } catch (JacksonException e) {
      log.error("Failed to serialize error response", e);
      errorJson =
          String.format(
              "{\"error\":\"%s\",\"status\":%d}", status.getReasonPhrase(), status.value());
    }

    DataBuffer buffer =
        exchange.getResponse().bufferFactory().wrap(errorJson.getBytes(StandardCharsets.UTF_8));
    return exchange.getResponse().writeWith(Mono.just(buffer));
  }
}

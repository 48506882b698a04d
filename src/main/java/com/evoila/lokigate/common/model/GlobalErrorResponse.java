package com.evoila.lokigate.common.model;

import java.time.Instant;
import org.springframework.http.HttpStatus;

/**
 * Body written for failures that escape a controller, e.g. unknown routes or malformed request
 * parameters.
 */
public record GlobalErrorResponse(
    String error, String message, int status, String errorCode, String timestamp, String path) {

  public static GlobalErrorResponse of(
      HttpStatus status, String message, String errorCode, String path, Instant timestamp) {
    return new GlobalErrorResponse(
        status.getReasonPhrase(), message, status.value(), errorCode, timestamp.toString(), path);
  }
}

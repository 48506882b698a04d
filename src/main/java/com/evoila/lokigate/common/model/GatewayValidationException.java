package com.evoila.lokigate.common.model;

/**
 * Raised when a request is rejected before any store call: limit violations, missing parameters or
 * values that cannot be interpreted. The message is returned to the client verbatim.
 */
public class GatewayValidationException extends RuntimeException {

  public GatewayValidationException(String message) {
    super(message);
  }
}

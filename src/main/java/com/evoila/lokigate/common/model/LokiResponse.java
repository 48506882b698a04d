package com.evoila.lokigate.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Status-tagged envelope returned by every gateway operation.
 *
 * @param status {@code success} or {@code error}
 * @param data the typed payload; an empty payload of the same shape on errors
 * @param errorType {@code bad_data} for rejected requests, {@code internal} for store failures
 * @param error human readable reason, only present on errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LokiResponse<T>(String status, T data, String errorType, String error) {

  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_ERROR = "error";
  public static final String ERROR_TYPE_BAD_DATA = "bad_data";
  public static final String ERROR_TYPE_INTERNAL = "internal";

  public static <T> LokiResponse<T> success(T data) {
    return new LokiResponse<>(STATUS_SUCCESS, data, null, null);
  }

  public static <T> LokiResponse<T> badData(String message, T emptyData) {
    return new LokiResponse<>(STATUS_ERROR, emptyData, ERROR_TYPE_BAD_DATA, message);
  }

  public static <T> LokiResponse<T> internal(String message, T emptyData) {
    return new LokiResponse<>(STATUS_ERROR, emptyData, ERROR_TYPE_INTERNAL, message);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return STATUS_SUCCESS.equals(status);
  }
}

package com.evoila.lokigate.loki.model;

import java.util.List;

/**
 * The {@code data} of {@code /detected_fields}.
 *
 * @param fields detected fields, sorted by name
 * @param limit number of sampled rows
 */
public record DetectedFieldsResult(List<DetectedFieldSummary> fields, int limit) {

  public static DetectedFieldsResult empty(int limit) {
    return new DetectedFieldsResult(List.of(), limit);
  }
}

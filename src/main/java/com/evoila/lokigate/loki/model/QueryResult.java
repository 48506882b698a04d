package com.evoila.lokigate.loki.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * The {@code data} of a query response.
 *
 * @param resultType {@code streams}, {@code vector} or {@code matrix}
 * @param result {@link LokiStream}, {@link VectorSample} or {@link MatrixSeries} entries
 */
public record QueryResult(String resultType, List<?> result) {

  public static final String STREAMS = "streams";
  public static final String VECTOR = "vector";
  public static final String MATRIX = "matrix";

  public QueryResult {
    result = result == null ? List.of() : List.copyOf(result);
  }

  public static QueryResult streams(List<LokiStream> streams) {
    return new QueryResult(STREAMS, streams);
  }

  public static QueryResult vector(List<VectorSample> samples) {
    return new QueryResult(VECTOR, samples);
  }

  public static QueryResult matrix(List<MatrixSeries> series) {
    return new QueryResult(MATRIX, series);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return result.isEmpty();
  }
}

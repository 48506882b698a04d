package com.evoila.lokigate.loki.model;

import java.util.List;

/**
 * A mined log pattern.
 *
 * @param pattern the line template with {@code <_>} placeholders
 * @param samples {@code [bucketEpochSeconds, count]} in bucket order
 */
public record PatternResult(String pattern, List<List<Long>> samples) {

  public long total() {
    return samples.stream().mapToLong(sample -> sample.get(1)).sum();
  }
}

package com.evoila.lokigate.loki.limits;

import java.time.Duration;
import java.util.List;

/**
 * Per-query bounds. A zero value disables the corresponding check.
 */
public interface Limits {

  int maxQuerySeries();

  int maxEntriesLimitPerQuery();

  Duration maxQueryLookback();

  Duration maxQueryLength();

  long maxChunkBytesPerQuery();

  /** Labels every stream selector must match on. */
  List<String> requiredLabels();

  /** Minimum number of label matchers in a stream selector. */
  int requiredNumberLabels();
}

package com.evoila.lokigate.loki.pattern;

import java.util.Map;
import reactor.core.publisher.Mono;

/** Persisted pattern counts, keyed by the hash of the raw query that produced them. */
public interface PatternStore {

  /**
   * Loads stored counts for buckets inside {@code [startSeconds, endSeconds]}.
   *
   * @return pattern to bucket to count; empty if nothing is stored or the store is unavailable
   */
  Mono<Map<String, Map<Long, Long>>> load(long queryHash, long startSeconds, long endSeconds);

  /** Appends counts. Callers treat failures as non-fatal. */
  Mono<Void> save(long queryHash, Map<String, ? extends Map<Long, Long>> patterns);
}

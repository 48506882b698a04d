package com.evoila.lokigate.loki.pattern;

import static com.evoila.lokigate.common.util.RowValues.stringValue;

import com.evoila.lokigate.common.config.GatewayProperties;
import com.evoila.lokigate.common.util.TimestampNormalizer;
import com.evoila.lokigate.loki.model.PatternResult;
import com.evoila.lokigate.loki.sql.LabelMappings;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Mines log patterns from sampled rows: each body is templated by {@link PatternExtractor} and
 * counted per time bucket. With persistence enabled, stored counts for the same raw query are added
 * bucket-wise and the merged counts are written back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternMiner {

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private final PatternStore patternStore;
  private final GatewayProperties properties;

  /**
   * Counts templates per bucket.
   *
   * @param rows rows with {@code Timestamp} and {@code Body}
   * @param stepSeconds bucket width
   * @return template to bucket start (epoch seconds) to count, templates in first-seen order
   */
  public Map<String, TreeMap<Long, Long>> mine(List<Map<String, Object>> rows, long stepSeconds) {
    long step = Math.max(1, stepSeconds);
    Map<String, TreeMap<Long, Long>> patterns = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      long seconds =
          TimestampNormalizer.toEpochNanos(stringValue(row.get(LabelMappings.TIMESTAMP)))
              / NANOS_PER_SECOND;
      long bucket = Math.floorDiv(seconds, step) * step;
      String pattern = PatternExtractor.extract(stringValue(row.get(LabelMappings.BODY)));
      patterns.computeIfAbsent(pattern, key -> new TreeMap<>()).merge(bucket, 1L, Long::sum);
    }
    return patterns;
  }

  /** Bucket-wise sum of two count sets. Neither input is modified. */
  public static Map<String, TreeMap<Long, Long>> merge(
      Map<String, ? extends Map<Long, Long>> current,
      Map<String, ? extends Map<Long, Long>> persisted) {
    Map<String, TreeMap<Long, Long>> merged = new LinkedHashMap<>();
    current.forEach((pattern, buckets) -> merged.put(pattern, new TreeMap<>(buckets)));
    persisted.forEach(
        (pattern, buckets) -> {
          TreeMap<Long, Long> target = merged.computeIfAbsent(pattern, key -> new TreeMap<>());
          buckets.forEach((bucket, count) -> target.merge(bucket, count, Long::sum));
        });
    return merged;
  }

  /** Pattern results sorted by total count, largest first. */
  public static List<PatternResult> toResults(Map<String, TreeMap<Long, Long>> patterns) {
    List<PatternResult> results = new ArrayList<>(patterns.size());
    patterns.forEach(
        (pattern, buckets) -> {
          List<List<Long>> samples = new ArrayList<>(buckets.size());
          buckets.forEach((bucket, count) -> samples.add(List.of(bucket, count)));
          results.add(new PatternResult(pattern, samples));
        });
    results.sort(Comparator.comparingLong(PatternResult::total).reversed());
    return results;
  }

  /**
   * Hash of the raw query string under which counts are persisted. This is the 31-based polynomial
   * string hash as an unsigned value; collisions are not detected.
   */
  public static long queryHash(String rawQuery) {
    return Integer.toUnsignedLong(rawQuery == null ? 0 : rawQuery.hashCode());
  }

  /**
   * Mines the rows and, if persistence is enabled, merges in and writes back stored counts. Store
   * failures never fail the result.
   */
  public Mono<List<PatternResult>> mineAndMerge(
      String rawQuery,
      List<Map<String, Object>> rows,
      long stepSeconds,
      long startSeconds,
      long endSeconds) {
    Map<String, TreeMap<Long, Long>> current = mine(rows, stepSeconds);
    if (!properties.getPatterns().isPersistenceEnabled()) {
      return Mono.just(toResults(current));
    }

    long hash = queryHash(rawQuery);
    long step = Math.max(1, stepSeconds);
    // stored buckets start on step boundaries, the first one may begin before startSeconds
    long firstBucket = Math.floorDiv(startSeconds, step) * step;
    return patternStore
        .load(hash, firstBucket, endSeconds)
        .defaultIfEmpty(Map.of())
        .flatMap(
            persisted -> {
              Map<String, TreeMap<Long, Long>> merged = merge(current, persisted);
              log.debug(
                  "Merged {} mined with {} stored patterns for query hash {}",
                  current.size(),
                  persisted.size(),
                  hash);
              return patternStore
                  .save(hash, merged)
                  .onErrorResume(
                      e -> {
                        log.warn("Failed to persist patterns: {}", e.getMessage());
                        return Mono.empty();
                      })
                  .thenReturn(toResults(merged));
            });
  }
}

package com.evoila.lokigate.loki.limits;

import com.evoila.lokigate.loki.query.ParsedQuery;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates a query against the configured {@link Limits} before it reaches the store, and creates
 * the per-execution {@link QueryLimiter}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LimitsMiddleware {

  private final Limits limits;
  private final Clock clock;

  /**
   * Runs the pre-execution checks in order: required labels, required matcher count, query
   * length, lookback. The first failing check wins.
   *
   * @param query the parsed selector
   * @param start range start, may be null if the request has none
   * @param end range end, may be null if the request has none
   * @return the rejection reason, or empty if the query may run
   */
  public Optional<String> validateQuery(ParsedQuery query, Instant start, Instant end) {
    Optional<String> rejection =
        checkRequiredLabels(query)
            .or(() -> checkRequiredNumberLabels(query))
            .or(() -> checkQueryLength(start, end))
            .or(() -> checkLookback(start));
    rejection.ifPresent(reason -> log.warn("Query rejected by limits: {}", reason));
    return rejection;
  }

  /**
   * Rejects entry limits above {@code max-entries-limit-per-query}.
   *
   * @return the rejection reason, or empty if the limit is acceptable
   */
  public Optional<String> validateEntriesLimit(int requestedLimit) {
    int max = limits.maxEntriesLimitPerQuery();
    if (max > 0 && requestedLimit > max) {
      return Optional.of(
          "max entries limit per query exceeded, limit > max_entries_limit ("
              + requestedLimit
              + " > "
              + max
              + ")");
    }
    return Optional.empty();
  }

  public QueryLimiter createQueryLimiter() {
    return new QueryLimiter(
        limits.maxQuerySeries(), limits.maxChunkBytesPerQuery(), limits.maxEntriesLimitPerQuery());
  }

  private Optional<String> checkRequiredLabels(ParsedQuery query) {
    List<String> required = limits.requiredLabels();
    if (required.isEmpty()) {
      return Optional.empty();
    }
    Set<String> present = query.labelNames();
    List<String> missing = required.stream().filter(label -> !present.contains(label)).toList();
    if (missing.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        "stream selector is missing required matchers [" + String.join(", ", missing) + "]");
  }

  private Optional<String> checkRequiredNumberLabels(ParsedQuery query) {
    int required = limits.requiredNumberLabels();
    int present = query.matchers().size();
    if (required <= 0 || present >= required) {
      return Optional.empty();
    }
    return Optional.of(
        "stream selector has less label matchers than required: (present: "
            + present
            + ", required_number_label_matchers: "
            + required
            + ")");
  }

  private Optional<String> checkQueryLength(Instant start, Instant end) {
    Duration max = limits.maxQueryLength();
    if (max.isZero() || start == null || end == null) {
      return Optional.empty();
    }
    long lengthMillis = Duration.between(start, end).toMillis();
    if (lengthMillis <= max.toMillis()) {
      return Optional.empty();
    }
    return Optional.of(
        "query length (" + lengthMillis + "ms) exceeds limit (" + max.toMillis() + "ms)");
  }

  private Optional<String> checkLookback(Instant start) {
    Duration max = limits.maxQueryLookback();
    if (max.isZero() || start == null) {
      return Optional.empty();
    }
    Instant minStart = clock.instant().minus(max);
    if (!start.isBefore(minStart)) {
      return Optional.empty();
    }
    return Optional.of(
        "query start time ("
            + start.toEpochMilli()
            + ") is before allowed lookback period ("
            + minStart.toEpochMilli()
            + ")");
  }
}

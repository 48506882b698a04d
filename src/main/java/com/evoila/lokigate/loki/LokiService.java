package com.evoila.lokigate.loki;

import static com.evoila.lokigate.common.util.RowValues.longValue;
import static com.evoila.lokigate.common.util.RowValues.stringValue;

import com.evoila.lokigate.common.config.GatewayProperties;
import com.evoila.lokigate.common.model.GatewayValidationException;
import com.evoila.lokigate.common.model.LokiResponse;
import com.evoila.lokigate.common.service.ErrorHandler;
import com.evoila.lokigate.common.util.TimestampNormalizer;
import com.evoila.lokigate.common.util.ValidationUtils;
import com.evoila.lokigate.loki.detection.DetectedField;
import com.evoila.lokigate.loki.detection.FieldDetector;
import com.evoila.lokigate.loki.limits.LimitsMiddleware;
import com.evoila.lokigate.loki.limits.QueryLimiter;
import com.evoila.lokigate.loki.model.DetectedFieldSummary;
import com.evoila.lokigate.loki.model.DetectedFieldsResult;
import com.evoila.lokigate.loki.model.DetectedLabel;
import com.evoila.lokigate.loki.model.DetectedLabelsResult;
import com.evoila.lokigate.loki.model.IndexStats;
import com.evoila.lokigate.loki.model.PatternResult;
import com.evoila.lokigate.loki.model.QueryResult;
import com.evoila.lokigate.loki.model.VectorSample;
import com.evoila.lokigate.loki.pattern.PatternMiner;
import com.evoila.lokigate.loki.query.LogQueryParser;
import com.evoila.lokigate.loki.query.MetricQuery;
import com.evoila.lokigate.loki.query.MetricQueryDetector;
import com.evoila.lokigate.loki.query.ParsedQuery;
import com.evoila.lokigate.loki.query.StepParser;
import com.evoila.lokigate.loki.result.ResultShaper;
import com.evoila.lokigate.loki.result.SeverityLevel;
import com.evoila.lokigate.loki.result.StreamAssembly;
import com.evoila.lokigate.loki.sql.Direction;
import com.evoila.lokigate.loki.sql.GeneratedQuery;
import com.evoila.lokigate.loki.sql.LabelMappings;
import com.evoila.lokigate.loki.sql.QueryOptions;
import com.evoila.lokigate.loki.sql.SqlTranslator;
import com.evoila.lokigate.store.LogStoreClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Implements the Loki query API on top of the log store. Each operation parses, validates,
 * translates, runs at most the store round trips it needs and shapes the rows. Failures become
 * error envelopes through {@link ErrorHandler}; nothing is thrown past this class.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LokiService {

  static final Duration TAIL_DEFAULT_LOOKBACK = Duration.ofHours(1);

  private static final long ENTRIES_PER_CHUNK = 1000;

  private final LogQueryParser parser;
  private final SqlTranslator translator;
  private final ResultShaper resultShaper;
  private final PatternMiner patternMiner;
  private final FieldDetector fieldDetector;
  private final LimitsMiddleware limitsMiddleware;
  private final LogStoreClient storeClient;
  private final ErrorHandler errorHandler;
  private final GatewayProperties properties;
  private final Clock clock;

  /**
   * Instant query at {@code time} (default now). Log queries return the entries up to {@code time};
   * metric queries return a vector; {@code vector(...)} health checks return a constant sample.
   */
  public Mono<LokiResponse<QueryResult>> query(
      String query, String time, Integer limit, String direction) {
    return execute(
        "query",
        QueryResult.streams(List.of()),
        () -> {
          ValidationUtils.requireParameter(query, "query");
          Instant at = ValidationUtils.isNotNullOrEmpty(time) ? instantOrNull(time) : now();

          if (isVectorHealthCheck(query)) {
            return Mono.just(
                QueryResult.vector(
                    List.of(new VectorSample(Map.of(), List.of(at.getEpochSecond(), "2")))));
          }

          ParsedQuery parsed = parser.parse(query);
          MetricQuery metric = MetricQueryDetector.detect(query).orElse(null);
          if (metric != null) {
            long rangeSeconds =
                metric.hasRange()
                    ? metric.rangeSeconds()
                    : properties.getQuery().getDefaultStep().toSeconds();
            Instant from = at.minusSeconds(rangeSeconds);
            enforceLimits(parsed, from, at);
            return volumeVector(
                parsed,
                millis(from),
                millis(at),
                groupLabels(metric.groupByLabels(), parsed),
                limitOrDefault(limit),
                at.getEpochSecond());
          }

          enforceLimits(parsed, null, at);
          return streams(
              parsed,
              QueryOptions.builder()
                  .end(millis(at))
                  .limit(enforceEntriesLimit(limit))
                  .direction(Direction.fromParameter(direction))
                  .build());
        });
  }

  /**
   * Range query. Log queries return streams; metric queries are answered from the volume
   * aggregation. The step is the query's range selector, else {@code step}, else the default step.
   */
  public Mono<LokiResponse<QueryResult>> queryRange(
      String query, String start, String end, Integer limit, String direction, String step) {
    return execute(
        "query_range",
        QueryResult.streams(List.of()),
        () -> {
          ValidationUtils.requireParameter(query, "query");
          ValidationUtils.requireParameter(start, "start");
          ValidationUtils.requireParameter(end, "end");

          ParsedQuery parsed = parser.parse(query);
          enforceLimits(parsed, instantOrNull(start), instantOrNull(end));

          MetricQuery metric = MetricQueryDetector.detect(query).orElse(null);
          if (metric != null) {
            long stepSeconds =
                metric.hasRange()
                    ? metric.rangeSeconds()
                    : StepParser.parseSeconds(step, properties.getQuery().getDefaultStep());
            log.info("Routing metric query to volume range, step {}s", stepSeconds);
            return volumeMatrix(
                parsed, start, end, groupLabels(metric.groupByLabels(), parsed), stepSeconds);
          }

          return streams(
              parsed,
              QueryOptions.builder()
                  .start(start)
                  .end(end)
                  .limit(enforceEntriesLimit(limit))
                  .direction(Direction.fromParameter(direction))
                  .build());
        });
  }

  public Mono<LokiResponse<List<String>>> labels(String start, String end) {
    return execute(
        "labels",
        List.of(),
        () -> {
          GeneratedQuery query = translator.translateLabelsQuery(start, end);
          return run(query).map(rows -> column(rows, "label"));
        });
  }

  public Mono<LokiResponse<List<String>>> labelValues(String name, String start, String end) {
    return execute(
        "label values",
        List.of(),
        () -> {
          ValidationUtils.requireParameter(name, "name");
          GeneratedQuery query = translator.translateLabelValuesQuery(name, start, end);
          return run(query).map(rows -> resultShaper.toLabelValues(name, column(rows, "value")));
        });
  }

  public Mono<LokiResponse<List<Map<String, String>>>> series(
      List<String> match, String start, String end) {
    return execute(
        "series",
        List.of(),
        () -> run(translator.translateSeriesQuery(match, start, end)).map(resultShaper::toSeries));
  }

  /** Fixed label candidates present in range, with their distinct-value counts. */
  public Mono<LokiResponse<DetectedLabelsResult>> detectedLabels(
      String query, String start, String end) {
    return execute(
        "detected labels",
        DetectedLabelsResult.empty(),
        () -> {
          Range range = rangeOrDefault(start, end);
          GeneratedQuery sql =
              translator.translateDetectedLabelsQuery(
                  parseOptional(query), range.start(), range.end());
          return run(sql).map(LokiService::toDetectedLabels);
        });
  }

  /** Fields found in a sample of the most recent bodies in range. */
  public Mono<LokiResponse<DetectedFieldsResult>> detectedFields(
      String query, String start, String end) {
    int sampleSize = properties.getQuery().getDetectionSampleSize();
    return execute(
        "detected fields",
        DetectedFieldsResult.empty(sampleSize),
        () ->
            detectFields(query, start, end)
                .map(
                    fields -> {
                      List<DetectedFieldSummary> summaries =
                          fields.values().stream().map(DetectedField::toSummary).toList();
                      return new DetectedFieldsResult(summaries, sampleSize);
                    }));
  }

  /** Sorted values observed for one detected field. */
  public Mono<LokiResponse<List<String>>> detectedFieldValues(
      String name, String query, String start, String end) {
    return execute(
        "detected field values",
        List.of(),
        () -> {
          ValidationUtils.requireParameter(name, "name");
          return detectFields(query, start, end)
              .map(
                  fields -> {
                    DetectedField field = fields.get(name);
                    return field == null
                        ? List.<String>of()
                        : field.getValues().stream().sorted().toList();
                  });
        });
  }

  public Mono<LokiResponse<IndexStats>> indexStats(String query, String start, String end) {
    return execute(
        "index stats",
        IndexStats.empty(),
        () -> {
          ParsedQuery parsed = parseOptional(query);
          enforceLimits(parsed, instantOrNull(start), instantOrNull(end));
          return run(translator.translateStatsQuery(parsed, start, end))
              .map(
                  rows -> {
                    if (rows.isEmpty()) {
                      return IndexStats.empty();
                    }
                    Map<String, Object> row = rows.get(0);
                    long entries = longValue(row.get("entries"));
                    long chunks = (entries + ENTRIES_PER_CHUNK - 1) / ENTRIES_PER_CHUNK;
                    long streams = longValue(row.get("streams"));
                    return new IndexStats(streams, chunks, entries, longValue(row.get("bytes")));
                  });
        });
  }

  /**
   * Entry counts grouped by {@code targetLabels} (comma separated), or by the labels the query
   * matches on, largest first.
   */
  public Mono<LokiResponse<QueryResult>> indexVolume(
      String query, String start, String end, Integer limit, String targetLabels) {
    return execute(
        "index volume",
        QueryResult.vector(List.of()),
        () -> {
          ValidationUtils.requireParameter(query, "query");
          ValidationUtils.requireParameter(start, "start");
          ValidationUtils.requireParameter(end, "end");
          ParsedQuery parsed = parser.parse(query);
          enforceLimits(parsed, instantOrNull(start), instantOrNull(end));
          return volumeVector(
              parsed,
              start,
              end,
              groupLabels(splitLabels(targetLabels), parsed),
              limitOrDefault(limit),
              clock.instant().getEpochSecond());
        });
  }

  /** Entry counts per group and step bucket. */
  public Mono<LokiResponse<QueryResult>> indexVolumeRange(
      String query, String start, String end, String step, String targetLabels) {
    return execute(
        "index volume range",
        QueryResult.matrix(List.of()),
        () -> {
          ValidationUtils.requireParameter(query, "query");
          ValidationUtils.requireParameter(start, "start");
          ValidationUtils.requireParameter(end, "end");
          ParsedQuery parsed = parser.parse(query);
          enforceLimits(parsed, instantOrNull(start), instantOrNull(end));
          long stepSeconds =
              StepParser.parseSeconds(step, properties.getQuery().getDefaultVolumeStep());
          return volumeMatrix(
              parsed, start, end, groupLabels(splitLabels(targetLabels), parsed), stepSeconds);
        });
  }

  /** Log patterns mined from the most recent bodies in range, most frequent first. */
  public Mono<LokiResponse<List<PatternResult>>> patterns(
      String query, String start, String end, String step) {
    return execute(
        "patterns",
        List.of(),
        () -> {
          ValidationUtils.requireParameter(query, "query");
          ValidationUtils.requireParameter(start, "start");
          ValidationUtils.requireParameter(end, "end");
          ParsedQuery parsed = parser.parse(query);
          Instant from = TimestampNormalizer.toInstant(start);
          Instant to = TimestampNormalizer.toInstant(end);
          enforceLimits(parsed, from, to);
          long stepSeconds = StepParser.parseSeconds(step, properties.getQuery().getDefaultStep());

          return run(translator.translatePatternSampleQuery(parsed, start, end))
              .flatMap(
                  rows ->
                      patternMiner.mineAndMerge(
                          query, rows, stepSeconds, from.getEpochSecond(), to.getEpochSecond()));
        });
  }

  /**
   * Live tail. Polls every {@code tail-interval} over a window that starts at {@code start}
   * (default one hour ago) and moves past the newest entry seen. Only non-empty results are
   * emitted; polling stops when the subscriber cancels. A failed poll terminates the flux with the
   * error.
   */
  public Flux<QueryResult> tail(String query, String start, Integer limit) {
    return Flux.defer(
        () -> {
          ValidationUtils.requireParameter(query, "query");
          ParsedQuery parsed = parser.parse(query);
          enforceLimits(parsed, null, null);
          int tailLimit = enforceEntriesLimit(limit);
          AtomicReference<String> windowStart =
              new AtomicReference<>(
                  ValidationUtils.isNotNullOrEmpty(start)
                      ? start
                      : millis(clock.instant().minus(TAIL_DEFAULT_LOOKBACK)));
          log.info("Starting tail for query '{}' from {}", query, windowStart.get());

          return Flux.interval(Duration.ZERO, properties.getQuery().getTailInterval())
              .onBackpressureDrop()
              .concatMap(tick -> pollTail(parsed, windowStart, tailLimit))
              .filter(result -> !result.isEmpty())
              .doOnCancel(() -> log.info("Tail for query '{}' cancelled", query));
        });
  }

  /** True if the store answers its liveness check. */
  public Mono<Boolean> ready() {
    return storeClient.ping();
  }

  private Mono<QueryResult> pollTail(
      ParsedQuery parsed, AtomicReference<String> windowStart, int limit) {
    GeneratedQuery query =
        translator.translateQuery(
            parsed,
            QueryOptions.builder()
                .start(windowStart.get())
                .limit(limit)
                .direction(Direction.FORWARD)
                .build());
    return run(query)
        .map(
            rows -> {
              advanceWindow(windowStart, rows);
              return QueryResult.streams(assemble(rows).streams());
            });
  }

  private static void advanceWindow(
      AtomicReference<String> windowStart, List<Map<String, Object>> rows) {
    rows.stream()
        .map(row -> stringValue(row.get(LabelMappings.TIMESTAMP)))
        .filter(ValidationUtils::isNotNullOrEmpty)
        .mapToLong(TimestampNormalizer::toEpochNanos)
        .max()
        .ifPresent(newest -> windowStart.set(Long.toString(newest / 1_000_000L + 1)));
  }

  private Mono<QueryResult> streams(ParsedQuery parsed, QueryOptions options) {
    return run(translator.translateQuery(parsed, options))
        .map(rows -> QueryResult.streams(assemble(rows).streams()));
  }

  private StreamAssembly assemble(List<Map<String, Object>> rows) {
    QueryLimiter limiter = limitsMiddleware.createQueryLimiter();
    StreamAssembly assembly = resultShaper.toStreams(rows, limiter);
    assembly
        .violationMessage()
        .ifPresent(
            violation -> {
              throw new GatewayValidationException(violation);
            });
    return assembly;
  }

  private Mono<QueryResult> volumeVector(
      ParsedQuery parsed,
      String start,
      String end,
      List<String> groupBy,
      int limit,
      long timeSeconds) {
    GeneratedQuery query = translator.translateVolumeQuery(parsed, start, end, groupBy, limit);
    return run(query).map(rows -> QueryResult.vector(resultShaper.toVector(rows, timeSeconds)));
  }

  private Mono<QueryResult> volumeMatrix(
      ParsedQuery parsed, String start, String end, List<String> groupBy, long stepSeconds) {
    GeneratedQuery query =
        translator.translateVolumeRangeQuery(parsed, start, end, groupBy, stepSeconds);
    return run(query).map(rows -> QueryResult.matrix(resultShaper.toMatrix(rows)));
  }

  private Mono<Map<String, DetectedField>> detectFields(String query, String start, String end) {
    Range range = rangeOrDefault(start, end);
    GeneratedQuery sql =
        translator.translateFieldSampleQuery(parseOptional(query), range.start(), range.end());
    return run(sql)
        .map(
            rows ->
                fieldDetector.detect(
                    rows.stream().map(row -> stringValue(row.get(LabelMappings.BODY))).toList()));
  }

  private static DetectedLabelsResult toDetectedLabels(List<Map<String, Object>> rows) {
    if (rows.isEmpty()) {
      return DetectedLabelsResult.empty();
    }
    Map<String, Object> row = rows.get(0);
    List<DetectedLabel> labels = new ArrayList<>();
    for (LabelMappings.DetectedLabelCandidate candidate :
        LabelMappings.DETECTED_LABEL_CANDIDATES) {
      Object value = row.get(candidate.label());
      long cardinality =
          value instanceof Collection<?> severities
              ? levelCardinality(severities)
              : longValue(value);
      if (cardinality > 0) {
        labels.add(new DetectedLabel(candidate.label(), cardinality));
      }
    }
    return new DetectedLabelsResult(labels);
  }

  private static long levelCardinality(Collection<?> severities) {
    Set<String> levels =
        severities.stream()
            .map(String::valueOf)
            .map(SeverityLevel::toLevelLabel)
            .collect(Collectors.toSet());
    return levels.size();
  }

  private Mono<List<Map<String, Object>>> run(GeneratedQuery query) {
    return storeClient.query(query.sql(), query.parameters());
  }

  private <T> Mono<LokiResponse<T>> execute(
      String operation, T emptyData, Supplier<Mono<T>> action) {
    log.debug("Executing {}", operation);
    return Mono.defer(action)
        .map(LokiResponse::success)
        .onErrorResume(e -> Mono.just(errorHandler.toErrorResponse(e, operation, emptyData)));
  }

  private void enforceLimits(ParsedQuery parsed, Instant start, Instant end) {
    limitsMiddleware
        .validateQuery(parsed, start, end)
        .ifPresent(
            reason -> {
              throw new GatewayValidationException(reason);
            });
  }

  private int enforceEntriesLimit(Integer requested) {
    int limit = limitOrDefault(requested);
    limitsMiddleware
        .validateEntriesLimit(limit)
        .ifPresent(
            reason -> {
              throw new GatewayValidationException(reason);
            });
    return limit;
  }

  private int limitOrDefault(Integer requested) {
    return requested != null && requested > 0
        ? requested
        : properties.getQuery().getDefaultLimit();
  }

  private ParsedQuery parseOptional(String query) {
    return ValidationUtils.isNotNullOrEmpty(query) ? parser.parse(query) : ParsedQuery.empty();
  }

  /** Explicit group labels, else the labels the query matches on. */
  private static List<String> groupLabels(List<String> explicit, ParsedQuery parsed) {
    return explicit.isEmpty() ? List.copyOf(parsed.labelNames()) : explicit;
  }

  private static List<String> splitLabels(String labels) {
    if (!ValidationUtils.isNotNullOrEmpty(labels)) {
      return List.of();
    }
    return Arrays.stream(labels.split(","))
        .map(String::trim)
        .filter(label -> !label.isEmpty())
        .toList();
  }

  private Range rangeOrDefault(String start, String end) {
    Instant now = clock.instant();
    String to = ValidationUtils.isNotNullOrEmpty(end) ? end : millis(now);
    String from =
        ValidationUtils.isNotNullOrEmpty(start)
            ? start
            : millis(now.minus(properties.getQuery().getDefaultLookback()));
    return new Range(from, to);
  }

  private static Instant instantOrNull(String timestamp) {
    return ValidationUtils.isNotNullOrEmpty(timestamp)
        ? TimestampNormalizer.toInstant(timestamp)
        : null;
  }

  private Instant now() {
    return clock.instant();
  }

  private static boolean isVectorHealthCheck(String query) {
    return query.trim().startsWith("vector(");
  }

  private static String millis(Instant instant) {
    return Long.toString(instant.toEpochMilli());
  }

  private static List<String> column(List<Map<String, Object>> rows, String name) {
    return rows.stream().map(row -> stringValue(row.get(name))).toList();
  }

  private record Range(String start, String end) {}
}

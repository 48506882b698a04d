package com.evoila.lokigate.loki.result;

import static com.evoila.lokigate.common.util.RowValues.longValue;
import static com.evoila.lokigate.common.util.RowValues.stringValue;

import com.evoila.lokigate.common.util.TimestampNormalizer;
import com.evoila.lokigate.loki.limits.QueryLimiter;
import com.evoila.lokigate.loki.model.LokiStream;
import com.evoila.lokigate.loki.model.MatrixSeries;
import com.evoila.lokigate.loki.model.VectorSample;
import com.evoila.lokigate.loki.sql.LabelMappings;
import com.evoila.lokigate.loki.sql.SqlTranslator;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps store rows to the Loki result shapes. Every grouping is keyed by {@link LabelSet#key()} and
 * scoped to a single call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultShaper {

  private final LabelSetFactory labelSetFactory;

  /**
   * Groups log rows into streams in first-seen order, entries in store order. Assembly stops at the
   * first limit the limiter reports.
   */
  public StreamAssembly toStreams(List<Map<String, Object>> rows, QueryLimiter limiter) {
    Map<LabelSet, List<List<String>>> streams = new LinkedHashMap<>();

    for (Map<String, Object> row : rows) {
      LabelSet labels = labelSetFactory.fromRow(row);
      if (limiter.addSeries(labels)) {
        return StreamAssembly.rejected(limiter.seriesLimitMessage());
      }

      String body = stringValue(row.get(LabelMappings.BODY));
      if (limiter.addChunk()) {
        return StreamAssembly.rejected(limiter.chunkLimitMessage());
      }
      if (limiter.addChunkBytes(body.getBytes(StandardCharsets.UTF_8).length)) {
        return StreamAssembly.rejected(limiter.chunkBytesLimitMessage());
      }

      String timestamp =
          TimestampNormalizer.toEpochNanosString(stringValue(row.get(LabelMappings.TIMESTAMP)));
      streams.computeIfAbsent(labels, key -> new ArrayList<>()).add(List.of(timestamp, body));
    }

    List<LokiStream> result = new ArrayList<>(streams.size());
    streams.forEach((labels, values) -> result.add(new LokiStream(labels.asMap(), values)));
    log.debug("Assembled {} rows into {} streams, {}", rows.size(), result.size(), limiter.stats());
    return StreamAssembly.of(result);
  }

  /**
   * One sample per group of an aggregated result. Groups that collapse onto the same labels after
   * severity mapping are summed.
   *
   * @param rows rows with label columns and a {@code volume} column
   * @param timeSeconds evaluation time of the instant query
   */
  public List<VectorSample> toVector(List<Map<String, Object>> rows, long timeSeconds) {
    Map<LabelSet, Long> counts = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      counts.merge(metricLabels(row), longValue(row.get(SqlTranslator.VOLUME_COLUMN)), Long::sum);
    }

    List<VectorSample> result = new ArrayList<>(counts.size());
    counts.forEach(
        (labels, count) ->
            result.add(
                new VectorSample(labels.asMap(), List.of(timeSeconds, Long.toString(count)))));
    return result;
  }

  /** Time-bucketed samples per group, in bucket order. */
  public List<MatrixSeries> toMatrix(List<Map<String, Object>> rows) {
    Map<LabelSet, TreeMap<Long, Long>> groups = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      long bucket = longValue(row.get(SqlTranslator.BUCKET_COLUMN));
      long count = longValue(row.get(SqlTranslator.VOLUME_COLUMN));
      groups
          .computeIfAbsent(metricLabels(row), key -> new TreeMap<>())
          .merge(bucket, count, Long::sum);
    }

    List<MatrixSeries> result = new ArrayList<>(groups.size());
    groups.forEach(
        (labels, buckets) -> {
          List<List<Object>> values = new ArrayList<>(buckets.size());
          buckets.forEach((bucket, count) -> values.add(List.of(bucket, Long.toString(count))));
          result.add(new MatrixSeries(labels.asMap(), values));
        });
    return result;
  }

  /** Distinct label sets in first-seen order. */
  public List<Map<String, String>> toSeries(List<Map<String, Object>> rows) {
    Set<LabelSet> series = new LinkedHashSet<>();
    rows.forEach(row -> series.add(labelSetFactory.fromRow(row)));
    return series.stream().map(LabelSet::asMap).toList();
  }

  /**
   * Values of a label-values query. Severity and level values are mapped to level labels, which
   * deduplicates them; every result is sorted.
   */
  public List<String> toLabelValues(String labelName, Collection<String> values) {
    Set<String> result = new TreeSet<>();
    boolean severity = LabelMappings.isSeverityLabel(labelName);
    for (String value : values) {
      if (value == null || value.isEmpty()) {
        continue;
      }
      result.add(severity ? SeverityLevel.toLevelLabel(value) : value);
    }
    return List.copyOf(result);
  }

  private static LabelSet metricLabels(Map<String, Object> row) {
    Map<String, String> metric = new LinkedHashMap<>();
    row.forEach(
        (column, value) -> {
          if (value == null
              || SqlTranslator.VOLUME_COLUMN.equals(column)
              || SqlTranslator.BUCKET_COLUMN.equals(column)) {
            return;
          }
          String text = value.toString();
          boolean severity = LabelMappings.isSeverityLabel(column);
          metric.put(column, severity ? SeverityLevel.toLevelLabel(text) : text);
        });
    return LabelSet.of(metric);
  }
}

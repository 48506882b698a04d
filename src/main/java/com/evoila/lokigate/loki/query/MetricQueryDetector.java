package com.evoila.lokigate.loki.query;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the metric queries Grafana sends for log volume panels ({@code count_over_time},
 * {@code sum by}, {@code rate}, ...). Only the range selector and the grouping labels are
 * extracted; the aggregation itself is always a count.
 */
public final class MetricQueryDetector {

  private static final Pattern AGGREGATION =
      Pattern.compile(
          "\\b(?:count_over_time|rate|avg_over_time|sum_over_time|histogram_quantile)\\s*\\("
              + "|\\bsum\\s+by\\b");

  private static final Pattern RANGE_SELECTOR = Pattern.compile("\\[(\\d+)([smhd])]");
  private static final Pattern SUM_BY =
      Pattern.compile("sum\\s+by\\s*\\(([^)]+)\\)", Pattern.CASE_INSENSITIVE);

  private MetricQueryDetector() {
    // Utility class - prevent instantiation
  }

  public static boolean isMetricQuery(String query) {
    return query != null && AGGREGATION.matcher(query).find();
  }

  /** Returns the metric description of the query, or empty for plain log queries. */
  public static Optional<MetricQuery> detect(String query) {
    if (!isMetricQuery(query)) {
      return Optional.empty();
    }

    long rangeSeconds = 0;
    Matcher range = RANGE_SELECTOR.matcher(query);
    if (range.find()) {
      rangeSeconds = StepParser.toSeconds(Long.parseLong(range.group(1)), range.group(2).charAt(0));
    }

    List<String> groupBy = List.of();
    Matcher sumBy = SUM_BY.matcher(query);
    if (sumBy.find()) {
      groupBy =
          Arrays.stream(sumBy.group(1).split(","))
              .map(String::trim)
              .filter(label -> !label.isEmpty())
              .toList();
    }

    return Optional.of(new MetricQuery(rangeSeconds, groupBy));
  }
}

package com.evoila.lokigate.loki.query;

import java.util.List;

/**
 * A metric-style LogQL query answered by the volume aggregator.
 *
 * @param rangeSeconds the {@code [5m]} range selector in seconds, or 0 if the query has none
 * @param groupByLabels labels from a {@code sum by (...)} clause, empty if absent
 */
public record MetricQuery(long rangeSeconds, List<String> groupByLabels) {

  public MetricQuery {
    groupByLabels = groupByLabels == null ? List.of() : List.copyOf(groupByLabels);
  }

  public boolean hasRange() {
    return rangeSeconds > 0;
  }
}

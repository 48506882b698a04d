package com.evoila.lokigate.loki.model;

import java.util.List;
import java.util.Map;

/**
 * One group of a range matrix.
 *
 * @param metric the group's labels
 * @param values {@code [bucketEpochSeconds, "count"]} samples in bucket order
 */
public record MatrixSeries(Map<String, String> metric, List<List<Object>> values) {}

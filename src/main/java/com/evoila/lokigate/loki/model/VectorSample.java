package com.evoila.lokigate.loki.model;

import java.util.List;
import java.util.Map;

/**
 * One group of an instant vector.
 *
 * @param metric the group's labels
 * @param value {@code [epochSeconds, "count"]}
 */
public record VectorSample(Map<String, String> metric, List<Object> value) {}

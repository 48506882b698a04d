package com.evoila.lokigate.loki.model;

import java.util.List;
import java.util.Map;

/**
 * One stream of a {@code streams} result.
 *
 * @param stream the label set identifying the stream
 * @param values {@code [epochNanosString, line]} entries in store order
 */
public record LokiStream(Map<String, String> stream, List<List<String>> values) {}

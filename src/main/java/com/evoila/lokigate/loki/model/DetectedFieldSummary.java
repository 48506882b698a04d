package com.evoila.lokigate.loki.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A field found in log bodies.
 *
 * @param label flattened field name
 * @param type inferred type name
 * @param cardinality number of distinct values seen
 * @param parsers parsers that produced the field ({@code json}, {@code logfmt})
 * @param jsonPath path of the field inside a JSON body, absent for logfmt fields
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectedFieldSummary(
    String label, String type, long cardinality, List<String> parsers, List<String> jsonPath) {}

package com.evoila.lokigate.loki.sql;

import java.util.Map;

/**
 * A parameterized store query. User supplied values only ever appear in {@code parameters}; the
 * text references them as {@code {name:Type}} placeholders.
 *
 * @param sql the query text
 * @param parameters placeholder name to value
 */
public record GeneratedQuery(String sql, Map<String, Object> parameters) {

  public GeneratedQuery {
    parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
  }
}

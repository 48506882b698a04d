package com.evoila.lokigate.loki.sql;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates AND-combined conditions and their bound parameters. Shared by every generated query
 * so that time bounds and matcher translation read the same everywhere.
 */
public final class SqlFilter {

  private final List<String> conditions = new ArrayList<>();
  private final Map<String, Object> parameters = new LinkedHashMap<>();

  SqlFilter add(String condition) {
    conditions.add(condition);
    return this;
  }

  SqlFilter bind(String name, Object value) {
    parameters.put(name, value);
    return this;
  }

  public List<String> conditions() {
    return List.copyOf(conditions);
  }

  public Map<String, Object> parameters() {
    return new LinkedHashMap<>(parameters);
  }

  public boolean isEmpty() {
    return conditions.isEmpty();
  }

  /** {@code " WHERE a AND b"}, or an empty string if there are no conditions. */
  public String whereClause() {
    return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
  }

  /** {@code " AND a AND b"}, for appending to an existing WHERE clause. */
  String andClause() {
    return conditions.isEmpty() ? "" : " AND " + String.join(" AND ", conditions);
  }
}

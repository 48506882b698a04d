package com.evoila.lokigate.store;

import java.util.List;
import java.util.Map;
import reactor.core.publisher.Mono;

/** Access to the columnar log store. */
public interface LogStoreClient {

  /**
   * Executes a parameterized query.
   *
   * @param sql query text referencing parameters as {@code {name:Type}}
   * @param parameters parameter name to value
   * @return the result rows as loosely typed records; empty for statements without a result
   */
  Mono<List<Map<String, Object>>> query(String sql, Map<String, Object> parameters);

  /** Appends rows to a table. */
  Mono<Void> insert(String table, List<Map<String, Object>> rows);

  /** Liveness check; never errors, emits false if the store is unreachable. */
  Mono<Boolean> ping();
}

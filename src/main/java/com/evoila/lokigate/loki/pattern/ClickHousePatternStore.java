package com.evoila.lokigate.loki.pattern;

import static com.evoila.lokigate.common.util.RowValues.longValue;
import static com.evoila.lokigate.common.util.RowValues.stringValue;

import com.evoila.lokigate.common.config.GatewayProperties;
import com.evoila.lokigate.store.LogStoreClient;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Pattern counts in an append-only ClickHouse table {@code (query_hash, pattern, time_bucket,
 * count)}. The table is created on first save; until then loads find nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClickHousePatternStore implements PatternStore {

  private final LogStoreClient storeClient;
  private final GatewayProperties properties;
  private final AtomicBoolean tableReady = new AtomicBoolean();

  @Override
  public Mono<Map<String, Map<Long, Long>>> load(
      long queryHash, long startSeconds, long endSeconds) {
    String sql =
        "SELECT pattern, time_bucket, max(count) AS count FROM "
            + table()
            + " WHERE query_hash = {queryHash:UInt64}"
            + " AND time_bucket >= {start:Int64} AND time_bucket <= {end:Int64}"
            + " GROUP BY pattern, time_bucket";
    Map<String, Object> params = new HashMap<>();
    params.put("queryHash", queryHash);
    params.put("start", startSeconds);
    params.put("end", endSeconds);

    return storeClient
        .query(sql, params)
        .map(ClickHousePatternStore::toPatternCounts)
        .onErrorResume(
            e -> {
              log.warn("No stored patterns available: {}", e.getMessage());
              return Mono.just(Map.of());
            });
  }

  @Override
  public Mono<Void> save(long queryHash, Map<String, ? extends Map<Long, Long>> patterns) {
    List<Map<String, Object>> rows = new ArrayList<>();
    patterns.forEach(
        (pattern, buckets) ->
            buckets.forEach(
                (bucket, count) -> {
                  Map<String, Object> row = new LinkedHashMap<>();
                  row.put("query_hash", queryHash);
                  row.put("pattern", pattern);
                  row.put("time_bucket", bucket);
                  row.put("count", count);
                  rows.add(row);
                }));
    if (rows.isEmpty()) {
      return Mono.empty();
    }
    return ensureTable().then(storeClient.insert(table(), rows));
  }

  private Mono<Void> ensureTable() {
    if (tableReady.get()) {
      return Mono.empty();
    }
    String ddl =
        "CREATE TABLE IF NOT EXISTS "
            + table()
            + " (query_hash UInt64, pattern String, time_bucket Int64, count UInt64)"
            + " ENGINE = MergeTree ORDER BY (query_hash, pattern, time_bucket)";
    return storeClient
        .query(ddl, Map.of())
        .doOnNext(ignored -> tableReady.set(true))
        .then();
  }

  private static Map<String, Map<Long, Long>> toPatternCounts(List<Map<String, Object>> rows) {
    Map<String, Map<Long, Long>> patterns = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      patterns
          .computeIfAbsent(stringValue(row.get("pattern")), key -> new HashMap<>())
          .merge(longValue(row.get("time_bucket")), longValue(row.get("count")), Long::sum);
    }
    return patterns;
  }

  private String table() {
    return properties.getPatterns().getTable();
  }
}

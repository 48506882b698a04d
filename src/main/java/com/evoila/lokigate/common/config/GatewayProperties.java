package com.evoila.lokigate.common.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Gateway configuration properties. Groups the ClickHouse connection, query defaults, per-query
 * limits and pattern persistence settings under the {@code gateway} prefix.
 *
 * <p>Every optional request parameter has a named default here so the query pipeline never has to
 * reason about absent values.
 */
@Data
@Component
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

  private ClickHouse clickhouse = new ClickHouse();
  private Query query = new Query();
  private Limits limits = new Limits();
  private Patterns patterns = new Patterns();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ClickHouse {
    @Builder.Default private String url = "http://localhost:8123";
    @Builder.Default private String database = "default";
    @Builder.Default private String username = "default";
    @Builder.Default private String password = "";
    @Builder.Default private String logsTable = "otel_logs";
    @Builder.Default private Duration connectTimeout = Duration.ofSeconds(10);
    @Builder.Default private Duration responseTimeout = Duration.ofSeconds(30);
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Query {
    /** Entry limit applied when a request carries none. */
    @Builder.Default private int defaultLimit = 100;

    /** Upper bound for any requested entry limit. */
    @Builder.Default private int maxLimit = 5000;

    /** Bucket width for pattern mining and metric queries without a step. */
    @Builder.Default private Duration defaultStep = Duration.ofSeconds(60);

    /** Bucket width for volume range requests without a step. */
    @Builder.Default private Duration defaultVolumeStep = Duration.ofHours(1);

    @Builder.Default private int detectionSampleSize = 1000;
    @Builder.Default private int patternSampleSize = 10000;
    @Builder.Default private Duration tailInterval = Duration.ofSeconds(1);

    /** Range used by discovery endpoints when the client sends no start. */
    @Builder.Default private Duration defaultLookback = Duration.ofHours(24);
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Limits {
    @Builder.Default private int maxQuerySeries = 500;
    @Builder.Default private int maxEntriesLimitPerQuery = 1000;

    /** Zero disables the lookback check. */
    @Builder.Default private Duration maxQueryLookback = Duration.ZERO;

    /** Zero disables the query length check. */
    @Builder.Default private Duration maxQueryLength = Duration.ZERO;

    /** Zero disables the chunk byte check. */
    @Builder.Default private long maxChunkBytesPerQuery = 0;

    @Builder.Default private List<String> requiredLabels = new ArrayList<>();
    @Builder.Default private int requiredNumberLabels = 0;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Patterns {
    @Builder.Default private boolean persistenceEnabled = false;
    @Builder.Default private String table = "loki_patterns";
  }
}

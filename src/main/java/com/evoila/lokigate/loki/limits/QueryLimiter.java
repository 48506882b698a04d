package com.evoila.lokigate.loki.limits;

import com.evoila.lokigate.loki.result.LabelSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Tracks series, chunk bytes and chunks admitted during one query execution. Each {@code add}
 * method reports whether its limit is exceeded; stopping is left to the caller.
 *
 * <p>Instances are not thread-safe and must not be shared between executions.
 */
public class QueryLimiter {

  private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB"};

  private final int maxSeriesPerQuery;
  private final long maxChunkBytesPerQuery;
  private final long maxChunksPerQuery;

  private final Set<String> uniqueSeries = new HashSet<>();
  private long chunkBytesCount;
  private long chunkCount;

  public QueryLimiter(int maxSeriesPerQuery, long maxChunkBytesPerQuery, long maxChunksPerQuery) {
    this.maxSeriesPerQuery = maxSeriesPerQuery;
    this.maxChunkBytesPerQuery = maxChunkBytesPerQuery;
    this.maxChunksPerQuery = maxChunksPerQuery;
  }

  /** A limiter that never reports a violation. */
  public static QueryLimiter unlimited() {
    return new QueryLimiter(0, 0, 0);
  }

  public boolean addSeries(LabelSet labels) {
    return addSeries(labels.key());
  }

  /**
   * Admits a series key. A key seen before is never counted twice.
   *
   * @return true if the key is new and the series cap is already reached
   */
  public boolean addSeries(String seriesKey) {
    if (uniqueSeries.contains(seriesKey)) {
      return false;
    }
    if (maxSeriesPerQuery > 0 && uniqueSeries.size() >= maxSeriesPerQuery) {
      return true;
    }
    uniqueSeries.add(seriesKey);
    return false;
  }

  /** @return true once the cumulative byte count exceeds the cap */
  public boolean addChunkBytes(long bytes) {
    chunkBytesCount += bytes;
    return maxChunkBytesPerQuery > 0 && chunkBytesCount > maxChunkBytesPerQuery;
  }

  /** @return true once the chunk count exceeds the cap */
  public boolean addChunk() {
    chunkCount++;
    return maxChunksPerQuery > 0 && chunkCount > maxChunksPerQuery;
  }

  public LimiterStats stats() {
    return new LimiterStats(uniqueSeries.size(), chunkBytesCount, chunkCount);
  }

  public String seriesLimitMessage() {
    return "maximum number of series (" + maxSeriesPerQuery + ") reached for a single query";
  }

  public String chunkBytesLimitMessage() {
    return "the query hit the aggregated chunks size limit (limit: "
        + formatBytes(maxChunkBytesPerQuery)
        + " actual: "
        + formatBytes(chunkBytesCount)
        + ")";
  }

  public String chunkLimitMessage() {
    return "the query hit the max number of chunks limit (limit: " + maxChunksPerQuery + ")";
  }

  /** Human readable byte size, e.g. {@code 1.5KB}. */
  public static String formatBytes(long bytes) {
    if (bytes <= 0) {
      return "0B";
    }
    int unit = (int) Math.min(BYTE_UNITS.length - 1, Math.floor(Math.log(bytes) / Math.log(1024)));
    double value = bytes / Math.pow(1024, unit);
    String formatted = String.format(Locale.ROOT, "%.2f", value);
    formatted = formatted.replaceAll("\\.?0+$", "");
    return formatted + BYTE_UNITS[unit];
  }
}

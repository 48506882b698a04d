package com.evoila.lokigate.loki.limits;

/** Counters of one query execution. */
public record LimiterStats(int seriesCount, long chunkBytesCount, long chunkCount) {}

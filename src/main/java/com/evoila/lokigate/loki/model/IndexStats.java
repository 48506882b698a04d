package com.evoila.lokigate.loki.model;

/** Totals reported by {@code /index/stats}. */
public record IndexStats(long streams, long chunks, long entries, long bytes) {

  public static IndexStats empty() {
    return new IndexStats(0, 0, 0, 0);
  }
}

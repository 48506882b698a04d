package com.evoila.lokigate.loki.sql;

/** Ordering of log entries in a stream response. */
public enum Direction {
  FORWARD,
  BACKWARD;

  /** Parses Loki's {@code direction} parameter; anything but {@code forward} is backward. */
  public static Direction fromParameter(String value) {
    return "forward".equalsIgnoreCase(value) ? FORWARD : BACKWARD;
  }

  String sqlOrder() {
    return this == FORWARD ? "ASC" : "DESC";
  }
}

package com.evoila.lokigate.common.util;

/** Typed access to loosely typed {@code JSONEachRow} values. */
public final class RowValues {

  private RowValues() {
    // Utility class - prevent instantiation
  }

  public static String stringValue(Object value) {
    return value == null ? "" : value.toString();
  }

  /**
   * Reads an integer column. ClickHouse renders 64-bit integers as JSON strings, so numbers and
   * numeric strings are both accepted; anything else is 0.
   */
  public static long longValue(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        try {
          return (long) Double.parseDouble(text.trim());
        } catch (NumberFormatException ignored) {
          return 0L;
        }
      }
    }
    return 0L;
  }
}

package com.evoila.lokigate.loki.detection;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Inferred type of a detected field, declared in upgrade priority order. A field's type only ever
 * moves to a later constant.
 */
public enum FieldType {
  STRING,
  BOOLEAN,
  INT,
  FLOAT,
  DURATION,
  BYTES;

  private static final Pattern DURATION_VALUE = Pattern.compile("\\d+[smhd]");
  private static final Pattern BYTES_VALUE =
      Pattern.compile("\\d+[KMGT]?B", Pattern.CASE_INSENSITIVE);
  private static final Pattern FLOAT_VALUE = Pattern.compile("[+-]?\\d*\\.\\d+|[+-]?\\d+\\.\\d*");
  private static final Pattern INT_VALUE = Pattern.compile("[+-]?\\d+");

  /** Classifies one observed value. */
  public static FieldType classify(String value) {
    if (value == null) {
      return STRING;
    }
    String trimmed = value.trim();
    if (DURATION_VALUE.matcher(trimmed).matches()) {
      return DURATION;
    }
    if (BYTES_VALUE.matcher(trimmed).matches()) {
      return BYTES;
    }
    if (FLOAT_VALUE.matcher(trimmed).matches()) {
      return FLOAT;
    }
    if (INT_VALUE.matcher(trimmed).matches()) {
      return INT;
    }
    if ("true".equals(trimmed) || "false".equals(trimmed)) {
      return BOOLEAN;
    }
    return STRING;
  }

  /** The higher-priority of the two types. */
  public FieldType upgrade(FieldType observed) {
    return observed.ordinal() > ordinal() ? observed : this;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

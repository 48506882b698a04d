package com.evoila.lokigate.common.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between the three time representations the gateway deals with:
 *
 * <ul>
 *   <li>epoch strings sent by Grafana (nanoseconds, milliseconds, seconds)
 *   <li>RFC 3339 / ISO-8601 strings
 *   <li>the store's {@code DateTime64} text form, {@code yyyy-MM-dd HH:mm:ss.ffffff}
 * </ul>
 *
 * <p>All conversions happen in UTC. Nanosecond inputs keep millisecond precision only, so {@link
 * #toEpochNanos(String)} of a converted value returns the input truncated to the millisecond.
 */
public final class TimestampNormalizer {

  private static final DateTimeFormatter STORE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern DECIMAL_SECONDS = Pattern.compile("(\\d+)\\.(\\d{1,9})");
  private static final Pattern STORE_DATE_TIME =
      Pattern.compile("(\\d{4}-\\d{2}-\\d{2})[ T](\\d{2}:\\d{2}:\\d{2})(?:\\.(\\d{1,9}))?Z?");

  private static final int MILLIS_DIGITS = 13;
  private static final int SECONDS_DIGITS = 10;
  private static final long NANOS_PER_MILLI = 1_000_000L;

  private TimestampNormalizer() {
    // Utility class - prevent instantiation
  }

  /**
   * Formats a client timestamp as a store-bound parameter.
   *
   * @param timestamp epoch (ns, ms or s) or date string
   * @return {@code yyyy-MM-dd HH:mm:ss.ffffff} in UTC
   * @throws IllegalArgumentException if the value cannot be interpreted as a point in time
   */
  public static String toStoreDateTime(String timestamp) {
    return STORE_FORMAT.format(toInstant(timestamp));
  }

  /** Formats an instant as a store-bound parameter. */
  public static String toStoreDateTime(Instant instant) {
    return STORE_FORMAT.format(instant);
  }

  /**
   * Interprets a client timestamp. Pure digit strings longer than 13 characters are epoch
   * nanoseconds and keep their first 13 digits as epoch milliseconds; 11 to 13 digits are epoch
   * milliseconds; shorter ones are epoch seconds. Anything else must be a date string.
   *
   * @throws IllegalArgumentException if the value cannot be interpreted as a point in time
   */
  public static Instant toInstant(String timestamp) {
    if (timestamp == null || timestamp.isBlank()) {
      throw new IllegalArgumentException("timestamp cannot be empty");
    }
    String value = timestamp.trim();

    if (DIGITS.matcher(value).matches()) {
      if (value.length() > MILLIS_DIGITS) {
        return Instant.ofEpochMilli(Long.parseLong(value.substring(0, MILLIS_DIGITS)));
      }
      if (value.length() > SECONDS_DIGITS) {
        return Instant.ofEpochMilli(Long.parseLong(value));
      }
      return Instant.ofEpochSecond(Long.parseLong(value));
    }

    Matcher decimal = DECIMAL_SECONDS.matcher(value);
    if (decimal.matches()) {
      String fraction = (decimal.group(2) + "000000000").substring(0, 9);
      return Instant.ofEpochSecond(Long.parseLong(decimal.group(1)), Long.parseLong(fraction));
    }

    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      return parseStoreDateTime(value);
    }
  }

  /**
   * Converts a store timestamp ({@code 2025-07-15 12:04:14.350566000}) to epoch nanoseconds. The
   * result is millisecond precise; sub-millisecond digits are dropped.
   *
   * @throws IllegalArgumentException if the value is not in the store format
   */
  public static long toEpochNanos(String storeTimestamp) {
    if (storeTimestamp == null || storeTimestamp.isBlank()) {
      throw new IllegalArgumentException("store timestamp cannot be empty");
    }
    return parseStoreDateTime(storeTimestamp.trim()).toEpochMilli() * NANOS_PER_MILLI;
  }

  /** Same as {@link #toEpochNanos(String)}, rendered as the decimal string Loki clients expect. */
  public static String toEpochNanosString(String storeTimestamp) {
    return Long.toString(toEpochNanos(storeTimestamp));
  }

  private static Instant parseStoreDateTime(String value) {
    Matcher matcher = STORE_DATE_TIME.matcher(value);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("invalid timestamp: " + value);
    }
    String fraction = matcher.group(3) != null ? "." + matcher.group(3) : "";
    try {
      return LocalDateTime.parse(matcher.group(1) + "T" + matcher.group(2) + fraction)
          .toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("invalid timestamp: " + value, e);
    }
  }
}

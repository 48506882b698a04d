package com.evoila.lokigate.loki.query;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses Loki step and range durations such as {@code 30s}, {@code 5m} or {@code 15}. */
public final class StepParser {

  private static final Pattern UNIT_DURATION = Pattern.compile("(\\d+)([smhd])");
  private static final Pattern PLAIN_SECONDS = Pattern.compile("(\\d+)(?:\\.\\d+)?");

  private StepParser() {
    // Utility class - prevent instantiation
  }

  /**
   * Returns the step in whole seconds, or the default when the value is absent, malformed or not
   * positive.
   */
  public static long parseSeconds(String step, Duration defaultStep) {
    long fallback = Math.max(1, defaultStep.toSeconds());
    if (step == null || step.isBlank()) {
      return fallback;
    }
    String value = step.trim();

    Matcher unit = UNIT_DURATION.matcher(value);
    if (unit.matches()) {
      long seconds = toSeconds(Long.parseLong(unit.group(1)), unit.group(2).charAt(0));
      return seconds > 0 ? seconds : fallback;
    }

    Matcher plain = PLAIN_SECONDS.matcher(value);
    if (plain.matches()) {
      long seconds = Long.parseLong(plain.group(1));
      return seconds > 0 ? seconds : fallback;
    }
    return fallback;
  }

  static long toSeconds(long amount, char unit) {
    return switch (unit) {
      case 's' -> amount;
      case 'm' -> amount * 60;
      case 'h' -> amount * 3600;
      case 'd' -> amount * 86400;
      default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
    };
  }
}

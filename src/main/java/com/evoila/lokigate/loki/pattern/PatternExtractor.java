package com.evoila.lokigate.loki.pattern;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a log line into a template by replacing volatile tokens with {@value #PLACEHOLDER}. The
 * replacements run in a fixed order and are repeated until the line stops changing, so extracting
 * an extracted template is a no-op.
 */
public final class PatternExtractor {

  public static final String PLACEHOLDER = "<_>";

  private static final int MAX_PASSES = 8;

  private static final List<Pattern> VOLATILE_TOKENS =
      List.of(
          // ISO timestamps
          Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?Z?"),
          // epoch seconds and millis
          Pattern.compile("\\b\\d{10,13}\\b"),
          // UUIDs
          Pattern.compile(
              "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\b\\d{4,}\\b"),
          // IPv4
          Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b"),
          Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
          Pattern.compile("https?://\\S+"),
          // file paths
          Pattern.compile("/\\S*\\.[a-zA-Z]{2,4}"),
          // request ids
          Pattern.compile("\\b[0-9a-f]{16,}\\b", Pattern.CASE_INSENSITIVE),
          // durations and sizes, e.g. 500ms
          Pattern.compile("\\b\\d+[a-z]+\\b"),
          // IP:port
          Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}:\\d+\\b"),
          // domain names
          Pattern.compile("\\b[A-Za-z0-9._-]+\\.[A-Za-z]{2,}\\b"));

  private PatternExtractor() {
    // Utility class - prevent instantiation
  }

  public static String extract(String line) {
    if (line == null || line.isEmpty()) {
      return "";
    }
    String current = line;
    for (int pass = 0; pass < MAX_PASSES; pass++) {
      String next = replaceOnce(current);
      if (next.equals(current)) {
        return next;
      }
      current = next;
    }
    return current;
  }

  private static String replaceOnce(String line) {
    String result = line;
    for (Pattern token : VOLATILE_TOKENS) {
      result = token.matcher(result).replaceAll(PLACEHOLDER);
    }
    return result;
  }
}

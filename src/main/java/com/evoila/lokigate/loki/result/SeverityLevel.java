package com.evoila.lokigate.loki.result;

import java.util.List;
import java.util.Locale;
import lombok.Getter;

/**
 * Grafana's log level vocabulary. Severity texts are classified case-insensitively by substring, in
 * declaration order; anything unrecognized is {@link #UNKNOWN}.
 */
@Getter
public enum SeverityLevel {
  CRITICAL("critical", List.of("fatal", "critical", "emerg", "alert", "crit")),
  ERROR("error", List.of("error", "err")),
  WARNING("warning", List.of("warn")),
  INFO("info", List.of("info", "information", "informational", "notice")),
  DEBUG("debug", List.of("debug", "dbug")),
  TRACE("trace", List.of("trace")),
  UNKNOWN("unknown", List.of());

  private final String label;
  private final List<String> markers;

  SeverityLevel(String label, List<String> markers) {
    this.label = label;
    this.markers = markers;
  }

  public static SeverityLevel fromSeverityText(String severityText) {
    if (severityText == null) {
      return UNKNOWN;
    }
    String severity = severityText.toLowerCase(Locale.ROOT);
    for (SeverityLevel level : values()) {
      if (level.markers.stream().anyMatch(severity::contains)) {
        return level;
      }
    }
    return UNKNOWN;
  }

  /** Maps a raw severity text to its {@code level} label value. */
  public static String toLevelLabel(String severityText) {
    return fromSeverityText(severityText).label;
  }
}

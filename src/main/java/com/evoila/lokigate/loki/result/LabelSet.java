package com.evoila.lokigate.loki.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Labels identifying a stream or series. Keeps insertion order for output; identity is the
 * canonical key, the pairs sorted by name.
 */
public final class LabelSet {

  private final Map<String, String> labels;
  private final String key;

  private LabelSet(Map<String, String> labels) {
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    this.key = canonicalKey(labels);
  }

  public static LabelSet of(Map<String, String> labels) {
    return new LabelSet(labels);
  }

  /** Labels in insertion order. */
  public Map<String, String> asMap() {
    return labels;
  }

  /**
   * Canonical serialization, e.g. {@code {a="1", b="2"}}. Backslashes and double quotes in names
   * and values are escaped, so distinct label sets never share a key.
   */
  public String key() {
    return key;
  }

  private static String canonicalKey(Map<String, String> labels) {
    return new TreeMap<>(labels)
        .entrySet().stream()
            .map(entry -> escape(entry.getKey()) + "=\"" + escape(entry.getValue()) + "\"")
            .collect(Collectors.joining(", ", "{", "}"));
  }

  private static String escape(String text) {
    return text == null ? "" : text.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LabelSet other)) {
      return false;
    }
    return key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key;
  }
}

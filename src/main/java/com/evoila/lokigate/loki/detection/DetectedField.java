package com.evoila.lokigate.loki.detection;

import com.evoila.lokigate.loki.model.DetectedFieldSummary;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.Getter;

/** Accumulates the values seen for one field during a detection pass. */
@Getter
public class DetectedField {

  public static final String PARSER_JSON = "json";
  public static final String PARSER_LOGFMT = "logfmt";

  private final String label;
  private final Set<String> values = new LinkedHashSet<>();
  private final Set<String> parsers = new TreeSet<>();
  private FieldType type;
  private List<String> jsonPath;

  public DetectedField(String label) {
    this.label = label;
  }

  /**
   * Records one value.
   *
   * @param value the raw value
   * @param parser {@link #PARSER_JSON} or {@link #PARSER_LOGFMT}
   * @param path the JSON path of the value, null for logfmt
   */
  public void observe(String value, String parser, List<String> path) {
    values.add(value);
    parsers.add(parser);
    FieldType observed = FieldType.classify(value);
    type = type == null ? observed : type.upgrade(observed);
    if (jsonPath == null && path != null) {
      jsonPath = List.copyOf(path);
    }
  }

  public DetectedFieldSummary toSummary() {
    return new DetectedFieldSummary(
        label,
        (type == null ? FieldType.STRING : type).wireName(),
        values.size(),
        List.copyOf(parsers),
        jsonPath);
  }
}

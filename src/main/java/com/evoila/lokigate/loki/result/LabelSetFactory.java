package com.evoila.lokigate.loki.result;

import static com.evoila.lokigate.loki.sql.LabelMappings.LABEL_LEVEL;
import static com.evoila.lokigate.loki.sql.LabelMappings.LABEL_SCOPE_NAME;
import static com.evoila.lokigate.loki.sql.LabelMappings.LABEL_SCOPE_VERSION;
import static com.evoila.lokigate.loki.sql.LabelMappings.LABEL_SERVICE_NAME;
import static com.evoila.lokigate.loki.sql.LabelMappings.LABEL_SEVERITY;
import static com.evoila.lokigate.loki.sql.LabelMappings.LABEL_SPAN_ID;
import static com.evoila.lokigate.loki.sql.LabelMappings.LABEL_TRACE_ID;

import com.evoila.lokigate.loki.sql.LabelMappings;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * Builds the {@link LabelSet} of a log row. Order: service and severity labels, trace and span ids,
 * resource attributes, log attributes, scope name and version. On key collisions the later source
 * wins. {@code service.name} attributes are dropped because the row already carries {@code
 * service_name}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LabelSetFactory {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final JsonMapper jsonMapper;

  public LabelSet fromRow(Map<String, Object> row) {
    Map<String, String> labels = new LinkedHashMap<>();

    putIfPresent(labels, LABEL_SERVICE_NAME, row.get(LabelMappings.SERVICE_NAME), true);
    Object severity = row.get(LabelMappings.SEVERITY_TEXT);
    putIfPresent(labels, LABEL_SEVERITY, severity, true);
    if (severity != null && !severity.toString().isEmpty()) {
      labels.put(LABEL_LEVEL, SeverityLevel.toLevelLabel(severity.toString()));
    }
    putIfPresent(labels, LABEL_TRACE_ID, row.get(LabelMappings.TRACE_ID), false);
    putIfPresent(labels, LABEL_SPAN_ID, row.get(LabelMappings.SPAN_ID), false);

    putAttributes(labels, row.get(LabelMappings.RESOURCE_ATTRIBUTES));
    putAttributes(labels, row.get(LabelMappings.LOG_ATTRIBUTES));

    putIfPresent(labels, LABEL_SCOPE_NAME, row.get(LabelMappings.SCOPE_NAME), false);
    putIfPresent(labels, LABEL_SCOPE_VERSION, row.get(LabelMappings.SCOPE_VERSION), false);

    return LabelSet.of(labels);
  }

  private static void putIfPresent(
      Map<String, String> labels, String label, Object value, boolean keepEmpty) {
    if (value == null) {
      return;
    }
    String text = value.toString();
    if (keepEmpty || !text.isEmpty()) {
      labels.put(label, text);
    }
  }

  private void putAttributes(Map<String, String> labels, Object attributes) {
    Map<?, ?> map = toMap(attributes);
    map.forEach(
        (key, value) -> {
          if (key != null
              && value != null
              && !LabelMappings.SERVICE_NAME_ATTRIBUTE.equals(key.toString())) {
            labels.put(key.toString(), value.toString());
          }
        });
  }

  /** Attribute maps arrive as JSON objects; a JSON string is parsed, anything else is ignored. */
  private Map<?, ?> toMap(Object attributes) {
    if (attributes instanceof Map<?, ?> map) {
      return map;
    }
    if (attributes instanceof String text && !text.isBlank()) {
      try {
        return jsonMapper.readValue(text, MAP_TYPE);
      } catch (JacksonException e) {
        log.debug("Ignoring malformed attribute map: {}", e.getOriginalMessage());
      }
    }
    return Map.of();
  }
}

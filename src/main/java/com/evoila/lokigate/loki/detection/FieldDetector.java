package com.evoila.lokigate.loki.detection;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * Infers fields from log bodies. Bodies that parse as a JSON object contribute their flattened
 * keys (nested keys joined with {@code _}); everything else is scanned for logfmt {@code key=value}
 * pairs. Bodies that yield nothing are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FieldDetector {

  private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

  private static final Pattern LOGFMT_PAIR =
      Pattern.compile("([A-Za-z_][A-Za-z0-9_.\\-]*)=(\"(?:[^\"\\\\]|\\\\.)*\"|[^\\s\"]+)");

  private final JsonMapper jsonMapper;

  /**
   * Runs one detection pass.
   *
   * @return fields by label, sorted by label
   */
  public Map<String, DetectedField> detect(List<String> bodies) {
    Map<String, DetectedField> fields = new TreeMap<>();
    int structured = 0;
    for (String body : bodies) {
      if (body == null || body.isBlank()) {
        continue;
      }
      Map<String, Object> object = parseObject(body);
      if (object != null) {
        structured++;
        flatten(object, "", new ArrayList<>(), fields);
      } else {
        scanLogfmt(body, fields);
      }
    }
    log.debug(
        "Detected {} fields in {} bodies ({} structured)",
        fields.size(),
        bodies.size(),
        structured);
    return fields;
  }

  private Map<String, Object> parseObject(String body) {
    String trimmed = body.trim();
    if (!trimmed.startsWith("{")) {
      return null;
    }
    try {
      return jsonMapper.readValue(trimmed, OBJECT_TYPE);
    } catch (JacksonException e) {
      log.trace("Body is not a JSON object: {}", e.getOriginalMessage());
      return null;
    }
  }

  private void flatten(
      Map<?, ?> object, String prefix, List<String> path, Map<String, DetectedField> fields) {
    object.forEach(
        (key, value) -> {
          if (key == null || value == null) {
            return;
          }
          String name = prefix.isEmpty() ? key.toString() : prefix + "_" + key;
          List<String> childPath = new ArrayList<>(path);
          childPath.add(key.toString());
          if (value instanceof Map<?, ?> nested) {
            flatten(nested, name, childPath, fields);
          } else {
            fields
                .computeIfAbsent(name, DetectedField::new)
                .observe(scalarText(value), DetectedField.PARSER_JSON, childPath);
          }
        });
  }

  private String scalarText(Object value) {
    if (value instanceof List<?>) {
      return jsonMapper.writeValueAsString(value);
    }
    return value.toString();
  }

  private static void scanLogfmt(String body, Map<String, DetectedField> fields) {
    Matcher pair = LOGFMT_PAIR.matcher(body);
    while (pair.find()) {
      String value = pair.group(2);
      if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
        value = value.substring(1, value.length() - 1).replace("\\\"", "\"");
      }
      fields
          .computeIfAbsent(pair.group(1), DetectedField::new)
          .observe(value, DetectedField.PARSER_LOGFMT, null);
    }
  }
}

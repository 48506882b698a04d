package com.evoila.lokigate.loki.result;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class LabelSetFactoryTest {

  private final LabelSetFactory factory = new LabelSetFactory(JsonMapper.builder().build());

  @Test
  void fromRow_ShouldOrderLabelsBySource() {
    // Given
    Map<String, Object> row = new HashMap<>();
    row.put("ServiceName", "api");
    row.put("SeverityText", "WARN");
    row.put("TraceId", "t1");
    row.put("SpanId", "");
    row.put("ResourceAttributes", Map.of("service.name", "api", "host.name", "node-1"));
    row.put("LogAttributes", Map.of("user", "bob"));
    row.put("ScopeName", "io.otel");
    row.put("ScopeVersion", "");

    // When
    LabelSet labels = factory.fromRow(row);

    // Then
    assertThat(labels.asMap())
        .containsExactly(
            Map.entry("service_name", "api"),
            Map.entry("severity", "WARN"),
            Map.entry("level", "warning"),
            Map.entry("trace_id", "t1"),
            Map.entry("host.name", "node-1"),
            Map.entry("user", "bob"),
            Map.entry("scope_name", "io.otel"));
  }

  @Test
  void fromRow_ShouldLetLogAttributesWinCollisions() {
    Map<String, Object> row = new HashMap<>();
    row.put("ServiceName", "api");
    row.put("ResourceAttributes", Map.of("env", "resource"));
    row.put("LogAttributes", Map.of("env", "log"));

    assertThat(factory.fromRow(row).asMap()).containsEntry("env", "log");
  }

  @Test
  void fromRow_ShouldParseAttributeMapsSentAsJsonText() {
    Map<String, Object> row = new HashMap<>();
    row.put("ServiceName", "api");
    row.put("ResourceAttributes", "{\"region\":\"eu-west-1\"}");
    row.put("LogAttributes", "{not json");

    Map<String, String> labels = factory.fromRow(row).asMap();

    assertThat(labels).containsEntry("region", "eu-west-1");
    assertThat(labels).containsOnlyKeys("service_name", "region");
  }

  @Test
  void fromRow_ShouldKeepEmptySeverityWithoutLevel() {
    Map<String, Object> row = new HashMap<>();
    row.put("ServiceName", "api");
    row.put("SeverityText", "");

    assertThat(factory.fromRow(row).asMap())
        .containsEntry("severity", "")
        .doesNotContainKey("level");
  }
}

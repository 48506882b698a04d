package com.evoila.lokigate.loki.sql;

import com.evoila.lokigate.loki.query.MatchOperator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The one place that maps Loki label names to the OpenTelemetry log table. Matcher translation,
 * label value discovery, volume grouping and label detection all resolve labels through here.
 */
public final class LabelMappings {

  public static final String TIMESTAMP = "Timestamp";
  public static final String TRACE_ID = "TraceId";
  public static final String SPAN_ID = "SpanId";
  public static final String SEVERITY_TEXT = "SeverityText";
  public static final String SERVICE_NAME = "ServiceName";
  public static final String BODY = "Body";
  public static final String RESOURCE_ATTRIBUTES = "ResourceAttributes";
  public static final String LOG_ATTRIBUTES = "LogAttributes";
  public static final String SCOPE_NAME = "ScopeName";
  public static final String SCOPE_VERSION = "ScopeVersion";

  public static final String LABEL_SERVICE_NAME = "service_name";
  public static final String LABEL_SEVERITY = "severity";
  public static final String LABEL_LEVEL = "level";
  public static final String LABEL_TRACE_ID = "trace_id";
  public static final String LABEL_SPAN_ID = "span_id";
  public static final String LABEL_SCOPE_NAME = "scope_name";
  public static final String LABEL_SCOPE_VERSION = "scope_version";

  /** Attribute key already exposed as {@code service_name}; dropped from attribute labels. */
  public static final String SERVICE_NAME_ATTRIBUTE = "service.name";

  /** Pseudo-labels always reported by label discovery. */
  public static final List<String> PSEUDO_LABELS =
      List.of(LABEL_SERVICE_NAME, LABEL_SEVERITY, LABEL_TRACE_ID, LABEL_SPAN_ID);

  private static final LabelTarget.Column SERVICE =
      new LabelTarget.Column(SERVICE_NAME, EnumSet.allOf(MatchOperator.class));

  // Regex matchers on severity are not translated
  private static final LabelTarget.Column SEVERITY =
      new LabelTarget.Column(
          SEVERITY_TEXT, EnumSet.of(MatchOperator.EQUAL, MatchOperator.NOT_EQUAL));

  private static final LabelTarget.Column TRACE =
      new LabelTarget.Column(TRACE_ID, EnumSet.of(MatchOperator.EQUAL));

  private static final LabelTarget.Column SPAN = new LabelTarget.Column(SPAN_ID, Set.of());

  private static final LabelTarget ATTRIBUTE_MAPS = new LabelTarget.AttributeMaps();

  private static final Map<String, LabelTarget.Column> COLUMN_LABELS =
      Map.of(
          LABEL_SERVICE_NAME, SERVICE,
          "service", SERVICE,
          LABEL_SEVERITY, SEVERITY,
          LABEL_LEVEL, SEVERITY,
          LABEL_TRACE_ID, TRACE,
          LABEL_SPAN_ID, SPAN);

  /**
   * Candidates reported by label detection, with the expression whose distinct values give the
   * cardinality. {@code level} is derived from the severity column and counted after mapping.
   */
  public static final List<DetectedLabelCandidate> DETECTED_LABEL_CANDIDATES =
      List.of(
          new DetectedLabelCandidate(LABEL_SERVICE_NAME, SERVICE_NAME),
          new DetectedLabelCandidate(LABEL_SEVERITY, SEVERITY_TEXT),
          new DetectedLabelCandidate(LABEL_LEVEL, SEVERITY_TEXT),
          new DetectedLabelCandidate(LABEL_TRACE_ID, TRACE_ID),
          new DetectedLabelCandidate(LABEL_SPAN_ID, SPAN_ID),
          new DetectedLabelCandidate(LABEL_SCOPE_NAME, SCOPE_NAME),
          new DetectedLabelCandidate(LABEL_SCOPE_VERSION, SCOPE_VERSION),
          new DetectedLabelCandidate(
              "service_namespace", RESOURCE_ATTRIBUTES + "['service.namespace']"),
          new DetectedLabelCandidate(
              "deployment_environment", RESOURCE_ATTRIBUTES + "['deployment.environment']"),
          new DetectedLabelCandidate("host_name", RESOURCE_ATTRIBUTES + "['host.name']"),
          new DetectedLabelCandidate(
              "k8s_namespace_name", RESOURCE_ATTRIBUTES + "['k8s.namespace.name']"),
          new DetectedLabelCandidate("k8s_pod_name", RESOURCE_ATTRIBUTES + "['k8s.pod.name']"));

  private LabelMappings() {
    // Utility class - prevent instantiation
  }

  public static LabelTarget resolve(String label) {
    LabelTarget column = COLUMN_LABELS.get(label);
    return column != null ? column : ATTRIBUTE_MAPS;
  }

  public static boolean isSeverityLabel(String label) {
    return LABEL_SEVERITY.equals(label) || LABEL_LEVEL.equals(label);
  }

  /**
   * Expression selecting the label's value for grouping. Attribute labels read the log attribute
   * map first and fall back to the resource attribute map. The label name is interpolated into the
   * expression text, not bound as a parameter.
   */
  public static String valueExpression(String label) {
    if (resolve(label) instanceof LabelTarget.Column column) {
      return column.name();
    }
    String key = "'" + label + "'";
    return "if(mapContains("
        + LOG_ATTRIBUTES
        + ", "
        + key
        + "), "
        + LOG_ATTRIBUTES
        + "["
        + key
        + "], "
        + RESOURCE_ATTRIBUTES
        + "["
        + key
        + "])";
  }

  /**
   * Output name for a grouped label. Aliases of a column label collapse onto the canonical name,
   * so {@code service} groups come back as {@code service_name}.
   */
  public static String outputName(String label) {
    return SERVICE.equals(COLUMN_LABELS.get(label)) ? LABEL_SERVICE_NAME : label;
  }

  /**
   * A label reported by label detection.
   *
   * @param label the label name
   * @param expression the column or map lookup holding its values
   */
  public record DetectedLabelCandidate(String label, String expression) {}
}

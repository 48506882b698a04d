package com.evoila.lokigate.loki.sql;

import com.evoila.lokigate.common.config.GatewayProperties;
import com.evoila.lokigate.common.model.GatewayValidationException;
import com.evoila.lokigate.common.util.TimestampNormalizer;
import com.evoila.lokigate.common.util.ValidationUtils;
import com.evoila.lokigate.loki.query.LogQueryParser;
import com.evoila.lokigate.loki.query.MatchOperator;
import com.evoila.lokigate.loki.query.ParsedQuery;
import com.evoila.lokigate.loki.query.QueryMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Translates parsed LogQL into parameterized ClickHouse SQL against the OpenTelemetry log table.
 *
 * <p>User supplied values are always bound as {@code {name:Type}} parameters. Label names used as
 * grouping expressions by the volume queries are the only user input interpolated into the query
 * text; they are checked with {@link ValidationUtils#validateLabelNameCharacters(String)} first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqlTranslator {

  /** Column alias holding the row count in aggregate queries. */
  public static final String VOLUME_COLUMN = "volume";

  /** Column alias holding the bucket start (epoch seconds) in range aggregate queries. */
  public static final String BUCKET_COLUMN = "bucket";

  private static final String LOG_PROJECTION =
      String.join(
          ", ",
          LabelMappings.TIMESTAMP,
          LabelMappings.TRACE_ID,
          LabelMappings.SPAN_ID,
          "TraceFlags",
          LabelMappings.SEVERITY_TEXT,
          "SeverityNumber",
          LabelMappings.SERVICE_NAME,
          LabelMappings.BODY,
          "ResourceSchemaUrl",
          LabelMappings.RESOURCE_ATTRIBUTES,
          "ScopeSchemaUrl",
          LabelMappings.SCOPE_NAME,
          LabelMappings.SCOPE_VERSION,
          "ScopeAttributes",
          LabelMappings.LOG_ATTRIBUTES);

  private static final String SERIES_PROJECTION =
      String.join(
          ", ",
          LabelMappings.SERVICE_NAME,
          LabelMappings.SEVERITY_TEXT,
          LabelMappings.RESOURCE_ATTRIBUTES,
          LabelMappings.LOG_ATTRIBUTES);

  private final GatewayProperties properties;
  private final LogQueryParser parser;

  /**
   * Builds the main log selection query.
   *
   * @param query the parsed selector and line filter
   * @param options time range, limit and direction
   * @return the parameterized query
   * @throws IllegalArgumentException if a bound is not a valid timestamp
   */
  public GeneratedQuery translateQuery(ParsedQuery query, QueryOptions options) {
    SqlFilter filter = buildFilter(query, options.getStart(), options.getEnd());
    filter.bind("limit", clampLimit(options.getLimit()));

    String sql =
        "SELECT "
            + LOG_PROJECTION
            + " FROM "
            + table()
            + filter.whereClause()
            + " ORDER BY "
            + LabelMappings.TIMESTAMP
            + " "
            + options.getDirection().sqlOrder()
            + " LIMIT {limit:UInt32}";

    return generated("query", sql, filter.parameters());
  }

  /**
   * Builds the AND-combined conditions shared by every query: inclusive time bounds, one condition
   * per matcher and the case-insensitive line filter.
   */
  public SqlFilter buildFilter(ParsedQuery query, String start, String end) {
    SqlFilter filter = new SqlFilter();
    addTimeBounds(filter, start, end);

    List<QueryMatcher> matchers = query.matchers();
    for (int i = 0; i < matchers.size(); i++) {
      addMatcher(filter, matchers.get(i), "label_" + i, "labelKey_" + i);
    }

    query
        .textFilterValue()
        .ifPresent(
            text ->
                filter
                    .add(
                        "positionCaseInsensitive("
                            + LabelMappings.BODY
                            + ", {textFilter:String}) > 0")
                    .bind("textFilter", text));
    return filter;
  }

  /** Label names: the fixed pseudo-labels plus every attribute key seen in range. */
  public GeneratedQuery translateLabelsQuery(String start, String end) {
    SqlFilter filter = new SqlFilter();
    addTimeBounds(filter, start, end);

    StringBuilder sql = new StringBuilder("SELECT DISTINCT label FROM (");
    for (int i = 0; i < LabelMappings.PSEUDO_LABELS.size(); i++) {
      if (i > 0) {
        sql.append(" UNION ALL ");
      }
      sql.append("SELECT '").append(LabelMappings.PSEUDO_LABELS.get(i)).append("' AS label");
    }
    for (String map : List.of(LabelMappings.RESOURCE_ATTRIBUTES, LabelMappings.LOG_ATTRIBUTES)) {
      sql.append(" UNION ALL SELECT arrayJoin(mapKeys(")
          .append(map)
          .append(")) AS label FROM ")
          .append(table())
          .append(filter.whereClause());
    }
    sql.append(") WHERE label != '")
        .append(LabelMappings.SERVICE_NAME_ATTRIBUTE)
        .append("' ORDER BY label");

    return generated("labels", sql.toString(), filter.parameters());
  }

  /**
   * Distinct values of one label. Column labels read their column; anything else is looked up in
   * both attribute maps. Severity values are returned raw and mapped by the caller.
   */
  public GeneratedQuery translateLabelValuesQuery(String labelName, String start, String end) {
    SqlFilter filter = new SqlFilter();
    addTimeBounds(filter, start, end);

    String sql;
    if (LabelMappings.resolve(labelName) instanceof LabelTarget.Column column) {
      sql =
          "SELECT DISTINCT "
              + column.name()
              + " AS value FROM "
              + table()
              + " WHERE "
              + column.name()
              + " != ''"
              + filter.andClause()
              + " ORDER BY value";
    } else {
      filter.bind("labelName", labelName);
      sql =
          "SELECT DISTINCT value FROM ("
              + attributeValueSelect(LabelMappings.RESOURCE_ATTRIBUTES, filter)
              + " UNION ALL "
              + attributeValueSelect(LabelMappings.LOG_ATTRIBUTES, filter)
              + ") WHERE value != '' ORDER BY value";
    }
    return generated("label values", sql, filter.parameters());
  }

  /**
   * Series discovery. Each {@code match[]} selector contributes its matchers with parameters named
   * {@code match_<i>_<j>}; all resulting conditions are combined with AND.
   */
  public GeneratedQuery translateSeriesQuery(List<String> match, String start, String end) {
    SqlFilter filter = new SqlFilter();
    addTimeBounds(filter, start, end);

    if (match != null) {
      for (int i = 0; i < match.size(); i++) {
        List<QueryMatcher> matchers = parser.parse(match.get(i)).matchers();
        for (int j = 0; j < matchers.size(); j++) {
          String param = "match_" + i + "_" + j;
          addMatcher(filter, matchers.get(j), param, "labelKey_" + param);
        }
      }
    }

    String sql =
        "SELECT DISTINCT "
            + SERIES_PROJECTION
            + " FROM "
            + table()
            + filter.whereClause()
            + " ORDER BY "
            + LabelMappings.SERVICE_NAME
            + ", "
            + LabelMappings.SEVERITY_TEXT;
    return generated("series", sql, filter.parameters());
  }

  /** Stream, entry and byte totals for the selected rows. */
  public GeneratedQuery translateStatsQuery(ParsedQuery query, String start, String end) {
    SqlFilter filter = buildFilter(query, start, end);
    String sql =
        "SELECT uniqExact("
            + LabelMappings.SERVICE_NAME
            + ") AS streams, count() AS entries, sum(length("
            + LabelMappings.BODY
            + ")) AS bytes FROM "
            + table()
            + filter.whereClause();
    return generated("index stats", sql, filter.parameters());
  }

  /**
   * Row counts grouped by the given labels, largest first.
   *
   * @throws GatewayValidationException if a label name cannot be used as a grouping identifier
   *     or is reserved
   */
  public GeneratedQuery translateVolumeQuery(
      ParsedQuery query, String start, String end, List<String> groupBy, int limit) {
    SqlFilter filter = buildFilter(query, start, end);
    filter.bind("limit", clampLimit(limit));
    Map<String, String> groups = groupingColumns(groupBy);

    StringBuilder sql = new StringBuilder("SELECT ");
    groups.forEach((alias, expression) -> sql.append(expression).append(", "));
    sql.append("count() AS ").append(VOLUME_COLUMN).append(" FROM ").append(table());
    sql.append(filter.whereClause());
    if (!groups.isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", quoted(groups.keySet())));
    }
    sql.append(" ORDER BY ").append(VOLUME_COLUMN).append(" DESC LIMIT {limit:UInt32}");

    return generated("volume", sql.toString(), filter.parameters());
  }

  /** Row counts per label group and time bucket, ordered by bucket. */
  public GeneratedQuery translateVolumeRangeQuery(
      ParsedQuery query, String start, String end, List<String> groupBy, long stepSeconds) {
    SqlFilter filter = buildFilter(query, start, end);
    filter.bind("step", Math.max(1, stepSeconds));
    Map<String, String> groups = groupingColumns(groupBy);

    StringBuilder sql =
        new StringBuilder("SELECT toUnixTimestamp(toStartOfInterval(")
            .append(LabelMappings.TIMESTAMP)
            .append(", toIntervalSecond({step:UInt32}))) AS ")
            .append(BUCKET_COLUMN)
            .append(", ");
    groups.forEach((alias, expression) -> sql.append(expression).append(", "));
    sql.append("count() AS ").append(VOLUME_COLUMN).append(" FROM ").append(table());
    sql.append(filter.whereClause());

    List<String> groupColumns = new ArrayList<>();
    groupColumns.add(BUCKET_COLUMN);
    groupColumns.addAll(quoted(groups.keySet()));
    sql.append(" GROUP BY ").append(String.join(", ", groupColumns));
    sql.append(" ORDER BY ").append(BUCKET_COLUMN);

    return generated("volume range", sql.toString(), filter.parameters());
  }

  /** Most recent timestamps and bodies, the input of pattern mining. */
  public GeneratedQuery translatePatternSampleQuery(ParsedQuery query, String start, String end) {
    return sampleQuery(
        "pattern sample",
        LabelMappings.TIMESTAMP + ", " + LabelMappings.BODY,
        query,
        start,
        end,
        properties.getQuery().getPatternSampleSize());
  }

  /** Most recent bodies, the input of field detection. */
  public GeneratedQuery translateFieldSampleQuery(ParsedQuery query, String start, String end) {
    return sampleQuery(
        "field sample",
        LabelMappings.BODY,
        query,
        start,
        end,
        properties.getQuery().getDetectionSampleSize());
  }

  /**
   * One row with a distinct-value count per detected label candidate. {@code level} carries the
   * raw severity values, since its cardinality is only known after mapping.
   */
  public GeneratedQuery translateDetectedLabelsQuery(ParsedQuery query, String start, String end) {
    SqlFilter filter = buildFilter(query, start, end);

    List<String> columns = new ArrayList<>();
    for (LabelMappings.DetectedLabelCandidate candidate :
        LabelMappings.DETECTED_LABEL_CANDIDATES) {
      String expression = candidate.expression();
      String aggregate =
          LabelMappings.LABEL_LEVEL.equals(candidate.label())
              ? "groupUniqArrayIf(" + expression + ", " + expression + " != '')"
              : "uniqExactIf(" + expression + ", " + expression + " != '')";
      columns.add(aggregate + " AS `" + candidate.label() + "`");
    }

    String sql =
        "SELECT " + String.join(", ", columns) + " FROM " + table() + filter.whereClause();
    return generated("detected labels", sql, filter.parameters());
  }

  /** Clamps a requested limit to {@code [1, maxLimit]}; non-positive values use the default. */
  public int clampLimit(int requested) {
    GatewayProperties.Query query = properties.getQuery();
    int limit = requested > 0 ? requested : query.getDefaultLimit();
    return Math.max(1, Math.min(limit, query.getMaxLimit()));
  }

  private GeneratedQuery sampleQuery(
      String kind, String columns, ParsedQuery query, String start, String end, int limit) {
    SqlFilter filter = buildFilter(query, start, end);
    filter.bind("limit", Math.max(1, limit));
    String sql =
        "SELECT "
            + columns
            + " FROM "
            + table()
            + filter.whereClause()
            + " ORDER BY "
            + LabelMappings.TIMESTAMP
            + " DESC LIMIT {limit:UInt32}";
    return generated(kind, sql, filter.parameters());
  }

  private void addTimeBounds(SqlFilter filter, String start, String end) {
    if (ValidationUtils.isNotNullOrEmpty(start)) {
      filter
          .add(LabelMappings.TIMESTAMP + " >= {start:DateTime64(6)}")
          .bind("start", TimestampNormalizer.toStoreDateTime(start));
    }
    if (ValidationUtils.isNotNullOrEmpty(end)) {
      filter
          .add(LabelMappings.TIMESTAMP + " <= {end:DateTime64(6)}")
          .bind("end", TimestampNormalizer.toStoreDateTime(end));
    }
  }

  private void addMatcher(
      SqlFilter filter, QueryMatcher matcher, String valueParam, String keyParam) {
    String value = "{" + valueParam + ":String}";
    MatchOperator operator = matcher.operator();

    if (LabelMappings.resolve(matcher.key()) instanceof LabelTarget.Column column
        && column.isMatchable()) {
      if (!column.matchOperators().contains(operator)) {
        log.warn(
            "Matcher {} uses an operator not supported for label '{}', ignoring it",
            matcher.serialize(),
            matcher.key());
        return;
      }
      filter.add(comparison(column.name(), operator, value)).bind(valueParam, matcher.value());
      return;
    }

    String key = "{" + keyParam + ":String}";
    String resource =
        comparison(LabelMappings.RESOURCE_ATTRIBUTES + "[" + key + "]", operator, value);
    String logAttribute =
        comparison(LabelMappings.LOG_ATTRIBUTES + "[" + key + "]", operator, value);
    String joiner = isNegative(operator) ? " AND " : " OR ";

    filter
        .add("(" + resource + joiner + logAttribute + ")")
        .bind(keyParam, matcher.key())
        .bind(valueParam, matcher.value());
  }

  private static String comparison(String expression, MatchOperator operator, String value) {
    return switch (operator) {
      case EQUAL -> expression + " = " + value;
      case NOT_EQUAL -> expression + " != " + value;
      case REGEX_MATCH -> "match(" + expression + ", " + value + ")";
      case REGEX_NOT_MATCH -> "NOT match(" + expression + ", " + value + ")";
    };
  }

  private static boolean isNegative(MatchOperator operator) {
    return operator == MatchOperator.NOT_EQUAL || operator == MatchOperator.REGEX_NOT_MATCH;
  }

  private String attributeValueSelect(String map, SqlFilter filter) {
    return "SELECT "
        + map
        + "[{labelName:String}] AS value FROM "
        + table()
        + " WHERE mapContains("
        + map
        + ", {labelName:String})"
        + filter.andClause();
  }

  /**
   * Output alias to {@code expression AS `alias`}, deduplicated by alias. {@value #VOLUME_COLUMN}
   * and {@value #BUCKET_COLUMN} are reserved for the aggregate columns.
   */
  private static Map<String, String> groupingColumns(List<String> labels) {
    Map<String, String> columns = new LinkedHashMap<>();
    if (labels == null) {
      return columns;
    }
    for (String label : labels) {
      ValidationUtils.validateLabelNameCharacters(label);
      String alias = LabelMappings.outputName(label);
      if (VOLUME_COLUMN.equals(alias) || BUCKET_COLUMN.equals(alias)) {
        throw new GatewayValidationException(
            "label '" + alias + "' cannot be used for grouping, the name is reserved");
      }
      columns.putIfAbsent(alias, LabelMappings.valueExpression(label) + " AS `" + alias + "`");
    }
    return columns;
  }

  private static List<String> quoted(Iterable<String> aliases) {
    List<String> quoted = new ArrayList<>();
    aliases.forEach(alias -> quoted.add("`" + alias + "`"));
    return quoted;
  }

  private String table() {
    return properties.getClickhouse().getLogsTable();
  }

  private static GeneratedQuery generated(String kind, String sql, Map<String, Object> params) {
    log.debug("Generated {} SQL: {} with params: {}", kind, sql, params);
    return new GeneratedQuery(sql, params);
  }
}

package com.evoila.lokigate.loki.query;

/**
 * A single {@code key<op>"value"} label matcher.
 *
 * @param key the label name
 * @param operator the match operator
 * @param value the unescaped matcher value
 */
public record QueryMatcher(String key, MatchOperator operator, String value) {

  public String serialize() {
    return key + operator.getSymbol() + "\"" + value.replace("\"", "\\\"") + "\"";
  }
}

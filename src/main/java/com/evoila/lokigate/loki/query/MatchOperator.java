package com.evoila.lokigate.loki.query;

import java.util.Arrays;
import lombok.Getter;

/** Label matcher operators of the supported LogQL subset. */
@Getter
public enum MatchOperator {
  EQUAL("="),
  NOT_EQUAL("!="),
  REGEX_MATCH("=~"),
  REGEX_NOT_MATCH("!~");

  private final String symbol;

  MatchOperator(String symbol) {
    this.symbol = symbol;
  }

  /**
   * Parse an operator from its LogQL symbol.
   *
   * @throws IllegalArgumentException if the symbol is not a matcher operator
   */
  public static MatchOperator fromSymbol(String symbol) {
    return Arrays.stream(values())
        .filter(operator -> operator.symbol.equals(symbol))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown matcher operator: " + symbol));
  }

  @Override
  public String toString() {
    return symbol;
  }
}

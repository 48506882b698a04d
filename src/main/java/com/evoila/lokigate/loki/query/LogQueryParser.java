package com.evoila.lokigate.loki.query;

/**
 * Extracts label matchers and a line filter from LogQL text. The SQL translator and result shaping
 * only depend on this contract, so a grammar-based parser can replace the scanner later.
 */
public interface LogQueryParser {

  /**
   * Parses a query. Never fails: text without matchers or filters yields an empty result which
   * selects everything in range.
   *
   * @param query the raw LogQL text, may be null
   * @return the parsed query
   */
  ParsedQuery parse(String query);
}

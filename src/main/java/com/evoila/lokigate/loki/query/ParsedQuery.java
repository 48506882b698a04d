package com.evoila.lokigate.loki.query;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Result of parsing a LogQL query: the label matchers in order of appearance and at most one line
 * filter. All matchers are combined with AND; order only drives parameter naming.
 *
 * @param matchers the label matchers, never null
 * @param textFilter the line-contains filter, or null if the query has none
 */
public record ParsedQuery(List<QueryMatcher> matchers, String textFilter) {

  private static final ParsedQuery EMPTY = new ParsedQuery(List.of(), null);

  public ParsedQuery {
    matchers = matchers == null ? List.of() : List.copyOf(matchers);
  }

  public static ParsedQuery empty() {
    return EMPTY;
  }

  public Optional<String> textFilterValue() {
    return Optional.ofNullable(textFilter);
  }

  /** Distinct label names referenced by the matchers, in order of first appearance. */
  public Set<String> labelNames() {
    Set<String> names = new LinkedHashSet<>();
    matchers.forEach(matcher -> names.add(matcher.key()));
    return names;
  }
}

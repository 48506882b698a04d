package com.evoila.lokigate.loki.sql;

import com.evoila.lokigate.loki.query.MatchOperator;
import java.util.Set;

/** Where the value of a label lives in the log table. */
public sealed interface LabelTarget permits LabelTarget.Column, LabelTarget.AttributeMaps {

  /**
   * A dedicated column.
   *
   * @param name the column name
   * @param matchOperators operators a matcher on this label may use; empty if matchers on the label
   *     are answered from the attribute maps instead
   */
  record Column(String name, Set<MatchOperator> matchOperators) implements LabelTarget {

    public Column {
      matchOperators = Set.copyOf(matchOperators);
    }

    public boolean isMatchable() {
      return !matchOperators.isEmpty();
    }
  }

  /** A key in either the resource or the log attribute map. */
  record AttributeMaps() implements LabelTarget {}
}

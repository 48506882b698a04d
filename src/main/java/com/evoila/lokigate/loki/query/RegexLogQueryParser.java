package com.evoila.lokigate.loki.query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Minimal LogQL scanner. Picks up every {@code name<op>"value"} occurrence as a matcher and a
 * single {@code |= "literal"} or {@code |~ "literal"} line filter. There is no operator precedence
 * and no nested boolean logic; pipeline stages other than the first line filter are ignored.
 */
@Slf4j
@Component
public class RegexLogQueryParser implements LogQueryParser {

  private static final String QUOTED = "\"((?:[^\"\\\\]|\\\\.)*)\"";
  private static final String BACKTICKED = "`([^`]*)`";

  private static final Pattern MATCHER_PATTERN =
      Pattern.compile("([A-Za-z_][A-Za-z0-9_.]*)\\s*(=~|!~|!=|=)\\s*" + QUOTED);

  private static final Pattern CONTAINS_FILTER =
      Pattern.compile("\\|=\\s*(?:" + QUOTED + "|" + BACKTICKED + ")");

  private static final Pattern REGEX_FILTER =
      Pattern.compile("\\|~\\s*(?:" + QUOTED + "|" + BACKTICKED + ")");

  private static final Pattern ANY_QUOTED_FILTER = Pattern.compile("\\|[=~]\\s*" + QUOTED);

  @Override
  public ParsedQuery parse(String query) {
    if (query == null || query.isBlank()) {
      return ParsedQuery.empty();
    }

    List<QueryMatcher> matchers = new ArrayList<>();
    Matcher matcher = MATCHER_PATTERN.matcher(query);
    while (matcher.find()) {
      if (isInsideLineFilter(query, matcher.start())) {
        continue;
      }
      matchers.add(
          new QueryMatcher(
              matcher.group(1),
              MatchOperator.fromSymbol(matcher.group(2)),
              unescape(matcher.group(3))));
    }

    String textFilter = findLineFilter(query, CONTAINS_FILTER);
    if (textFilter == null) {
      textFilter = findLineFilter(query, REGEX_FILTER);
    }

    log.debug(
        "Parsed query '{}' into {} matchers, text filter: {}", query, matchers.size(), textFilter);
    return new ParsedQuery(matchers, textFilter);
  }

  /** The first filter of the given kind; later ones are ignored. Empty literals count as absent. */
  private static String findLineFilter(String query, Pattern pattern) {
    Matcher matcher = pattern.matcher(query);
    if (!matcher.find()) {
      return null;
    }
    String value = matcher.group(1) != null ? unescape(matcher.group(1)) : matcher.group(2);
    return value == null || value.isEmpty() ? null : value;
  }

  /** True if the match starts inside the quoted literal of a line filter. */
  private static boolean isInsideLineFilter(String query, int position) {
    Matcher filter = ANY_QUOTED_FILTER.matcher(query);
    while (filter.find()) {
      if (position >= filter.start(1) && position < filter.end(1)) {
        return true;
      }
    }
    return false;
  }

  private static String unescape(String value) {
    if (value.indexOf('\\') < 0) {
      return value;
    }
    StringBuilder result = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\\' && i + 1 < value.length()) {
        char next = value.charAt(++i);
        switch (next) {
          case 'n' -> result.append('\n');
          case 't' -> result.append('\t');
          default -> result.append(next);
        }
      } else {
        result.append(c);
      }
    }
    return result.toString();
  }
}

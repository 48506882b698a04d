package com.evoila.lokigate.loki.sql;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Time range, limit and ordering for a log query. Bounds are inclusive client timestamps (epoch or
 * date strings); either may be absent.
 */
@Getter
@Builder
@ToString
public class QueryOptions {

  /** Entry limit used when none is requested. */
  public static final int DEFAULT_LIMIT = 100;

  private final String start;
  private final String end;
  @Builder.Default private final int limit = DEFAULT_LIMIT;
  @Builder.Default private final Direction direction = Direction.BACKWARD;
}

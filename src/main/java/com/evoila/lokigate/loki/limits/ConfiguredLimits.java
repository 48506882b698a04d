package com.evoila.lokigate.loki.limits;

import com.evoila.lokigate.common.config.GatewayProperties;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Limits read from {@code gateway.limits.*}. */
@Component
@RequiredArgsConstructor
public class ConfiguredLimits implements Limits {

  private final GatewayProperties properties;

  @Override
  public int maxQuerySeries() {
    return Math.max(0, limits().getMaxQuerySeries());
  }

  @Override
  public int maxEntriesLimitPerQuery() {
    return Math.max(0, limits().getMaxEntriesLimitPerQuery());
  }

  @Override
  public Duration maxQueryLookback() {
    return nonNegative(limits().getMaxQueryLookback());
  }

  @Override
  public Duration maxQueryLength() {
    return nonNegative(limits().getMaxQueryLength());
  }

  @Override
  public long maxChunkBytesPerQuery() {
    return Math.max(0, limits().getMaxChunkBytesPerQuery());
  }

  @Override
  public List<String> requiredLabels() {
    List<String> labels = limits().getRequiredLabels();
    return labels == null ? List.of() : List.copyOf(labels);
  }

  @Override
  public int requiredNumberLabels() {
    return Math.max(0, limits().getRequiredNumberLabels());
  }

  private GatewayProperties.Limits limits() {
    return properties.getLimits();
  }

  private static Duration nonNegative(Duration duration) {
    return duration == null || duration.isNegative() ? Duration.ZERO : duration;
  }
}

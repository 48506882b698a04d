package com.evoila.lokigate.loki.model;

import java.util.List;

public record DetectedLabelsResult(List<DetectedLabel> detectedLabels) {

  public static DetectedLabelsResult empty() {
    return new DetectedLabelsResult(List.of());
  }
}

package com.evoila.lokigate.loki.model;

public record DetectedLabel(String label, long cardinality) {}

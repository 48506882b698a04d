package com.evoila.lokigate.loki.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Payload of {@code /status/buildinfo}, shaped like Loki's so Grafana accepts the data source. */
public record BuildInfo(
    String version,
    String revision,
    String branch,
    @JsonProperty("buildUser") String buildUser,
    @JsonProperty("buildDate") String buildDate,
    @JsonProperty("goVersion") String goVersion) {}

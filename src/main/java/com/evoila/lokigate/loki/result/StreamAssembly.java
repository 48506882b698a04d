package com.evoila.lokigate.loki.result;

import com.evoila.lokigate.loki.model.LokiStream;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of stream assembly: the streams, or the limit that stopped assembly.
 *
 * @param streams assembled streams, empty if rejected
 * @param violation the exceeded limit, or null
 */
public record StreamAssembly(List<LokiStream> streams, String violation) {

  static StreamAssembly of(List<LokiStream> streams) {
    return new StreamAssembly(List.copyOf(streams), null);
  }

  static StreamAssembly rejected(String violation) {
    return new StreamAssembly(List.of(), violation);
  }

  public Optional<String> violationMessage() {
    return Optional.ofNullable(violation);
  }
}

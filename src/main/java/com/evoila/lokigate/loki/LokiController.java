package com.evoila.lokigate.loki;

import com.evoila.lokigate.common.controller.BaseLokiController;
import com.evoila.lokigate.common.model.LokiResponse;
import com.evoila.lokigate.loki.model.BuildInfo;
import com.evoila.lokigate.loki.model.DetectedFieldsResult;
import com.evoila.lokigate.loki.model.DetectedLabelsResult;
import com.evoila.lokigate.loki.model.IndexStats;
import com.evoila.lokigate.loki.model.PatternResult;
import com.evoila.lokigate.loki.model.QueryResult;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Loki HTTP query API answered from the log store. */
@Slf4j
@RestController
@RequestMapping("/loki/api/v1")
@RequiredArgsConstructor
public class LokiController extends BaseLokiController {

  static final BuildInfo BUILD_INFO =
      new BuildInfo("2.9.0", "lokigate", "main", "lokigate", "", "java17");

  private static final String FORM = MediaType.APPLICATION_FORM_URLENCODED_VALUE;

  private final LokiService lokiService;

  @GetMapping("/query")
  public Mono<ResponseEntity<LokiResponse<QueryResult>>> query(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String time,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String direction) {
    return respond(exchange, lokiService.query(query, time, limit, direction));
  }

  @PostMapping(value = "/query", consumes = FORM)
  public Mono<ResponseEntity<LokiResponse<QueryResult>>> queryForm(ServerWebExchange exchange) {
    return respondToForm(
        exchange,
        form ->
            lokiService.query(
                form.getFirst("query"),
                form.getFirst("time"),
                intParam(form, "limit"),
                form.getFirst("direction")));
  }

  @GetMapping("/query_range")
  public Mono<ResponseEntity<LokiResponse<QueryResult>>> queryRange(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String direction,
      @RequestParam(required = false) String step) {
    return respond(exchange, lokiService.queryRange(query, start, end, limit, direction, step));
  }

  @PostMapping(value = "/query_range", consumes = FORM)
  public Mono<ResponseEntity<LokiResponse<QueryResult>>> queryRangeForm(
      ServerWebExchange exchange) {
    return respondToForm(
        exchange,
        form ->
            lokiService.queryRange(
                form.getFirst("query"),
                form.getFirst("start"),
                form.getFirst("end"),
                intParam(form, "limit"),
                form.getFirst("direction"),
                form.getFirst("step")));
  }

  @GetMapping({"/labels", "/label"})
  public Mono<ResponseEntity<LokiResponse<List<String>>>> labels(
      ServerWebExchange exchange,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    return respond(exchange, lokiService.labels(start, end));
  }

  @GetMapping("/label/{name}/values")
  public Mono<ResponseEntity<LokiResponse<List<String>>>> labelValues(
      ServerWebExchange exchange,
      @PathVariable String name,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    return respond(exchange, lokiService.labelValues(name, start, end));
  }

  @GetMapping("/series")
  public Mono<ResponseEntity<LokiResponse<List<Map<String, String>>>>> series(
      ServerWebExchange exchange,
      @RequestParam(name = "match[]", required = false) List<String> match,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    return respond(exchange, lokiService.series(match == null ? List.of() : match, start, end));
  }

  @PostMapping(value = "/series", consumes = FORM)
  public Mono<ResponseEntity<LokiResponse<List<Map<String, String>>>>> seriesForm(
      ServerWebExchange exchange) {
    return respondToForm(
        exchange,
        form -> {
          List<String> match = form.get("match[]");
          return lokiService.series(
              match == null ? List.of() : match, form.getFirst("start"), form.getFirst("end"));
        });
  }

  @GetMapping("/detected_labels")
  public Mono<ResponseEntity<LokiResponse<DetectedLabelsResult>>> detectedLabels(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    return respond(exchange, lokiService.detectedLabels(query, start, end));
  }

  @GetMapping("/detected_fields")
  public Mono<ResponseEntity<LokiResponse<DetectedFieldsResult>>> detectedFields(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    return respond(exchange, lokiService.detectedFields(query, start, end));
  }

  @GetMapping("/detected_field/{name}/values")
  public Mono<ResponseEntity<LokiResponse<List<String>>>> detectedFieldValues(
      ServerWebExchange exchange,
      @PathVariable String name,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    return respond(exchange, lokiService.detectedFieldValues(name, query, start, end));
  }

  @GetMapping("/index/stats")
  public Mono<ResponseEntity<LokiResponse<IndexStats>>> indexStats(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    return respond(exchange, lokiService.indexStats(query, start, end));
  }

  @GetMapping("/index/volume")
  public Mono<ResponseEntity<LokiResponse<QueryResult>>> indexVolume(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String targetLabels) {
    return respond(exchange, lokiService.indexVolume(query, start, end, limit, targetLabels));
  }

  @GetMapping("/index/volume_range")
  public Mono<ResponseEntity<LokiResponse<QueryResult>>> indexVolumeRange(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) String step,
      @RequestParam(required = false) String targetLabels) {
    return respond(
        exchange, lokiService.indexVolumeRange(query, start, end, step, targetLabels));
  }

  @GetMapping("/patterns")
  public Mono<ResponseEntity<LokiResponse<List<PatternResult>>>> patterns(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) String step) {
    return respond(exchange, lokiService.patterns(query, start, end, step));
  }

  /**
   * Live tail as server-sent events. The first event is an empty stream list so clients see the
   * connection open; a failed poll ends the stream with an {@code error} event.
   */
  @GetMapping(value = "/tail", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<Map<String, Object>>> tail(
      ServerWebExchange exchange,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) Integer limit) {
    logIncomingRequest(exchange);
    return Flux.concat(
            Flux.just(streamsEvent(List.of())),
            lokiService.tail(query, start, limit).map(result -> streamsEvent(result.result())))
        .onErrorResume(
            e -> {
              log.warn("Tail for query '{}' failed: {}", query, e.getMessage());
              return Flux.just(
                  ServerSentEvent.<Map<String, Object>>builder(
                          Map.of("error", String.valueOf(e.getMessage())))
                      .event("error")
                      .build());
            });
  }

  @GetMapping("/status/buildinfo")
  public Mono<BuildInfo> buildInfo() {
    return Mono.just(BUILD_INFO);
  }

  private static ServerSentEvent<Map<String, Object>> streamsEvent(List<?> streams) {
    return ServerSentEvent.<Map<String, Object>>builder(Map.of(QueryResult.STREAMS, streams))
        .build();
  }

  private static Integer intParam(MultiValueMap<String, String> form, String name) {
    String value = form.getFirst(name);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid " + name + ": " + value, e);
    }
  }
}

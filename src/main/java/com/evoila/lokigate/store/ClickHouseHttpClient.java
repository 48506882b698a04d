package com.evoila.lokigate.store;

import com.evoila.lokigate.common.config.GatewayProperties;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * {@link LogStoreClient} over the ClickHouse HTTP interface. Queries are POSTed as the request
 * body, parameters travel as {@code param_<name>} query parameters and rows come back as {@code
 * JSONEachRow}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClickHouseHttpClient implements LogStoreClient {

  static final String USER_HEADER = "X-ClickHouse-User";
  static final String KEY_HEADER = "X-ClickHouse-Key";
  static final String FORMAT = "JSONEachRow";

  private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

  private final WebClient webClient;
  private final GatewayProperties properties;
  private final JsonMapper jsonMapper;

  @Override
  public Mono<List<Map<String, Object>>> query(String sql, Map<String, Object> parameters) {
    URI uri = buildUri(parameters);
    log.info("Executing ClickHouse query with {} parameters", parameters.size());
    log.debug("SQL: {} params: {}", sql, parameters);

    return webClient
        .post()
        .uri(uri)
        .headers(this::applyCredentials)
        .contentType(MediaType.TEXT_PLAIN)
        .bodyValue(sql)
        .retrieve()
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(this::parseRows)
        .doOnNext(rows -> log.info("ClickHouse returned {} rows", rows.size()))
        .doOnError(e -> logError(e, sql));
  }

  @Override
  public Mono<Void> insert(String table, List<Map<String, Object>> rows) {
    if (rows.isEmpty()) {
      return Mono.empty();
    }
    StringBuilder body = new StringBuilder("INSERT INTO ").append(table).append(" FORMAT ");
    body.append(FORMAT).append('\n');
    rows.forEach(row -> body.append(jsonMapper.writeValueAsString(row)).append('\n'));

    log.info("Inserting {} rows into {}", rows.size(), table);
    return webClient
        .post()
        .uri(buildUri(Map.of()))
        .headers(this::applyCredentials)
        .contentType(MediaType.TEXT_PLAIN)
        .bodyValue(body.toString())
        .retrieve()
        .toBodilessEntity()
        .doOnError(e -> logError(e, "INSERT INTO " + table))
        .then();
  }

  @Override
  public Mono<Boolean> ping() {
    String url = properties.getClickhouse().getUrl();
    return webClient
        .get()
        .uri(UriComponentsBuilder.fromUriString(url).path("/ping").build().toUri())
        .retrieve()
        .bodyToMono(String.class)
        .map(body -> body.trim().startsWith("Ok"))
        .defaultIfEmpty(false)
        .onErrorResume(
            e -> {
              log.warn("ClickHouse ping failed: {}", e.getMessage());
              return Mono.just(false);
            });
  }

  URI buildUri(Map<String, Object> parameters) {
    GatewayProperties.ClickHouse clickHouse = properties.getClickhouse();
    Map<String, Object> variables = new HashMap<>();
    variables.put("database", clickHouse.getDatabase());
    variables.put("format", FORMAT);

    UriComponentsBuilder builder =
        UriComponentsBuilder.fromUriString(clickHouse.getUrl())
            .path("/")
            .queryParam("database", "{database}")
            .queryParam("default_format", "{format}");

    int index = 0;
    for (Map.Entry<String, Object> parameter : parameters.entrySet()) {
      String variable = "p" + index++;
      builder.queryParam("param_" + parameter.getKey(), "{" + variable + "}");
      variables.put(variable, String.valueOf(parameter.getValue()));
    }
    return builder.encode().buildAndExpand(variables).toUri();
  }

  private void applyCredentials(HttpHeaders headers) {
    GatewayProperties.ClickHouse clickHouse = properties.getClickhouse();
    headers.set(USER_HEADER, clickHouse.getUsername());
    if (clickHouse.getPassword() != null && !clickHouse.getPassword().isEmpty()) {
      headers.set(KEY_HEADER, clickHouse.getPassword());
    }
  }

  private List<Map<String, Object>> parseRows(String body) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (String line : body.split("\n")) {
      if (!line.isBlank()) {
        rows.add(jsonMapper.readValue(line, ROW_TYPE));
      }
    }
    return rows;
  }

  private void logError(Throwable e, String sql) {
    log.error("ClickHouse request failed: {}", e.getMessage());
    log.debug("Failed SQL: {}", sql);
    if (e instanceof WebClientResponseException webEx) {
      log.error("HTTP Status: {}", webEx.getStatusCode());
      log.error("Response Body: {}", webEx.getResponseBodyAsString());
    }
  }
}

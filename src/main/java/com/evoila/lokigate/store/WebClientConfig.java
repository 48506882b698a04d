package com.evoila.lokigate.store;

import com.evoila.lokigate.common.config.GatewayProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

@Configuration
@Slf4j
public class WebClientConfig {

  @Value("${webclient.buffer-size:52428800}") // Default 50MB
  private int bufferSize;

  @Bean
  public WebClient webClient(GatewayProperties properties) {
    GatewayProperties.ClickHouse clickHouse = properties.getClickhouse();
    log.info("Creating ClickHouse WebClient for {}", clickHouse.getUrl());

    ConnectionProvider connectionProvider =
        ConnectionProvider.builder("clickhouse-pool")
            .maxConnections(50)
            .maxIdleTime(Duration.ofSeconds(30))
            .maxLifeTime(Duration.ofMinutes(5))
            .pendingAcquireTimeout(Duration.ofSeconds(10))
            .evictInBackground(Duration.ofSeconds(30))
            .build();

    HttpClient httpClient =
        createHttpClient(
            connectionProvider, clickHouse.getConnectTimeout(), clickHouse.getResponseTimeout());

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .codecs(
            configurer -> {
              // Log queries can return large bodies
              configurer.defaultCodecs().maxInMemorySize(bufferSize);
              log.info(
                  "WebClient configured with buffer size: {} bytes ({} MB)",
                  bufferSize,
                  bufferSize / (1024 * 1024));
            })
        .build();
  }

  private HttpClient createHttpClient(
      ConnectionProvider connectionProvider, Duration connectTimeout, Duration responseTimeout) {
    long readTimeoutSeconds = Math.max(1, responseTimeout.toSeconds());
    return HttpClient.create(connectionProvider)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
        .responseTimeout(responseTimeout)
        .doOnConnected(
            conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
                    .addHandlerLast(new WriteTimeoutHandler(10, TimeUnit.SECONDS)))
        .doOnRequest(
            (request, connection) ->
                log.debug("ClickHouse request: {} {}", request.method(), request.uri()))
        .doOnResponse(
            (response, connection) ->
                log.debug("ClickHouse response: {} from {}", response.status(), response.uri()))
        .doOnError(
            (request, throwable) ->
                log.error(
                    "ClickHouse request failed: {} {} - {}",
                    request.method(),
                    request.uri(),
                    throwable.getMessage()),
            (response, throwable) ->
                log.error(
                    "ClickHouse response error: {} from {} - {}",
                    response.status(),
                    response.uri(),
                    throwable.getMessage()));
  }
}

package com.evoila.lokigate.store;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.lokigate.common.config.GatewayProperties;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.test.StepVerifier;
import tools.jackson.databind.json.JsonMapper;

@Tag("wiremock")
class ClickHouseHttpClientTest {

  private WireMockServer wireMockServer;
  private GatewayProperties properties;
  private ClickHouseHttpClient client;

  @BeforeEach
  void setUp() {
    wireMockServer = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
    wireMockServer.start();

    properties = new GatewayProperties();
    properties.getClickhouse().setUrl("http://localhost:" + wireMockServer.port());
    properties.getClickhouse().setDatabase("logs");
    client =
        new ClickHouseHttpClient(
            WebClient.builder().build(), properties, JsonMapper.builder().build());
  }

  @AfterEach
  void tearDown() {
    wireMockServer.stop();
  }

  @Test
  void query_ShouldPostSqlAndParseJsonEachRow() {
    // Given
    wireMockServer.stubFor(
        post(urlPathEqualTo("/"))
            .withQueryParam("database", equalTo("logs"))
            .withQueryParam("default_format", equalTo("JSONEachRow"))
            .withQueryParam("param_label_0", equalTo("api"))
            .withQueryParam("param_start", equalTo("2025-07-15 12:04:14.000000"))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withBody(
                        "{\"ServiceName\":\"api\",\"volume\":\"3\"}\n"
                            + "{\"ServiceName\":\"web\",\"volume\":\"1\"}\n")));
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("label_0", "api");
    params.put("start", "2025-07-15 12:04:14.000000");

    // When / Then
    StepVerifier.create(client.query("SELECT 1", params))
        .assertNext(
            rows -> {
              assertThat(rows).hasSize(2);
              assertThat(rows.get(0)).containsEntry("ServiceName", "api");
              assertThat(rows.get(1)).containsEntry("volume", "1");
            })
        .verifyComplete();

    wireMockServer.verify(
        postRequestedFor(urlPathEqualTo("/"))
            .withHeader(ClickHouseHttpClient.USER_HEADER, equalTo("default"))
            .withHeader(ClickHouseHttpClient.KEY_HEADER, absent())
            .withRequestBody(equalTo("SELECT 1")));
  }

  @Test
  void query_ShouldSendPasswordWhenConfigured() {
    properties.getClickhouse().setPassword("secret");
    wireMockServer.stubFor(post(urlPathEqualTo("/")).willReturn(aResponse().withStatus(200)));

    StepVerifier.create(client.query("SELECT 1", Map.of()))
        .assertNext(rows -> assertThat(rows).isEmpty())
        .verifyComplete();

    wireMockServer.verify(
        postRequestedFor(urlPathEqualTo("/"))
            .withHeader(ClickHouseHttpClient.KEY_HEADER, equalTo("secret")));
  }

  @Test
  void query_ShouldPropagateStoreErrors() {
    wireMockServer.stubFor(
        post(urlPathEqualTo("/"))
            .willReturn(aResponse().withStatus(404).withBody("Code: 60. Unknown table")));

    StepVerifier.create(client.query("SELECT * FROM missing", Map.of()))
        .expectErrorSatisfies(
            e -> {
              assertThat(e).isInstanceOf(WebClientResponseException.class);
              assertThat(((WebClientResponseException) e).getResponseBodyAsString())
                  .contains("Unknown table");
            })
        .verify();
  }

  @Test
  void insert_ShouldSendJsonEachRowBody() {
    wireMockServer.stubFor(post(urlPathEqualTo("/")).willReturn(aResponse().withStatus(200)));
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("pattern", "user <_> logged in");
    row.put("count", 2);

    StepVerifier.create(client.insert("loki_patterns", List.of(row))).verifyComplete();

    wireMockServer.verify(
        postRequestedFor(urlPathEqualTo("/"))
            .withRequestBody(
                equalTo(
                    "INSERT INTO loki_patterns FORMAT JSONEachRow\n"
                        + "{\"pattern\":\"user <_> logged in\",\"count\":2}\n")));
  }

  @Test
  void insert_ShouldSkipEmptyBatches() {
    StepVerifier.create(client.insert("loki_patterns", List.of())).verifyComplete();

    assertThat(wireMockServer.getAllServeEvents()).isEmpty();
  }

  @Test
  void ping_ShouldReportStoreState() {
    wireMockServer.stubFor(get("/ping").willReturn(aResponse().withStatus(200).withBody("Ok.\n")));
    StepVerifier.create(client.ping()).expectNext(true).verifyComplete();

    wireMockServer.stubFor(get("/ping").willReturn(aResponse().withStatus(503)));
    StepVerifier.create(client.ping()).expectNext(false).verifyComplete();
  }

  @Test
  void ping_ShouldReportUnreachableStore() {
    wireMockServer.stop();

    StepVerifier.create(client.ping()).expectNext(false).verifyComplete();
  }

  @Test
  void buildUri_ShouldEncodeParameterValues() {
    URI uri = client.buildUri(Map.of("textFilter", "a&b=c d"));

    assertThat(uri.getRawQuery())
        .contains("database=logs")
        .contains("default_format=JSONEachRow")
        .contains("param_textFilter=a%26b%3Dc%20d");
  }
}

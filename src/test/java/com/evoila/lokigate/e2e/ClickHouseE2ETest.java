package com.evoila.lokigate.e2e;

import com.evoila.lokigate.app.LokiGateApplication;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Function;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.util.DefaultUriBuilderFactory;
import org.springframework.web.util.UriBuilder;

/**
 * End-to-end tests against a real ClickHouse server. The generated SQL, the parameter binding and
 * the JSONEachRow decoding all run unmocked.
 *
 * <p>Test data (see {@link ClickHouseTestContainer}):
 *
 * <ul>
 *   <li>service {@code checkout}, env {@code prod}: one error, one info, one warning entry
 *   <li>service {@code inventory}, env {@code staging}: one info, one debug entry
 * </ul>
 */
@Tag("e2e")
@Tag("clickhouse")
@ActiveProfiles("test")
@SpringBootTest(
    classes = LokiGateApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ClickHouseE2ETest {

  private static ClickHouseTestContainer clickHouse;

  @LocalServerPort private int port;

  private WebTestClient webTestClient;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    if (clickHouse == null) {
      clickHouse = new ClickHouseTestContainer();
      clickHouse.start();
    }
    registry.add("gateway.clickhouse.url", clickHouse::getUrl);
    registry.add("gateway.clickhouse.database", () -> ClickHouseTestContainer.DATABASE);
    registry.add("gateway.clickhouse.username", () -> ClickHouseTestContainer.USERNAME);
    registry.add("gateway.clickhouse.password", () -> ClickHouseTestContainer.PASSWORD);
    registry.add("gateway.clickhouse.response-timeout", () -> "30s");
  }

  @AfterAll
  static void stopContainers() {
    if (clickHouse != null) {
      clickHouse.stop();
      clickHouse = null;
    }
  }

  @BeforeEach
  void setupWebTestClient() {
    // Query values are encoded by hand so braces are not read as URI template variables
    DefaultUriBuilderFactory factory = new DefaultUriBuilderFactory("http://localhost:" + port);
    factory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.NONE);
    webTestClient =
        WebTestClient.bindToServer()
            .uriBuilderFactory(factory)
            .responseTimeout(Duration.ofSeconds(30))
            .build();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static Function<UriBuilder, URI> uri(String path, String... parameters) {
    StringBuilder query = new StringBuilder();
    for (int i = 0; i + 1 < parameters.length; i += 2) {
      if (query.length() > 0) {
        query.append('&');
      }
      query.append(parameters[i]).append('=').append(encode(parameters[i + 1]));
    }
    return uriBuilder -> uriBuilder.path(path).query(query.toString()).build();
  }

  private String rangeStart() {
    return Long.toString(clickHouse.getSeededAt().minus(Duration.ofMinutes(30)).getEpochSecond());
  }

  private String rangeEnd() {
    return Long.toString(clickHouse.getSeededAt().plus(Duration.ofMinutes(1)).getEpochSecond());
  }

  @Test
  @DisplayName("query_range returns one stream per label set, newest entry first")
  void queryRange_ShouldGroupRowsIntoStreams() {
    webTestClient
        .get()
        .uri(
            uri(
                "/loki/api/v1/query_range",
                "query",
                "{service_name=\"checkout\"}",
                "start",
                rangeStart(),
                "end",
                rangeEnd()))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo("success")
        .jsonPath("$.data.resultType")
        .isEqualTo("streams")
        .jsonPath("$.data.result.length()")
        .isEqualTo(3)
        .jsonPath("$.data.result[0].stream.level")
        .isEqualTo("error")
        .jsonPath("$.data.result[0].stream.env")
        .isEqualTo("prod")
        .jsonPath("$.data.result[0].values[0][1]")
        .isEqualTo("payment timeout after 3000 ms");
  }

  @Test
  @DisplayName("line filters match case-insensitively and combine with label matchers")
  void queryRange_ShouldApplyLineFilter() {
    webTestClient
        .get()
        .uri(
            uri(
                "/loki/api/v1/query_range",
                "query",
                "{env=~\"prod|staging\"} |= \"PAYMENT\"",
                "start",
                rangeStart(),
                "end",
                rangeEnd()))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.data.result.length()")
        .isEqualTo(2)
        .jsonPath("$.data.result[1].values[0][1]")
        .isEqualTo("retrying payment for order 4712");
  }

  @Test
  @DisplayName("metric queries are answered with a matrix of per-step counts")
  void queryRange_ShouldAnswerMetricQueryWithMatrix() {
    webTestClient
        .get()
        .uri(
            uri(
                "/loki/api/v1/query_range",
                "query",
                "sum by (service_name) (count_over_time({env=~\".+\"}[5m]))",
                "start",
                rangeStart(),
                "end",
                rangeEnd(),
                "step",
                "3600"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.data.resultType")
        .isEqualTo("matrix")
        .jsonPath("$.data.result.length()")
        .isEqualTo(2);
  }

  @Test
  @DisplayName("label discovery reports pseudo-labels and attribute keys")
  void labels_ShouldIncludeAttributeKeys() {
    webTestClient
        .get()
        .uri(uri("/loki/api/v1/labels", "start", rangeStart(), "end", rangeEnd()))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.data[?(@ == 'service_name')]")
        .exists()
        .jsonPath("$.data[?(@ == 'env')]")
        .exists()
        .jsonPath("$.data[?(@ == 'user_id')]")
        .exists();
  }

  @Test
  @DisplayName("level values are mapped to Grafana's level vocabulary")
  void labelValues_ShouldMapLevels() {
    webTestClient
        .get()
        .uri(uri("/loki/api/v1/label/level/values", "start", rangeStart(), "end", rangeEnd()))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .json("{\"data\":[\"debug\",\"error\",\"info\",\"warning\"]}");
  }

  @Test
  @DisplayName("series lists distinct label sets")
  void series_ShouldReturnDistinctLabelSets() {
    webTestClient
        .get()
        .uri(
            uri(
                "/loki/api/v1/series",
                "match[]",
                "{service_name=\"inventory\"}",
                "start",
                rangeStart(),
                "end",
                rangeEnd()))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.data.length()")
        .isEqualTo(2)
        .jsonPath("$.data[0].service_name")
        .isEqualTo("inventory");
  }

  @Test
  @DisplayName("index stats count entries and bytes of matching rows")
  void indexStats_ShouldCountMatchingRows() {
    webTestClient
        .get()
        .uri(
            uri(
                "/loki/api/v1/index/stats",
                "query",
                "{service_name=\"checkout\"}",
                "start",
                rangeStart(),
                "end",
                rangeEnd()))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.entries")
        .isEqualTo(3)
        .jsonPath("$.streams")
        .isEqualTo(1);
  }

  @Test
  @DisplayName("health reports a connected store")
  void health_ShouldReportConnected() {
    webTestClient
        .get()
        .uri("/health")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.clickhouse")
        .isEqualTo("connected");
  }
}

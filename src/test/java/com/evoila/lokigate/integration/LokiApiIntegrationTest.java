package com.evoila.lokigate.integration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;

import com.evoila.lokigate.base.BaseIntegrationTest;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webtestclient.autoconfigure.AutoConfigureWebTestClient;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@Tag("loki")
@Tag("wiremock")
@AutoConfigureWebTestClient
class LokiApiIntegrationTest extends BaseIntegrationTest {

  private static final String LOG_ROWS =
      "{\"Timestamp\":\"2025-07-15 12:10:00.000000000\",\"ServiceName\":\"api\","
          + "\"SeverityText\":\"ERROR\",\"Body\":\"db timeout\","
          + "\"ResourceAttributes\":{\"env\":\"prod\"},\"LogAttributes\":{}}\n"
          + "{\"Timestamp\":\"2025-07-15 12:09:00.000000000\",\"ServiceName\":\"api\","
          + "\"SeverityText\":\"ERROR\",\"Body\":\"upstream timeout\","
          + "\"ResourceAttributes\":{\"env\":\"prod\"},\"LogAttributes\":{}}\n";

  @Autowired private WebTestClient webTestClient;

  @Test
  void queryRange_ShouldReturnStreamsFromClickHouseRows() {
    // Given
    clickHouse.stubFor(
        post(urlPathEqualTo("/"))
            .withQueryParam("param_label_0", equalTo("api"))
            .withQueryParam("param_textFilter", equalTo("timeout"))
            .willReturn(aResponse().withStatus(200).withBody(LOG_ROWS)));

    // When / Then
    webTestClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/loki/api/v1/query_range")
                    .queryParam("query", "{query}")
                    .queryParam("start", "1752581054000000000")
                    .queryParam("end", "1752584654000000000")
                    .build("{service_name=\"api\"} |= \"timeout\""))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo("success")
        .jsonPath("$.data.resultType")
        .isEqualTo("streams")
        .jsonPath("$.data.result.length()")
        .isEqualTo(1)
        .jsonPath("$.data.result[0].stream.level")
        .isEqualTo("error")
        .jsonPath("$.data.result[0].stream.env")
        .isEqualTo("prod")
        .jsonPath("$.data.result[0].values[0][0]")
        .isEqualTo("1752581400000000000")
        .jsonPath("$.data.result[0].values[1][1]")
        .isEqualTo("upstream timeout");

    clickHouse.verify(
        postRequestedFor(urlPathEqualTo("/"))
            .withRequestBody(containing("positionCaseInsensitive(Body, {textFilter:String})")));
  }

  @Test
  void queryRange_ShouldAcceptFormEncodedPost() {
    clickHouse.stubFor(post(urlPathEqualTo("/")).willReturn(aResponse().withBody(LOG_ROWS)));

    webTestClient
        .post()
        .uri("/loki/api/v1/query_range")
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(
            BodyInserters.fromFormData("query", "{service_name=\"api\"}")
                .with("start", "1752581054")
                .with("end", "1752584654")
                .with("limit", "10"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.data.result[0].values.length()")
        .isEqualTo(2);
  }

  @Test
  void queryRange_ShouldAnswerBadDataForMissingQuery() {
    webTestClient
        .get()
        .uri("/loki/api/v1/query_range?start=1752581054&end=1752584654")
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo("error")
        .jsonPath("$.errorType")
        .isEqualTo("bad_data")
        .jsonPath("$.error")
        .isEqualTo("query parameter is required")
        .jsonPath("$.data.result")
        .isEmpty();

    clickHouse.verify(0, postRequestedFor(urlPathEqualTo("/")));
  }

  @Test
  void labels_ShouldAnswerInternalErrorWhenClickHouseFails() {
    clickHouse.stubFor(
        post(urlPathEqualTo("/"))
            .willReturn(aResponse().withStatus(500).withBody("Code: 81. Database does not exist")));

    webTestClient
        .get()
        .uri("/loki/api/v1/labels")
        .exchange()
        .expectStatus()
        .is5xxServerError()
        .expectBody()
        .jsonPath("$.errorType")
        .isEqualTo("internal")
        .jsonPath("$.error")
        .isEqualTo("ClickHouse error: Code: 81. Database does not exist");
  }

  @Test
  void labelValues_ShouldMapSeverityValues() {
    clickHouse.stubFor(
        post(urlPathEqualTo("/"))
            .willReturn(
                aResponse()
                    .withBody(
                        "{\"value\":\"ERROR\"}\n{\"value\":\"Warn\"}\n"
                            + "{\"value\":\"INFO\"}\n")));

    webTestClient
        .get()
        .uri("/loki/api/v1/label/level/values")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .json("{\"status\":\"success\",\"data\":[\"error\",\"info\",\"warning\"]}");
  }

  @Test
  void series_ShouldReadRepeatedMatchParameters() {
    clickHouse.stubFor(
        post(urlPathEqualTo("/"))
            .willReturn(
                aResponse()
                    .withBody(
                        "{\"ServiceName\":\"api\",\"SeverityText\":\"INFO\","
                            + "\"ResourceAttributes\":{},\"LogAttributes\":{}}\n")));

    webTestClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/loki/api/v1/series")
                    .queryParam("match[]", "{first}")
                    .queryParam("match[]", "{second}")
                    .build("{service_name=\"api\"}", "{level=\"info\"}"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.data[0].service_name")
        .isEqualTo("api");

    clickHouse.verify(
        postRequestedFor(urlPathEqualTo("/"))
            .withQueryParam("param_match_0_0", equalTo("api"))
            .withQueryParam("param_match_1_0", equalTo("info")));
  }

  @Test
  void query_ShouldRejectMalformedLimit() {
    webTestClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/loki/api/v1/query")
                    .queryParam("query", "{query}")
                    .queryParam("limit", "abc")
                    .build("{job=\"a\"}"))
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo(400);
  }

  @Test
  void tail_ShouldOpenWithEmptyStreamsEvent() {
    clickHouse.stubFor(post(urlPathEqualTo("/")).willReturn(aResponse().withBody("")));

    Flux<String> events =
        webTestClient
            .get()
            .uri(
                uriBuilder ->
                    uriBuilder
                        .path("/loki/api/v1/tail")
                        .queryParam("query", "{query}")
                        .build("{service_name=\"api\"}"))
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus()
            .isOk()
            .returnResult(String.class)
            .getResponseBody();

    StepVerifier.create(events).expectNext("{\"streams\":[]}").thenCancel().verify();
  }

  @Test
  void buildInfo_ShouldLookLikeLoki() {
    webTestClient
        .get()
        .uri("/loki/api/v1/status/buildinfo")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.version")
        .isEqualTo("2.9.0");
  }

  @Test
  void ready_ShouldFollowClickHousePing() {
    clickHouse.stubFor(get("/ping").willReturn(aResponse().withBody("Ok.\n")));
    webTestClient
        .get()
        .uri("/ready")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody(String.class)
        .isEqualTo("ready");

    clickHouse.stubFor(get("/ping").willReturn(aResponse().withStatus(500)));
    webTestClient
        .get()
        .uri("/health")
        .exchange()
        .expectStatus()
        .isEqualTo(503)
        .expectBody()
        .jsonPath("$.clickhouse")
        .isEqualTo("disconnected");
  }

  @Test
  void unknownRoute_ShouldAnswerJsonNotFound() {
    webTestClient
        .get()
        .uri("/loki/api/v1/unknown")
        .exchange()
        .expectStatus()
        .isNotFound()
        .expectBody()
        .jsonPath("$.errorCode")
        .isEqualTo("NOT_FOUND");
  }
}

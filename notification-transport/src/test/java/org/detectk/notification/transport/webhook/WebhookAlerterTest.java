package org.detectk.notification.transport.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Direction;
import org.detectk.metric.anomaly.datamodel.exception.AlertException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookAlerterTest {

  private MockWebServer mockWebServer;

  @BeforeEach
  public void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
  }

  @AfterEach
  public void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testJsonPayloadDelivered() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    WebhookAlerter alerter = new WebhookAlerter(config(WebhookFormat.JSON));

    Assertions.assertTrue(alerter.send(anomaly()));

    Assertions.assertEquals(1, mockWebServer.getRequestCount());
    RecordedRequest request = mockWebServer.takeRequest();
    Assertions.assertEquals("POST", request.getMethod());
    JsonNode body = PayloadMapper.readTree(request.getBody().readUtf8());
    Assertions.assertEquals("orders", body.get("metric_name").asText());
    Assertions.assertEquals("abcd1234", body.get("detector_id").asText());
    Assertions.assertTrue(body.get("is_anomaly").asBoolean());
    Assertions.assertEquals(250.0, body.get("value").asDouble());
    Assertions.assertEquals("up", body.get("direction").asText());
    Assertions.assertEquals("2024-11-01T23:50:00Z", body.get("timestamp").asText());
    Assertions.assertEquals("mad", body.get("metadata").get("detector_type").asText());
  }

  @Test
  void testTextPayloadDelivered() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    WebhookAlerter alerter = new WebhookAlerter(config(WebhookFormat.TEXT));

    Assertions.assertTrue(alerter.send(anomaly()));

    JsonNode body =
        PayloadMapper.readTree(mockWebServer.takeRequest().getBody().readUtf8());
    Assertions.assertEquals("detectk-bot", body.get("username").asText());
    Assertions.assertEquals("alerts", body.get("channel").asText());
    Assertions.assertTrue(body.get("text").asText().contains("`orders`"));
    Assertions.assertFalse(body.has("icon_url"));
  }

  @Test
  void testNonAnomalousResultIsNotSent() throws Exception {
    WebhookAlerter alerter = new WebhookAlerter(config(WebhookFormat.JSON));

    DetectionResult normal = anomaly().toBuilder().anomaly(false).build();

    Assertions.assertFalse(alerter.send(normal));
    Assertions.assertEquals(0, mockWebServer.getRequestCount());
  }

  @Test
  void testErrorResponseRaisesAlertException() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    WebhookAlerter alerter = new WebhookAlerter(config(WebhookFormat.JSON));

    AlertException exception =
        Assertions.assertThrows(AlertException.class, () -> alerter.send(anomaly()));
    Assertions.assertTrue(exception.getMessage().contains("500"));
  }

  @Test
  void testUnreachableWebhookRaisesAlertException() throws IOException {
    String url = mockWebServer.url("/hooks/abc").toString();
    mockWebServer.shutdown();
    WebhookAlerter alerter =
        new WebhookAlerter(
            new WebhookAlerterConfig(
                url, WebhookFormat.JSON, "detectk", null, null, Duration.ofSeconds(2)));

    Assertions.assertThrows(AlertException.class, () -> alerter.send(anomaly()));
  }

  @Test
  void testInfiniteScoreIsOmittedFromJson() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    WebhookAlerter alerter = new WebhookAlerter(config(WebhookFormat.JSON));

    alerter.send(anomaly().toBuilder().score(Double.POSITIVE_INFINITY).build());

    JsonNode body =
        PayloadMapper.readTree(mockWebServer.takeRequest().getBody().readUtf8());
    Assertions.assertFalse(body.has("score"));
  }

  private WebhookAlerterConfig config(WebhookFormat format) {
    return new WebhookAlerterConfig(
        mockWebServer.url("/hooks/abc").toString(),
        format,
        "detectk-bot",
        "alerts",
        null,
        Duration.ofSeconds(5));
  }

  static DetectionResult anomaly() {
    return DetectionResult.builder()
        .metricName("orders")
        .detectorId("abcd1234")
        .timestamp(Instant.parse("2024-11-01T23:50:00Z"))
        .value(250.0)
        .anomaly(true)
        .score(4.2)
        .lowerBound(90.0)
        .upperBound(110.0)
        .direction(Direction.UP)
        .percentDeviation(150.0)
        .metadata(Map.of("detector_type", "mad", "window_size", "PT720H", "n_sigma", 3.0))
        .build();
  }
}

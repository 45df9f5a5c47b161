package org.detectk.metric.anomaly.task.manager;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants;
import org.detectk.metric.anomaly.task.manager.plugin.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobKey;

class MetricCheckServiceTest {

  private MockWebServer mockWebServer;
  private MetricCheckService service;

  @BeforeEach
  public void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
  }

  @AfterEach
  public void tearDown() throws IOException {
    if (service != null) {
      service.stop();
    }
    mockWebServer.shutdown();
  }

  @Test
  void testTriggeredCheckAlertsThroughWebhook() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    CollectorRegistry collectors =
        new CollectorRegistry()
            .register(
                "spike",
                params ->
                    (periodStart, periodEnd) ->
                        List.of(Measurement.of(periodStart, params.getDouble("value"))));
    Config config =
        ConfigFactory.parseString(
                "metricChecks = [{\n"
                    + "  metricName = queue_depth\n"
                    + "  cronExpression = \"0 0 0 1 1 ? 2099\"\n"
                    + "  collector { type = spike, params { value = 5000 } }\n"
                    + "  alerter { type = webhook, params { url = \""
                    + mockWebServer.url("/hooks/detectk")
                    + "\", format = text } }\n"
                    + "  detectors = [\n"
                    + "    { kind = threshold, params { operator = gt, value = 1000 } }\n"
                    + "  ]\n"
                    + "}]")
            .withFallback(ConfigFactory.parseResources("application.conf"));

    service = new MetricCheckService(config, collectors);
    service.init();
    service.start();
    JobKey jobKey = JobKey.jobKey("queue_depth", MetricCheckJobConstants.JOB_GROUP);
    Assertions.assertTrue(service.getScheduler().checkExists(jobKey));

    service.getScheduler().triggerJob(jobKey);

    RecordedRequest request = mockWebServer.takeRequest(10, TimeUnit.SECONDS);
    Assertions.assertNotNull(request, "webhook was not called");
    Assertions.assertTrue(request.getBody().readUtf8().contains("queue_depth"));
    Assertions.assertEquals(
        1,
        service
            .getStorage()
            .queryWindow("queue_depth", Instant.now(), Duration.ofHours(1))
            .size());
  }

  @Test
  void testStartsWithoutChecks() throws Exception {
    service =
        new MetricCheckService(
            ConfigFactory.parseResources("application.conf"), new CollectorRegistry());
    service.init();
    service.start();

    Assertions.assertTrue(service.getScheduler().isStarted());
  }

  @Test
  void testPrometheusRegistryReceivesGlobalMeters() throws Exception {
    service =
        new MetricCheckService(
            ConfigFactory.parseResources("application.conf"), new CollectorRegistry());
    service.init();

    Metrics.counter("detectk.service.test.events", "metric", "queue_depth").increment(3);

    String scrape = service.scrapeMetrics();
    Assertions.assertTrue(scrape.contains("jvm_threads_live_threads"));
    Assertions.assertTrue(
        scrape.lines()
            .anyMatch(
                line ->
                    line.startsWith("detectk_service_test_events_total{metric=\"queue_depth\"")
                        && line.endsWith(" 3.0")),
        scrape);
  }

  @Test
  void testJdbcStorageAndDisabledReporter() throws Exception {
    Config config =
        ConfigFactory.parseString(
                "metrics.reporter = none\n"
                    + "storage { type = jdbc, jdbc { url = \"jdbc:h2:mem:"
                    + UUID.randomUUID()
                    + ";DB_CLOSE_DELAY=-1\", maximumPoolSize = 2 } }")
            .withFallback(ConfigFactory.parseResources("application.conf"));
    service = new MetricCheckService(config, new CollectorRegistry());
    service.init();

    Assertions.assertEquals("", service.scrapeMetrics());
    service.getStorage().setCheckpoint("queue_depth", Instant.parse("2024-01-01T00:00:00Z"));
    Assertions.assertEquals(
        Instant.parse("2024-01-01T00:00:00Z"),
        service.getStorage().getCheckpoint("queue_depth").get());
  }
}

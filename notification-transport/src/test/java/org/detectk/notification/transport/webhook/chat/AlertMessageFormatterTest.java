package org.detectk.notification.transport.webhook.chat;

import java.time.Instant;
import java.util.Map;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Direction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AlertMessageFormatterTest {

  private final AlertMessageFormatter formatter = new AlertMessageFormatter();

  @Test
  void testFormatsStatisticalResult() {
    DetectionResult result =
        DetectionResult.builder()
            .metricName("sessions")
            .detectorId("0f3a9c21")
            .timestamp(Instant.parse("2024-11-01T23:50:00Z"))
            .value(1234.5)
            .anomaly(true)
            .score(4.2)
            .lowerBound(900.0)
            .upperBound(1100.0)
            .direction(Direction.UP)
            .percentDeviation(15.0)
            .metadata(Map.of("detector_type", "mad", "n_sigma", 3.0))
            .build();

    String message = formatter.format(result);

    Assertions.assertTrue(message.contains("**ANOMALY DETECTED** `sessions`"));
    Assertions.assertTrue(message.contains("**Value:** 1,234.50 (up)"));
    Assertions.assertTrue(message.contains("**Expected:** [900.00 - 1,100.00]"));
    Assertions.assertTrue(message.contains("**Score:** 4.20 sigma"));
    Assertions.assertTrue(message.contains("**Deviation:** +15.0%"));
    Assertions.assertTrue(message.contains("2024-11-01 23:50:00"));
    Assertions.assertTrue(message.contains("Detector: mad [0f3a9c21] (n_sigma: 3.0)"));
  }

  @Test
  void testOmitsMissingBoundsAndScore() {
    DetectionResult result =
        DetectionResult.builder()
            .metricName("errors")
            .detectorId("threshold-errors")
            .timestamp(Instant.parse("2024-11-01T00:00:00Z"))
            .value(12.0)
            .anomaly(true)
            .upperBound(10.0)
            .metadata(Map.of("detector_type", "threshold", "operator", "gt"))
            .build();

    String message = formatter.format(result);

    Assertions.assertFalse(message.contains("**Expected:**"));
    Assertions.assertFalse(message.contains("**Score:**"));
    Assertions.assertTrue(message.contains("(operator: gt)"));
  }

  @Test
  void testInfiniteScore() {
    Assertions.assertEquals(
        AlertMessageFormatter.EXTREME_SCORE,
        AlertMessageFormatter.formatScore(Double.POSITIVE_INFINITY));
  }
}

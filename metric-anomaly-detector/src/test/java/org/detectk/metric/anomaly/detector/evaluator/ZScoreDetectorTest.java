package org.detectk.metric.anomaly.detector.evaluator;

import static org.detectk.metric.anomaly.detector.evaluator.MadDetectorTest.hourly;

import java.time.Duration;
import java.time.Instant;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Direction;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.exception.DetectionException;
import org.detectk.metric.anomaly.datamodel.exception.InsufficientDataException;
import org.detectk.metric.anomaly.detector.config.ZScoreParams;
import org.detectk.metric.anomaly.storage.InMemoryMetricStorage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ZScoreDetectorTest {

  private static final String METRIC = "latency_p95";
  private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

  @Test
  void testMeanAndPopulationStdDev() throws Exception {
    InMemoryMetricStorage storage = new InMemoryMetricStorage();
    storage.saveBatch(METRIC, hourly(T0, 10, 20, 30, 40, 50, 10, 20, 30, 40, 50));
    ZScoreDetector detector =
        new ZScoreDetector(
            "0badc0de", ZScoreParams.builder().nSigma(2.0).minWindowSize(10).build(), storage);
    Instant next = T0.plus(Duration.ofHours(10));
    double std = Math.sqrt(200);

    DetectionResult high = detector.detect(METRIC, Measurement.of(next, 60.0));
    Assertions.assertTrue(high.isAnomaly());
    Assertions.assertEquals(Direction.UP, high.getDirection());
    Assertions.assertEquals(30 - 2 * std, (double) high.getLowerBound(), 1e-9);
    Assertions.assertEquals(30 + 2 * std, (double) high.getUpperBound(), 1e-9);
    Assertions.assertEquals(30 / std, (double) high.getScore(), 1e-9);
    Assertions.assertEquals(100.0, (double) high.getPercentDeviation(), 1e-9);
    Assertions.assertEquals(
        "zscore", high.getMetadata().get(DetectionResult.METADATA_DETECTOR_TYPE));

    DetectionResult inside = detector.detect(METRIC, Measurement.of(next, 45.0));
    Assertions.assertFalse(inside.isAnomaly());
    Assertions.assertNull(inside.getDirection());
  }

  @Test
  void testZeroCenterHasNoPercentDeviation() throws Exception {
    InMemoryMetricStorage storage = new InMemoryMetricStorage();
    storage.saveBatch(METRIC, hourly(T0, -1, 1, -1, 1));
    ZScoreDetector detector =
        new ZScoreDetector("0badc0de", ZScoreParams.builder().minWindowSize(4).build(), storage);

    DetectionResult result =
        detector.detect(METRIC, Measurement.of(T0.plus(Duration.ofHours(4)), -5.0));

    Assertions.assertTrue(result.isAnomaly());
    Assertions.assertEquals(Direction.DOWN, result.getDirection());
    Assertions.assertNull(result.getPercentDeviation());
  }

  @Test
  void testEmptyHistory() {
    ZScoreDetector detector =
        new ZScoreDetector("0badc0de", ZScoreParams.defaults(), new InMemoryMetricStorage());
    InsufficientDataException e =
        Assertions.assertThrows(
            InsufficientDataException.class,
            () -> detector.detect(METRIC, Measurement.of(T0, 1.0)));
    Assertions.assertEquals(0, e.getObserved());
    Assertions.assertEquals(100, e.getRequired());
  }

  @Test
  void testWindowSizeLimitsHistory() throws Exception {
    InMemoryMetricStorage storage = new InMemoryMetricStorage();
    storage.saveBatch(METRIC, hourly(T0, 1000, 1000, 10, 10, 10));
    ZScoreDetector detector =
        new ZScoreDetector(
            "0badc0de",
            ZScoreParams.builder().windowSize(Duration.ofHours(3)).minWindowSize(3).build(),
            storage);

    DetectionResult result =
        detector.detect(METRIC, Measurement.of(T0.plus(Duration.ofHours(5)), 10.0));

    Assertions.assertEquals(10.0, result.getMetadata().get(BaselineDetector.METADATA_CENTER));
    Assertions.assertEquals(0.0, (double) result.getScore());
  }

  @Test
  void testVanishingDecayWeightsFailDetection() throws Exception {
    InMemoryMetricStorage storage = new InMemoryMetricStorage();
    storage.saveBatch(METRIC, hourly(T0, 10, 20, 30));
    ZScoreDetector detector =
        new ZScoreDetector(
            "0badc0de",
            ZScoreParams.builder()
                .windowSize(Duration.ofDays(120))
                .minWindowSize(3)
                .useWeighted(true)
                .decayFactor(10.0)
                .build(),
            storage);

    Assertions.assertThrows(
        DetectionException.class,
        () -> detector.detect(METRIC, Measurement.of(T0.plus(Duration.ofDays(100)), 1e6)));
  }

  @Test
  void testWeightedMeanFavoursRecentPoints() throws Exception {
    InMemoryMetricStorage storage = new InMemoryMetricStorage();
    storage.saveBatch(METRIC, hourly(T0, 100, 100, 10, 10));
    ZScoreDetector detector =
        new ZScoreDetector(
            "0badc0de",
            ZScoreParams.builder()
                .windowSize(Duration.ofDays(1))
                .minWindowSize(4)
                .useWeighted(true)
                .decayFactor(1.0)
                .build(),
            storage);

    DetectionResult result =
        detector.detect(METRIC, Measurement.of(T0.plus(Duration.ofHours(4)), 10.0));

    double center = (double) result.getMetadata().get(BaselineDetector.METADATA_CENTER);
    Assertions.assertTrue(center > 10.0 && center < 55.0);
  }
}

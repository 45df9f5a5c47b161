package org.detectk.metric.anomaly.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.StoredDetection;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryMetricStorageTest {

  private static final String METRIC = "sessions";
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private InMemoryMetricStorage storage;

  @BeforeEach
  void setUp() {
    storage = new InMemoryMetricStorage();
  }

  @Test
  void testSaveBatchIsIdempotent() throws Exception {
    List<Measurement> batch = hourly(T0, 10.0, 11.0, 12.0);
    Assertions.assertEquals(new BatchSaveSummary(3, 0, 0), storage.saveBatch(METRIC, batch));
    Assertions.assertEquals(new BatchSaveSummary(0, 0, 3), storage.saveBatch(METRIC, batch));

    List<Measurement> stored =
        storage.queryWindow(METRIC, T0.plus(Duration.ofDays(1)), Duration.ofDays(2));
    Assertions.assertEquals(batch, stored);
  }

  @Test
  void testLastWriteWins() throws Exception {
    storage.saveBatch(METRIC, hourly(T0, 10.0, 11.0));
    BatchSaveSummary summary =
        storage.saveBatch(METRIC, hourly(T0.plus(Duration.ofHours(1)), 99.0, 12.0));
    Assertions.assertEquals(new BatchSaveSummary(1, 1, 0), summary);

    List<Measurement> stored =
        storage.queryWindow(METRIC, T0.plus(Duration.ofHours(3)), Duration.ofHours(3));
    Assertions.assertEquals(3, stored.size());
    Assertions.assertEquals(99.0, stored.get(1).getValue());
  }

  @Test
  void testWindowIsHalfOpenAndOrdered() throws Exception {
    storage.saveBatch(METRIC, hourly(T0, 1.0, 2.0, 3.0, 4.0));
    // [T0+1h, T0+3h)
    List<Measurement> window =
        storage.queryWindow(METRIC, T0.plus(Duration.ofHours(3)), Duration.ofHours(2));
    Assertions.assertEquals(2, window.size());
    Assertions.assertEquals(2.0, window.get(0).getValue());
    Assertions.assertEquals(3.0, window.get(1).getValue());

    Assertions.assertTrue(storage.queryWindow("unknown", T0, Duration.ofDays(1)).isEmpty());
  }

  @Test
  void testContextFilter() throws Exception {
    storage.saveBatch(
        METRIC,
        List.of(
            Measurement.of(T0, 1.0, Map.of("hour_of_day", 0)),
            Measurement.of(T0.plus(Duration.ofHours(1)), 2.0, Map.of("hour_of_day", 1)),
            Measurement.of(T0.plus(Duration.ofDays(1)), 3.0, Map.of("hour_of_day", 0))));
    List<Measurement> window =
        storage.queryWindow(
            METRIC,
            T0.plus(Duration.ofDays(2)),
            Duration.ofDays(7),
            context -> Integer.valueOf(0).equals(context.get("hour_of_day")));
    Assertions.assertEquals(2, window.size());
    Assertions.assertEquals(3.0, window.get(1).getValue());
  }

  @Test
  void testMissingValuesAreStored() throws Exception {
    storage.saveBatch(METRIC, List.of(Measurement.of(T0, null)));
    List<Measurement> window =
        storage.queryWindow(METRIC, T0.plusSeconds(1), Duration.ofMinutes(1));
    Assertions.assertEquals(1, window.size());
    Assertions.assertFalse(window.get(0).hasValue());
  }

  @Test
  void testCheckpointIsMonotonic() throws Exception {
    Assertions.assertTrue(storage.getCheckpoint(METRIC).isEmpty());
    storage.setCheckpoint(METRIC, T0.plus(Duration.ofDays(2)));
    storage.setCheckpoint(METRIC, T0.plus(Duration.ofDays(1)));
    Assertions.assertEquals(T0.plus(Duration.ofDays(2)), storage.getCheckpoint(METRIC).get());
    storage.setCheckpoint(METRIC, T0.plus(Duration.ofDays(3)));
    Assertions.assertEquals(T0.plus(Duration.ofDays(3)), storage.getCheckpoint(METRIC).get());
  }

  @Test
  void testDetectionsKeyedByDetector() throws Exception {
    DetectionResult mad = result("a1b2c3d4", T0, false);
    DetectionResult zscore = result("ffff0000", T0, true);
    Assertions.assertEquals(
        new BatchSaveSummary(2, 0, 0),
        storage.saveDetections(
            List.of(StoredDetection.notAlerted(mad), StoredDetection.notAlerted(zscore))));
    Assertions.assertEquals(
        new BatchSaveSummary(0, 1, 0),
        storage.saveDetections(List.of(StoredDetection.alerted(zscore, "anomaly"))));

    List<StoredDetection> stored =
        storage.queryDetections(METRIC, "ffff0000", T0.plusSeconds(1), Duration.ofHours(1));
    Assertions.assertEquals(1, stored.size());
    Assertions.assertTrue(stored.get(0).isAlertSent());
    Assertions.assertEquals(
        1,
        storage.queryDetections(METRIC, "a1b2c3d4", T0.plusSeconds(1), Duration.ofHours(1)).size());
  }

  @Test
  void testPurgeOlderThan() throws Exception {
    storage.saveBatch(METRIC, hourly(T0, 1.0, 2.0, 3.0));
    storage.saveDetections(List.of(StoredDetection.notAlerted(result("a1b2c3d4", T0, false))));

    Assertions.assertEquals(
        2, storage.purgeOlderThan(T0.plus(Duration.ofHours(2)), DataKind.MEASUREMENTS));
    Assertions.assertEquals(
        1, storage.queryWindow(METRIC, T0.plus(Duration.ofDays(1)), Duration.ofDays(2)).size());
    Assertions.assertEquals(1, storage.purgeOlderThan(T0.plusSeconds(1), DataKind.DETECTIONS));
    Assertions.assertEquals(0, storage.purgeOlderThan(T0.plusSeconds(1), DataKind.DETECTIONS));
  }

  @Test
  void testAlertDispatchKeepsLatest() throws Exception {
    storage.recordDispatch(METRIC, "a1b2c3d4", T0.plus(Duration.ofMinutes(30)));
    storage.recordDispatch(METRIC, "a1b2c3d4", T0);
    Assertions.assertEquals(
        T0.plus(Duration.ofMinutes(30)), storage.lastDispatch(METRIC, "a1b2c3d4").get());
    Assertions.assertTrue(storage.lastDispatch(METRIC, "other").isEmpty());
  }

  @Test
  void testConcurrentOverlappingBatches() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<BatchSaveSummary>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        int offset = i * 50;
        futures.add(
            executor.submit(
                () -> {
                  List<Measurement> batch = new ArrayList<>();
                  for (int j = 0; j < 100; j++) {
                    batch.add(Measurement.of(T0.plus(Duration.ofMinutes(offset + j)), 1.0));
                  }
                  return storage.saveBatch(METRIC, batch);
                }));
      }
      int inserted = 0;
      for (Future<BatchSaveSummary> future : futures) {
        inserted += future.get().getInserted();
      }
      // 8 batches of 100 overlapping by 50 cover 450 distinct minutes
      Assertions.assertEquals(450, inserted);
      Assertions.assertEquals(
          450, storage.queryWindow(METRIC, T0.plus(Duration.ofDays(1)), Duration.ofDays(2)).size());
    } finally {
      executor.shutdownNow();
    }
  }

  static List<Measurement> hourly(Instant start, Double... values) {
    List<Measurement> measurements = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      measurements.add(Measurement.of(start.plus(Duration.ofHours(i)), values[i]));
    }
    return measurements;
  }

  private static DetectionResult result(String detectorId, Instant timestamp, boolean anomaly) {
    return DetectionResult.builder()
        .metricName(METRIC)
        .detectorId(detectorId)
        .timestamp(timestamp)
        .value(1.0)
        .anomaly(anomaly)
        .build();
  }
}

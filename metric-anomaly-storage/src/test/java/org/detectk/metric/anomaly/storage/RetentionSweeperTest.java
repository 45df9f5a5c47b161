package org.detectk.metric.anomaly.storage;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.RetentionPolicy;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RetentionSweeperTest {

  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void testSweepAppliesPolicy() throws Exception {
    InMemoryMetricStorage storage = new InMemoryMetricStorage();
    storage.saveBatch(
        "sessions",
        List.of(
            Measurement.of(NOW.minus(Duration.ofDays(40)), 1.0),
            Measurement.of(NOW.minus(Duration.ofDays(20)), 2.0),
            Measurement.of(NOW.minus(Duration.ofDays(1)), 3.0)));

    RetentionSweepResult result =
        new RetentionSweeper(storage, new RetentionPolicy(30, 7), CLOCK).sweep();

    Assertions.assertTrue(result.isSuccessful());
    Assertions.assertEquals(1, result.getPurged().get(DataKind.MEASUREMENTS));
    Assertions.assertEquals(0, result.getPurged().get(DataKind.DETECTIONS));
    Assertions.assertEquals(
        2, storage.queryWindow("sessions", NOW, Duration.ofDays(365)).size());
  }

  @Test
  void testFailedPurgeIsReportedNotThrown() throws StorageException {
    MetricStorage storage = mock(MetricStorage.class);
    when(storage.purgeOlderThan(any(), eq(DataKind.MEASUREMENTS)))
        .thenThrow(new StorageException("backend unavailable"));
    when(storage.purgeOlderThan(any(), eq(DataKind.DETECTIONS))).thenReturn(4);

    RetentionSweepResult result =
        new RetentionSweeper(storage, RetentionPolicy.defaultPolicy(), CLOCK).sweep();

    Assertions.assertFalse(result.isSuccessful());
    Assertions.assertEquals("backend unavailable", result.getFailures().get(DataKind.MEASUREMENTS));
    Assertions.assertEquals(4, result.getPurged().get(DataKind.DETECTIONS));
  }
}

package org.detectk.engine.loader;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BatchPlannerTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void testSplitsIntoConsecutiveBatches() {
    List<TimeRange> batches =
        BatchPlanner.plan(T0, T0.plus(Duration.ofDays(10)), Duration.ofDays(3));

    Assertions.assertEquals(4, batches.size());
    Assertions.assertEquals(new TimeRange(T0, T0.plus(Duration.ofDays(3))), batches.get(0));
    Assertions.assertEquals(
        new TimeRange(T0.plus(Duration.ofDays(9)), T0.plus(Duration.ofDays(10))), batches.get(3));
    for (int i = 1; i < batches.size(); i++) {
      Assertions.assertEquals(batches.get(i - 1).getEnd(), batches.get(i).getStart());
    }
  }

  @Test
  void testEmptyIntervalHasNoBatches() {
    Assertions.assertTrue(BatchPlanner.plan(T0, T0, Duration.ofDays(1)).isEmpty());
  }

  @Test
  void testInvalidArguments() {
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> BatchPlanner.plan(T0, T0.plusSeconds(60), Duration.ZERO));
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> BatchPlanner.plan(T0.plusSeconds(60), T0, Duration.ofDays(1)));
  }
}

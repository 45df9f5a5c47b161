package org.detectk.engine.loader;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class BatchPlanner {

  private BatchPlanner() {}

  /**
   * Splits {@code [start, end)} into consecutive ranges of {@code batchSize}; the last range is cut
   * at {@code end}. An empty interval yields no batches.
   */
  public static List<TimeRange> plan(Instant start, Instant end, Duration batchSize) {
    Preconditions.checkArgument(
        !batchSize.isNegative() && !batchSize.isZero(),
        "Batch size must be positive, got %s",
        batchSize);
    Preconditions.checkArgument(!end.isBefore(start), "Load end %s is before start %s", end, start);
    List<TimeRange> batches = new ArrayList<>();
    Instant batchStart = start;
    while (batchStart.isBefore(end)) {
      Instant batchEnd = batchStart.plus(batchSize);
      if (batchEnd.isAfter(end)) {
        batchEnd = end;
      }
      batches.add(new TimeRange(batchStart, batchEnd));
      batchStart = batchEnd;
    }
    return batches;
  }
}

package org.detectk.metric.anomaly.storage;

import lombok.Value;

/** Counts of how each row of a saved batch was merged into storage. */
@Value
public class BatchSaveSummary {
  public static final BatchSaveSummary EMPTY = new BatchSaveSummary(0, 0, 0);

  int inserted;
  int updated;
  int unchanged;

  public int getTotal() {
    return inserted + updated + unchanged;
  }

  public BatchSaveSummary plus(BatchSaveSummary other) {
    return new BatchSaveSummary(
        inserted + other.inserted, updated + other.updated, unchanged + other.unchanged);
  }
}

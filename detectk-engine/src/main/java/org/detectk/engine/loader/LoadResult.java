package org.detectk.engine.loader;

import java.time.Instant;
import java.util.Optional;
import lombok.Value;
import org.detectk.metric.anomaly.storage.BatchSaveSummary;

@Value
public class LoadResult {
  String metricName;
  int batchesLoaded;
  int batchesSkipped;
  int measurementsCollected;
  BatchSaveSummary saved;
  Instant checkpoint;

  public Optional<Instant> getCheckpoint() {
    return Optional.ofNullable(checkpoint);
  }
}

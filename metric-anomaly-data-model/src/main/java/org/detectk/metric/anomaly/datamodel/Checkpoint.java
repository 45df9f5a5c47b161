package org.detectk.metric.anomaly.datamodel;

import java.time.Instant;
import lombok.NonNull;
import lombok.Value;

@Value
public class Checkpoint {
  @NonNull String metricName;
  @NonNull Instant lastLoadedTimestamp;

  /** Returns whichever checkpoint is further ahead; checkpoints never move backwards. */
  public Checkpoint advanceTo(Instant timestamp) {
    if (timestamp.isAfter(lastLoadedTimestamp)) {
      return new Checkpoint(metricName, timestamp);
    }
    return this;
  }
}

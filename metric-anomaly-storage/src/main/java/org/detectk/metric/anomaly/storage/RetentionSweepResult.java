package org.detectk.metric.anomaly.storage;

import java.util.Map;
import lombok.Value;

@Value
public class RetentionSweepResult {
  Map<DataKind, Integer> purged;
  Map<DataKind, String> failures;

  public boolean isSuccessful() {
    return failures.isEmpty();
  }
}

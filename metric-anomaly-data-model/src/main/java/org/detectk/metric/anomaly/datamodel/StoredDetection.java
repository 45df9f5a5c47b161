package org.detectk.metric.anomaly.datamodel;

import lombok.NonNull;
import lombok.Value;

/** A detection result as persisted in the detections table, with the alert bookkeeping. */
@Value
public class StoredDetection {
  @NonNull DetectionResult result;
  boolean alertSent;
  String alertReason;

  public static StoredDetection notAlerted(DetectionResult result) {
    return new StoredDetection(result, false, null);
  }

  public static StoredDetection alerted(DetectionResult result, String reason) {
    return new StoredDetection(result, true, reason);
  }
}

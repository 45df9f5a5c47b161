package org.detectk.metric.anomaly.storage;

public enum DataKind {
  MEASUREMENTS,
  DETECTIONS
}

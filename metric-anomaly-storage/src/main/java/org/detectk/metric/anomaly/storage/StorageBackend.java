package org.detectk.metric.anomaly.storage;

/** One store serving measurements, detections, checkpoints and alert state. */
public interface StorageBackend extends MetricStorage, AlertStateStore, AutoCloseable {

  /** Releases pooled connections, if any. */
  @Override
  default void close() {}
}

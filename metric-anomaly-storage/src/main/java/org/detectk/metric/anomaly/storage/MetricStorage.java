package org.detectk.metric.anomaly.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.StoredDetection;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;

/**
 * Time-series store for measurements, detection outcomes and load checkpoints.
 *
 * <p>Writes are idempotent: a row is identified by {@code (metric, timestamp)} for measurements and
 * {@code (metric, detectorId, timestamp)} for detections. Re-writing an identical row is a no-op,
 * re-writing with different content replaces it. Overlapping and concurrent batches are therefore
 * safe, which is what lets bulk loads resume after a crash without deduplication.
 */
public interface MetricStorage {

  BatchSaveSummary saveBatch(String metricName, List<Measurement> measurements)
      throws StorageException;

  /**
   * Returns the measurements in {@code [endTime - window, endTime)} in ascending timestamp order,
   * keeping only those whose context satisfies {@code contextFilter}. An empty window is not an
   * error.
   */
  List<Measurement> queryWindow(
      String metricName,
      Instant endTime,
      Duration window,
      Predicate<Map<String, Object>> contextFilter)
      throws StorageException;

  default List<Measurement> queryWindow(String metricName, Instant endTime, Duration window)
      throws StorageException {
    return queryWindow(metricName, endTime, window, context -> true);
  }

  Optional<Instant> getCheckpoint(String metricName) throws StorageException;

  /** Stores a checkpoint. A timestamp older than the stored checkpoint is ignored. */
  void setCheckpoint(String metricName, Instant timestamp) throws StorageException;

  BatchSaveSummary saveDetections(List<StoredDetection> detections) throws StorageException;

  /** Detections of one detector in {@code [endTime - window, endTime)}, ascending. */
  List<StoredDetection> queryDetections(
      String metricName, String detectorId, Instant endTime, Duration window)
      throws StorageException;

  /** Removes rows of the given kind strictly older than {@code cutoff}; returns rows removed. */
  int purgeOlderThan(Instant cutoff, DataKind kind) throws StorageException;
}

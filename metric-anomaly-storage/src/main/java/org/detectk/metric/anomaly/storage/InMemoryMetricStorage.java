package org.detectk.metric.anomaly.storage;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;
import org.apache.commons.lang3.tuple.Pair;
import org.detectk.metric.anomaly.datamodel.Checkpoint;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.StoredDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Storage backed by concurrent sorted maps. Every single-row write is an atomic put, so concurrent
 * writers of the same row resolve to whichever put landed last.
 */
public class InMemoryMetricStorage implements StorageBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMetricStorage.class);

  private final ConcurrentMap<String, ConcurrentSkipListMap<Instant, Measurement>> measurements =
      new ConcurrentHashMap<>();
  // key <metricName, detectorId>
  private final ConcurrentMap<Pair<String, String>, ConcurrentSkipListMap<Instant, StoredDetection>>
      detections = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();
  private final ConcurrentMap<Pair<String, String>, Instant> alertDispatches =
      new ConcurrentHashMap<>();

  @Override
  public BatchSaveSummary saveBatch(String metricName, List<Measurement> batch) {
    Preconditions.checkArgument(metricName != null, "metricName is required");
    ConcurrentSkipListMap<Instant, Measurement> series =
        measurements.computeIfAbsent(metricName, k -> new ConcurrentSkipListMap<>());
    int inserted = 0, updated = 0, unchanged = 0;
    for (Measurement measurement : batch) {
      Measurement previous = series.put(measurement.getTimestamp(), measurement);
      if (previous == null) {
        inserted++;
      } else if (previous.equals(measurement)) {
        unchanged++;
      } else {
        updated++;
      }
    }
    LOGGER.debug(
        "Saved batch for metric {}: inserted {}, updated {}, unchanged {}",
        metricName,
        inserted,
        updated,
        unchanged);
    return new BatchSaveSummary(inserted, updated, unchanged);
  }

  @Override
  public List<Measurement> queryWindow(
      String metricName,
      Instant endTime,
      Duration window,
      Predicate<Map<String, Object>> contextFilter) {
    ConcurrentSkipListMap<Instant, Measurement> series = measurements.get(metricName);
    if (series == null) {
      return List.of();
    }
    List<Measurement> result = new ArrayList<>();
    NavigableMap<Instant, Measurement> range =
        series.subMap(endTime.minus(window), true, endTime, false);
    for (Measurement measurement : range.values()) {
      if (contextFilter.test(measurement.getContext())) {
        result.add(measurement);
      }
    }
    return result;
  }

  @Override
  public Optional<Instant> getCheckpoint(String metricName) {
    return Optional.ofNullable(checkpoints.get(metricName))
        .map(Checkpoint::getLastLoadedTimestamp);
  }

  @Override
  public void setCheckpoint(String metricName, Instant timestamp) {
    checkpoints.merge(
        metricName,
        new Checkpoint(metricName, timestamp),
        (current, proposed) -> current.advanceTo(proposed.getLastLoadedTimestamp()));
  }

  @Override
  public BatchSaveSummary saveDetections(List<StoredDetection> batch) {
    int inserted = 0, updated = 0, unchanged = 0;
    for (StoredDetection detection : batch) {
      DetectionResult result = detection.getResult();
      StoredDetection previous =
          detections
              .computeIfAbsent(
                  Pair.of(result.getMetricName(), result.getDetectorId()),
                  k -> new ConcurrentSkipListMap<>())
              .put(result.getTimestamp(), detection);
      if (previous == null) {
        inserted++;
      } else if (Objects.equals(previous, detection)) {
        unchanged++;
      } else {
        updated++;
      }
    }
    return new BatchSaveSummary(inserted, updated, unchanged);
  }

  @Override
  public List<StoredDetection> queryDetections(
      String metricName, String detectorId, Instant endTime, Duration window) {
    ConcurrentSkipListMap<Instant, StoredDetection> series =
        detections.get(Pair.of(metricName, detectorId));
    if (series == null) {
      return List.of();
    }
    return new ArrayList<>(series.subMap(endTime.minus(window), true, endTime, false).values());
  }

  @Override
  public int purgeOlderThan(Instant cutoff, DataKind kind) {
    int removed = 0;
    switch (kind) {
      case MEASUREMENTS:
        for (ConcurrentSkipListMap<Instant, Measurement> series : measurements.values()) {
          removed += removeHead(series, cutoff);
        }
        break;
      case DETECTIONS:
        for (ConcurrentSkipListMap<Instant, StoredDetection> series : detections.values()) {
          removed += removeHead(series, cutoff);
        }
        break;
      default:
        throw new UnsupportedOperationException("Unsupported data kind: " + kind);
    }
    LOGGER.info("Purged {} {} rows older than {}", removed, kind, cutoff);
    return removed;
  }

  @Override
  public Optional<Instant> lastDispatch(String metricName, String detectorId) {
    return Optional.ofNullable(alertDispatches.get(Pair.of(metricName, detectorId)));
  }

  @Override
  public void recordDispatch(String metricName, String detectorId, Instant dispatchedAt) {
    alertDispatches.merge(
        Pair.of(metricName, detectorId),
        dispatchedAt,
        (current, proposed) -> proposed.isAfter(current) ? proposed : current);
  }

  private static <V> int removeHead(ConcurrentSkipListMap<Instant, V> series, Instant cutoff) {
    int removed = 0;
    NavigableMap<Instant, V> head = series.headMap(cutoff, false);
    for (Instant timestamp : head.keySet()) {
      if (head.remove(timestamp) != null) {
        removed++;
      }
    }
    return removed;
  }
}

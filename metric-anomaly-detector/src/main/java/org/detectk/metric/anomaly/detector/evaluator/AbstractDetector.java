package org.detectk.metric.anomaly.detector.evaluator;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.exception.DetectionException;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.detector.config.DetectorKind;
import org.detectk.metric.anomaly.storage.MetricStorage;

/**
 * Common evaluation steps: measurements without a value are reported as skipped, non-finite values
 * are rejected, and evaluation latency is recorded per detector kind.
 */
public abstract class AbstractDetector implements Detector {
  private static final ConcurrentMap<DetectorKind, Timer> detectorTimer =
      new ConcurrentHashMap<>();
  private static final String DETECTOR_TIMER = "detectk.detector.evaluation.latency";

  protected final String id;
  protected final MetricStorage storage;

  protected AbstractDetector(String id, MetricStorage storage) {
    this.id = id;
    this.storage = storage;
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public final DetectionResult detect(String metricName, Measurement current)
      throws DetectionException, StorageException {
    if (!current.hasValue()) {
      return skipped(metricName, current, DetectionResult.SKIPPED_MISSING_VALUE);
    }
    if (!Double.isFinite(current.getValue())) {
      throw new DetectionException(
          String.format(
              "Non-finite value %s for metric %s at %s",
              current.getValue(), metricName, current.getTimestamp()));
    }
    Instant startTime = Instant.now();
    try {
      return evaluate(metricName, current);
    } finally {
      detectorTimer
          .computeIfAbsent(
              getKind(), k -> Metrics.timer(DETECTOR_TIMER, "kind", k.getLabel()))
          .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  protected abstract DetectionResult evaluate(String metricName, Measurement current)
      throws DetectionException, StorageException;

  protected DetectionResult.DetectionResultBuilder resultBuilder(
      String metricName, Measurement current) {
    return DetectionResult.builder()
        .metricName(metricName)
        .detectorId(id)
        .timestamp(current.getTimestamp())
        .value(current.getValue());
  }

  protected Map<String, Object> baseMetadata() {
    Map<String, Object> metadata = new HashMap<>();
    metadata.put(DetectionResult.METADATA_DETECTOR_TYPE, getKind().getLabel());
    return metadata;
  }

  private DetectionResult skipped(String metricName, Measurement current, String reason) {
    Map<String, Object> metadata = baseMetadata();
    metadata.put(DetectionResult.METADATA_SKIPPED, reason);
    return resultBuilder(metricName, current).anomaly(false).metadata(Map.copyOf(metadata)).build();
  }

  static Double percentDeviation(double value, double reference) {
    if (reference == 0) {
      return null;
    }
    return (value - reference) / reference * 100;
  }
}

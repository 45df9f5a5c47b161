package org.detectk.metric.anomaly.datamodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Outcome of evaluating one detector against one measurement of a metric. */
@Value
public class DetectionResult {
  public static final String METADATA_DETECTOR_TYPE = "detector_type";
  public static final String METADATA_SKIPPED = "skipped";
  public static final String SKIPPED_MISSING_VALUE = "missing_value";

  String metricName;
  String detectorId;
  Instant timestamp;
  Double value;
  boolean anomaly;
  Double score;
  Double lowerBound;
  Double upperBound;
  Direction direction;
  Double percentDeviation;
  Map<String, Object> metadata;

  @Builder(toBuilder = true)
  private DetectionResult(
      @NonNull String metricName,
      @NonNull String detectorId,
      @NonNull Instant timestamp,
      Double value,
      boolean anomaly,
      Double score,
      Double lowerBound,
      Double upperBound,
      Direction direction,
      Double percentDeviation,
      Map<String, Object> metadata) {
    this.metricName = metricName;
    this.detectorId = detectorId;
    this.timestamp = timestamp;
    this.value = value;
    this.anomaly = anomaly;
    this.score = score;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.direction = direction;
    this.percentDeviation = percentDeviation;
    this.metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public boolean isSkipped() {
    return metadata.containsKey(METADATA_SKIPPED);
  }
}

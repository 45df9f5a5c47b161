package org.detectk.metric.anomaly.datamodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single observation of a metric. The value may be absent (a collector returned NULL for the
 * period), in which case the point is kept in storage but ignored by statistical detectors.
 *
 * <p>{@code context} carries the seasonal feature values attached at collection time, e.g. {@code
 * hour_of_day -> 14}.
 */
@Value
public class Measurement {
  Instant timestamp;
  Double value;
  Map<String, Object> context;

  /** The context is copied, so later changes to the caller's map do not reach this point. */
  @Builder(toBuilder = true)
  private Measurement(@NonNull Instant timestamp, Double value, Map<String, Object> context) {
    this.timestamp = timestamp;
    this.value = value;
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public static Measurement of(Instant timestamp, Double value) {
    return Measurement.builder().timestamp(timestamp).value(value).build();
  }

  public static Measurement of(Instant timestamp, Double value, Map<String, Object> context) {
    return Measurement.builder().timestamp(timestamp).value(value).context(context).build();
  }

  public boolean hasValue() {
    return value != null;
  }

  public Optional<Object> getContextValue(String feature) {
    return Optional.ofNullable(context.get(feature));
  }
}

package org.detectk.metric.anomaly.detector.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned table of parameter defaults used when deriving detector ids. Parameters equal to their
 * default are left out of the hashed form, so adding a new parameter with a default to a table
 * version keeps existing ids stable. A table version is never edited once released; changing a
 * default means adding a new version.
 */
public final class DetectorDefaults {

  public static final DetectorDefaults V1 =
      new DetectorDefaults(
          "v1",
          Map.of(
              DetectorKind.THRESHOLD,
              Map.of(
                  ThresholdParams.PERCENT_CHANGE, false,
                  ThresholdParams.BASELINE, ChangeBaseline.PREVIOUS.getLabel(),
                  ThresholdParams.BASELINE_WINDOW, Duration.ofDays(1)),
              DetectorKind.MAD,
              statisticalDefaultsV1(),
              DetectorKind.ZSCORE,
              statisticalDefaultsV1()));

  private final String version;
  private final Map<DetectorKind, Map<String, Object>> defaultsByKind;

  public DetectorDefaults(String version, Map<DetectorKind, Map<String, Object>> defaultsByKind) {
    this.version = version;
    this.defaultsByKind = new EnumMap<>(DetectorKind.class);
    defaultsByKind.forEach((kind, defaults) -> this.defaultsByKind.put(kind, Map.copyOf(defaults)));
  }

  public String getVersion() {
    return version;
  }

  public Map<String, Object> forKind(DetectorKind kind) {
    return defaultsByKind.getOrDefault(kind, Map.of());
  }

  private static Map<String, Object> statisticalDefaultsV1() {
    return Map.of(
        StatisticalParams.WINDOW_SIZE, Duration.ofDays(30),
        StatisticalParams.N_SIGMA, 3.0,
        StatisticalParams.MIN_WINDOW_SIZE, 100,
        StatisticalParams.SEASONAL_FEATURES, List.of(),
        StatisticalParams.USE_COMBINED_SEASONALITY, true,
        StatisticalParams.USE_WEIGHTED, false,
        StatisticalParams.DECAY_FACTOR, 0.1);
  }

  @Override
  public String toString() {
    return "DetectorDefaults{" + version + "}";
  }
}

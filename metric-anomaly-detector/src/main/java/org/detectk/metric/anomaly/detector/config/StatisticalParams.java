package org.detectk.metric.anomaly.detector.config;

import static org.detectk.metric.anomaly.detector.config.ParamChecks.require;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Parameters shared by the detectors that derive bounds from a historical window. */
@Getter
@EqualsAndHashCode
@ToString
public abstract class StatisticalParams implements DetectorParams {
  public static final String WINDOW_SIZE = "window_size";
  public static final String N_SIGMA = "n_sigma";
  public static final String MIN_WINDOW_SIZE = "min_window_size";
  public static final String SEASONAL_FEATURES = "seasonal_features";
  public static final String USE_COMBINED_SEASONALITY = "use_combined_seasonality";
  public static final String USE_WEIGHTED = "use_weighted";
  public static final String DECAY_FACTOR = "decay_factor";

  static final Duration DEFAULT_WINDOW_SIZE = Duration.ofDays(30);
  static final double DEFAULT_N_SIGMA = 3.0;
  static final int DEFAULT_MIN_WINDOW_SIZE = 100;
  static final boolean DEFAULT_USE_COMBINED_SEASONALITY = true;
  static final boolean DEFAULT_USE_WEIGHTED = false;
  static final double DEFAULT_DECAY_FACTOR = 0.1;

  private final Duration windowSize;
  private final double nSigma;
  private final int minWindowSize;
  // sorted and distinct: feature order has no effect on grouping
  private final List<String> seasonalFeatures;
  private final boolean useCombinedSeasonality;
  private final boolean useWeighted;
  // per day of point age
  private final double decayFactor;

  protected StatisticalParams(
      Duration windowSize,
      Double nSigma,
      Integer minWindowSize,
      List<String> seasonalFeatures,
      Boolean useCombinedSeasonality,
      Boolean useWeighted,
      Double decayFactor) {
    this.windowSize = windowSize == null ? DEFAULT_WINDOW_SIZE : windowSize;
    this.nSigma = nSigma == null ? DEFAULT_N_SIGMA : nSigma;
    this.minWindowSize = minWindowSize == null ? DEFAULT_MIN_WINDOW_SIZE : minWindowSize;
    this.seasonalFeatures =
        seasonalFeatures == null ? List.of() : List.copyOf(new TreeSet<>(seasonalFeatures));
    this.useCombinedSeasonality =
        useCombinedSeasonality == null ? DEFAULT_USE_COMBINED_SEASONALITY : useCombinedSeasonality;
    this.useWeighted = useWeighted == null ? DEFAULT_USE_WEIGHTED : useWeighted;
    this.decayFactor = decayFactor == null ? DEFAULT_DECAY_FACTOR : decayFactor;

    require(
        !this.windowSize.isNegative() && !this.windowSize.isZero(),
        "%s must be positive: %s",
        WINDOW_SIZE,
        this.windowSize);
    require(
        Double.isFinite(this.nSigma) && this.nSigma > 0,
        "%s must be positive: %s",
        N_SIGMA,
        this.nSigma);
    require(this.minWindowSize >= 1, "%s must be at least 1: %s", MIN_WINDOW_SIZE, minWindowSize);
    require(
        this.seasonalFeatures.stream().noneMatch(f -> f == null || f.isBlank()),
        "%s must not contain blank names",
        SEASONAL_FEATURES);
    require(
        Double.isFinite(this.decayFactor) && this.decayFactor >= 0,
        "%s must be non-negative: %s",
        DECAY_FACTOR,
        this.decayFactor);
  }

  public boolean isSeasonal() {
    return !seasonalFeatures.isEmpty();
  }

  @Override
  public Map<String, Object> toParamMap() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put(WINDOW_SIZE, windowSize);
    params.put(N_SIGMA, nSigma);
    params.put(MIN_WINDOW_SIZE, minWindowSize);
    params.put(SEASONAL_FEATURES, seasonalFeatures);
    params.put(USE_COMBINED_SEASONALITY, useCombinedSeasonality);
    params.put(USE_WEIGHTED, useWeighted);
    params.put(DECAY_FACTOR, decayFactor);
    return params;
  }
}

package org.detectk.metric.anomaly.detector.evaluator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Direction;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.exception.DetectionException;
import org.detectk.metric.anomaly.datamodel.exception.InsufficientDataException;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.detector.config.StatisticalParams;
import org.detectk.metric.anomaly.storage.MetricStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detector flagging values outside {@code center +/- n_sigma * spread} of the preceding window.
 * Subclasses choose the center and spread estimators.
 */
public abstract class BaselineDetector extends AbstractDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(BaselineDetector.class);
  private static final double SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

  public static final String METADATA_WINDOW_SIZE = "window_size";
  public static final String METADATA_N_SIGMA = "n_sigma";
  public static final String METADATA_WINDOW_POINTS = "window_points";
  public static final String METADATA_CENTER = "center";
  public static final String METADATA_SPREAD = "spread";
  public static final String METADATA_SEASONAL_GROUP = "seasonal_group";
  public static final String METADATA_WEIGHTED = "weighted";

  protected final StatisticalParams params;
  private final SeasonalFilter seasonalFilter;

  protected BaselineDetector(String id, StatisticalParams params, MetricStorage storage) {
    super(id, storage);
    this.params = params;
    this.seasonalFilter =
        new SeasonalFilter(params.getSeasonalFeatures(), params.isUseCombinedSeasonality());
  }

  protected abstract Baseline computeBaseline(double[] values);

  protected abstract Baseline computeWeightedBaseline(double[] values, double[] weights);

  @Override
  protected DetectionResult evaluate(String metricName, Measurement current)
      throws DetectionException, StorageException {
    Predicate<Map<String, Object>> contextFilter = seasonalFilter.forTarget(current);
    List<Measurement> window =
        storage.queryWindow(
            metricName, current.getTimestamp(), params.getWindowSize(), contextFilter);

    List<Measurement> usable = new ArrayList<>(window.size());
    for (Measurement measurement : window) {
      if (!measurement.hasValue()) {
        continue;
      }
      if (!Double.isFinite(measurement.getValue())) {
        throw new DetectionException(
            String.format(
                "Non-finite historical value %s for metric %s at %s",
                measurement.getValue(), metricName, measurement.getTimestamp()));
      }
      usable.add(measurement);
    }

    if (usable.size() < params.getMinWindowSize()) {
      LOGGER.debug(
          "Detector {} on metric {}: {} usable points in window, {} required",
          id,
          metricName,
          usable.size(),
          params.getMinWindowSize());
      throw new InsufficientDataException(usable.size(), params.getMinWindowSize());
    }

    double[] values = new double[usable.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = usable.get(i).getValue();
    }
    Baseline baseline;
    if (params.isUseWeighted()) {
      double[] weights = ageWeights(usable, current);
      if (!StatisticsUtil.hasUsableWeights(weights)) {
        throw new DetectionException(
            String.format(
                "Decay weights for metric %s vanish over the window (decay_factor %s)",
                metricName, params.getDecayFactor()));
      }
      baseline = computeWeightedBaseline(values, weights);
    } else {
      baseline = computeBaseline(values);
    }
    if (!Double.isFinite(baseline.getCenter()) || !Double.isFinite(baseline.getSpread())) {
      throw new DetectionException(
          String.format("Non-finite baseline %s for metric %s", baseline, metricName));
    }

    double value = current.getValue();
    Direction direction = null;
    if (value > baseline.getUpperBound()) {
      direction = Direction.UP;
    } else if (value < baseline.getLowerBound()) {
      direction = Direction.DOWN;
    }

    LOGGER.debug(
        "Detector {} on metric {} at {}: value {}, baseline {}",
        id,
        metricName,
        current.getTimestamp(),
        value,
        baseline);

    Map<String, Object> metadata = baseMetadata();
    metadata.put(METADATA_WINDOW_SIZE, params.getWindowSize().toString());
    metadata.put(METADATA_N_SIGMA, params.getNSigma());
    metadata.put(METADATA_WINDOW_POINTS, baseline.getWindowPoints());
    metadata.put(METADATA_CENTER, baseline.getCenter());
    metadata.put(METADATA_SPREAD, baseline.getSpread());
    metadata.put(METADATA_WEIGHTED, params.isUseWeighted());
    if (seasonalFilter.isActive()) {
      metadata.put(METADATA_SEASONAL_GROUP, seasonalFilter.toString());
    }

    return resultBuilder(metricName, current)
        .anomaly(baseline.isOutside(value))
        .score(baseline.score(value))
        .lowerBound(baseline.getLowerBound())
        .upperBound(baseline.getUpperBound())
        .direction(direction)
        .percentDeviation(percentDeviation(value, baseline.getCenter()))
        .metadata(Map.copyOf(metadata))
        .build();
  }

  private double[] ageWeights(List<Measurement> points, Measurement current) {
    double[] ages = new double[points.size()];
    for (int i = 0; i < ages.length; i++) {
      Duration age = Duration.between(points.get(i).getTimestamp(), current.getTimestamp());
      ages[i] = age.getSeconds() / SECONDS_PER_DAY;
    }
    return StatisticsUtil.exponentialDecayWeights(ages, params.getDecayFactor());
  }
}

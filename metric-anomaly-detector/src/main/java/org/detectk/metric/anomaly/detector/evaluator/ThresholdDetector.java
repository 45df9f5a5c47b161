package org.detectk.metric.anomaly.detector.evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Direction;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.exception.DetectionException;
import org.detectk.metric.anomaly.datamodel.exception.InsufficientDataException;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.detector.config.ChangeBaseline;
import org.detectk.metric.anomaly.detector.config.DetectorKind;
import org.detectk.metric.anomaly.detector.config.ThresholdOperator;
import org.detectk.metric.anomaly.detector.config.ThresholdParams;
import org.detectk.metric.anomaly.storage.MetricStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-rule detector. Absolute rules never read history; percent-change rules read the baseline
 * window only.
 */
public class ThresholdDetector extends AbstractDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(ThresholdDetector.class);
  public static final String METADATA_OPERATOR = "operator";
  public static final String METADATA_BASELINE_VALUE = "baseline_value";
  public static final String METADATA_PERCENT_CHANGE = "percent_change";

  private final ThresholdParams params;

  public ThresholdDetector(String id, ThresholdParams params, MetricStorage storage) {
    super(id, storage);
    this.params = params;
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.THRESHOLD;
  }

  @Override
  protected DetectionResult evaluate(String metricName, Measurement current)
      throws DetectionException, StorageException {
    Map<String, Object> metadata = baseMetadata();
    metadata.put(METADATA_OPERATOR, params.getOperator().getLabel());

    double compared = current.getValue();
    if (params.isPercentChange()) {
      double baselineValue = changeBaseline(metricName, current);
      if (baselineValue == 0) {
        throw new DetectionException(
            String.format(
                "Percent change undefined for metric %s at %s: baseline is zero",
                metricName, current.getTimestamp()));
      }
      compared = (current.getValue() - baselineValue) / Math.abs(baselineValue) * 100;
      metadata.put(METADATA_BASELINE_VALUE, baselineValue);
      metadata.put(METADATA_PERCENT_CHANGE, compared);
    }

    ThresholdOperator operator = params.getOperator();
    boolean anomaly = evalOperator(operator, compared);
    Direction direction = anomaly ? direction(operator, compared) : null;

    LOGGER.debug(
        "Detector {} on metric {} at {}: {} {} -> {}",
        id,
        metricName,
        current.getTimestamp(),
        compared,
        operator.getLabel(),
        anomaly);

    DetectionResult.DetectionResultBuilder builder =
        resultBuilder(metricName, current).anomaly(anomaly).direction(direction);
    if (operator.isRange()) {
      builder.lowerBound(params.getMinValue()).upperBound(params.getMaxValue());
    } else {
      double threshold = params.getValue();
      switch (operator) {
        case GT:
        case GTE:
          builder.upperBound(threshold);
          break;
        case LT:
        case LTE:
          builder.lowerBound(threshold);
          break;
        default:
          builder.lowerBound(threshold).upperBound(threshold);
      }
      if (!params.isPercentChange()) {
        builder.percentDeviation(percentDeviation(compared, threshold));
      }
    }
    if (params.isPercentChange()) {
      builder.percentDeviation(compared);
    }
    return builder.metadata(Map.copyOf(metadata)).build();
  }

  private double changeBaseline(String metricName, Measurement current)
      throws StorageException, InsufficientDataException {
    List<Measurement> window =
        storage.queryWindow(metricName, current.getTimestamp(), params.getBaselineWindow());
    List<Double> values = new ArrayList<>();
    for (Measurement measurement : window) {
      if (measurement.hasValue() && Double.isFinite(measurement.getValue())) {
        values.add(measurement.getValue());
      }
    }
    if (values.isEmpty()) {
      throw new InsufficientDataException(0, 1);
    }
    if (params.getBaseline() == ChangeBaseline.PREVIOUS) {
      return values.get(values.size() - 1);
    }
    return values.stream().mapToDouble(Double::doubleValue).average().getAsDouble();
  }

  boolean evalOperator(ThresholdOperator operator, double lhs) {
    switch (operator) {
      case GT:
        return lhs > params.getValue();
      case GTE:
        return lhs >= params.getValue();
      case LT:
        return lhs < params.getValue();
      case LTE:
        return lhs <= params.getValue();
      case EQ:
        return lhs == params.getValue();
      case NEQ:
        return lhs != params.getValue();
      case BETWEEN:
        return lhs >= params.getMinValue() && lhs <= params.getMaxValue();
      case OUTSIDE:
        return lhs < params.getMinValue() || lhs > params.getMaxValue();
      default:
        throw new UnsupportedOperationException("Unsupported threshold operator: " + operator);
    }
  }

  private Direction direction(ThresholdOperator operator, double lhs) {
    switch (operator) {
      case EQ:
      case BETWEEN:
        return null;
      case OUTSIDE:
        return lhs > params.getMaxValue() ? Direction.UP : Direction.DOWN;
      default:
        if (lhs == params.getValue()) {
          return null;
        }
        return lhs > params.getValue() ? Direction.UP : Direction.DOWN;
    }
  }
}

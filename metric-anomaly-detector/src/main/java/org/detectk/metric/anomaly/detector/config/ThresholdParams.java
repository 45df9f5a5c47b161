package org.detectk.metric.anomaly.detector.config;

import static org.detectk.metric.anomaly.detector.config.ParamChecks.require;
import static org.detectk.metric.anomaly.detector.config.ParamChecks.requireFinite;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Fixed threshold rule. In absolute mode the operator is applied to the measured value; with
 * {@code percentChange} it is applied to the percent change of the value against a baseline.
 */
@Value
public class ThresholdParams implements DetectorParams {
  public static final String OPERATOR = "operator";
  public static final String VALUE = "value";
  public static final String MIN_VALUE = "min_value";
  public static final String MAX_VALUE = "max_value";
  public static final String PERCENT_CHANGE = "percent_change";
  public static final String BASELINE = "baseline";
  public static final String BASELINE_WINDOW = "baseline_window";

  static final ChangeBaseline DEFAULT_BASELINE = ChangeBaseline.PREVIOUS;
  static final Duration DEFAULT_BASELINE_WINDOW = Duration.ofDays(1);

  ThresholdOperator operator;
  Double value;
  Double minValue;
  Double maxValue;
  boolean percentChange;
  ChangeBaseline baseline;
  Duration baselineWindow;

  @Builder
  private ThresholdParams(
      ThresholdOperator operator,
      Double value,
      Double minValue,
      Double maxValue,
      Boolean percentChange,
      ChangeBaseline baseline,
      Duration baselineWindow) {
    require(operator != null, "%s is required", OPERATOR);
    if (operator.isRange()) {
      requireFinite(minValue, MIN_VALUE);
      requireFinite(maxValue, MAX_VALUE);
      require(
          minValue <= maxValue,
          "%s must not exceed %s: %s > %s",
          MIN_VALUE,
          MAX_VALUE,
          minValue,
          maxValue);
      require(value == null, "%s is not used by operator %s", VALUE, operator.getLabel());
    } else {
      requireFinite(value, VALUE);
      require(
          minValue == null && maxValue == null,
          "%s/%s are not used by operator %s",
          MIN_VALUE,
          MAX_VALUE,
          operator.getLabel());
    }
    Duration window = baselineWindow == null ? DEFAULT_BASELINE_WINDOW : baselineWindow;
    require(
        !window.isNegative() && !window.isZero(),
        "%s must be positive: %s",
        BASELINE_WINDOW,
        window);
    this.operator = operator;
    this.value = value;
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.percentChange = percentChange != null && percentChange;
    this.baseline = baseline == null ? DEFAULT_BASELINE : baseline;
    this.baselineWindow = window;
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.THRESHOLD;
  }

  @Override
  public Map<String, Object> toParamMap() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put(OPERATOR, operator.getLabel());
    if (operator.isRange()) {
      params.put(MIN_VALUE, minValue);
      params.put(MAX_VALUE, maxValue);
    } else {
      params.put(VALUE, value);
    }
    params.put(PERCENT_CHANGE, percentChange);
    params.put(BASELINE, baseline.getLabel());
    params.put(BASELINE_WINDOW, baselineWindow);
    return params;
  }
}

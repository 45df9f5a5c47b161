package org.detectk.metric.anomaly.detector.config;

import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;

/** Condition under which a threshold detector reports an anomaly. */
public enum ThresholdOperator {
  GT("gt", false),
  GTE("gte", false),
  LT("lt", false),
  LTE("lte", false),
  EQ("eq", false),
  NEQ("neq", false),
  BETWEEN("between", true),
  OUTSIDE("outside", true);

  private final String label;
  private final boolean range;

  ThresholdOperator(String label, boolean range) {
    this.label = label;
    this.range = range;
  }

  public String getLabel() {
    return label;
  }

  /** True for operators taking {@code (min_value, max_value)} instead of {@code value}. */
  public boolean isRange() {
    return range;
  }

  public static ThresholdOperator fromLabel(String label) {
    for (ThresholdOperator operator : values()) {
      if (operator.label.equalsIgnoreCase(label)) {
        return operator;
      }
    }
    throw new ConfigurationException(String.format("Unknown threshold operator:%s", label));
  }
}

package org.detectk.metric.anomaly.detector.config;

import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;

/** Reference value for percent-change thresholds. */
public enum ChangeBaseline {
  /** Last stored point before the current one. */
  PREVIOUS("previous"),
  /** Mean of the stored points in the baseline window. */
  AVERAGE("average");

  private final String label;

  ChangeBaseline(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static ChangeBaseline fromLabel(String label) {
    for (ChangeBaseline baseline : values()) {
      if (baseline.label.equalsIgnoreCase(label)) {
        return baseline;
      }
    }
    throw new ConfigurationException(String.format("Unknown change baseline:%s", label));
  }
}

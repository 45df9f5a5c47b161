package org.detectk.metric.anomaly.detector.config;

import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;

public enum DetectorKind {
  THRESHOLD("threshold"),
  MAD("mad"),
  ZSCORE("zscore");

  private final String label;

  DetectorKind(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static DetectorKind fromLabel(String label) {
    for (DetectorKind kind : values()) {
      if (kind.label.equalsIgnoreCase(label)) {
        return kind;
      }
    }
    throw new ConfigurationException(String.format("Unknown detector kind:%s", label));
  }
}

package org.detectk.metric.anomaly.detector.config;

import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;

final class ParamChecks {

  private ParamChecks() {}

  static void require(boolean condition, String messageFormat, Object... args) {
    if (!condition) {
      throw new ConfigurationException(String.format(messageFormat, args));
    }
  }

  static void requireFinite(Double value, String name) {
    require(value != null, "%s is required", name);
    require(Double.isFinite(value), "%s must be finite: %s", name, value);
  }
}

package org.detectk.metric.anomaly.datamodel.exception;

/** Invalid detector or check setup. Raised at construction time, never during a check run. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}

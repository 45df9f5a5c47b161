package org.detectk.metric.anomaly.datamodel.exception;

public class AlertException extends DetectKException {

  public AlertException(String message) {
    super(message);
  }

  public AlertException(String message, Throwable cause) {
    super(message, cause);
  }
}

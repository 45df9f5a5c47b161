package org.detectk.metric.anomaly.datamodel.exception;

public class DetectionException extends DetectKException {

  public DetectionException(String message) {
    super(message);
  }

  public DetectionException(String message, Throwable cause) {
    super(message, cause);
  }
}

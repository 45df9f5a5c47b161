package org.detectk.metric.anomaly.datamodel.exception;

/** Base type of the recoverable failures raised by the check pipeline stages. */
public class DetectKException extends Exception {

  public DetectKException(String message) {
    super(message);
  }

  public DetectKException(String message, Throwable cause) {
    super(message, cause);
  }
}

package org.detectk.metric.anomaly.datamodel.exception;

public class CollectionException extends DetectKException {

  public CollectionException(String message) {
    super(message);
  }

  public CollectionException(String message, Throwable cause) {
    super(message, cause);
  }
}

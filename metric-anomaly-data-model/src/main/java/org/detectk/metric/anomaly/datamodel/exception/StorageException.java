package org.detectk.metric.anomaly.datamodel.exception;

public class StorageException extends DetectKException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}

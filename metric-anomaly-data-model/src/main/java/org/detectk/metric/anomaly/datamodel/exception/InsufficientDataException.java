package org.detectk.metric.anomaly.datamodel.exception;

/** Raised when a historical window has fewer usable points than a detector requires. */
public class InsufficientDataException extends DetectionException {
  private final int observed;
  private final int required;

  public InsufficientDataException(int observed, int required) {
    super(
        String.format(
            "Insufficient data for detection: %d points in window, %d required",
            observed, required));
    this.observed = observed;
    this.required = required;
  }

  public int getObserved() {
    return observed;
  }

  public int getRequired() {
    return required;
  }
}

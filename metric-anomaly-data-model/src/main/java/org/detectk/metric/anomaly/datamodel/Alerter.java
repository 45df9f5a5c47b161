package org.detectk.metric.anomaly.datamodel;

import org.detectk.metric.anomaly.datamodel.exception.AlertException;

public interface Alerter {

  /**
   * Delivers an alert for an anomalous result.
   *
   * @return true once the channel confirmed delivery, false if the alerter chose not to send
   * @throws AlertException when delivery was attempted and failed
   */
  boolean send(DetectionResult result) throws AlertException;
}

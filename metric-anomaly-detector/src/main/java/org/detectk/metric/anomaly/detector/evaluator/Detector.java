package org.detectk.metric.anomaly.detector.evaluator;

import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.exception.DetectionException;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.detector.config.DetectorKind;

public interface Detector {

  String getId();

  DetectorKind getKind();

  /**
   * Evaluates {@code current}, which must already be stored, against the metric's history.
   *
   * @throws org.detectk.metric.anomaly.datamodel.exception.InsufficientDataException when the
   *     history window is smaller than the detector requires
   * @throws DetectionException on non-finite inputs or an undefined baseline
   * @throws StorageException when the history cannot be read
   */
  DetectionResult detect(String metricName, Measurement current)
      throws DetectionException, StorageException;
}

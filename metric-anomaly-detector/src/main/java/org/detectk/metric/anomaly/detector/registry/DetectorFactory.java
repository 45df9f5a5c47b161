package org.detectk.metric.anomaly.detector.registry;

import org.detectk.metric.anomaly.detector.config.DetectorParams;
import org.detectk.metric.anomaly.detector.evaluator.Detector;
import org.detectk.metric.anomaly.storage.MetricStorage;

@FunctionalInterface
public interface DetectorFactory {
  Detector create(String id, DetectorParams params, MetricStorage storage);
}

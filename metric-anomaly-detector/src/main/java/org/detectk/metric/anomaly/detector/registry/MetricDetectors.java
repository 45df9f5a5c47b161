package org.detectk.metric.anomaly.detector.registry;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.detectk.metric.anomaly.detector.evaluator.Detector;

/** The detectors configured for one metric, unique by id, in configuration order. */
public class MetricDetectors {
  private final String metricName;
  private final List<Detector> detectors;

  MetricDetectors(String metricName, List<Detector> detectors) {
    this.metricName = metricName;
    this.detectors = List.copyOf(detectors);
  }

  public String getMetricName() {
    return metricName;
  }

  public List<Detector> getDetectors() {
    return detectors;
  }

  public List<String> getIds() {
    return detectors.stream().map(Detector::getId).collect(Collectors.toList());
  }

  public Optional<Detector> get(String detectorId) {
    return detectors.stream().filter(d -> d.getId().equals(detectorId)).findFirst();
  }

  public int size() {
    return detectors.size();
  }
}

package org.detectk.metric.anomaly.detector.registry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;
import org.detectk.metric.anomaly.detector.config.DetectorDefaults;
import org.detectk.metric.anomaly.detector.config.DetectorKind;
import org.detectk.metric.anomaly.detector.config.DetectorSpec;
import org.detectk.metric.anomaly.detector.config.MadParams;
import org.detectk.metric.anomaly.detector.config.ThresholdParams;
import org.detectk.metric.anomaly.detector.config.ZScoreParams;
import org.detectk.metric.anomaly.detector.evaluator.Detector;
import org.detectk.metric.anomaly.detector.evaluator.MadDetector;
import org.detectk.metric.anomaly.detector.evaluator.ThresholdDetector;
import org.detectk.metric.anomaly.detector.evaluator.ZScoreDetector;
import org.detectk.metric.anomaly.detector.identity.DetectorIdGenerator;
import org.detectk.metric.anomaly.storage.MetricStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps detector kinds to their factories and builds the detector set of a metric, assigning
 * derived ids to specs that have none.
 */
public class DetectorRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectorRegistry.class);

  private final Map<DetectorKind, DetectorFactory> factories = new EnumMap<>(DetectorKind.class);
  private final DetectorIdGenerator idGenerator;

  public DetectorRegistry(DetectorIdGenerator idGenerator) {
    this.idGenerator = idGenerator;
  }

  /** Registry with the built-in threshold, MAD and Z-score detectors. */
  public static DetectorRegistry withBuiltInDetectors(DetectorDefaults defaults) {
    return new DetectorRegistry(new DetectorIdGenerator(defaults))
        .register(
            DetectorKind.THRESHOLD,
            (id, params, storage) -> new ThresholdDetector(id, (ThresholdParams) params, storage))
        .register(
            DetectorKind.MAD,
            (id, params, storage) -> new MadDetector(id, (MadParams) params, storage))
        .register(
            DetectorKind.ZSCORE,
            (id, params, storage) -> new ZScoreDetector(id, (ZScoreParams) params, storage));
  }

  public DetectorRegistry register(DetectorKind kind, DetectorFactory factory) {
    if (factories.containsKey(kind)) {
      throw new ConfigurationException(
          String.format("Detector kind %s is already registered", kind.getLabel()));
    }
    factories.put(kind, factory);
    return this;
  }

  public DetectorIdGenerator getIdGenerator() {
    return idGenerator;
  }

  public Detector create(DetectorSpec spec, MetricStorage storage) {
    DetectorFactory factory = factories.get(spec.getKind());
    if (factory == null) {
      throw new ConfigurationException(
          String.format("No detector registered for kind:%s", spec.getKind().getLabel()));
    }
    return factory.create(idGenerator.resolveId(spec), spec.getParams(), storage);
  }

  /**
   * Builds the detectors of one metric, in spec order.
   *
   * @throws ConfigurationException when two specs resolve to the same id
   */
  public MetricDetectors forMetric(
      String metricName, List<DetectorSpec> specs, MetricStorage storage) {
    Map<String, Detector> detectors = new LinkedHashMap<>();
    for (DetectorSpec spec : specs) {
      Detector detector = create(spec, storage);
      if (detectors.containsKey(detector.getId())) {
        throw new ConfigurationException(
            String.format(
                "Duplicate detector id %s for metric %s (kind %s)",
                detector.getId(), metricName, spec.getKind().getLabel()));
      }
      detectors.put(detector.getId(), detector);
    }
    LOGGER.info("Registered detectors {} for metric {}", detectors.keySet(), metricName);
    return new MetricDetectors(metricName, new ArrayList<>(detectors.values()));
  }
}

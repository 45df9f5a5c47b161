package org.detectk.engine.check;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import org.detectk.metric.anomaly.datamodel.Alerter;
import org.detectk.metric.anomaly.datamodel.Collector;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;
import org.detectk.metric.anomaly.detector.config.DetectorSpec;
import org.detectk.metric.anomaly.detector.config.DetectorSpecs;

/** One metric check: where data comes from, which detectors run, and how alerts are gated. */
@Value
public class MetricCheckConfig {
  public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(60);
  public static final Duration DEFAULT_COLLECT_INTERVAL = Duration.ofMinutes(10);

  private static final String METRIC_NAME = "metricName";
  private static final String DETECTORS = "detectors";
  private static final String COOLDOWN = "cooldown";
  private static final String COLLECT_INTERVAL = "collectInterval";
  private static final String SAVE_DETECTIONS = "saveDetections";

  String metricName;
  Collector collector;
  List<DetectorSpec> detectors;
  Alerter alerter;
  Duration cooldown;
  Duration collectInterval;
  boolean saveDetections;

  @Builder
  private MetricCheckConfig(
      String metricName,
      Collector collector,
      List<DetectorSpec> detectors,
      Alerter alerter,
      Duration cooldown,
      Duration collectInterval,
      Boolean saveDetections) {
    if (metricName == null || metricName.isBlank()) {
      throw new ConfigurationException("Metric check requires a metric name");
    }
    if (collector == null) {
      throw new ConfigurationException("Metric check " + metricName + " requires a collector");
    }
    if (detectors == null || detectors.isEmpty()) {
      throw new ConfigurationException(
          "Metric check " + metricName + " requires at least one detector");
    }
    this.metricName = metricName;
    this.collector = collector;
    this.detectors = List.copyOf(detectors);
    this.alerter = alerter;
    this.cooldown = cooldown == null ? DEFAULT_COOLDOWN : cooldown;
    this.collectInterval = collectInterval == null ? DEFAULT_COLLECT_INTERVAL : collectInterval;
    this.saveDetections = saveDetections == null || saveDetections;
    if (this.cooldown.isNegative()) {
      throw new ConfigurationException("Cooldown must not be negative, got " + this.cooldown);
    }
    if (this.collectInterval.isNegative() || this.collectInterval.isZero()) {
      throw new ConfigurationException(
          "Collect interval must be positive, got " + this.collectInterval);
    }
  }

  /**
   * Reads the metric name, detectors and timing settings of a check. The collector and alerter
   * are not expressible in configuration and must be set on the returned builder.
   */
  public static MetricCheckConfigBuilder fromConfig(Config config) {
    if (!config.hasPath(METRIC_NAME) || !config.hasPath(DETECTORS)) {
      throw new ConfigurationException(
          String.format("Metric check requires %s and %s", METRIC_NAME, DETECTORS));
    }
    try {
      return MetricCheckConfig.builder()
          .metricName(config.getString(METRIC_NAME))
          .detectors(DetectorSpecs.fromConfigList(config.getConfigList(DETECTORS)))
          .cooldown(config.hasPath(COOLDOWN) ? config.getDuration(COOLDOWN) : DEFAULT_COOLDOWN)
          .collectInterval(
              config.hasPath(COLLECT_INTERVAL)
                  ? config.getDuration(COLLECT_INTERVAL)
                  : DEFAULT_COLLECT_INTERVAL)
          .saveDetections(
              !config.hasPath(SAVE_DETECTIONS) || config.getBoolean(SAVE_DETECTIONS));
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid metric check configuration: " + e.getMessage(), e);
    }
  }

  public boolean hasAlerter() {
    return alerter != null;
  }
}

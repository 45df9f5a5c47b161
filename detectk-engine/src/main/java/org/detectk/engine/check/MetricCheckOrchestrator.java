package org.detectk.engine.check;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.apache.commons.lang3.tuple.Pair;
import org.detectk.engine.alert.AlertDecision;
import org.detectk.engine.alert.AlertGate;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.StoredDetection;
import org.detectk.metric.anomaly.datamodel.exception.AlertException;
import org.detectk.metric.anomaly.datamodel.exception.CollectionException;
import org.detectk.metric.anomaly.datamodel.exception.DetectionException;
import org.detectk.metric.anomaly.datamodel.exception.InsufficientDataException;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.detector.config.DetectorSpec;
import org.detectk.metric.anomaly.detector.evaluator.Detector;
import org.detectk.metric.anomaly.detector.registry.DetectorRegistry;
import org.detectk.metric.anomaly.detector.registry.MetricDetectors;
import org.detectk.metric.anomaly.storage.AlertStateStore;
import org.detectk.metric.anomaly.storage.BatchSaveSummary;
import org.detectk.metric.anomaly.storage.MetricStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one check of a metric: collect, store, evaluate every detector, gate and send alerts, store
 * detections. Stage failures are recorded in the {@link CheckResult} instead of being thrown; a
 * failing detector does not stop its siblings, and a failed alert does not prevent the detection
 * from being stored. Only invalid configuration is thrown, as {@code ConfigurationException}.
 */
public class MetricCheckOrchestrator {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricCheckOrchestrator.class);

  private static final String CHECK_COUNTER = "detectk.check.executions";
  private static final String ANOMALY_COUNTER = "detectk.check.anomalies";
  private static final String ALERT_COUNTER = "detectk.check.alerts.sent";
  private static final String FAILURE_COUNTER = "detectk.check.stage.failures";
  private static final String CHECK_TIMER = "detectk.check.latency";
  private static final String METRIC_TAG = "metric";

  private static final ConcurrentMap<String, Counter> checkCounter = new ConcurrentHashMap<>();
  private static final ConcurrentMap<String, Counter> anomalyCounter = new ConcurrentHashMap<>();
  private static final ConcurrentMap<String, Counter> alertCounter = new ConcurrentHashMap<>();
  private static final ConcurrentMap<Pair<String, PipelineStage>, Counter> failureCounter =
      new ConcurrentHashMap<>();
  private static final ConcurrentMap<String, Timer> checkTimer = new ConcurrentHashMap<>();

  private final MetricStorage storage;
  private final AlertGate alertGate;
  private final DetectorRegistry registry;
  private final ExecutorService detectionExecutor;
  private final ConcurrentMap<Pair<String, List<DetectorSpec>>, MetricDetectors> detectorCache =
      new ConcurrentHashMap<>();

  public MetricCheckOrchestrator(
      MetricStorage storage, AlertStateStore alertStateStore, DetectorRegistry registry) {
    this(storage, alertStateStore, registry, null);
  }

  /** Detectors of a check are evaluated concurrently on {@code detectionExecutor}. */
  public MetricCheckOrchestrator(
      MetricStorage storage,
      AlertStateStore alertStateStore,
      DetectorRegistry registry,
      ExecutorService detectionExecutor) {
    this.storage = storage;
    this.alertGate = new AlertGate(alertStateStore);
    this.registry = registry;
    this.detectionExecutor = detectionExecutor;
  }

  public CheckResult execute(MetricCheckConfig config, Instant executionTime) {
    MetricDetectors detectors = detectorsFor(config);
    Instant startTime = Instant.now();
    try {
      CheckResult result = run(config, detectors, executionTime);
      recordMetrics(result);
      if (result.isSuccessful()) {
        LOGGER.info(
            "Check of {} at {}: {} detections, {} anomalies, {} alerts sent",
            result.getMetricName(),
            executionTime,
            result.getDetections().size(),
            result.getAnomalies().size(),
            result.getAlertsSent());
      } else {
        LOGGER.warn(
            "Check of {} at {} completed with failures: {}",
            result.getMetricName(),
            executionTime,
            result.getFailures());
      }
      return result;
    } finally {
      checkTimer
          .computeIfAbsent(
              config.getMetricName(), m -> Metrics.timer(CHECK_TIMER, METRIC_TAG, m))
          .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  MetricDetectors detectorsFor(MetricCheckConfig config) {
    return detectorCache.computeIfAbsent(
        Pair.of(config.getMetricName(), config.getDetectors()),
        key -> registry.forMetric(key.getLeft(), key.getRight(), storage));
  }

  private CheckResult run(
      MetricCheckConfig config, MetricDetectors detectors, Instant executionTime) {
    String metricName = config.getMetricName();
    List<StageOutcome> stages = new ArrayList<>();
    Instant periodStart = executionTime.minus(config.getCollectInterval());

    List<Measurement> measurements;
    try {
      measurements = config.getCollector().collect(periodStart, executionTime);
      stages.add(
          StageOutcome.succeeded(
              PipelineStage.COLLECTION,
              String.format(
                  "collected %d measurements in [%s, %s)",
                  measurements.size(), periodStart, executionTime)));
    } catch (CollectionException e) {
      LOGGER.warn("Collection failed for {} at {}", metricName, executionTime, e);
      stages.add(StageOutcome.failed(PipelineStage.COLLECTION, e.getMessage()));
      stages.add(StageOutcome.skipped(PipelineStage.STORAGE, "collection failed"));
      skipDetection(stages, detectors, "collection failed");
      return new CheckResult(metricName, executionTime, stages, List.of(), 0);
    }

    try {
      BatchSaveSummary summary = storage.saveBatch(metricName, measurements);
      stages.add(StageOutcome.succeeded(PipelineStage.STORAGE, summary.toString()));
    } catch (StorageException e) {
      LOGGER.warn("Saving measurements failed for {} at {}", metricName, executionTime, e);
      stages.add(StageOutcome.failed(PipelineStage.STORAGE, e.getMessage()));
      skipDetection(stages, detectors, "measurements were not stored");
      return new CheckResult(metricName, executionTime, stages, List.of(), 0);
    }

    List<Measurement> points =
        measurements.stream()
            .filter(Measurement::hasValue)
            .sorted(Comparator.comparing(Measurement::getTimestamp))
            .collect(Collectors.toList());
    if (points.isEmpty()) {
      skipDetection(stages, detectors, "no measurement with a value in the collected period");
      return new CheckResult(metricName, executionTime, stages, List.of(), 0);
    }

    List<DetectionResult> results = new ArrayList<>();
    for (DetectorRun detectorRun : evaluateAll(metricName, detectors, points)) {
      stages.addAll(detectorRun.outcomes);
      results.addAll(detectorRun.results);
    }

    List<StoredDetection> toStore = new ArrayList<>();
    int alertsSent = 0;
    for (DetectionResult result : results) {
      if (!result.isAnomaly()) {
        toStore.add(StoredDetection.notAlerted(result));
        continue;
      }
      AlertAttempt attempt = dispatch(config, result, executionTime);
      stages.add(attempt.outcome);
      if (attempt.sent) {
        alertsSent++;
        toStore.add(StoredDetection.alerted(result, attempt.outcome.getMessage()));
      } else {
        toStore.add(StoredDetection.notAlerted(result));
      }
    }

    if (!config.isSaveDetections()) {
      stages.add(StageOutcome.skipped(PipelineStage.DETECTION_STORAGE, "disabled"));
    } else if (toStore.isEmpty()) {
      stages.add(StageOutcome.skipped(PipelineStage.DETECTION_STORAGE, "no detections"));
    } else {
      try {
        BatchSaveSummary summary = storage.saveDetections(toStore);
        stages.add(StageOutcome.succeeded(PipelineStage.DETECTION_STORAGE, summary.toString()));
      } catch (StorageException e) {
        LOGGER.warn("Saving detections failed for {} at {}", metricName, executionTime, e);
        stages.add(StageOutcome.failed(PipelineStage.DETECTION_STORAGE, e.getMessage()));
      }
    }
    return new CheckResult(metricName, executionTime, stages, results, alertsSent);
  }

  private List<DetectorRun> evaluateAll(
      String metricName, MetricDetectors detectors, List<Measurement> points) {
    List<DetectorRun> runs = new ArrayList<>();
    if (detectionExecutor == null) {
      for (Detector detector : detectors.getDetectors()) {
        runs.add(evaluate(metricName, detector, points));
      }
      return runs;
    }
    List<Future<DetectorRun>> futures = new ArrayList<>();
    for (Detector detector : detectors.getDetectors()) {
      futures.add(detectionExecutor.submit(() -> evaluate(metricName, detector, points)));
    }
    // collected in submission order so results do not depend on scheduling
    for (Future<DetectorRun> future : futures) {
      try {
        runs.add(future.get());
      } catch (ExecutionException e) {
        futures.forEach(f -> f.cancel(true));
        if (e.getCause() instanceof RuntimeException) {
          throw (RuntimeException) e.getCause();
        }
        throw new RuntimeException(e.getCause());
      } catch (InterruptedException e) {
        futures.forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        throw new RuntimeException(
            String.format("Interrupted while evaluating detectors of %s", metricName), e);
      }
    }
    return runs;
  }

  private DetectorRun evaluate(String metricName, Detector detector, List<Measurement> points) {
    DetectorRun detectorRun = new DetectorRun();
    for (Measurement point : points) {
      try {
        DetectionResult result = detector.detect(metricName, point);
        detectorRun.results.add(result);
        detectorRun.outcomes.add(
            StageOutcome.forDetector(
                PipelineStage.DETECTION,
                detector.getId(),
                point.getTimestamp(),
                StageStatus.SUCCEEDED,
                result.isAnomaly() ? "anomaly" : "normal"));
      } catch (InsufficientDataException e) {
        LOGGER.info("Detector {} of {}: {}", detector.getId(), metricName, e.getMessage());
        detectorRun.outcomes.add(detectionFailure(detector, point, e));
      } catch (DetectionException | StorageException e) {
        LOGGER.warn(
            "Detector {} failed for {} at {}",
            detector.getId(),
            metricName,
            point.getTimestamp(),
            e);
        detectorRun.outcomes.add(detectionFailure(detector, point, e));
      }
    }
    return detectorRun;
  }

  private AlertAttempt dispatch(MetricCheckConfig config, DetectionResult result, Instant now) {
    if (!config.hasAlerter()) {
      return AlertAttempt.notSent(alertOutcome(result, StageStatus.SKIPPED, "no alerter"));
    }
    try {
      if (alertGate.check(result, config.getCooldown(), now)
          == AlertDecision.SUPPRESSED_COOLDOWN) {
        return AlertAttempt.notSent(alertOutcome(result, StageStatus.SKIPPED, "in cooldown"));
      }
    } catch (StorageException e) {
      return AlertAttempt.notSent(
          alertOutcome(result, StageStatus.FAILED, "alert state lookup failed: " + e.getMessage()));
    }

    boolean delivered;
    try {
      delivered = config.getAlerter().send(result);
    } catch (AlertException e) {
      LOGGER.warn(
          "Alert for {}/{} at {} failed",
          result.getMetricName(),
          result.getDetectorId(),
          result.getTimestamp(),
          e);
      return AlertAttempt.notSent(alertOutcome(result, StageStatus.FAILED, e.getMessage()));
    }
    if (!delivered) {
      return AlertAttempt.notSent(
          alertOutcome(result, StageStatus.SKIPPED, "alerter did not send"));
    }

    try {
      alertGate.recordDispatch(result, now);
    } catch (StorageException e) {
      return AlertAttempt.sent(
          alertOutcome(
              result,
              StageStatus.FAILED,
              "alert sent but dispatch time not recorded: " + e.getMessage()));
    }
    return AlertAttempt.sent(alertOutcome(result, StageStatus.SUCCEEDED, "anomaly detected"));
  }

  private static void skipDetection(
      List<StageOutcome> stages, MetricDetectors detectors, String reason) {
    for (String detectorId : detectors.getIds()) {
      stages.add(
          StageOutcome.forDetector(
              PipelineStage.DETECTION, detectorId, null, StageStatus.SKIPPED, reason));
    }
  }

  private static StageOutcome detectionFailure(
      Detector detector, Measurement point, Exception cause) {
    return StageOutcome.forDetector(
        PipelineStage.DETECTION,
        detector.getId(),
        point.getTimestamp(),
        StageStatus.FAILED,
        cause.getMessage());
  }

  private static StageOutcome alertOutcome(
      DetectionResult result, StageStatus status, String message) {
    return StageOutcome.forDetector(
        PipelineStage.ALERT, result.getDetectorId(), result.getTimestamp(), status, message);
  }

  private static void recordMetrics(CheckResult result) {
    String metricName = result.getMetricName();
    checkCounter
        .computeIfAbsent(metricName, m -> Metrics.counter(CHECK_COUNTER, METRIC_TAG, m))
        .increment();
    anomalyCounter
        .computeIfAbsent(metricName, m -> Metrics.counter(ANOMALY_COUNTER, METRIC_TAG, m))
        .increment(result.getAnomalies().size());
    alertCounter
        .computeIfAbsent(metricName, m -> Metrics.counter(ALERT_COUNTER, METRIC_TAG, m))
        .increment(result.getAlertsSent());
    for (StageOutcome failure : result.getFailures()) {
      failureCounter
          .computeIfAbsent(
              Pair.of(metricName, failure.getStage()),
              key ->
                  Metrics.counter(
                      FAILURE_COUNTER,
                      METRIC_TAG,
                      key.getLeft(),
                      "stage",
                      key.getRight().name().toLowerCase()))
          .increment();
    }
  }

  private static class DetectorRun {
    private final List<StageOutcome> outcomes = new ArrayList<>();
    private final List<DetectionResult> results = new ArrayList<>();
  }

  private static class AlertAttempt {
    private final StageOutcome outcome;
    private final boolean sent;

    private AlertAttempt(StageOutcome outcome, boolean sent) {
      this.outcome = outcome;
      this.sent = sent;
    }

    private static AlertAttempt sent(StageOutcome outcome) {
      return new AlertAttempt(outcome, true);
    }

    private static AlertAttempt notSent(StageOutcome outcome) {
      return new AlertAttempt(outcome, false);
    }
  }
}

package org.detectk.engine.backtest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.detectk.engine.check.CheckResult;
import org.detectk.engine.check.MetricCheckConfig;
import org.detectk.engine.check.MetricCheckOrchestrator;
import org.detectk.engine.loader.BatchLoader;
import org.detectk.engine.loader.LoadResult;
import org.detectk.metric.anomaly.datamodel.exception.CollectionException;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a metric check over a historical period, as if it had been scheduled at every step.
 * Alert cooldown is measured against the simulated execution times.
 */
public class BacktestRunner {
  private static final Logger LOGGER = LoggerFactory.getLogger(BacktestRunner.class);

  private final MetricCheckOrchestrator orchestrator;
  private final BatchLoader loader;

  public BacktestRunner(MetricCheckOrchestrator orchestrator, BatchLoader loader) {
    this.orchestrator = orchestrator;
    this.loader = loader;
  }

  /**
   * Backfills the history before the detection period when enabled, then runs the check at every
   * step. Backfill failures are thrown; failures of individual checks are reported in their
   * results.
   */
  public BacktestResult run(MetricCheckConfig config, BacktestSettings settings)
      throws CollectionException, StorageException {
    String metricName = config.getMetricName();
    if (settings.isBackfill()) {
      LoadResult loadResult =
          loader.load(
              metricName,
              settings.getDataLoadStart(),
              settings.getDetectionStart(),
              settings.getBatchSize(),
              config.getCollector());
      LOGGER.info(
          "Backfilled {} for backtest: {} measurements in {} batches",
          metricName,
          loadResult.getMeasurementsCollected(),
          loadResult.getBatchesLoaded());
    }

    long totalSteps = settings.getStepCount();
    long progressInterval = Math.max(1, totalSteps / 10);
    List<CheckResult> results = new ArrayList<>();
    Instant current = settings.getDetectionStart();
    while (!current.isAfter(settings.getDetectionEnd())) {
      results.add(orchestrator.execute(config, current));
      if (results.size() % progressInterval == 0) {
        LOGGER.info("Backtest of {}: {}/{} checks", metricName, results.size(), totalSteps);
      }
      current = current.plus(settings.getStep());
    }

    BacktestResult backtestResult = BacktestResult.aggregate(metricName, results);
    LOGGER.info(
        "Backtest of {} finished: {} checks, {} anomalies, {} alerts, {} checks with failures",
        metricName,
        backtestResult.getTotalChecks(),
        backtestResult.getAnomaliesDetected(),
        backtestResult.getAlertsSent(),
        backtestResult.getFailedChecks());
    return backtestResult;
  }
}

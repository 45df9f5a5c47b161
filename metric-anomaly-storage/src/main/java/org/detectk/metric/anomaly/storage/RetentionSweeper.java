package org.detectk.metric.anomaly.storage;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.detectk.metric.anomaly.datamodel.RetentionPolicy;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link RetentionPolicy} to a storage. Sweeps are best-effort: a failed purge is logged
 * and reported, and the next sweep simply tries again. When started, sweeps run on a dedicated
 * thread so they never compete with check execution.
 */
public class RetentionSweeper implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);
  private static final ConcurrentMap<DataKind, Counter> purgedRowsCounter =
      new ConcurrentHashMap<>();
  private static final String PURGED_ROWS_COUNTER = "detectk.storage.retention.purged.rows";

  private final MetricStorage storage;
  private final RetentionPolicy policy;
  private final Clock clock;
  private ScheduledExecutorService executor;

  public RetentionSweeper(MetricStorage storage, RetentionPolicy policy, Clock clock) {
    this.storage = storage;
    this.policy = policy;
    this.clock = clock;
  }

  public RetentionSweepResult sweep() {
    Instant now = clock.instant();
    Map<DataKind, Integer> purged = new EnumMap<>(DataKind.class);
    Map<DataKind, String> failures = new EnumMap<>(DataKind.class);
    purge(DataKind.MEASUREMENTS, policy.measurementsCutoff(now), purged, failures);
    purge(DataKind.DETECTIONS, policy.detectionsCutoff(now), purged, failures);
    return new RetentionSweepResult(purged, failures);
  }

  private void purge(
      DataKind kind,
      Instant cutoff,
      Map<DataKind, Integer> purged,
      Map<DataKind, String> failures) {
    try {
      int removed = storage.purgeOlderThan(cutoff, kind);
      purged.put(kind, removed);
      purgedRowsCounter
          .computeIfAbsent(
              kind, k -> Metrics.counter(PURGED_ROWS_COUNTER, "kind", k.name().toLowerCase()))
          .increment(removed);
    } catch (StorageException e) {
      LOGGER.warn("Retention sweep of {} older than {} failed", kind, cutoff, e);
      failures.put(kind, e.getMessage());
    }
  }

  public synchronized void start(Duration period) {
    if (executor != null) {
      return;
    }
    executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("retention-sweeper-%d")
                .setDaemon(true)
                .build());
    executor.scheduleAtFixedRate(
        this::runSweep, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    LOGGER.info("Retention sweeper scheduled every {} with policy {}", period, policy);
  }

  private void runSweep() {
    try {
      RetentionSweepResult result = sweep();
      LOGGER.debug("Retention sweep finished: {}", result);
    } catch (RuntimeException e) {
      LOGGER.warn("Received exception when running retention sweep.", e);
    }
  }

  @Override
  public synchronized void close() {
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
  }
}

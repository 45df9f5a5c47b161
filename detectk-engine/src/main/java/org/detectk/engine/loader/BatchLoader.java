package org.detectk.engine.loader;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.detectk.metric.anomaly.datamodel.Collector;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.exception.CollectionException;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.storage.BatchSaveSummary;
import org.detectk.metric.anomaly.storage.MetricStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk historical load of one metric in bounded batches.
 *
 * <p>Each batch is collected, saved and only then checkpointed, so a load that fails or is killed
 * resumes from the last durable batch. Batches ending at or before the stored checkpoint are
 * skipped. With an executor, batches are loaded concurrently and the checkpoint advances over the
 * contiguous prefix of completed batches only.
 */
public class BatchLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchLoader.class);

  private final MetricStorage storage;
  private final ExecutorService executor;

  public BatchLoader(MetricStorage storage) {
    this(storage, null);
  }

  public BatchLoader(MetricStorage storage, ExecutorService executor) {
    this.storage = storage;
    this.executor = executor;
  }

  public LoadResult load(
      String metricName, Instant start, Instant end, Duration batchSize, Collector collector)
      throws CollectionException, StorageException {
    List<TimeRange> batches = BatchPlanner.plan(start, end, batchSize);
    Optional<Instant> checkpoint = storage.getCheckpoint(metricName);
    List<TimeRange> pending = new ArrayList<>();
    for (TimeRange batch : batches) {
      if (checkpoint.isPresent() && !batch.getEnd().isAfter(checkpoint.get())) {
        continue;
      }
      pending.add(batch);
    }
    int skipped = batches.size() - pending.size();
    if (skipped > 0) {
      LOGGER.info(
          "Resuming load of {} from checkpoint {}, skipping {} of {} batches",
          metricName,
          checkpoint.get(),
          skipped,
          batches.size());
    }

    LoadProgress progress = new LoadProgress(checkpoint.orElse(null));
    if (executor == null) {
      for (TimeRange batch : pending) {
        progress.completed(batch, loadBatch(metricName, batch, collector));
        storage.setCheckpoint(metricName, batch.getEnd());
      }
    } else {
      loadConcurrently(metricName, pending, collector, progress);
    }

    LOGGER.info(
        "Loaded {} batches of {} in [{}, {}): {} measurements, {}",
        pending.size(),
        metricName,
        start,
        end,
        progress.measurements,
        progress.saved);
    return new LoadResult(
        metricName,
        pending.size(),
        skipped,
        progress.measurements,
        progress.saved,
        progress.checkpoint);
  }

  private void loadConcurrently(
      String metricName, List<TimeRange> pending, Collector collector, LoadProgress progress)
      throws CollectionException, StorageException {
    List<Future<BatchOutcome>> futures = new ArrayList<>();
    for (TimeRange batch : pending) {
      futures.add(executor.submit(() -> loadBatch(metricName, batch, collector)));
    }
    for (int i = 0; i < futures.size(); i++) {
      try {
        progress.completed(pending.get(i), futures.get(i).get());
        storage.setCheckpoint(metricName, pending.get(i).getEnd());
      } catch (ExecutionException e) {
        cancelRemaining(futures, i + 1);
        Throwable cause = e.getCause();
        if (cause instanceof CollectionException) {
          throw (CollectionException) cause;
        }
        if (cause instanceof StorageException) {
          throw (StorageException) cause;
        }
        throw new RuntimeException(
            String.format("Unexpected failure loading %s batch %s", metricName, pending.get(i)),
            cause);
      } catch (StorageException e) {
        cancelRemaining(futures, i + 1);
        throw e;
      } catch (InterruptedException e) {
        cancelRemaining(futures, i + 1);
        Thread.currentThread().interrupt();
        throw new StorageException(
            String.format("Interrupted while loading %s batch %s", metricName, pending.get(i)), e);
      }
    }
  }

  private BatchOutcome loadBatch(String metricName, TimeRange batch, Collector collector)
      throws CollectionException, StorageException {
    List<Measurement> measurements = collector.collect(batch.getStart(), batch.getEnd());
    BatchSaveSummary summary = storage.saveBatch(metricName, measurements);
    LOGGER.debug("Batch {} of {}: {}", batch, metricName, summary);
    return new BatchOutcome(measurements.size(), summary);
  }

  private static void cancelRemaining(List<Future<BatchOutcome>> futures, int from) {
    for (int i = from; i < futures.size(); i++) {
      futures.get(i).cancel(true);
    }
  }

  private static class BatchOutcome {
    private final int collected;
    private final BatchSaveSummary summary;

    private BatchOutcome(int collected, BatchSaveSummary summary) {
      this.collected = collected;
      this.summary = summary;
    }
  }

  private static class LoadProgress {
    private Instant checkpoint;
    private int measurements;
    private BatchSaveSummary saved = BatchSaveSummary.EMPTY;

    private LoadProgress(Instant checkpoint) {
      this.checkpoint = checkpoint;
    }

    private void completed(TimeRange batch, BatchOutcome outcome) {
      measurements += outcome.collected;
      saved = saved.plus(outcome.summary);
      checkpoint = batch.getEnd();
    }
  }
}

package org.detectk.metric.anomaly.task.manager;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.detectk.engine.check.MetricCheckOrchestrator;
import org.detectk.metric.anomaly.datamodel.RetentionPolicy;
import org.detectk.metric.anomaly.detector.config.DetectorDefaults;
import org.detectk.metric.anomaly.detector.registry.DetectorRegistry;
import org.detectk.metric.anomaly.storage.MetricStorageProvider;
import org.detectk.metric.anomaly.storage.RetentionSweeper;
import org.detectk.metric.anomaly.storage.StorageBackend;
import org.detectk.metric.anomaly.task.manager.job.JobManager;
import org.detectk.metric.anomaly.task.manager.job.MetricCheckJobManager;
import org.detectk.metric.anomaly.task.manager.plugin.AlerterRegistry;
import org.detectk.metric.anomaly.task.manager.plugin.CollectorRegistry;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SchedulerFactory;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scheduled metric checks with their storage and retention sweep. Lifecycle is {@link #init()},
 * {@link #start()}, {@link #stop()}.
 */
public class MetricCheckService {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricCheckService.class);

  private static final String STORAGE_CONFIG = "storage";
  private static final String RETENTION_CONFIG = "retention";
  private static final String RETENTION_MEASUREMENTS_DAYS = "measurementsDays";
  private static final String RETENTION_DETECTIONS_DAYS = "detectionsDays";
  private static final String RETENTION_SWEEP_INTERVAL = "sweepInterval";
  private static final String DETECTION_PARALLELISM = "detection.parallelism";
  private static final String METRICS_REPORTER = "metrics.reporter";
  private static final String METRICS_REPORTER_PROMETHEUS = "prometheus";
  private static final String METRICS_REPORTER_NONE = "none";
  private static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofHours(24);

  private final Config appConfig;
  private final CollectorRegistry collectorRegistry;
  private final AlerterRegistry alerterRegistry;

  private Scheduler scheduler;
  private JobManager jobManager;
  private StorageBackend storage;
  private PrometheusMeterRegistry meterRegistry;
  private RetentionSweeper retentionSweeper;
  private Duration sweepInterval;
  private ExecutorService detectionExecutor;

  public MetricCheckService(Config appConfig, CollectorRegistry collectorRegistry) {
    this(appConfig, collectorRegistry, AlerterRegistry.withBuiltInAlerters());
  }

  public MetricCheckService(
      Config appConfig, CollectorRegistry collectorRegistry, AlerterRegistry alerterRegistry) {
    this.appConfig = appConfig;
    this.collectorRegistry = collectorRegistry;
    this.alerterRegistry = alerterRegistry;
  }

  public void init() {
    try {
      initMetrics();
      storage =
          MetricStorageProvider.getProvider(
              appConfig.hasPath(STORAGE_CONFIG)
                  ? appConfig.getConfig(STORAGE_CONFIG)
                  : ConfigFactory.parseMap(Map.of()));
      initRetention();

      int parallelism =
          appConfig.hasPath(DETECTION_PARALLELISM) ? appConfig.getInt(DETECTION_PARALLELISM) : 1;
      if (parallelism > 1) {
        detectionExecutor =
            Executors.newFixedThreadPool(
                parallelism,
                new ThreadFactoryBuilder()
                    .setNameFormat("detector-evaluation-%d")
                    .setDaemon(true)
                    .build());
      }
      MetricCheckOrchestrator orchestrator =
          new MetricCheckOrchestrator(
              storage,
              storage,
              DetectorRegistry.withBuiltInDetectors(DetectorDefaults.V1),
              detectionExecutor);

      SchedulerFactory schedulerFactory = new StdSchedulerFactory();
      scheduler = schedulerFactory.getScheduler();
      jobManager = new MetricCheckJobManager(orchestrator, collectorRegistry, alerterRegistry);
      jobManager.initJob(appConfig);
      LOGGER.info("Prepared {} metric check jobs", jobManager.getJobKeys().size());
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public void start() {
    try {
      jobManager.startJob(scheduler);
      scheduler.start();
      retentionSweeper.start(sweepInterval);
      LOGGER.info("Metric check service started");
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public void stop() {
    try {
      jobManager.stopJob(scheduler);
      scheduler.shutdown();
      retentionSweeper.close();
      if (detectionExecutor != null) {
        detectionExecutor.shutdown();
      }
      storage.close();
      if (meterRegistry != null) {
        Metrics.removeRegistry(meterRegistry);
        meterRegistry.close();
      }
      LOGGER.info("Metric check service stopped");
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  /** Current meter values in the Prometheus text format, empty when reporting is disabled. */
  public String scrapeMetrics() {
    return meterRegistry == null ? "" : meterRegistry.scrape();
  }

  @VisibleForTesting
  StorageBackend getStorage() {
    return storage;
  }

  @VisibleForTesting
  Scheduler getScheduler() {
    return scheduler;
  }

  private void initMetrics() {
    String reporter =
        appConfig.hasPath(METRICS_REPORTER)
            ? appConfig.getString(METRICS_REPORTER)
            : METRICS_REPORTER_PROMETHEUS;
    switch (reporter) {
      case METRICS_REPORTER_PROMETHEUS:
        meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(meterRegistry);
        new JvmThreadMetrics().bindTo(meterRegistry);
        Metrics.addRegistry(meterRegistry);
        break;
      case METRICS_REPORTER_NONE:
        break;
      default:
        throw new RuntimeException(String.format("Invalid metrics reporter:%s", reporter));
    }
  }

  private void initRetention() {
    Config retentionConfig =
        appConfig.hasPath(RETENTION_CONFIG)
            ? appConfig.getConfig(RETENTION_CONFIG)
            : ConfigFactory.parseMap(Map.of());
    RetentionPolicy policy =
        new RetentionPolicy(
            retentionConfig.hasPath(RETENTION_MEASUREMENTS_DAYS)
                ? retentionConfig.getInt(RETENTION_MEASUREMENTS_DAYS)
                : RetentionPolicy.DEFAULT_RETENTION_DAYS,
            retentionConfig.hasPath(RETENTION_DETECTIONS_DAYS)
                ? retentionConfig.getInt(RETENTION_DETECTIONS_DAYS)
                : RetentionPolicy.DEFAULT_RETENTION_DAYS);
    sweepInterval =
        retentionConfig.hasPath(RETENTION_SWEEP_INTERVAL)
            ? retentionConfig.getDuration(RETENTION_SWEEP_INTERVAL)
            : DEFAULT_SWEEP_INTERVAL;
    retentionSweeper = new RetentionSweeper(storage, policy, Clock.systemUTC());
  }

  public static void main(String[] args) {
    MetricCheckService service =
        new MetricCheckService(ConfigFactory.load(), new CollectorRegistry());
    service.init();
    Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "metric-check-shutdown"));
    service.start();
  }
}

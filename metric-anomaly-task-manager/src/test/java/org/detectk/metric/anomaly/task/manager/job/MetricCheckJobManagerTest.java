package org.detectk.metric.anomaly.task.manager.job;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import org.detectk.engine.check.MetricCheckOrchestrator;
import org.detectk.metric.anomaly.datamodel.Collector;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;
import org.detectk.metric.anomaly.task.manager.plugin.AlerterRegistry;
import org.detectk.metric.anomaly.task.manager.plugin.CollectorRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.CronTrigger;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.Trigger;

class MetricCheckJobManagerTest {

  private static final String TWO_CHECKS =
      "job.config.cronExpression = \"0 */5 * * * ?\"\n"
          + "metricChecks = [\n"
          + "  {\n"
          + "    metricName = sessions\n"
          + "    collector { type = fixed }\n"
          + "    alerter { type = webhook, params { url = \"http://localhost:8065/hooks/x\" } }\n"
          + "    detectors = [{ kind = mad }]\n"
          + "  },\n"
          + "  {\n"
          + "    metricName = errors\n"
          + "    cronExpression = \"0 0 * * * ?\"\n"
          + "    collector { type = fixed }\n"
          + "    detectors = [{ kind = threshold, params { operator = gt, value = 5 } }]\n"
          + "  }\n"
          + "]\n";

  private MetricCheckJobManager jobManager;

  @BeforeEach
  void setUp() {
    CollectorRegistry collectorRegistry =
        new CollectorRegistry().register("fixed", params -> mock(Collector.class));
    jobManager =
        new MetricCheckJobManager(
            mock(MetricCheckOrchestrator.class),
            collectorRegistry,
            AlerterRegistry.withBuiltInAlerters());
  }

  @Test
  void testSchedulesOneJobPerCheck() throws Exception {
    jobManager.initJob(ConfigFactory.parseString(TWO_CHECKS));
    Scheduler scheduler = mock(Scheduler.class);

    jobManager.startJob(scheduler);

    Assertions.assertEquals(
        List.of(
            JobKey.jobKey("sessions", MetricCheckJobConstants.JOB_GROUP),
            JobKey.jobKey("errors", MetricCheckJobConstants.JOB_GROUP)),
        jobManager.getJobKeys());
    verify(scheduler, times(2)).scheduleJob(any(JobDetail.class), any(Trigger.class));
    verify(scheduler)
        .scheduleJob(
            argThat(detail -> detail.getKey().getName().equals("sessions")),
            argThat(
                trigger ->
                    ((CronTrigger) trigger).getCronExpression().equals("0 */5 * * * ?")));
    verify(scheduler)
        .scheduleJob(
            argThat(detail -> detail.getKey().getName().equals("errors")),
            argThat(
                trigger -> ((CronTrigger) trigger).getCronExpression().equals("0 0 * * * ?")));
  }

  @Test
  void testDefaultCronExpression() throws Exception {
    jobManager.initJob(
        ConfigFactory.parseString(
            "metricChecks = [{ metricName = a, collector { type = fixed }, "
                + "detectors = [{ kind = zscore }] }]"));
    Scheduler scheduler = mock(Scheduler.class);

    jobManager.startJob(scheduler);

    verify(scheduler)
        .scheduleJob(
            any(JobDetail.class),
            argThat(
                trigger ->
                    ((CronTrigger) trigger)
                        .getCronExpression()
                        .equals(MetricCheckJobConstants.CRON_EXPRESSION)));
  }

  @Test
  void testStopRemovesScheduledJobs() throws Exception {
    jobManager.initJob(ConfigFactory.parseString(TWO_CHECKS));
    Scheduler scheduler = mock(Scheduler.class);
    when(scheduler.checkExists(any(JobKey.class))).thenReturn(true);

    jobManager.stopJob(scheduler);

    verify(scheduler).deleteJob(JobKey.jobKey("sessions", MetricCheckJobConstants.JOB_GROUP));
    verify(scheduler).deleteJob(JobKey.jobKey("errors", MetricCheckJobConstants.JOB_GROUP));
  }

  @Test
  void testInvalidChecksAreRejected() {
    Config duplicate =
        ConfigFactory.parseString(
            "metricChecks = [\n"
                + "  { metricName = a, collector { type = fixed },\n"
                + "    detectors = [{ kind = mad }] },\n"
                + "  { metricName = a, collector { type = fixed },\n"
                + "    detectors = [{ kind = zscore }] }\n"
                + "]");
    Assertions.assertThrows(ConfigurationException.class, () -> jobManager.initJob(duplicate));

    Config unknownCollector =
        ConfigFactory.parseString(
            "metricChecks = [{ metricName = a, collector { type = kafka }, "
                + "detectors = [{ kind = mad }] }]");
    Assertions.assertThrows(
        ConfigurationException.class, () -> jobManager.initJob(unknownCollector));

    Config missingCollector =
        ConfigFactory.parseString(
            "metricChecks = [{ metricName = a, detectors = [{ kind = mad }] }]");
    Assertions.assertThrows(
        ConfigurationException.class, () -> jobManager.initJob(missingCollector));
  }
}

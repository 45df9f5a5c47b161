package org.detectk.metric.anomaly.task.manager.job;

import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_DATA_MAP_CHECK_CONFIG;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_DATA_MAP_ORCHESTRATOR;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import org.detectk.engine.check.MetricCheckConfig;
import org.detectk.engine.check.MetricCheckOrchestrator;
import org.detectk.metric.anomaly.datamodel.Collector;
import org.detectk.metric.anomaly.detector.config.DetectorSpec;
import org.detectk.metric.anomaly.detector.config.ZScoreParams;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;

class MetricCheckJobTest {

  private static final Instant FIRE_TIME = Instant.parse("2024-06-01T10:20:00Z");

  @Test
  void testRunsCheckAtScheduledFireTime() {
    MetricCheckOrchestrator orchestrator = mock(MetricCheckOrchestrator.class);
    MetricCheckConfig checkConfig = checkConfig();
    JobExecutionContext context = context(orchestrator, checkConfig);

    new MetricCheckJob().execute(context);

    verify(orchestrator).execute(checkConfig, FIRE_TIME);
  }

  @Test
  void testCheckFailureDoesNotEscapeJob() {
    MetricCheckOrchestrator orchestrator = mock(MetricCheckOrchestrator.class);
    when(orchestrator.execute(any(), any())).thenThrow(new IllegalStateException("boom"));
    JobExecutionContext context = context(orchestrator, checkConfig());

    Assertions.assertDoesNotThrow(() -> new MetricCheckJob().execute(context));
  }

  private static JobExecutionContext context(
      MetricCheckOrchestrator orchestrator, MetricCheckConfig checkConfig) {
    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_ORCHESTRATOR, orchestrator);
    jobDataMap.put(JOB_DATA_MAP_CHECK_CONFIG, checkConfig);
    JobDetail jobDetail =
        JobBuilder.newJob(MetricCheckJob.class)
            .withIdentity("sessions", MetricCheckJobConstants.JOB_GROUP)
            .usingJobData(jobDataMap)
            .build();
    JobExecutionContext context = mock(JobExecutionContext.class);
    when(context.getJobDetail()).thenReturn(jobDetail);
    when(context.getScheduledFireTime()).thenReturn(Date.from(FIRE_TIME));
    return context;
  }

  private static MetricCheckConfig checkConfig() {
    return MetricCheckConfig.builder()
        .metricName("sessions")
        .collector(mock(Collector.class))
        .detectors(List.of(DetectorSpec.of(ZScoreParams.defaults())))
        .build();
  }
}

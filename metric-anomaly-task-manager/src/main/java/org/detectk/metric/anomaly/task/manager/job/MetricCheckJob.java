package org.detectk.metric.anomaly.task.manager.job;

import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_DATA_MAP_CHECK_CONFIG;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_DATA_MAP_ORCHESTRATOR;

import java.time.Instant;
import org.detectk.engine.check.CheckResult;
import org.detectk.engine.check.MetricCheckConfig;
import org.detectk.engine.check.MetricCheckOrchestrator;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one metric check per firing. The check's execution time is the trigger's scheduled fire
 * time, so a late firing still collects the period it was scheduled for.
 */
@DisallowConcurrentExecution
public class MetricCheckJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricCheckJob.class);

  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Starting metric check job: {}", jobDetail.getKey());

    JobDataMap jobDataMap = jobDetail.getJobDataMap();
    MetricCheckOrchestrator orchestrator =
        (MetricCheckOrchestrator) jobDataMap.get(JOB_DATA_MAP_ORCHESTRATOR);
    MetricCheckConfig checkConfig = (MetricCheckConfig) jobDataMap.get(JOB_DATA_MAP_CHECK_CONFIG);

    Instant executionTime =
        jobExecutionContext.getScheduledFireTime() != null
            ? jobExecutionContext.getScheduledFireTime().toInstant()
            : Instant.now();
    try {
      CheckResult result = orchestrator.execute(checkConfig, executionTime);
      LOGGER.debug(
          "Metric check job {} finished, successful: {}",
          jobDetail.getKey(),
          result.isSuccessful());
    } catch (RuntimeException e) {
      LOGGER.error("Metric check job {} failed at {}", jobDetail.getKey(), executionTime, e);
    }
  }
}

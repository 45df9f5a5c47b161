package org.detectk.metric.anomaly.task.manager.job;

import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.CHECK_ALERTER;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.CHECK_COLLECTOR;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.CHECK_CRON_EXPRESSION;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.CRON_EXPRESSION;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_CONFIG;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_CONFIG_CRON_EXPRESSION;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_DATA_MAP_CHECK_CONFIG;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_DATA_MAP_ORCHESTRATOR;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_GROUP;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.JOB_TRIGGER_SUFFIX;
import static org.detectk.metric.anomaly.task.manager.job.MetricCheckJobConstants.METRIC_CHECKS;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.detectk.engine.check.MetricCheckConfig;
import org.detectk.engine.check.MetricCheckOrchestrator;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;
import org.detectk.metric.anomaly.task.manager.plugin.AlerterRegistry;
import org.detectk.metric.anomaly.task.manager.plugin.CollectorRegistry;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Schedules one cron job per configured metric check. */
public class MetricCheckJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricCheckJobManager.class);

  private final MetricCheckOrchestrator orchestrator;
  private final CollectorRegistry collectorRegistry;
  private final AlerterRegistry alerterRegistry;
  private final List<ScheduledCheck> scheduledChecks = new ArrayList<>();

  public MetricCheckJobManager(
      MetricCheckOrchestrator orchestrator,
      CollectorRegistry collectorRegistry,
      AlerterRegistry alerterRegistry) {
    this.orchestrator = orchestrator;
    this.collectorRegistry = collectorRegistry;
    this.alerterRegistry = alerterRegistry;
  }

  public void initJob(Config appConfig) {
    Config jobConfig =
        appConfig.hasPath(JOB_CONFIG)
            ? appConfig.getConfig(JOB_CONFIG)
            : ConfigFactory.parseMap(Map.of());
    String defaultCronExpression =
        jobConfig.hasPath(JOB_CONFIG_CRON_EXPRESSION)
            ? jobConfig.getString(JOB_CONFIG_CRON_EXPRESSION)
            : CRON_EXPRESSION;

    List<? extends Config> checkConfigs =
        appConfig.hasPath(METRIC_CHECKS) ? appConfig.getConfigList(METRIC_CHECKS) : List.of();
    Set<String> metricNames = new HashSet<>();
    scheduledChecks.clear();
    for (Config checkConfig : checkConfigs) {
      MetricCheckConfig metricCheckConfig = toMetricCheckConfig(checkConfig);
      if (!metricNames.add(metricCheckConfig.getMetricName())) {
        throw new ConfigurationException(
            "Duplicate metric check for " + metricCheckConfig.getMetricName());
      }
      String cronExpression =
          checkConfig.hasPath(CHECK_CRON_EXPRESSION)
              ? checkConfig.getString(CHECK_CRON_EXPRESSION)
              : defaultCronExpression;
      scheduledChecks.add(schedule(metricCheckConfig, cronExpression));
    }
    LOGGER.info("Initialized {} metric check jobs", scheduledChecks.size());
  }

  public void startJob(Scheduler scheduler) throws SchedulerException {
    for (ScheduledCheck check : scheduledChecks) {
      LOGGER.info("Schedule a job:{} with Trigger:{}", check.jobDetail.getKey(), check.trigger);
      scheduler.scheduleJob(check.jobDetail, check.trigger);
    }
  }

  public void stopJob(Scheduler scheduler) throws SchedulerException {
    for (ScheduledCheck check : scheduledChecks) {
      if (scheduler.checkExists(check.jobDetail.getKey())) {
        scheduler.deleteJob(check.jobDetail.getKey());
      }
    }
  }

  public List<JobKey> getJobKeys() {
    List<JobKey> jobKeys = new ArrayList<>();
    scheduledChecks.forEach(check -> jobKeys.add(check.jobDetail.getKey()));
    return jobKeys;
  }

  private MetricCheckConfig toMetricCheckConfig(Config checkConfig) {
    if (!checkConfig.hasPath(CHECK_COLLECTOR)) {
      throw new ConfigurationException("Metric check requires a " + CHECK_COLLECTOR);
    }
    MetricCheckConfig.MetricCheckConfigBuilder builder =
        MetricCheckConfig.fromConfig(checkConfig)
            .collector(collectorRegistry.create(checkConfig.getConfig(CHECK_COLLECTOR)));
    if (checkConfig.hasPath(CHECK_ALERTER)) {
      builder.alerter(alerterRegistry.create(checkConfig.getConfig(CHECK_ALERTER)));
    }
    return builder.build();
  }

  private ScheduledCheck schedule(MetricCheckConfig checkConfig, String cronExpression) {
    JobKey jobKey = JobKey.jobKey(checkConfig.getMetricName(), JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_ORCHESTRATOR, orchestrator);
    jobDataMap.put(JOB_DATA_MAP_CHECK_CONFIG, checkConfig);

    JobDetail jobDetail =
        JobBuilder.newJob(MetricCheckJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();
    Trigger trigger =
        TriggerBuilder.newTrigger()
            .withIdentity(checkConfig.getMetricName() + JOB_TRIGGER_SUFFIX, JOB_GROUP)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .build();
    return new ScheduledCheck(jobDetail, trigger);
  }

  private static class ScheduledCheck {
    private final JobDetail jobDetail;
    private final Trigger trigger;

    private ScheduledCheck(JobDetail jobDetail, Trigger trigger) {
      this.jobDetail = jobDetail;
      this.trigger = trigger;
    }
  }
}

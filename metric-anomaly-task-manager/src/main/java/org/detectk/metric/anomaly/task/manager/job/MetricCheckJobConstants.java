package org.detectk.metric.anomaly.task.manager.job;

public class MetricCheckJobConstants {
  public static final String JOB_DATA_MAP_ORCHESTRATOR = "orchestrator";
  public static final String JOB_DATA_MAP_CHECK_CONFIG = "checkConfig";

  public static final String JOB_GROUP = "metric-checks";
  public static final String JOB_TRIGGER_SUFFIX = "-trigger";
  public static final String CRON_EXPRESSION = "0 */10 * * * ?";

  public static final String JOB_CONFIG = "job.config";
  public static final String JOB_CONFIG_CRON_EXPRESSION = "cronExpression";

  public static final String METRIC_CHECKS = "metricChecks";
  public static final String CHECK_COLLECTOR = "collector";
  public static final String CHECK_ALERTER = "alerter";
  public static final String CHECK_CRON_EXPRESSION = "cronExpression";
}

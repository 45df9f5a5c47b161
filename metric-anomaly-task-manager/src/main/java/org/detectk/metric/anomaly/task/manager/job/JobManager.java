package org.detectk.metric.anomaly.task.manager.job;

import com.typesafe.config.Config;
import java.util.List;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;

/** Builds scheduled jobs from application config and manages their lifecycle on a scheduler. */
public interface JobManager {
  /** Parses the config into job and trigger definitions; nothing is scheduled yet. */
  void initJob(Config config);

  void startJob(Scheduler scheduler) throws SchedulerException;

  void stopJob(Scheduler scheduler) throws SchedulerException;

  /** Keys of the jobs prepared by the last {@link #initJob(Config)} call. */
  List<JobKey> getJobKeys();
}

package org.costwatch.alert.engine.job;

import static org.costwatch.alert.engine.job.EngineJobConstants.ANOMALY_DETECTION_CRON_EXPRESSION;
import static org.costwatch.alert.engine.job.EngineJobConstants.ANOMALY_DETECTION_JOB;
import static org.costwatch.alert.engine.job.EngineJobConstants.DEFAULT_JOB_SUFFIX;
import static org.costwatch.alert.engine.job.EngineJobConstants.FORECAST_CHECK_CRON_EXPRESSION;
import static org.costwatch.alert.engine.job.EngineJobConstants.FORECAST_CHECK_JOB;
import static org.costwatch.alert.engine.job.EngineJobConstants.JOB_CONFIG;
import static org.costwatch.alert.engine.job.EngineJobConstants.JOB_CONFIG_CRON_EXPRESSION;
import static org.costwatch.alert.engine.job.EngineJobConstants.JOB_DATA_MAP_ENGINE;
import static org.costwatch.alert.engine.job.EngineJobConstants.JOB_GROUP;
import static org.costwatch.alert.engine.job.EngineJobConstants.JOB_SUFFIX;
import static org.costwatch.alert.engine.job.EngineJobConstants.JOB_TRIGGER_SUFFIX;
import static org.costwatch.alert.engine.job.EngineJobConstants.RULE_EVALUATION_CRON_EXPRESSION;
import static org.costwatch.alert.engine.job.EngineJobConstants.RULE_EVALUATION_JOB;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.apache.commons.lang3.tuple.Pair;
import org.costwatch.alert.engine.CostAlertEngine;
import org.quartz.CronScheduleBuilder;
import org.quartz.Job;
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

/**
 * Schedules the rule evaluation, forecast check and anomaly detection passes of one engine, each
 * on its own cron expression under {@code job.config.<job>.cronExpression}.
 */
public class RuleEvaluationJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuleEvaluationJobManager.class);

  private final CostAlertEngine engine;
  private final List<Pair<JobDetail, Trigger>> jobs = new ArrayList<>();

  public RuleEvaluationJobManager(CostAlertEngine engine) {
    this.engine = engine;
  }

  @Override
  public void initJob(Config appConfig) {
    Config jobConfig =
        appConfig.hasPath(JOB_CONFIG)
            ? appConfig.getConfig(JOB_CONFIG)
            : ConfigFactory.parseMap(Map.of());
    String jobSuffix =
        jobConfig.hasPath(JOB_SUFFIX) ? jobConfig.getString(JOB_SUFFIX) : DEFAULT_JOB_SUFFIX;
    String jobGroup = new StringJoiner(".").add(JOB_GROUP).add(jobSuffix).toString();

    jobs.clear();
    jobs.add(
        buildJob(
            RuleEvaluationJob.class,
            RULE_EVALUATION_JOB,
            jobGroup,
            cronExpression(jobConfig, RULE_EVALUATION_JOB, RULE_EVALUATION_CRON_EXPRESSION)));
    jobs.add(
        buildJob(
            ForecastCheckJob.class,
            FORECAST_CHECK_JOB,
            jobGroup,
            cronExpression(jobConfig, FORECAST_CHECK_JOB, FORECAST_CHECK_CRON_EXPRESSION)));
    jobs.add(
        buildJob(
            AnomalyDetectionJob.class,
            ANOMALY_DETECTION_JOB,
            jobGroup,
            cronExpression(jobConfig, ANOMALY_DETECTION_JOB, ANOMALY_DETECTION_CRON_EXPRESSION)));
  }

  @Override
  public void startJob(Scheduler scheduler) throws SchedulerException {
    for (Pair<JobDetail, Trigger> job : jobs) {
      LOGGER.info("Schedule a job:{} with Trigger:{}", job.getLeft().getKey(), job.getRight());
      scheduler.scheduleJob(job.getLeft(), job.getRight());
    }
  }

  @Override
  public void stopJob(Scheduler scheduler) throws SchedulerException {
    for (Pair<JobDetail, Trigger> job : jobs) {
      JobKey jobKey = job.getLeft().getKey();
      if (scheduler.checkExists(jobKey)) {
        scheduler.deleteJob(jobKey);
      }
    }
  }

  List<JobKey> getJobKeys() {
    List<JobKey> keys = new ArrayList<>();
    jobs.forEach(job -> keys.add(job.getLeft().getKey()));
    return keys;
  }

  private Pair<JobDetail, Trigger> buildJob(
      Class<? extends Job> jobClass, String jobName, String jobGroup, String cronExpression) {
    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_ENGINE, engine);

    JobDetail jobDetail =
        JobBuilder.newJob(jobClass)
            .withIdentity(JobKey.jobKey(jobName, jobGroup))
            .usingJobData(jobDataMap)
            .build();
    Trigger trigger =
        TriggerBuilder.newTrigger()
            .withIdentity(jobName + JOB_TRIGGER_SUFFIX, jobGroup)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .build();
    return Pair.of(jobDetail, trigger);
  }

  private static String cronExpression(Config jobConfig, String jobName, String defaultCron) {
    String path = jobName + "." + JOB_CONFIG_CRON_EXPRESSION;
    return jobConfig.hasPath(path) ? jobConfig.getString(path) : defaultCron;
  }
}

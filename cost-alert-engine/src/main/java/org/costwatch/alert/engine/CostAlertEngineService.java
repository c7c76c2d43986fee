package org.costwatch.alert.engine;

import com.typesafe.config.Config;
import java.io.IOException;
import java.util.Properties;
import java.util.UUID;
import org.costwatch.alert.engine.datamodel.rule.source.RuleSourceProvider;
import org.costwatch.alert.engine.job.EngineJobConstants;
import org.costwatch.alert.engine.job.JobManager;
import org.costwatch.alert.engine.job.RuleEvaluationJobManager;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an engine as a service: {@link #init()} builds it and seeds the rule store, {@link
 * #start()} resumes pending notifications and schedules the periodic passes, {@link #stop()} tears
 * everything down.
 */
public class CostAlertEngineService {
  private static final Logger LOGGER = LoggerFactory.getLogger(CostAlertEngineService.class);
  static final int SCHEDULER_THREADS = 3;
  static final String SKIP_UPDATE_CHECK_PROPERTY = "org.quartz.scheduler.skipUpdateCheck";
  static final String THREAD_COUNT_PROPERTY = "org.quartz.threadPool.threadCount";

  private final Config appConfig;
  private final CostAlertEngine.Builder engineBuilder;
  private CostAlertEngine engine;
  private JobManager jobManager;
  private Scheduler scheduler;

  /**
   * @param engineBuilder carries the collaborators; the application config is applied by this
   *     service
   */
  public CostAlertEngineService(Config appConfig, CostAlertEngine.Builder engineBuilder) {
    this.appConfig = appConfig;
    this.engineBuilder = engineBuilder;
  }

  public void init() {
    engine = engineBuilder.appConfig(appConfig).build();
    if (appConfig.hasPath(EngineJobConstants.ALERT_RULE_SOURCE)) {
      try {
        engine.seedRules(
            RuleSourceProvider.getProvider(
                appConfig.getConfig(EngineJobConstants.ALERT_RULE_SOURCE)));
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load the alert rule source", e);
      }
    } else {
      LOGGER.info("No alert rule source configured, starting with an empty rule store");
    }
    jobManager = new RuleEvaluationJobManager(engine);
    jobManager.initJob(appConfig);
  }

  public void start() throws SchedulerException {
    engine.resumePendingNotifications();
    scheduler = new StdSchedulerFactory(schedulerProperties()).getScheduler();
    jobManager.startJob(scheduler);
    scheduler.start();
    LOGGER.info("Cost alert engine started");
  }

  public void stop() {
    try {
      if (scheduler != null) {
        jobManager.stopJob(scheduler);
        scheduler.shutdown();
      }
    } catch (SchedulerException e) {
      LOGGER.error("Failed to stop the scheduler", e);
    } finally {
      if (engine != null) {
        engine.close();
      }
    }
    LOGGER.info("Cost alert engine stopped");
  }

  public CostAlertEngine getEngine() {
    return engine;
  }

  Scheduler getScheduler() {
    return scheduler;
  }

  static Properties schedulerProperties() {
    Properties properties = new Properties();
    properties.setProperty(
        StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, "cost-alert-engine-" + UUID.randomUUID());
    properties.setProperty(SKIP_UPDATE_CHECK_PROPERTY, "true");
    properties.setProperty(
        StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
    properties.setProperty(THREAD_COUNT_PROPERTY, String.valueOf(SCHEDULER_THREADS));
    properties.setProperty(
        StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
    return properties;
  }
}

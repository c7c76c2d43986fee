package org.costwatch.alert.engine.job;

import java.time.Duration;
import java.time.Instant;
import org.costwatch.alert.engine.CostAlertEngine;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Base for the scheduled passes. Overlapping fires of the same job are skipped by Quartz. */
@DisallowConcurrentExecution
public abstract class EngineJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(EngineJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) throws JobExecutionException {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Starting job: {}", jobDetail.getKey());

    JobDataMap jobDataMap = jobDetail.getJobDataMap();
    CostAlertEngine engine =
        (CostAlertEngine) jobDataMap.get(EngineJobConstants.JOB_DATA_MAP_ENGINE);
    if (engine == null) {
      throw new JobExecutionException("No engine in the job data of " + jobDetail.getKey());
    }

    Instant startTime = Instant.now();
    try {
      run(engine);
    } catch (RuntimeException e) {
      LOGGER.error("Job {} failed", jobDetail.getKey(), e);
      throw new JobExecutionException(e);
    }
    LOGGER.debug(
        "Finished job {} in {}", jobDetail.getKey(), Duration.between(startTime, Instant.now()));
  }

  protected abstract void run(CostAlertEngine engine);
}

package org.costwatch.alert.engine.job;

import org.costwatch.alert.engine.CostAlertEngine;
import org.quartz.DisallowConcurrentExecution;

@DisallowConcurrentExecution
public class AnomalyDetectionJob extends EngineJob {
  @Override
  protected void run(CostAlertEngine engine) {
    engine.runAnomalyDetection();
  }
}

package org.costwatch.alert.engine.job;

import org.costwatch.alert.engine.CostAlertEngine;
import org.quartz.DisallowConcurrentExecution;

/** Threshold, budget and anomaly rules. */
@DisallowConcurrentExecution
public class RuleEvaluationJob extends EngineJob {
  @Override
  protected void run(CostAlertEngine engine) {
    engine.runRuleEvaluation();
  }
}

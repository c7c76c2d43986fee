package org.costwatch.alert.engine.job;

public class EngineJobConstants {
  public static final String JOB_DATA_MAP_ENGINE = "costAlertEngine";
  public static final String ALERT_RULE_SOURCE = "alertRuleSource";

  public static final String JOB_GROUP = "alerting";
  public static final String JOB_CONFIG = "job.config";
  public static final String JOB_SUFFIX = "jobSuffix";
  public static final String DEFAULT_JOB_SUFFIX = "cost";
  public static final String JOB_CONFIG_CRON_EXPRESSION = "cronExpression";

  public static final String RULE_EVALUATION_JOB = "ruleEvaluation";
  public static final String RULE_EVALUATION_CRON_EXPRESSION = "0 * * * * ?";
  public static final String FORECAST_CHECK_JOB = "forecastCheck";
  public static final String FORECAST_CHECK_CRON_EXPRESSION = "0 */15 * * * ?";
  public static final String ANOMALY_DETECTION_JOB = "anomalyDetection";
  public static final String ANOMALY_DETECTION_CRON_EXPRESSION = "0 5 * * * ?";

  public static final String JOB_TRIGGER_SUFFIX = "-trigger";

  private EngineJobConstants() {}
}

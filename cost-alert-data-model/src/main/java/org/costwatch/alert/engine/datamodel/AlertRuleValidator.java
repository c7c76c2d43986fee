package org.costwatch.alert.engine.datamodel;

import com.google.common.base.Strings;

public class AlertRuleValidator {

  private AlertRuleValidator() {}

  /** Throws {@link InvalidAlertRuleException} describing the first violated constraint. */
  public static void validate(AlertRule rule) {
    require(!Strings.isNullOrEmpty(rule.getId()), "rule id is required");
    require(!Strings.isNullOrEmpty(rule.getOrganizationId()), "organization id is required");
    require(rule.getKind() != null, "alert kind is required");
    require(
        rule.getCooldown() != null && !rule.getCooldown().isNegative(), "cooldown must be >= 0");

    RuleCondition condition = rule.getCondition();
    require(condition != null, "condition is required");
    require(!Strings.isNullOrEmpty(condition.getMetricName()), "metric name is required");
    require(condition.getOperator() != null, "comparator is required");
    require(condition.getPeriod() != null, "aggregation period is required");
    require(Double.isFinite(condition.getThreshold()), "threshold must be a finite number");
    if (condition.isCostMetric()) {
      require(condition.getThreshold() >= 0, "threshold must be >= 0 for cost metrics");
    } else {
      require(
          condition.getThreshold() >= 0 && condition.getThreshold() <= 1,
          "anomaly score threshold must be within [0, 1]");
    }
    if (rule.getKind() == AlertKind.ANOMALY) {
      require(
          !condition.isCostMetric(),
          "anomaly rules must compare " + RuleCondition.ANOMALY_SCORE_METRIC);
    }
    if (condition.getForecastHorizonDays() != null) {
      require(condition.getForecastHorizonDays() >= 1, "forecast horizon must be >= 1 day");
    }

    require(rule.getNotificationTargets() != null, "notification targets are required");
    for (NotificationTarget target : rule.getNotificationTargets()) {
      require(
          target.getChannel() != null && !Strings.isNullOrEmpty(target.getRecipient()),
          "notification target needs a channel and a recipient: " + target);
    }
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new InvalidAlertRuleException(message);
    }
  }
}

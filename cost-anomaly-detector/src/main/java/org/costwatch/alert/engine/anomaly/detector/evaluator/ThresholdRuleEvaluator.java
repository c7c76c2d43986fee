package org.costwatch.alert.engine.anomaly.detector.evaluator;

import static org.costwatch.alert.engine.anomaly.detector.evaluator.EvaluatorUtil.displayName;
import static org.costwatch.alert.engine.anomaly.detector.evaluator.EvaluatorUtil.formatCost;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.ComparisonOperator;
import org.costwatch.alert.engine.datamodel.RuleCondition;
import org.costwatch.alert.engine.datamodel.Severity;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Compares an aggregated cost against a fixed threshold or budget amount. */
public class ThresholdRuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(ThresholdRuleEvaluator.class);
  private final MetricCache metricCache;

  public ThresholdRuleEvaluator(MetricCache metricCache) {
    this.metricCache = metricCache;
  }

  EvaluationResult evaluateRule(AlertRule rule) throws MetricUnavailableException {
    RuleCondition condition = rule.getCondition();
    double value =
        metricCache.getAggregatedCost(
            rule.getOrganizationId(),
            condition.getMetricName(),
            condition.getDimensions(),
            condition.getPeriod());
    boolean violation =
        EvaluatorUtil.compare(condition.getOperator(), value, condition.getThreshold());

    LOGGER.debug(
        "Rule {} {}: {} {} {}",
        rule.getId(),
        violation ? "violated" : "normal",
        value,
        condition.getOperator().getSymbol(),
        condition.getThreshold());

    Severity severity =
        rule.getSeverity() != null
            ? rule.getSeverity()
            : EvaluatorUtil.severityForExcess(
                condition.getOperator(), value, condition.getThreshold());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("metric", condition.getMetricName());
    payload.put("value", value);
    payload.put("threshold", condition.getThreshold());
    payload.put("comparator", condition.getOperator().getSymbol());
    payload.put("period", condition.getPeriod().name());
    payload.put("dimensions", condition.getDimensions());

    return EvaluationResult.builder()
        .isViolation(violation)
        .observedValue(value)
        .threshold(condition.getThreshold())
        .operator(condition.getOperator())
        .severity(severity)
        .title(rule.getName())
        .description(describe(rule, value))
        .payload(payload)
        .build();
  }

  private static String describe(AlertRule rule, double value) {
    RuleCondition condition = rule.getCondition();
    String metric = displayName(condition.getMetricName());
    if (rule.getKind() == AlertKind.BUDGET_EXCEEDED) {
      double usedPercentage =
          condition.getThreshold() > 0 ? value / condition.getThreshold() * 100 : 100;
      return String.format(
          Locale.ROOT,
          "%s has reached %.1f%% of the budget. Current spend: %s, Budget: %s",
          metric, usedPercentage, formatCost(value), formatCost(condition.getThreshold()));
    }
    return String.format(
        Locale.ROOT,
        "%s %s the threshold. Current value: %s, Threshold: %s",
        metric,
        verb(condition.getOperator()),
        formatCost(value),
        formatCost(condition.getThreshold()));
  }

  private static String verb(ComparisonOperator operator) {
    switch (operator) {
      case GT:
      case GTE:
        return "has exceeded";
      case LT:
      case LTE:
        return "has dropped below";
      case EQ:
        return "is equal to";
      case NE:
        return "differs from";
      default:
        throw new UnsupportedOperationException("Unsupported comparator: " + operator);
    }
  }
}

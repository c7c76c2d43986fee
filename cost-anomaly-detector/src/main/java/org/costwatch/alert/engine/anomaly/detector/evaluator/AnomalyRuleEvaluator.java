package org.costwatch.alert.engine.anomaly.detector.evaluator;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.CostAnomaly;
import org.costwatch.alert.engine.datamodel.RuleCondition;
import org.costwatch.alert.engine.datamodel.store.CostAnomalyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Escalates the latest unresolved cost anomaly of the rule's dimensions when its score satisfies
 * the rule condition. Anomalies older than {@link #MAX_ANOMALY_AGE_DAYS} are ignored.
 */
public class AnomalyRuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyRuleEvaluator.class);
  static final int MAX_ANOMALY_AGE_DAYS = 2;

  private final CostAnomalyStore costAnomalyStore;
  private final Clock clock;

  public AnomalyRuleEvaluator(CostAnomalyStore costAnomalyStore, Clock clock) {
    this.costAnomalyStore = costAnomalyStore;
    this.clock = clock;
  }

  EvaluationResult evaluateRule(AlertRule rule) {
    RuleCondition condition = rule.getCondition();
    LocalDate oldest = LocalDate.now(clock).minusDays(MAX_ANOMALY_AGE_DAYS);
    Optional<CostAnomaly> latest =
        costAnomalyStore
            .findLatestUnresolved(rule.getOrganizationId(), condition.getDimensions())
            .filter(anomaly -> !anomaly.getAnomalyDate().isBefore(oldest));

    if (latest.isEmpty()) {
      LOGGER.debug("No recent unresolved anomaly for rule {}", rule.getId());
      return EvaluationResult.builder()
          .isViolation(false)
          .threshold(condition.getThreshold())
          .operator(condition.getOperator())
          .build();
    }

    CostAnomaly anomaly = latest.get();
    boolean violation =
        EvaluatorUtil.compare(
            condition.getOperator(), anomaly.getAnomalyScore(), condition.getThreshold());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("anomalyId", anomaly.getId());
    payload.put("anomalyDate", anomaly.getAnomalyDate().toString());
    payload.put("expectedCost", anomaly.getExpectedCost());
    payload.put("actualCost", anomaly.getActualCost());
    payload.put("deviationPercentage", anomaly.getDeviationPercentage());
    payload.put("anomalyScore", anomaly.getAnomalyScore());
    payload.put("dimensions", anomaly.getDimensions());

    return EvaluationResult.builder()
        .isViolation(violation)
        .observedValue(anomaly.getAnomalyScore())
        .threshold(condition.getThreshold())
        .operator(condition.getOperator())
        .severity(rule.getSeverity() != null ? rule.getSeverity() : anomaly.getSeverity())
        .title(rule.getName())
        .description(anomaly.getDescription())
        .anomalyId(anomaly.getId())
        .payload(payload)
        .build();
  }
}

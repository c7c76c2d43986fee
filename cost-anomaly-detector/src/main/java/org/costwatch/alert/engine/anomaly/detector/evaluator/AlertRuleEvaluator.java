package org.costwatch.alert.engine.anomaly.detector.evaluator;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.commons.lang3.tuple.Pair;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Routes a rule to the evaluator for its kind. */
public class AlertRuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertRuleEvaluator.class);
  private static final String RULE_TIMER = "costwatch.alert.engine.rule.evaluation.time";

  private final ThresholdRuleEvaluator thresholdRuleEvaluator;
  private final AnomalyRuleEvaluator anomalyRuleEvaluator;
  private final ForecastBreachChecker forecastBreachChecker;
  private final MeterRegistry meterRegistry;
  // key <organizationId, kind>
  private final ConcurrentMap<Pair<String, AlertKind>, Timer> ruleTimer =
      new ConcurrentHashMap<>();

  public AlertRuleEvaluator(
      ThresholdRuleEvaluator thresholdRuleEvaluator,
      AnomalyRuleEvaluator anomalyRuleEvaluator,
      ForecastBreachChecker forecastBreachChecker,
      MeterRegistry meterRegistry) {
    this.thresholdRuleEvaluator = thresholdRuleEvaluator;
    this.anomalyRuleEvaluator = anomalyRuleEvaluator;
    this.forecastBreachChecker = forecastBreachChecker;
    this.meterRegistry = meterRegistry;
  }

  public EvaluationResult evaluate(AlertRule rule) throws MetricUnavailableException {
    Pair<String, AlertKind> key = Pair.of(rule.getOrganizationId(), rule.getKind());
    Instant startTime = Instant.now();
    try {
      return evaluateByKind(rule);
    } finally {
      ruleTimer
          .computeIfAbsent(
              key,
              k ->
                  Timer.builder(RULE_TIMER)
                      .tag("organizationId", k.getLeft())
                      .tag("kind", k.getRight().name())
                      .register(meterRegistry))
          .record(Duration.between(startTime, Instant.now()));
    }
  }

  private EvaluationResult evaluateByKind(AlertRule rule) throws MetricUnavailableException {
    LOGGER.debug("Evaluating {} rule {}", rule.getKind(), rule.getId());
    switch (rule.getKind()) {
      case THRESHOLD:
      case BUDGET_EXCEEDED:
        return thresholdRuleEvaluator.evaluateRule(rule);
      case ANOMALY:
        return anomalyRuleEvaluator.evaluateRule(rule);
      case FORECAST_BREACH:
        return forecastBreachChecker.check(rule);
      default:
        throw new UnsupportedOperationException("Unsupported alert kind: " + rule.getKind());
    }
  }
}

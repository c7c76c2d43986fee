package org.costwatch.alert.engine.anomaly.detector.evaluator;

import static org.costwatch.alert.engine.anomaly.detector.evaluator.EvaluatorUtil.formatCost;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.RuleCondition;
import org.costwatch.alert.engine.datamodel.Severity;
import org.costwatch.alert.engine.datamodel.metric.CostForecast;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks for the first day within the rule's horizon whose forecast upper bound breaches the
 * threshold. Earlier breaches rank higher, uncertain forecasts rank lower.
 */
public class ForecastBreachChecker {
  private static final Logger LOGGER = LoggerFactory.getLogger(ForecastBreachChecker.class);

  private final MetricRequestHandler metricRequestHandler;
  private final Clock clock;
  private final int defaultHorizonDays;

  public ForecastBreachChecker(
      MetricRequestHandler metricRequestHandler, Clock clock, int defaultHorizonDays) {
    this.metricRequestHandler = metricRequestHandler;
    this.clock = clock;
    this.defaultHorizonDays = defaultHorizonDays;
  }

  public EvaluationResult check(AlertRule rule) throws MetricUnavailableException {
    RuleCondition condition = rule.getCondition();
    int horizonDays =
        condition.getForecastHorizonDays() != null
            ? condition.getForecastHorizonDays()
            : defaultHorizonDays;
    LocalDate today = LocalDate.now(clock);

    boolean anyForecast = false;
    for (int day = 1; day <= horizonDays; day++) {
      LocalDate date = today.plusDays(day);
      Optional<CostForecast> forecast =
          metricRequestHandler.getForecast(
              rule.getOrganizationId(), condition.getDimensions(), date);
      if (forecast.isEmpty()) {
        continue;
      }
      anyForecast = true;
      if (EvaluatorUtil.compare(
          condition.getOperator(), forecast.get().getUpperBound(), condition.getThreshold())) {
        return breach(rule, forecast.get(), ChronoUnit.DAYS.between(today, date));
      }
    }

    if (!anyForecast) {
      throw new MetricUnavailableException(
          String.format(
              Locale.ROOT,
              "No forecast within %d days for %s %s",
              horizonDays, rule.getOrganizationId(), condition.getDimensions()));
    }
    LOGGER.debug("No forecast breach within {} days for rule {}", horizonDays, rule.getId());
    return EvaluationResult.builder()
        .isViolation(false)
        .threshold(condition.getThreshold())
        .operator(condition.getOperator())
        .build();
  }

  /**
   * Bands by days until the breach (3/7/14), then lowered one band below 0.8 confidence and two
   * bands below 0.5.
   */
  public static Severity breachSeverity(long daysUntilBreach, double confidenceScore) {
    Severity severity;
    if (daysUntilBreach <= 3) {
      severity = Severity.CRITICAL;
    } else if (daysUntilBreach <= 7) {
      severity = Severity.HIGH;
    } else if (daysUntilBreach <= 14) {
      severity = Severity.MEDIUM;
    } else {
      severity = Severity.LOW;
    }
    if (confidenceScore >= 0.8) {
      return severity;
    } else if (confidenceScore >= 0.5) {
      return severity.lowerBy(1);
    }
    return severity.lowerBy(2);
  }

  private EvaluationResult breach(AlertRule rule, CostForecast forecast, long daysUntilBreach) {
    RuleCondition condition = rule.getCondition();
    Severity severity =
        rule.getSeverity() != null
            ? rule.getSeverity()
            : breachSeverity(daysUntilBreach, forecast.getConfidenceScore());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("forecastDate", forecast.getForecastDate().toString());
    payload.put("daysUntilBreach", daysUntilBreach);
    payload.put("predictedCost", forecast.getPredictedCost());
    payload.put("lowerBound", forecast.getLowerBound());
    payload.put("upperBound", forecast.getUpperBound());
    payload.put("confidenceScore", forecast.getConfidenceScore());
    payload.put("threshold", condition.getThreshold());
    payload.put("dimensions", condition.getDimensions());

    LOGGER.debug(
        "Rule {} forecast breach on {} ({} days), upper bound {}",
        rule.getId(),
        forecast.getForecastDate(),
        daysUntilBreach,
        forecast.getUpperBound());

    return EvaluationResult.builder()
        .isViolation(true)
        .observedValue(forecast.getUpperBound())
        .threshold(condition.getThreshold())
        .operator(condition.getOperator())
        .severity(severity)
        .title(rule.getName())
        .description(
            String.format(
                Locale.ROOT,
                "Forecast cost may breach %s on %s (in %d days). Predicted: %s, upper bound: %s,"
                    + " confidence: %.0f%%",
                formatCost(condition.getThreshold()),
                forecast.getForecastDate(),
                daysUntilBreach,
                formatCost(forecast.getPredictedCost()),
                formatCost(forecast.getUpperBound()),
                forecast.getConfidenceScore() * 100))
        .payload(payload)
        .build();
  }
}

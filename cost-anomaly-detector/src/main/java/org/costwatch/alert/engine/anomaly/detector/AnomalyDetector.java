package org.costwatch.alert.engine.anomaly.detector;

import com.google.common.math.Stats;
import com.google.common.primitives.Doubles;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.datamodel.CostAnomaly;
import org.costwatch.alert.engine.datamodel.Severity;
import org.costwatch.alert.engine.datamodel.metric.DailyCost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores the cost of a target day against its trailing history.
 *
 * <p>The expected cost is the mean of the lookback window, which never includes the target day.
 * The score grows with the deviation measured in standard deviations and saturates at 1. An empty
 * result means the series could not be evaluated; it is not an error.
 */
public class AnomalyDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyDetector.class);

  private final AnomalyDetectorConfig config;
  private final Clock clock;

  public AnomalyDetector(AnomalyDetectorConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  public AnomalyDetectorConfig getConfig() {
    return config;
  }

  public Optional<CostAnomaly> detect(
      String organizationId,
      Map<String, String> dimensions,
      List<DailyCost> series,
      LocalDate targetDate) {
    return assess(series, targetDate, OptionalDouble.empty())
        .map(
            assessment ->
                CostAnomaly.builder()
                    .id(UUID.randomUUID().toString())
                    .organizationId(organizationId)
                    .dimensions(dimensions)
                    .anomalyDate(targetDate)
                    .expectedCost(assessment.getExpectedCost())
                    .actualCost(assessment.getActualCost())
                    .deviationPercentage(assessment.getDeviationPercentage())
                    .anomalyScore(assessment.getAnomalyScore())
                    .severity(assessment.getSeverity())
                    .description(describe(dimensions, targetDate, assessment))
                    .createdAt(clock.instant())
                    .build());
  }

  /**
   * @param baseline replaces the trailing mean as expected cost when present, e.g. a forecast
   */
  public Optional<AnomalyAssessment> assess(
      List<DailyCost> series, LocalDate targetDate, OptionalDouble baseline) {
    LocalDate windowStart = targetDate.minusDays(config.getLookbackDays());
    List<DailyCost> history =
        series.stream()
            .filter(point -> !point.getDate().isBefore(windowStart))
            .filter(point -> point.getDate().isBefore(targetDate))
            .collect(Collectors.toList());
    Optional<DailyCost> current =
        series.stream().filter(point -> point.getDate().equals(targetDate)).findFirst();

    if (current.isEmpty()) {
      LOGGER.debug("No cost recorded for {}, not evaluable", targetDate);
      return Optional.empty();
    }
    if (history.size() < config.getMinDataPoints()) {
      LOGGER.debug(
          "Only {} history points before {}, need {}",
          history.size(),
          targetDate,
          config.getMinDataPoints());
      return Optional.empty();
    }
    if (current.get().getCost() < 0 || history.stream().anyMatch(point -> point.getCost() < 0)) {
      LOGGER.warn("Negative cost in window ending {}, not evaluable", targetDate);
      return Optional.empty();
    }

    Stats stats = Stats.of(history.stream().mapToDouble(DailyCost::getCost).toArray());
    double expected = baseline.orElse(stats.mean());
    double actual = current.get().getCost();
    double floor = Math.max(expected, config.getExpectedFloor());
    double deviationPercentage = deviationPercentage(actual, expected, config.getExpectedFloor());
    double stddevPercentage =
        Math.max(
            stats.sampleStandardDeviation() / floor * 100, config.getMinStddevPercentage());
    double score = anomalyScore(deviationPercentage, stddevPercentage, config.getScoreScale());

    return Optional.of(
        AnomalyAssessment.builder()
            .expectedCost(expected)
            .actualCost(actual)
            .deviationPercentage(deviationPercentage)
            .stddevPercentage(stddevPercentage)
            .anomalyScore(score)
            .severity(severityForScore(score))
            .historyPoints(history.size())
            .build());
  }

  public static double deviationPercentage(double actual, double expected, double expectedFloor) {
    return (actual - expected) / Math.max(expected, expectedFloor) * 100;
  }

  public static double anomalyScore(
      double deviationPercentage, double stddevPercentage, double scoreScale) {
    if (deviationPercentage == 0) {
      return 0;
    }
    return Doubles.constrainToRange(
        Math.abs(deviationPercentage) / (scoreScale * stddevPercentage), 0, 1);
  }

  public static Severity severityForScore(double score) {
    if (score < 0.3) {
      return Severity.LOW;
    } else if (score < 0.6) {
      return Severity.MEDIUM;
    } else if (score < 0.85) {
      return Severity.HIGH;
    }
    return Severity.CRITICAL;
  }

  private static String describe(
      Map<String, String> dimensions, LocalDate date, AnomalyAssessment assessment) {
    StringJoiner scope = new StringJoiner(", ");
    new TreeMap<>(dimensions).forEach((key, value) -> scope.add(key + "=" + value));
    return String.format(
        Locale.ROOT,
        "Cost for %s on %s was $%.2f, %.1f%% %s the expected $%.2f",
        scope.length() == 0 ? "all resources" : scope.toString(),
        date,
        assessment.getActualCost(),
        Math.abs(assessment.getDeviationPercentage()),
        assessment.getDeviationPercentage() >= 0 ? "above" : "below",
        assessment.getExpectedCost());
  }
}

package org.costwatch.alert.engine.anomaly.detector;

import com.typesafe.config.ConfigFactory;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.costwatch.alert.engine.datamodel.CostAnomaly;
import org.costwatch.alert.engine.datamodel.Severity;
import org.costwatch.alert.engine.datamodel.metric.DailyCost;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AnomalyDetectorTest {
  private static final LocalDate TARGET = LocalDate.parse("2024-03-15");

  private final AnomalyDetector anomalyDetector =
      new AnomalyDetector(
          AnomalyDetectorConfig.from(ConfigFactory.parseMap(Map.of())),
          new TestClock(Instant.parse("2024-03-16T01:00:00Z")));

  @Test
  void testDeviationSign() {
    AnomalyAssessment above =
        anomalyDetector.assess(series(150), TARGET, OptionalDouble.empty()).orElseThrow();
    Assertions.assertEquals(100, above.getExpectedCost(), 1e-9);
    Assertions.assertEquals(50, above.getDeviationPercentage(), 1e-9);

    AnomalyAssessment below =
        anomalyDetector.assess(series(50), TARGET, OptionalDouble.empty()).orElseThrow();
    Assertions.assertEquals(-50, below.getDeviationPercentage(), 1e-9);
  }

  @Test
  void testScoreIsZeroWhenActualEqualsExpected() {
    AnomalyAssessment assessment =
        anomalyDetector.assess(series(100), TARGET, OptionalDouble.empty()).orElseThrow();
    Assertions.assertEquals(0, assessment.getAnomalyScore());
    Assertions.assertEquals(Severity.LOW, assessment.getSeverity());
  }

  @Test
  void testScoreStaysWithinBoundsAndGrowsWithDeviation() {
    double previous = -1;
    for (double actual : new double[] {100, 102, 105, 110, 120, 500, 10_000}) {
      double score =
          anomalyDetector
              .assess(series(actual), TARGET, OptionalDouble.empty())
              .orElseThrow()
              .getAnomalyScore();
      Assertions.assertTrue(score >= 0 && score <= 1, "score " + score);
      Assertions.assertTrue(score >= previous, actual + " scored below a smaller deviation");
      previous = score;
    }
    Assertions.assertEquals(1, previous);
  }

  @Test
  void testFlatHistoryStaysFinite() {
    List<DailyCost> flat = new ArrayList<>();
    for (int day = 14; day >= 1; day--) {
      flat.add(DailyCost.of(TARGET.minusDays(day), 100));
    }
    flat.add(DailyCost.of(TARGET, 101));

    AnomalyAssessment assessment =
        anomalyDetector.assess(flat, TARGET, OptionalDouble.empty()).orElseThrow();
    Assertions.assertEquals(1.0, assessment.getStddevPercentage());
    Assertions.assertEquals(1.0 / 3, assessment.getAnomalyScore(), 1e-9);
  }

  @Test
  void testBaselineReplacesTrailingMean() {
    AnomalyAssessment assessment =
        anomalyDetector.assess(series(150), TARGET, OptionalDouble.of(120)).orElseThrow();
    Assertions.assertEquals(120, assessment.getExpectedCost());
    Assertions.assertEquals(25, assessment.getDeviationPercentage(), 1e-9);
  }

  @Test
  void testNotEvaluable() {
    // fewer than seven history points
    List<DailyCost> shortSeries = series(150).subList(9, 15);
    Assertions.assertTrue(
        anomalyDetector.assess(shortSeries, TARGET, OptionalDouble.empty()).isEmpty());

    // target day missing
    Assertions.assertTrue(
        anomalyDetector.assess(series(150).subList(0, 14), TARGET, OptionalDouble.empty())
            .isEmpty());

    // negative cost in the window
    List<DailyCost> negative = new ArrayList<>(series(150));
    negative.set(3, DailyCost.of(negative.get(3).getDate(), -5));
    Assertions.assertTrue(
        anomalyDetector.assess(negative, TARGET, OptionalDouble.empty()).isEmpty());
  }

  @Test
  void testTargetDayIsExcludedFromExpectedCost() {
    List<DailyCost> withFuture = new ArrayList<>(series(1000));
    withFuture.add(DailyCost.of(TARGET.plusDays(1), 5000));
    AnomalyAssessment assessment =
        anomalyDetector.assess(withFuture, TARGET, OptionalDouble.empty()).orElseThrow();
    Assertions.assertEquals(100, assessment.getExpectedCost(), 1e-9);
    Assertions.assertEquals(14, assessment.getHistoryPoints());
  }

  @Test
  void testDetectBuildsAnomaly() {
    Optional<CostAnomaly> anomaly =
        anomalyDetector.detect("org-1", Map.of("service", "ec2"), series(150), TARGET);

    Assertions.assertTrue(anomaly.isPresent());
    Assertions.assertEquals("org-1", anomaly.get().getOrganizationId());
    Assertions.assertEquals(TARGET, anomaly.get().getAnomalyDate());
    Assertions.assertEquals(Severity.CRITICAL, anomaly.get().getSeverity());
    Assertions.assertEquals(
        "Cost for service=ec2 on 2024-03-15 was $150.00, 50.0% above the expected $100.00",
        anomaly.get().getDescription());
    Assertions.assertEquals(Instant.parse("2024-03-16T01:00:00Z"), anomaly.get().getCreatedAt());
  }

  @Test
  void testSeverityBands() {
    Assertions.assertEquals(Severity.LOW, AnomalyDetector.severityForScore(0.29));
    Assertions.assertEquals(Severity.MEDIUM, AnomalyDetector.severityForScore(0.3));
    Assertions.assertEquals(Severity.HIGH, AnomalyDetector.severityForScore(0.6));
    Assertions.assertEquals(Severity.HIGH, AnomalyDetector.severityForScore(0.84));
    Assertions.assertEquals(Severity.CRITICAL, AnomalyDetector.severityForScore(0.85));
  }

  @Test
  void testLookbackIsClamped() {
    AnomalyDetectorConfig config =
        AnomalyDetectorConfig.from(
            ConfigFactory.parseMap(Map.of("lookback.days", 90, "sensitivity", "high")));
    Assertions.assertEquals(30, config.getLookbackDays());
    Assertions.assertEquals(2.0, config.getScoreScale());
  }

  // fourteen days alternating 95 and 105 before the target, then the target day
  private static List<DailyCost> series(double actual) {
    List<DailyCost> series = new ArrayList<>();
    for (int day = 14; day >= 1; day--) {
      series.add(DailyCost.of(TARGET.minusDays(day), day % 2 == 0 ? 95 : 105));
    }
    series.add(DailyCost.of(TARGET, actual));
    return series;
  }
}

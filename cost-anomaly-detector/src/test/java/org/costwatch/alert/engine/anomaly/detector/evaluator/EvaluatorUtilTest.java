package org.costwatch.alert.engine.anomaly.detector.evaluator;

import org.costwatch.alert.engine.datamodel.ComparisonOperator;
import org.costwatch.alert.engine.datamodel.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class EvaluatorUtilTest {

  @Test
  void testComparatorsUseEpsilon() {
    Assertions.assertTrue(EvaluatorUtil.compare(ComparisonOperator.GT, 100.5, 100));
    Assertions.assertFalse(EvaluatorUtil.compare(ComparisonOperator.GT, 100 + 1e-8, 100));
    Assertions.assertTrue(EvaluatorUtil.compare(ComparisonOperator.GTE, 100 - 1e-8, 100));
    Assertions.assertFalse(EvaluatorUtil.compare(ComparisonOperator.GTE, 99.9, 100));
    Assertions.assertTrue(EvaluatorUtil.compare(ComparisonOperator.LT, 99.9, 100));
    Assertions.assertFalse(EvaluatorUtil.compare(ComparisonOperator.LT, 100 - 1e-8, 100));
    Assertions.assertTrue(EvaluatorUtil.compare(ComparisonOperator.LTE, 100 + 1e-8, 100));
    Assertions.assertTrue(EvaluatorUtil.compare(ComparisonOperator.EQ, 0.1 + 0.2, 0.3));
    Assertions.assertFalse(EvaluatorUtil.compare(ComparisonOperator.NE, 0.1 + 0.2, 0.3));
    Assertions.assertTrue(EvaluatorUtil.compare(ComparisonOperator.NE, 0.31, 0.3));
  }

  @Test
  void testSeverityForExcess() {
    Assertions.assertEquals(
        Severity.LOW, EvaluatorUtil.severityForExcess(ComparisonOperator.GT, 110, 100));
    Assertions.assertEquals(
        Severity.MEDIUM, EvaluatorUtil.severityForExcess(ComparisonOperator.GT, 120, 100));
    Assertions.assertEquals(
        Severity.HIGH, EvaluatorUtil.severityForExcess(ComparisonOperator.GTE, 150, 100));
    Assertions.assertEquals(
        Severity.CRITICAL, EvaluatorUtil.severityForExcess(ComparisonOperator.GT, 200, 100));
    Assertions.assertEquals(
        Severity.MEDIUM, EvaluatorUtil.severityForExcess(ComparisonOperator.LT, 10, 100));
  }

  @Test
  void testDisplayNameAndCost() {
    Assertions.assertEquals("Daily Cost", EvaluatorUtil.displayName("daily_cost"));
    Assertions.assertEquals("Monthly Spend", EvaluatorUtil.displayName("monthly.spend"));
    Assertions.assertEquals("$1,234.50", EvaluatorUtil.formatCost(1234.5));
  }
}

package org.costwatch.alert.engine.anomaly.detector.evaluator;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.datamodel.ComparisonOperator;
import org.costwatch.alert.engine.datamodel.Severity;

public class EvaluatorUtil {
  public static final double EPSILON = 1e-6;

  private EvaluatorUtil() {}

  public static boolean compare(ComparisonOperator operator, double lhs, double rhs) {
    switch (operator) {
      case GT:
        return lhs > rhs && !approximatelyEqual(lhs, rhs);
      case GTE:
        return lhs > rhs || approximatelyEqual(lhs, rhs);
      case LT:
        return lhs < rhs && !approximatelyEqual(lhs, rhs);
      case LTE:
        return lhs < rhs || approximatelyEqual(lhs, rhs);
      case EQ:
        return approximatelyEqual(lhs, rhs);
      case NE:
        return !approximatelyEqual(lhs, rhs);
      default:
        throw new UnsupportedOperationException("Unsupported comparator: " + operator);
    }
  }

  static boolean approximatelyEqual(double lhs, double rhs) {
    return Math.abs(lhs - rhs) <= EPSILON;
  }

  /**
   * Severity for rules that do not configure one: how far an upper threshold was exceeded. Other
   * comparators have no meaningful ratio and get {@link Severity#MEDIUM}.
   */
  public static Severity severityForExcess(
      ComparisonOperator operator, double value, double threshold) {
    if (operator != ComparisonOperator.GT && operator != ComparisonOperator.GTE) {
      return Severity.MEDIUM;
    }
    if (threshold <= 0) {
      return value > 0 ? Severity.CRITICAL : Severity.LOW;
    }
    double ratio = value / threshold;
    if (ratio >= 2.0) {
      return Severity.CRITICAL;
    } else if (ratio >= 1.5) {
      return Severity.HIGH;
    } else if (ratio >= 1.2) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  /** {@code daily_cost} becomes {@code Daily Cost}. */
  static String displayName(String metricName) {
    return Arrays.stream(metricName.split("[_.]"))
        .filter(part -> !part.isEmpty())
        .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1))
        .collect(Collectors.joining(" "));
  }

  static String formatCost(double value) {
    return String.format(Locale.ROOT, "$%,.2f", value);
  }
}

package org.costwatch.alert.engine.datamodel;

import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class RuleCondition {
  public static final String ANOMALY_SCORE_METRIC = "anomaly_score";

  private final String metricName;
  private final ComparisonOperator operator;
  private final double threshold;
  @Builder.Default private final AggregationPeriod period = AggregationPeriod.DAILY;
  @Builder.Default private final Map<String, String> dimensions = Map.of();
  // forecast rules only, null means the configured default horizon
  private final Integer forecastHorizonDays;

  public boolean isCostMetric() {
    return !ANOMALY_SCORE_METRIC.equals(metricName);
  }
}

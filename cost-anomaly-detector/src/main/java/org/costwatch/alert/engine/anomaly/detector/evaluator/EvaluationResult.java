package org.costwatch.alert.engine.anomaly.detector.evaluator;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.costwatch.alert.engine.datamodel.ComparisonOperator;
import org.costwatch.alert.engine.datamodel.Severity;

@SuperBuilder
@Getter
@ToString
public class EvaluationResult {
  private final boolean isViolation;
  private final double observedValue;
  private final double threshold;
  private final ComparisonOperator operator;
  private final Severity severity;
  private final String title;
  private final String description;
  // set when the result was driven by a detected cost anomaly
  private final String anomalyId;
  @Builder.Default private final Map<String, Object> payload = Map.of();
}

package org.costwatch.alert.engine.anomaly.detector;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.costwatch.alert.engine.datamodel.Severity;

@SuperBuilder
@Getter
@ToString
public class AnomalyAssessment {
  private final double expectedCost;
  private final double actualCost;
  private final double deviationPercentage;
  private final double stddevPercentage;
  private final double anomalyScore;
  private final Severity severity;
  private final int historyPoints;
}

package org.costwatch.alert.engine.datamodel.metric;

import java.time.LocalDate;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class CostForecast {
  private final LocalDate forecastDate;
  private final double predictedCost;
  private final double lowerBound;
  private final double upperBound;
  // within [0, 1]
  private final double confidenceScore;
}

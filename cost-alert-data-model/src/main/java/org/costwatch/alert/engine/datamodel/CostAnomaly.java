package org.costwatch.alert.engine.datamodel;

import java.time.Instant;
import java.time.LocalDate;
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
public class CostAnomaly {
  private final String id;
  private final String organizationId;
  @Builder.Default private final Map<String, String> dimensions = Map.of();
  private final LocalDate anomalyDate;
  private final double expectedCost;
  private final double actualCost;
  private final double deviationPercentage;
  // always within [0, 1]
  private final double anomalyScore;
  private final Severity severity;
  private final String description;
  private final boolean resolved;
  private final Instant createdAt;
}

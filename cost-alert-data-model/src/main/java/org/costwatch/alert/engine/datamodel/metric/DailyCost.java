package org.costwatch.alert.engine.datamodel.metric;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class DailyCost {
  private final LocalDate date;
  private final double cost;
}

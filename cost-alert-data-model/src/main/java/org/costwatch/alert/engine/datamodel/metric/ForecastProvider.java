package org.costwatch.alert.engine.datamodel.metric;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

public interface ForecastProvider {

  /** Empty when no forecast exists for {@code date}. */
  Optional<CostForecast> getForecast(
      String organizationId, Map<String, String> dimensions, LocalDate date)
      throws MetricUnavailableException;
}

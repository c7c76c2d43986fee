package org.costwatch.alert.engine.datamodel.metric;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.costwatch.alert.engine.datamodel.AggregationPeriod;

/** Supplies aggregated cost figures per organization and dimension. */
public interface MetricAggregator {

  double getAggregatedCost(
      String organizationId,
      String metricName,
      Map<String, String> dimensions,
      AggregationPeriod period)
      throws MetricUnavailableException;

  /** Daily totals for {@code [from, to]}, both ends inclusive. Missing days are simply absent. */
  List<DailyCost> getDailyCosts(
      String organizationId, Map<String, String> dimensions, LocalDate from, LocalDate to)
      throws MetricUnavailableException;
}

package org.costwatch.alert.engine.anomaly.detector.evaluator;

import com.typesafe.config.Config;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.costwatch.alert.engine.datamodel.AggregationPeriod;
import org.costwatch.alert.engine.datamodel.metric.CostForecast;
import org.costwatch.alert.engine.datamodel.metric.DailyCost;
import org.costwatch.alert.engine.datamodel.metric.ForecastProvider;
import org.costwatch.alert.engine.datamodel.metric.MetricAggregator;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Calls the upstream metric and forecast collaborators with a bounded wait. */
public class MetricRequestHandler {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricRequestHandler.class);
  static final String REQUEST_TIMEOUT_CONFIG = "request.timeout";
  static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final MetricAggregator metricAggregator;
  private final ForecastProvider forecastProvider;
  private final ExecutorService executorService;
  private final Duration requestTimeout;

  public MetricRequestHandler(
      Config evaluatorConfig,
      MetricAggregator metricAggregator,
      ForecastProvider forecastProvider,
      ExecutorService executorService) {
    this.metricAggregator = metricAggregator;
    this.forecastProvider = forecastProvider;
    this.executorService = executorService;
    this.requestTimeout =
        evaluatorConfig.hasPath(REQUEST_TIMEOUT_CONFIG)
            ? evaluatorConfig.getDuration(REQUEST_TIMEOUT_CONFIG)
            : DEFAULT_REQUEST_TIMEOUT;
  }

  public double getAggregatedCost(
      String organizationId,
      String metricName,
      Map<String, String> dimensions,
      AggregationPeriod period)
      throws MetricUnavailableException {
    return executeWithTimeout(
        () -> metricAggregator.getAggregatedCost(organizationId, metricName, dimensions, period),
        String.format("%s %s for %s %s", period, metricName, organizationId, dimensions));
  }

  public List<DailyCost> getDailyCosts(
      String organizationId, Map<String, String> dimensions, LocalDate from, LocalDate to)
      throws MetricUnavailableException {
    return executeWithTimeout(
        () -> metricAggregator.getDailyCosts(organizationId, dimensions, from, to),
        String.format("daily costs %s..%s for %s %s", from, to, organizationId, dimensions));
  }

  public Optional<CostForecast> getForecast(
      String organizationId, Map<String, String> dimensions, LocalDate date)
      throws MetricUnavailableException {
    return executeWithTimeout(
        () -> forecastProvider.getForecast(organizationId, dimensions, date),
        String.format("forecast %s for %s %s", date, organizationId, dimensions));
  }

  private <T> T executeWithTimeout(Callable<T> request, String description)
      throws MetricUnavailableException {
    Future<T> future = executorService.submit(request);
    try {
      return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOGGER.warn("Timed out after {} fetching {}", requestTimeout, description);
      throw new MetricUnavailableException("Timed out fetching " + description, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof MetricUnavailableException) {
        throw (MetricUnavailableException) e.getCause();
      }
      throw new MetricUnavailableException("Failed fetching " + description, e.getCause());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new MetricUnavailableException("Interrupted fetching " + description, e);
    }
  }
}

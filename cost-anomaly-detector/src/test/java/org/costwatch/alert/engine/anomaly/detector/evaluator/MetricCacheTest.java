package org.costwatch.alert.engine.anomaly.detector.evaluator;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.costwatch.alert.engine.anomaly.detector.TestClock;
import org.costwatch.alert.engine.datamodel.AggregationPeriod;
import org.costwatch.alert.engine.datamodel.metric.ForecastProvider;
import org.costwatch.alert.engine.datamodel.metric.MetricAggregator;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricCacheTest {
  private static final Map<String, String> EC2 = Map.of("service", "ec2");

  private ExecutorService executorService;
  private MetricAggregator metricAggregator;
  private TestClock clock;

  @BeforeEach
  void setUp() {
    executorService = Executors.newFixedThreadPool(2);
    metricAggregator = mock(MetricAggregator.class);
    clock = new TestClock(Instant.parse("2024-03-01T10:00:00Z"));
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  @Test
  void testMetricCache() throws Exception {
    when(metricAggregator.getAggregatedCost(
            eq("org-1"), eq("daily_cost"), anyMap(), eq(AggregationPeriod.DAILY)))
        .thenReturn(120.0);
    MetricCache metricCache = metricCache(ConfigFactory.parseMap(Map.of()));

    Assertions.assertEquals(
        120.0,
        metricCache.getAggregatedCost("org-1", "daily_cost", EC2, AggregationPeriod.DAILY));
    Assertions.assertEquals(
        120.0,
        metricCache.getAggregatedCost("org-1", "daily_cost", EC2, AggregationPeriod.DAILY));
    verify(metricAggregator, times(1))
        .getAggregatedCost("org-1", "daily_cost", EC2, AggregationPeriod.DAILY);
    Assertions.assertEquals(1, metricCache.size());

    // a different period is a different entry
    metricCache.getAggregatedCost("org-1", "daily_cost", EC2, AggregationPeriod.WEEKLY);
    Assertions.assertEquals(2, metricCache.size());
  }

  @Test
  void testEntriesExpireWithClock() throws Exception {
    when(metricAggregator.getAggregatedCost(
            eq("org-1"), eq("daily_cost"), anyMap(), eq(AggregationPeriod.DAILY)))
        .thenReturn(120.0, 130.0);
    MetricCache metricCache = metricCache(ConfigFactory.parseMap(Map.of()));

    metricCache.getAggregatedCost("org-1", "daily_cost", EC2, AggregationPeriod.DAILY);
    clock.advance(Duration.ofSeconds(31));

    Assertions.assertEquals(
        130.0,
        metricCache.getAggregatedCost("org-1", "daily_cost", EC2, AggregationPeriod.DAILY));
    verify(metricAggregator, times(2))
        .getAggregatedCost("org-1", "daily_cost", EC2, AggregationPeriod.DAILY);
  }

  @Test
  void testSlowAggregatorIsUnavailable() throws Exception {
    when(metricAggregator.getAggregatedCost(
            eq("org-1"), eq("daily_cost"), anyMap(), eq(AggregationPeriod.DAILY)))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return 120.0;
            });
    MetricCache metricCache =
        metricCache(ConfigFactory.parseMap(Map.of("request.timeout", "100ms")));

    Assertions.assertThrows(
        MetricUnavailableException.class,
        () -> metricCache.getAggregatedCost("org-1", "daily_cost", EC2, AggregationPeriod.DAILY));
    Assertions.assertEquals(0, metricCache.size());
  }

  @Test
  void testAggregatorFailureIsPropagated() throws Exception {
    when(metricAggregator.getAggregatedCost(
            eq("org-1"), eq("daily_cost"), anyMap(), eq(AggregationPeriod.DAILY)))
        .thenThrow(new MetricUnavailableException("billing export lagging"));
    MetricCache metricCache = metricCache(ConfigFactory.parseMap(Map.of()));

    MetricUnavailableException exception =
        Assertions.assertThrows(
            MetricUnavailableException.class,
            () ->
                metricCache.getAggregatedCost(
                    "org-1", "daily_cost", EC2, AggregationPeriod.DAILY));
    Assertions.assertEquals("billing export lagging", exception.getMessage());
  }

  private MetricCache metricCache(Config evaluatorConfig) {
    MetricRequestHandler metricRequestHandler =
        new MetricRequestHandler(
            evaluatorConfig, metricAggregator, mock(ForecastProvider.class), executorService);
    return new MetricCache(evaluatorConfig, metricRequestHandler, clock);
  }
}

package org.costwatch.alert.engine.anomaly.detector.evaluator;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.typesafe.config.Config;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.costwatch.alert.engine.datamodel.AggregationPeriod;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;

/**
 * Short lived cache of aggregated costs, so rules sharing a metric within one pass hit the
 * aggregator once. Expiry follows the engine clock.
 */
public class MetricCache {
  static final String CACHE_TTL_CONFIG = "metric.cache.ttl";
  static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(30);

  // cache key <organizationId, <metricName, dimensions, period>>
  private final Cache<Pair<String, Triple<String, Map<String, String>, AggregationPeriod>>, Double>
      metricCache;
  private final MetricRequestHandler metricRequestHandler;
  private final boolean enabled;

  public MetricCache(
      Config evaluatorConfig, MetricRequestHandler metricRequestHandler, Clock clock) {
    this.metricRequestHandler = metricRequestHandler;
    Duration ttl =
        evaluatorConfig.hasPath(CACHE_TTL_CONFIG)
            ? evaluatorConfig.getDuration(CACHE_TTL_CONFIG)
            : DEFAULT_CACHE_TTL;
    this.enabled = !ttl.isZero();
    this.metricCache =
        CacheBuilder.newBuilder()
            .ticker(clockTicker(clock))
            .expireAfterWrite(ttl.toMillis(), TimeUnit.MILLISECONDS)
            .recordStats()
            .build();
  }

  public MetricRequestHandler getMetricRequestHandler() {
    return metricRequestHandler;
  }

  public double getAggregatedCost(
      String organizationId,
      String metricName,
      Map<String, String> dimensions,
      AggregationPeriod period)
      throws MetricUnavailableException {
    Pair<String, Triple<String, Map<String, String>, AggregationPeriod>> cacheKey =
        Pair.of(organizationId, Triple.of(metricName, Map.copyOf(dimensions), period));
    Double cached = enabled ? metricCache.getIfPresent(cacheKey) : null;
    if (cached != null) {
      return cached;
    }
    double value =
        metricRequestHandler.getAggregatedCost(organizationId, metricName, dimensions, period);
    if (enabled) {
      metricCache.put(cacheKey, value);
    }
    return value;
  }

  long size() {
    return metricCache.size();
  }

  private static Ticker clockTicker(Clock clock) {
    return new Ticker() {
      @Override
      public long read() {
        return TimeUnit.MILLISECONDS.toNanos(clock.millis());
      }
    };
  }
}

package org.costwatch.alert.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.commons.lang3.tuple.Pair;
import org.costwatch.alert.engine.anomaly.detector.AnomalyDetector;
import org.costwatch.alert.engine.anomaly.detector.evaluator.MetricRequestHandler;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.CostAnomaly;
import org.costwatch.alert.engine.datamodel.metric.DailyCost;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;
import org.costwatch.alert.engine.datamodel.store.AlertRuleStore;
import org.costwatch.alert.engine.datamodel.store.CostAnomalyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores yesterday's cost of every monitored scope and stores the results as {@link CostAnomaly}
 * records. A scope is an organization plus the dimension filter of one of its active anomaly
 * rules; every organization with an active rule is also monitored as a whole.
 *
 * <p>Detection never raises alerts. Anomaly rules decide whether a stored anomaly becomes one.
 */
public class AnomalyDetectionService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyDetectionService.class);
  private static final String ANOMALY_DETECTED_COUNTER =
      "costwatch.alert.engine.anomaly.detected";

  private final AlertRuleStore ruleStore;
  private final MetricRequestHandler metricRequestHandler;
  private final AnomalyDetector anomalyDetector;
  private final CostAnomalyStore anomalyStore;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> anomalyDetectedCounter = new ConcurrentHashMap<>();

  public AnomalyDetectionService(
      AlertRuleStore ruleStore,
      MetricRequestHandler metricRequestHandler,
      AnomalyDetector anomalyDetector,
      CostAnomalyStore anomalyStore,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.ruleStore = ruleStore;
    this.metricRequestHandler = metricRequestHandler;
    this.anomalyDetector = anomalyDetector;
    this.anomalyStore = anomalyStore;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /** Runs one detection pass for the previous calendar day and returns the stored anomalies. */
  public List<CostAnomaly> detectAnomalies() {
    LocalDate targetDate = LocalDate.now(clock).minusDays(1);
    List<CostAnomaly> stored = new ArrayList<>();
    for (Pair<String, Map<String, String>> scope : monitoredScopes()) {
      try {
        detect(scope.getLeft(), scope.getRight(), targetDate).ifPresent(stored::add);
      } catch (MetricUnavailableException e) {
        LOGGER.warn(
            "Skipping anomaly detection for {} {}: {}",
            scope.getLeft(),
            scope.getRight(),
            e.getMessage());
      } catch (RuntimeException e) {
        LOGGER.error("Anomaly detection failed for {} {}", scope.getLeft(), scope.getRight(), e);
      }
    }
    LOGGER.info("Anomaly detection for {} stored {} results", targetDate, stored.size());
    return stored;
  }

  Optional<CostAnomaly> detect(
      String organizationId, Map<String, String> dimensions, LocalDate targetDate)
      throws MetricUnavailableException {
    LocalDate from = targetDate.minusDays(anomalyDetector.getConfig().getLookbackDays());
    List<DailyCost> series =
        metricRequestHandler.getDailyCosts(organizationId, dimensions, from, targetDate);

    Optional<CostAnomaly> detected =
        anomalyDetector.detect(organizationId, dimensions, series, targetDate);
    if (detected.isEmpty()) {
      return Optional.empty();
    }
    if (detected.get().getAnomalyScore() < anomalyDetector.getConfig().getRecordMinScore()) {
      LOGGER.debug("Score of {} below the record cut-off, not stored", detected.get());
      return Optional.empty();
    }

    CostAnomaly anomaly = anomalyStore.upsert(detected.get());
    // re-detections of an already stored day keep the stored id and are not counted again
    if (anomaly.getId().equals(detected.get().getId())) {
      anomalyDetectedCounter
          .computeIfAbsent(
              organizationId,
              k ->
                  Counter.builder(ANOMALY_DETECTED_COUNTER)
                      .tag("organizationId", k)
                      .register(meterRegistry))
          .increment();
    }
    return Optional.of(anomaly);
  }

  private Set<Pair<String, Map<String, String>>> monitoredScopes() {
    Set<Pair<String, Map<String, String>>> scopes = new LinkedHashSet<>();
    for (AlertRule rule : ruleStore.findActive()) {
      scopes.add(Pair.of(rule.getOrganizationId(), Map.of()));
      if (rule.getKind() == AlertKind.ANOMALY) {
        scopes.add(
            Pair.of(rule.getOrganizationId(), Map.copyOf(rule.getCondition().getDimensions())));
      }
    }
    return scopes;
  }
}

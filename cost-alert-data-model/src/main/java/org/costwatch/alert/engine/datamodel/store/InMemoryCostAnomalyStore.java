package org.costwatch.alert.engine.datamodel.store;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.apache.commons.lang3.tuple.Triple;
import org.costwatch.alert.engine.datamodel.CostAnomaly;

public class InMemoryCostAnomalyStore implements CostAnomalyStore {
  private static final Comparator<CostAnomaly> NEWEST_FIRST =
      Comparator.comparing(CostAnomaly::getAnomalyDate)
          .thenComparing(CostAnomaly::getCreatedAt)
          .reversed();

  private final ConcurrentMap<String, CostAnomaly> anomalies = new ConcurrentHashMap<>();
  // <organization, dimensions, date> -> anomaly id
  private final ConcurrentMap<Triple<String, Map<String, String>, LocalDate>, String> naturalKeys =
      new ConcurrentHashMap<>();

  @Override
  public CostAnomaly upsert(CostAnomaly anomaly) {
    AtomicReference<CostAnomaly> stored = new AtomicReference<>();
    naturalKeys.compute(
        naturalKey(anomaly),
        (k, existingId) -> {
          CostAnomaly existing = existingId == null ? null : anomalies.get(existingId);
          CostAnomaly toStore =
              existing == null
                  ? anomaly
                  : anomaly.toBuilder()
                      .id(existing.getId())
                      .resolved(existing.isResolved())
                      .createdAt(existing.getCreatedAt())
                      .build();
          anomalies.put(toStore.getId(), toStore);
          stored.set(toStore);
          return toStore.getId();
        });
    return stored.get();
  }

  @Override
  public Optional<CostAnomaly> findById(String anomalyId) {
    return Optional.ofNullable(anomalies.get(anomalyId));
  }

  @Override
  public Optional<CostAnomaly> findLatestUnresolved(
      String organizationId, Map<String, String> dimensions) {
    return anomalies.values().stream()
        .filter(anomaly -> organizationId.equals(anomaly.getOrganizationId()))
        .filter(anomaly -> dimensions.equals(anomaly.getDimensions()))
        .filter(anomaly -> !anomaly.isResolved())
        .min(NEWEST_FIRST);
  }

  @Override
  public List<CostAnomaly> findByOrganization(String organizationId, boolean unresolvedOnly) {
    return anomalies.values().stream()
        .filter(anomaly -> organizationId.equals(anomaly.getOrganizationId()))
        .filter(anomaly -> !unresolvedOnly || !anomaly.isResolved())
        .sorted(NEWEST_FIRST)
        .collect(Collectors.toList());
  }

  @Override
  public Optional<CostAnomaly> markResolved(String anomalyId) {
    CostAnomaly current = anomalies.get(anomalyId);
    if (current == null) {
      return Optional.empty();
    }
    // same lock as upsert, so a concurrent re-detection cannot undo the resolution
    AtomicReference<CostAnomaly> resolved = new AtomicReference<>();
    naturalKeys.compute(
        naturalKey(current),
        (k, existingId) -> {
          CostAnomaly latest = anomalies.get(anomalyId);
          if (latest != null) {
            CostAnomaly updated = latest.toBuilder().resolved(true).build();
            anomalies.put(anomalyId, updated);
            resolved.set(updated);
          }
          return existingId;
        });
    return Optional.ofNullable(resolved.get());
  }

  private static Triple<String, Map<String, String>, LocalDate> naturalKey(CostAnomaly anomaly) {
    return Triple.of(
        anomaly.getOrganizationId(), Map.copyOf(anomaly.getDimensions()), anomaly.getAnomalyDate());
  }
}

package org.costwatch.alert.engine.datamodel.store;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.datamodel.Alert;

public class InMemoryAlertStore implements AlertStore {
  private static final Comparator<Alert> NEWEST_FIRST =
      Comparator.comparing(Alert::getTriggeredAt).reversed().thenComparing(Alert::getId);

  private final ConcurrentMap<String, Alert> alerts = new ConcurrentHashMap<>();

  @Override
  public Alert insert(Alert alert) {
    if (alerts.putIfAbsent(alert.getId(), alert) != null) {
      throw new IllegalStateException("Alert already exists: " + alert.getId());
    }
    return alert;
  }

  @Override
  public Optional<Alert> findById(String alertId) {
    return Optional.ofNullable(alerts.get(alertId));
  }

  @Override
  public Optional<Alert> compareAndSet(long expectedVersion, Alert updated) {
    AtomicReference<Alert> stored = new AtomicReference<>();
    alerts.computeIfPresent(
        updated.getId(),
        (id, current) -> {
          if (current.getVersion() != expectedVersion) {
            return current;
          }
          Alert next = updated.toBuilder().version(expectedVersion + 1).build();
          stored.set(next);
          return next;
        });
    return Optional.ofNullable(stored.get());
  }

  @Override
  public Optional<Alert> findLatestByDedupKey(String dedupKey) {
    return alerts.values().stream()
        .filter(alert -> dedupKey.equals(alert.getDedupKey()))
        .min(NEWEST_FIRST);
  }

  @Override
  public Optional<Alert> findByAnomalyId(String anomalyId) {
    return alerts.values().stream()
        .filter(alert -> anomalyId.equals(alert.getAnomalyId()))
        .min(NEWEST_FIRST);
  }

  @Override
  public Page<Alert> query(AlertQuery query, int pageNumber, int pageSize) {
    List<Alert> matching =
        alerts.values().stream()
            .filter(query::matches)
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    List<Alert> items =
        matching.stream()
            .skip((long) pageNumber * pageSize)
            .limit(pageSize)
            .collect(Collectors.toList());
    return new Page<>(items, pageNumber, pageSize, matching.size());
  }
}

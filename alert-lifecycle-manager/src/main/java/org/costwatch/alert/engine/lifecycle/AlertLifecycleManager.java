package org.costwatch.alert.engine.lifecycle;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.AlertStatus;
import org.costwatch.alert.engine.datamodel.store.AlertQuery;
import org.costwatch.alert.engine.datamodel.store.AlertStore;
import org.costwatch.alert.engine.datamodel.store.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns alert state. Alerts start {@link AlertStatus#ACTIVE} and move to acknowledged, suppressed
 * or resolved; resolved is terminal.
 *
 * <p>Every transition re-reads the alert, checks its precondition against the effective status and
 * writes with compare-and-set on the version, retrying a bounded number of times on conflict. A
 * suppression that has run out is only reflected on read, never written back.
 */
public class AlertLifecycleManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertLifecycleManager.class);
  static final int MAX_UPDATE_ATTEMPTS = 10;
  private static final String ALERT_CREATED_COUNTER = "costwatch.alert.engine.alert.created";
  private static final Set<AlertStatus> OPEN_STATUSES =
      Set.of(AlertStatus.ACTIVE, AlertStatus.ACKNOWLEDGED, AlertStatus.SUPPRESSED);

  private final AlertStore alertStore;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
  private final ConcurrentMap<String, Counter> alertCreatedCounter = new ConcurrentHashMap<>();

  public AlertLifecycleManager(AlertStore alertStore, Clock clock, MeterRegistry meterRegistry) {
    this.alertStore = alertStore;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  public void addListener(AlertListener listener) {
    listeners.add(listener);
  }

  public Alert create(AlertRequest request) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(request.getOrganizationId()), "organization id is required");
    Preconditions.checkArgument(request.getKind() != null, "alert kind is required");
    Preconditions.checkArgument(request.getSeverity() != null, "severity is required");

    Instant now = clock.instant();
    Alert alert =
        alertStore.insert(
            Alert.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(request.getOrganizationId())
                .sourceRuleId(request.getSourceRuleId())
                .anomalyId(request.getAnomalyId())
                .dedupKey(request.getDedupKey())
                .kind(request.getKind())
                .title(request.getTitle())
                .description(request.getDescription())
                .severity(request.getSeverity())
                .status(AlertStatus.ACTIVE)
                .triggeredAt(now)
                .triggerPayload(request.getTriggerPayload())
                .version(1)
                .updatedAt(now)
                .build());
    LOGGER.info(
        "Created {} alert {} for organization {}: {}",
        alert.getSeverity(),
        alert.getId(),
        alert.getOrganizationId(),
        alert.getTitle());
    alertCreatedCounter
        .computeIfAbsent(
            alert.getOrganizationId(),
            k ->
                Counter.builder(ALERT_CREATED_COUNTER)
                    .tag("organizationId", k)
                    .register(meterRegistry))
        .increment();

    for (AlertListener listener : listeners) {
      try {
        listener.onAlertCreated(alert, request);
      } catch (RuntimeException e) {
        LOGGER.error("Alert listener failed for alert {}", alert.getId(), e);
      }
    }
    return alert;
  }

  public Alert acknowledge(String alertId, String acknowledgedBy, String notes) {
    return transition(
        alertId,
        current -> {
          Instant now = clock.instant();
          AlertStatus status = current.effectiveStatus(now);
          if (status != AlertStatus.ACTIVE) {
            throw new AlertPreconditionException(alertId, status, "acknowledge");
          }
          return current.toBuilder()
              .status(AlertStatus.ACKNOWLEDGED)
              .acknowledgedAt(now)
              .acknowledgedBy(acknowledgedBy)
              .acknowledgementNotes(notes)
              .suppressedUntil(null)
              .updatedAt(now)
              .build();
        });
  }

  public Alert resolve(String alertId, String resolvedBy, String notes) {
    return transition(
        alertId,
        current -> {
          if (current.getStatus() == AlertStatus.RESOLVED) {
            throw new AlertPreconditionException(alertId, current.getStatus(), "resolve");
          }
          Instant now = clock.instant();
          return current.toBuilder()
              .status(AlertStatus.RESOLVED)
              .resolvedAt(now)
              .resolvedBy(resolvedBy)
              .resolutionNotes(notes)
              .updatedAt(now)
              .build();
        });
  }

  public Alert suppress(String alertId, Instant until, String suppressedBy) {
    Preconditions.checkArgument(until != null, "suppression end is required");
    return transition(
        alertId,
        current -> {
          Instant now = clock.instant();
          Preconditions.checkArgument(
              until.isAfter(now), "suppression end %s is not in the future", until);
          AlertStatus status = current.effectiveStatus(now);
          if (status != AlertStatus.ACTIVE) {
            throw new AlertPreconditionException(alertId, status, "suppress");
          }
          return current.toBuilder()
              .status(AlertStatus.SUPPRESSED)
              .suppressedUntil(until)
              .suppressedBy(suppressedBy)
              .updatedAt(now)
              .build();
        });
  }

  /** The alert as seen now, with an elapsed suppression reported as active. */
  public Alert get(String alertId) {
    return asOf(find(alertId), clock.instant());
  }

  public Optional<Alert> findById(String alertId) {
    Instant now = clock.instant();
    return alertStore.findById(alertId).map(alert -> asOf(alert, now));
  }

  public Page<Alert> listAlerts(AlertQuery query, int pageNumber, int pageSize) {
    Preconditions.checkArgument(pageNumber >= 0, "page number must be >= 0");
    Preconditions.checkArgument(pageSize > 0, "page size must be > 0");
    Instant now = clock.instant();
    Page<Alert> page = alertStore.query(query.toBuilder().asOf(now).build(), pageNumber, pageSize);
    return new Page<>(
        page.getItems().stream().map(alert -> asOf(alert, now)).collect(Collectors.toList()),
        page.getPageNumber(),
        page.getPageSize(),
        page.getTotalCount());
  }

  public Page<Alert> listActiveAlerts(String organizationId, int pageNumber, int pageSize) {
    return listAlerts(
        AlertQuery.builder()
            .organizationId(organizationId)
            .statuses(Set.of(AlertStatus.ACTIVE))
            .build(),
        pageNumber,
        pageSize);
  }

  /** The alert already raised for a cost anomaly, whatever its status. */
  public Optional<Alert> findAlertForAnomaly(String anomalyId) {
    Instant now = clock.instant();
    return alertStore.findByAnomalyId(anomalyId).map(alert -> asOf(alert, now));
  }

  /** Every not yet resolved alert raised under {@code dedupKey}. */
  public List<Alert> findOpenAlerts(String dedupKey) {
    AlertQuery query = AlertQuery.builder().dedupKey(dedupKey).statuses(OPEN_STATUSES).build();
    List<Alert> open = new ArrayList<>();
    int pageNumber = 0;
    Page<Alert> page;
    do {
      page = listAlerts(query, pageNumber++, 100);
      open.addAll(page.getItems());
    } while (page.hasNext());
    return open;
  }

  private Alert transition(String alertId, Function<Alert, Alert> change) {
    for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
      Alert current = find(alertId);
      Alert updated = change.apply(current);
      Optional<Alert> stored = alertStore.compareAndSet(current.getVersion(), updated);
      if (stored.isPresent()) {
        LOGGER.info(
            "Alert {} moved from {} to {}",
            alertId,
            current.getStatus(),
            stored.get().getStatus());
        return stored.get();
      }
      LOGGER.debug("Alert {} changed concurrently, attempt {}", alertId, attempt);
    }
    throw new ConcurrentModificationException(
        String.format(
            "Alert %s kept changing, gave up after %d attempts", alertId, MAX_UPDATE_ATTEMPTS));
  }

  private Alert find(String alertId) {
    return alertStore.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
  }

  private static Alert asOf(Alert alert, Instant now) {
    AlertStatus effective = alert.effectiveStatus(now);
    return effective == alert.getStatus() ? alert : alert.toBuilder().status(effective).build();
  }
}

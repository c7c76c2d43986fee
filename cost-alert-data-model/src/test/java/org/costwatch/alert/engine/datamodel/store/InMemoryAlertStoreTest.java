package org.costwatch.alert.engine.datamodel.store;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.AlertStatus;
import org.costwatch.alert.engine.datamodel.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InMemoryAlertStoreTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void testCompareAndSetRejectsStaleVersion() {
    InMemoryAlertStore store = new InMemoryAlertStore();
    Alert alert = store.insert(alert("alert-1", "org-1", Severity.HIGH, AlertStatus.ACTIVE, 0));

    Optional<Alert> acknowledged =
        store.compareAndSet(1, alert.toBuilder().status(AlertStatus.ACKNOWLEDGED).build());
    Assertions.assertTrue(acknowledged.isPresent());
    Assertions.assertEquals(2, acknowledged.get().getVersion());

    // a writer still holding version 1 loses
    Optional<Alert> stale =
        store.compareAndSet(1, alert.toBuilder().status(AlertStatus.RESOLVED).build());
    Assertions.assertTrue(stale.isEmpty());
    Assertions.assertEquals(
        AlertStatus.ACKNOWLEDGED, store.findById("alert-1").orElseThrow().getStatus());
  }

  @Test
  void testInsertRejectsDuplicateId() {
    InMemoryAlertStore store = new InMemoryAlertStore();
    store.insert(alert("alert-1", "org-1", Severity.HIGH, AlertStatus.ACTIVE, 0));
    Assertions.assertThrows(
        IllegalStateException.class,
        () -> store.insert(alert("alert-1", "org-1", Severity.LOW, AlertStatus.ACTIVE, 1)));
  }

  @Test
  void testQueryFiltersAndPaginates() {
    InMemoryAlertStore store = new InMemoryAlertStore();
    for (int i = 0; i < 5; i++) {
      store.insert(alert("high-" + i, "org-1", Severity.HIGH, AlertStatus.ACTIVE, i));
    }
    store.insert(alert("low-0", "org-1", Severity.LOW, AlertStatus.ACTIVE, 10));
    store.insert(alert("other-org", "org-2", Severity.HIGH, AlertStatus.ACTIVE, 11));
    store.insert(alert("resolved", "org-1", Severity.HIGH, AlertStatus.RESOLVED, 12));

    AlertQuery query =
        AlertQuery.builder()
            .organizationId("org-1")
            .severities(Set.of(Severity.HIGH))
            .statuses(Set.of(AlertStatus.ACTIVE))
            .asOf(NOW)
            .build();

    Page<Alert> first = store.query(query, 0, 2);
    Assertions.assertEquals(5, first.getTotalCount());
    Assertions.assertTrue(first.hasNext());
    // newest trigger first
    Assertions.assertEquals(
        List.of("high-4", "high-3"),
        first.getItems().stream().map(Alert::getId).collect(Collectors.toList()));

    Page<Alert> last = store.query(query, 2, 2);
    Assertions.assertEquals(1, last.getItems().size());
    Assertions.assertEquals("high-0", last.getItems().get(0).getId());
    Assertions.assertFalse(last.hasNext());
  }

  @Test
  void testQueryUsesEffectiveStatus() {
    InMemoryAlertStore store = new InMemoryAlertStore();
    store.insert(
        alert("suppressed", "org-1", Severity.HIGH, AlertStatus.SUPPRESSED, 0).toBuilder()
            .suppressedUntil(NOW.plus(Duration.ofMinutes(30)))
            .build());

    AlertQuery active =
        AlertQuery.builder().organizationId("org-1").statuses(Set.of(AlertStatus.ACTIVE)).build();

    Assertions.assertEquals(
        0, store.query(active.toBuilder().asOf(NOW).build(), 0, 10).getTotalCount());
    Assertions.assertEquals(
        1,
        store
            .query(active.toBuilder().asOf(NOW.plus(Duration.ofMinutes(31))).build(), 0, 10)
            .getTotalCount());
  }

  @Test
  void testFindByAnomalyId() {
    InMemoryAlertStore store = new InMemoryAlertStore();
    store.insert(alert("threshold", "org-1", Severity.HIGH, AlertStatus.ACTIVE, 0));
    store.insert(
        alert("anomaly", "org-1", Severity.HIGH, AlertStatus.RESOLVED, 1).toBuilder()
            .anomalyId("anomaly-1")
            .build());

    Assertions.assertEquals("anomaly", store.findByAnomalyId("anomaly-1").orElseThrow().getId());
    Assertions.assertTrue(store.findByAnomalyId("anomaly-2").isEmpty());
  }

  private static Alert alert(
      String id, String organizationId, Severity severity, AlertStatus status, int minute) {
    return Alert.builder()
        .id(id)
        .organizationId(organizationId)
        .dedupKey("rule-1[]")
        .severity(severity)
        .status(status)
        .triggeredAt(NOW.minus(Duration.ofHours(1)).plus(Duration.ofMinutes(minute)))
        .version(1)
        .build();
  }
}

package org.costwatch.alert.engine.datamodel.store;

import java.util.List;
import java.util.Optional;
import org.costwatch.alert.engine.datamodel.Alert;

public interface AlertStore {

  /** Stores a new alert, failing with {@link IllegalStateException} if the id already exists. */
  Alert insert(Alert alert);

  Optional<Alert> findById(String alertId);

  /**
   * Replaces the stored alert only if its version still equals {@code expectedVersion}. The stored
   * copy gets version {@code expectedVersion + 1}. Returns empty when another writer won.
   */
  Optional<Alert> compareAndSet(long expectedVersion, Alert updated);

  Optional<Alert> findLatestByDedupKey(String dedupKey);

  /** The alert raised for a cost anomaly; an anomaly is escalated at most once. */
  Optional<Alert> findByAnomalyId(String anomalyId);

  /** Matching alerts, newest trigger first. */
  Page<Alert> query(AlertQuery query, int pageNumber, int pageSize);
}

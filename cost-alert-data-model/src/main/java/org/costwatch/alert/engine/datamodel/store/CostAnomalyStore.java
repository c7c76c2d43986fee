package org.costwatch.alert.engine.datamodel.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.costwatch.alert.engine.datamodel.CostAnomaly;

public interface CostAnomalyStore {

  /**
   * Stores the anomaly, replacing an existing record for the same organization, dimensions and
   * date. The replaced record's id, creation time and resolved flag are kept.
   */
  CostAnomaly upsert(CostAnomaly anomaly);

  Optional<CostAnomaly> findById(String anomalyId);

  Optional<CostAnomaly> findLatestUnresolved(String organizationId, Map<String, String> dimensions);

  List<CostAnomaly> findByOrganization(String organizationId, boolean unresolvedOnly);

  Optional<CostAnomaly> markResolved(String anomalyId);
}

package org.costwatch.alert.engine.datamodel.store;

import java.util.List;
import java.util.Optional;
import org.costwatch.alert.engine.datamodel.AlertRule;

public interface AlertRuleStore {

  /** Inserts or replaces the rule with the same id. */
  AlertRule save(AlertRule rule);

  Optional<AlertRule> findById(String ruleId);

  List<AlertRule> findByOrganization(String organizationId);

  List<AlertRule> findActive();
}

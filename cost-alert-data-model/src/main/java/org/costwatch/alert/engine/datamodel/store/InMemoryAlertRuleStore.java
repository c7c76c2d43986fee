package org.costwatch.alert.engine.datamodel.store;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.datamodel.AlertRule;

public class InMemoryAlertRuleStore implements AlertRuleStore {
  private final ConcurrentMap<String, AlertRule> rules = new ConcurrentHashMap<>();

  @Override
  public AlertRule save(AlertRule rule) {
    rules.put(rule.getId(), rule);
    return rule;
  }

  @Override
  public Optional<AlertRule> findById(String ruleId) {
    return Optional.ofNullable(rules.get(ruleId));
  }

  @Override
  public List<AlertRule> findByOrganization(String organizationId) {
    return rules.values().stream()
        .filter(rule -> organizationId.equals(rule.getOrganizationId()))
        .sorted(Comparator.comparing(AlertRule::getId))
        .collect(Collectors.toList());
  }

  @Override
  public List<AlertRule> findActive() {
    return rules.values().stream()
        .filter(AlertRule::isActive)
        .sorted(Comparator.comparing(AlertRule::getId))
        .collect(Collectors.toList());
  }
}

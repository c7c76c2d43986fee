package org.costwatch.alert.engine;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.anomaly.detector.evaluator.AlertRuleEvaluator;
import org.costwatch.alert.engine.anomaly.detector.evaluator.CooldownTracker;
import org.costwatch.alert.engine.anomaly.detector.evaluator.EvaluationResult;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.DedupKey;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;
import org.costwatch.alert.engine.datamodel.observability.MetaAlertSink;
import org.costwatch.alert.engine.datamodel.store.AlertRuleStore;
import org.costwatch.alert.engine.lifecycle.AlertLifecycleManager;
import org.costwatch.alert.engine.lifecycle.AlertPreconditionException;
import org.costwatch.alert.engine.lifecycle.AlertRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates active rules and turns violations into alerts. Organizations are evaluated in
 * parallel; rules of one organization run sequentially on the same worker.
 */
public class RuleEvaluationService {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuleEvaluationService.class);
  static final String SYSTEM_USER = "system";
  static final String AUTO_RESOLVE_NOTE = "Condition no longer holds";

  private static final Predicate<AlertRule> SCHEDULED_RULES =
      rule -> rule.getKind() != AlertKind.FORECAST_BREACH;
  private static final Predicate<AlertRule> FORECAST_RULES =
      rule -> rule.getKind() == AlertKind.FORECAST_BREACH;

  private final AlertRuleStore ruleStore;
  private final AlertRuleEvaluator alertRuleEvaluator;
  private final CooldownTracker cooldownTracker;
  private final AlertLifecycleManager lifecycleManager;
  private final MetaAlertSink metaAlertSink;
  private final Clock clock;
  private final ExecutorService organizationExecutor;

  public RuleEvaluationService(
      AlertRuleStore ruleStore,
      AlertRuleEvaluator alertRuleEvaluator,
      CooldownTracker cooldownTracker,
      AlertLifecycleManager lifecycleManager,
      MetaAlertSink metaAlertSink,
      Clock clock,
      ExecutorService organizationExecutor) {
    this.ruleStore = ruleStore;
    this.alertRuleEvaluator = alertRuleEvaluator;
    this.cooldownTracker = cooldownTracker;
    this.lifecycleManager = lifecycleManager;
    this.metaAlertSink = metaAlertSink;
    this.clock = clock;
    this.organizationExecutor = organizationExecutor;
  }

  /** One pass over threshold, budget and anomaly rules. */
  public List<Alert> evaluateRules() {
    return runPass(SCHEDULED_RULES);
  }

  /** One pass over forecast-breach rules. */
  public List<Alert> checkForecasts() {
    return runPass(FORECAST_RULES);
  }

  /** Evaluates every active rule of one organization on the calling thread. */
  public List<Alert> evaluateOrganization(String organizationId) {
    List<AlertRule> rules =
        ruleStore.findByOrganization(organizationId).stream()
            .filter(AlertRule::isActive)
            .collect(Collectors.toList());
    return evaluateAll(rules);
  }

  private List<Alert> runPass(Predicate<AlertRule> selector) {
    Map<String, List<AlertRule>> rulesByOrganization =
        ruleStore.findActive().stream()
            .filter(selector)
            .collect(Collectors.groupingBy(AlertRule::getOrganizationId));
    LOGGER.debug("Evaluating rules of {} organizations", rulesByOrganization.size());

    List<Callable<List<Alert>>> tasks = new ArrayList<>();
    rulesByOrganization.values().forEach(rules -> tasks.add(() -> evaluateAll(rules)));

    List<Alert> created = new ArrayList<>();
    try {
      for (Future<List<Alert>> future : organizationExecutor.invokeAll(tasks)) {
        try {
          created.addAll(future.get());
        } catch (ExecutionException e) {
          LOGGER.error("Rule evaluation of an organization failed", e.getCause());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Rule evaluation pass interrupted, {} alerts created so far", created.size());
    }
    if (!created.isEmpty()) {
      LOGGER.info("Rule evaluation pass created {} alerts", created.size());
    }
    return created;
  }

  private List<Alert> evaluateAll(List<AlertRule> rules) {
    List<Alert> created = new ArrayList<>();
    for (AlertRule rule : rules) {
      try {
        evaluateRule(rule).ifPresent(created::add);
      } catch (MetricUnavailableException e) {
        LOGGER.warn("Skipping rule {} this cycle: {}", rule.getId(), e.getMessage());
      } catch (RuntimeException e) {
        metaAlertSink.ruleEvaluationFailed(rule, e.getMessage(), e);
      }
    }
    return created;
  }

  Optional<Alert> evaluateRule(AlertRule rule) throws MetricUnavailableException {
    if (!rule.isActive()) {
      return Optional.empty();
    }
    DedupKey key = DedupKey.forRule(rule);
    Instant now = clock.instant();
    boolean coolingDown = cooldownTracker.isCoolingDown(key, rule.getCooldown(), now);
    if (coolingDown && !rule.isAutoResolve()) {
      LOGGER.debug("Rule {} is cooling down", rule.getId());
      return Optional.empty();
    }

    EvaluationResult result = alertRuleEvaluator.evaluate(rule);
    if (!result.isViolation()) {
      if (rule.isAutoResolve()) {
        autoResolve(rule, key);
      }
      return Optional.empty();
    }
    if (coolingDown || !cooldownTracker.tryAcquire(key, rule.getCooldown(), now)) {
      LOGGER.debug("Rule {} violated but already alerted within its cooldown", rule.getId());
      return Optional.empty();
    }

    boolean stillActive = ruleStore.findById(rule.getId()).map(AlertRule::isActive).orElse(false);
    if (!stillActive) {
      LOGGER.info("Rule {} was deactivated during evaluation", rule.getId());
      cooldownTracker.release(key, now);
      return Optional.empty();
    }

    Optional<Alert> escalated =
        result.getAnomalyId() == null
            ? Optional.empty()
            : lifecycleManager.findAlertForAnomaly(result.getAnomalyId());
    if (escalated.isPresent()) {
      LOGGER.debug(
          "Anomaly {} already raised alert {}", result.getAnomalyId(), escalated.get().getId());
      cooldownTracker.release(key, now);
      return Optional.empty();
    }

    try {
      return Optional.of(lifecycleManager.create(toAlertRequest(rule, key, result)));
    } catch (RuntimeException e) {
      cooldownTracker.release(key, now);
      throw e;
    }
  }

  private void autoResolve(AlertRule rule, DedupKey key) {
    for (Alert alert : lifecycleManager.findOpenAlerts(key.asString())) {
      try {
        lifecycleManager.resolve(alert.getId(), SYSTEM_USER, AUTO_RESOLVE_NOTE);
        LOGGER.info("Auto-resolved alert {} of rule {}", alert.getId(), rule.getId());
      } catch (AlertPreconditionException e) {
        LOGGER.info("Alert {} was resolved concurrently: {}", alert.getId(), e.getMessage());
      }
    }
  }

  private static AlertRequest toAlertRequest(
      AlertRule rule, DedupKey key, EvaluationResult result) {
    return AlertRequest.builder()
        .organizationId(rule.getOrganizationId())
        .sourceRuleId(rule.getId())
        .anomalyId(result.getAnomalyId())
        .dedupKey(key.asString())
        .kind(rule.getKind())
        .title(result.getTitle() != null ? result.getTitle() : rule.getName())
        .description(result.getDescription())
        .severity(result.getSeverity())
        .triggerPayload(result.getPayload())
        .notificationTargets(rule.getNotificationTargets())
        .build();
  }
}

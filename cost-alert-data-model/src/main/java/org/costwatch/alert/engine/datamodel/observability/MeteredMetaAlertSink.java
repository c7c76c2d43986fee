package org.costwatch.alert.engine.datamodel.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.costwatch.alert.engine.datamodel.AlertNotification;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MeteredMetaAlertSink implements MetaAlertSink {
  private static final Logger LOGGER = LoggerFactory.getLogger(MeteredMetaAlertSink.class);
  static final String RULE_EVALUATION_ERROR_COUNTER =
      "costwatch.alert.engine.rule.evaluation.error";
  static final String NOTIFICATION_EXHAUSTED_COUNTER =
      "costwatch.alert.engine.notification.exhausted";
  static final String CONFIGURATION_ERROR_COUNTER = "costwatch.alert.engine.configuration.error";
  private static final String ORGANIZATION_ID_TAG = "organizationId";
  private static final String UNKNOWN_ORGANIZATION = "unknown";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> ruleEvaluationErrorCounter =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> notificationExhaustedCounter =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> configurationErrorCounter =
      new ConcurrentHashMap<>();

  public MeteredMetaAlertSink(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void ruleEvaluationFailed(AlertRule rule, String reason, Throwable cause) {
    LOGGER.error(
        "Evaluation of rule {} for organization {} failed: {}",
        rule.getId(),
        rule.getOrganizationId(),
        reason,
        cause);
    counter(ruleEvaluationErrorCounter, RULE_EVALUATION_ERROR_COUNTER, rule.getOrganizationId())
        .increment();
  }

  @Override
  public void notificationExhausted(AlertNotification notification) {
    LOGGER.error(
        "Notification {} of alert {} to {} over {} failed permanently after {} attempts: {}",
        notification.getId(),
        notification.getAlertId(),
        notification.getRecipient(),
        notification.getChannel(),
        notification.getAttemptCount(),
        notification.getLastError());
    counter(
            notificationExhaustedCounter,
            NOTIFICATION_EXHAUSTED_COUNTER,
            notification.getOrganizationId())
        .increment();
  }

  @Override
  public void configurationError(String organizationId, String subject, String reason) {
    LOGGER.error(
        "Configuration error for {} in organization {}: {}", subject, organizationId, reason);
    counter(configurationErrorCounter, CONFIGURATION_ERROR_COUNTER, organizationId).increment();
  }

  private Counter counter(ConcurrentMap<String, Counter> counters, String name, String orgId) {
    return counters.computeIfAbsent(
        orgId == null ? UNKNOWN_ORGANIZATION : orgId,
        k -> Counter.builder(name).tag(ORGANIZATION_ID_TAG, k).register(meterRegistry));
  }
}

package org.costwatch.alert.engine.datamodel.observability;

import org.costwatch.alert.engine.datamodel.AlertNotification;
import org.costwatch.alert.engine.datamodel.AlertRule;

/** Receives the engine's own failures so they surface to operators. */
public interface MetaAlertSink {

  void ruleEvaluationFailed(AlertRule rule, String reason, Throwable cause);

  void notificationExhausted(AlertNotification notification);

  void configurationError(String organizationId, String subject, String reason);
}

package org.costwatch.alert.engine.notification.service.notification;

import java.time.Instant;
import java.util.Map;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import org.costwatch.alert.engine.datamodel.Alert;

/** JSON body posted to generic webhook and Teams targets. */
@SuperBuilder
@Getter
public class AlertWebhookEvent {
  static final String EVENT_TYPE = "cost_alert";

  private final String eventType;
  private final String alertId;
  private final String organizationId;
  private final String ruleId;
  private final String anomalyId;
  private final String kind;
  private final String severity;
  private final String status;
  private final String title;
  private final String description;
  private final Instant triggeredAt;
  private final Map<String, Object> payload;

  static AlertWebhookEvent from(Alert alert) {
    return AlertWebhookEvent.builder()
        .eventType(EVENT_TYPE)
        .alertId(alert.getId())
        .organizationId(alert.getOrganizationId())
        .ruleId(alert.getSourceRuleId())
        .anomalyId(alert.getAnomalyId())
        .kind(alert.getKind().name())
        .severity(alert.getSeverity().name())
        .status(alert.getStatus().name())
        .title(alert.getTitle())
        .description(alert.getDescription())
        .triggeredAt(alert.getTriggeredAt())
        .payload(alert.getTriggerPayload())
        .build();
  }
}

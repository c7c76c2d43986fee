package org.costwatch.alert.engine.lifecycle;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.NotificationTarget;
import org.costwatch.alert.engine.datamodel.Severity;

/** Everything needed to raise an alert, plus where listeners should route it. */
@SuperBuilder(toBuilder = true)
@Getter
@ToString
public class AlertRequest {
  private final String organizationId;
  private final String sourceRuleId;
  private final String anomalyId;
  private final String dedupKey;
  private final AlertKind kind;
  private final String title;
  private final String description;
  private final Severity severity;
  @Builder.Default private final Map<String, Object> triggerPayload = Map.of();
  // empty means the configured default targets
  @Builder.Default private final List<NotificationTarget> notificationTargets = List.of();
}

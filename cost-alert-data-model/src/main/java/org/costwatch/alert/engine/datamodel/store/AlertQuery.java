package org.costwatch.alert.engine.datamodel.store;

import java.time.Instant;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.AlertStatus;
import org.costwatch.alert.engine.datamodel.Severity;

/**
 * Filter for alert listings. Empty severity or status sets match everything. Statuses are matched
 * against the effective status at {@link #getAsOf()}.
 */
@SuperBuilder(toBuilder = true)
@Getter
@ToString
public class AlertQuery {
  private final String organizationId;
  @Builder.Default private final Set<Severity> severities = Set.of();
  @Builder.Default private final Set<AlertStatus> statuses = Set.of();
  private final String dedupKey;
  private final String sourceRuleId;
  private final Instant asOf;

  public boolean matches(Alert alert) {
    if (organizationId != null && !organizationId.equals(alert.getOrganizationId())) {
      return false;
    }
    if (dedupKey != null && !dedupKey.equals(alert.getDedupKey())) {
      return false;
    }
    if (sourceRuleId != null && !sourceRuleId.equals(alert.getSourceRuleId())) {
      return false;
    }
    if (!severities.isEmpty() && !severities.contains(alert.getSeverity())) {
      return false;
    }
    return statuses.isEmpty()
        || statuses.contains(asOf == null ? alert.getStatus() : alert.effectiveStatus(asOf));
  }
}

package org.costwatch.alert.engine.datamodel;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * An instance of a triggered rule or anomaly. Alerts are never deleted; the lifecycle manager
 * moves them through {@link AlertStatus} with optimistic concurrency on {@link #getVersion()}.
 */
@SuperBuilder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class Alert {
  private final String id;
  private final String organizationId;
  // null for anomaly-originated alerts
  private final String sourceRuleId;
  private final String anomalyId;
  private final String dedupKey;
  private final AlertKind kind;
  private final String title;
  private final String description;
  private final Severity severity;
  private final AlertStatus status;
  private final Instant triggeredAt;
  private final Instant acknowledgedAt;
  private final String acknowledgedBy;
  private final String acknowledgementNotes;
  private final Instant resolvedAt;
  private final String resolvedBy;
  private final String resolutionNotes;
  private final Instant suppressedUntil;
  private final String suppressedBy;
  @Builder.Default private final Map<String, Object> triggerPayload = Map.of();
  private final long version;
  private final Instant updatedAt;

  /**
   * Status as seen at {@code now}. A suppression whose window has elapsed reads as {@link
   * AlertStatus#ACTIVE}; the stored status is left untouched.
   */
  public AlertStatus effectiveStatus(Instant now) {
    if (status == AlertStatus.SUPPRESSED
        && suppressedUntil != null
        && !now.isBefore(suppressedUntil)) {
      return AlertStatus.ACTIVE;
    }
    return status;
  }

  public boolean isOpen() {
    return status != AlertStatus.RESOLVED;
  }
}

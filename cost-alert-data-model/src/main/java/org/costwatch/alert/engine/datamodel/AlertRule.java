package org.costwatch.alert.engine.datamodel;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class AlertRule {
  public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(60);

  private final String id;
  private final String organizationId;
  private final String name;
  private final String description;
  private final AlertKind kind;
  private final RuleCondition condition;
  // null means the severity is derived from how far the threshold was exceeded
  private final Severity severity;
  @Builder.Default private final List<NotificationTarget> notificationTargets = List.of();
  @Builder.Default private final Duration cooldown = DEFAULT_COOLDOWN;
  @Builder.Default private final boolean active = true;
  private final boolean autoResolve;
  private final Instant createdAt;
  private final Instant updatedAt;
}

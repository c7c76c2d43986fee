package org.costwatch.alert.engine.datamodel;

import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString(exclude = "body")
public class AlertNotification {
  private final String id;
  private final String alertId;
  private final String organizationId;
  private final NotificationChannelType channel;
  private final String recipient;
  private final String subject;
  private final String body;
  private final NotificationStatus status;
  private final int retryCount;
  private final int attemptCount;
  private final String lastError;
  private final Instant createdAt;
  private final Instant sentAt;
  private final Instant deliveredAt;
  private final Instant nextAttemptAt;
  private final long version;
}

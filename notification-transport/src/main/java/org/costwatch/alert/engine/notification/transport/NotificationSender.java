package org.costwatch.alert.engine.notification.transport;

import org.costwatch.alert.engine.datamodel.NotificationChannelType;

/**
 * Uniform delivery interface for every notification channel. Implementations either hand the
 * message over ({@link DeliveryStatus#SENT}), report that the receiver accepted it ({@link
 * DeliveryStatus#DELIVERED}), or throw.
 */
public interface NotificationSender {
  DeliveryStatus send(
      NotificationChannelType channel, String recipient, String subject, String body)
      throws NotificationDeliveryException;
}

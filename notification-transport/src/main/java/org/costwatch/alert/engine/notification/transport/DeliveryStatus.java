package org.costwatch.alert.engine.notification.transport;

public enum DeliveryStatus {
  // handed to the channel, receipt not confirmed
  SENT,
  DELIVERED
}

package org.costwatch.alert.engine.datamodel;

public enum NotificationStatus {
  PENDING,
  SENT,
  DELIVERED,
  FAILED;

  public boolean isTerminal() {
    return this == DELIVERED || this == FAILED;
  }
}

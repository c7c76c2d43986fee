package org.costwatch.alert.engine.datamodel;

import java.util.Locale;

public enum NotificationChannelType {
  EMAIL,
  SLACK,
  SMS,
  WEBHOOK,
  TEAMS;

  public static NotificationChannelType fromString(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

package org.costwatch.alert.engine.datamodel;

import java.util.Locale;

public enum AlertStatus {
  ACTIVE,
  ACKNOWLEDGED,
  RESOLVED,
  SUPPRESSED;

  public boolean isTerminal() {
    return this == RESOLVED;
  }

  public static AlertStatus fromString(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

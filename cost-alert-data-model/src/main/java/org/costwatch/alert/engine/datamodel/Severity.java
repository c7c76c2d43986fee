package org.costwatch.alert.engine.datamodel;

import java.util.Locale;

/** Ordered from least to most severe, so {@link #compareTo} reflects urgency. */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  public boolean isAtLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  public Severity lowerBy(int bands) {
    return values()[Math.max(0, ordinal() - bands)];
  }

  public static Severity fromString(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

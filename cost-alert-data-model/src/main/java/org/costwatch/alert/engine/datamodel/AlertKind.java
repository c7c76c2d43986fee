package org.costwatch.alert.engine.datamodel;

import java.util.Locale;

public enum AlertKind {
  THRESHOLD,
  ANOMALY,
  FORECAST_BREACH,
  BUDGET_EXCEEDED;

  /** Accepts both {@code forecast-breach} and {@code FORECAST_BREACH} spellings. */
  public static AlertKind fromString(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Alert kind is missing");
    }
    return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
  }
}

package org.costwatch.alert.engine.datamodel;

import java.util.Locale;

public enum AggregationPeriod {
  HOURLY,
  DAILY,
  WEEKLY,
  MONTHLY;

  public static AggregationPeriod fromString(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

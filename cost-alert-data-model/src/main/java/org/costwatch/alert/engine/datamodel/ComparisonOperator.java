package org.costwatch.alert.engine.datamodel;

public enum ComparisonOperator {
  GT(">", "gt"),
  GTE(">=", "gte"),
  LT("<", "lt"),
  LTE("<=", "lte"),
  EQ("=", "eq"),
  NE("!=", "ne");

  private final String symbol;
  private final String alias;

  ComparisonOperator(String symbol, String alias) {
    this.symbol = symbol;
    this.alias = alias;
  }

  public String getSymbol() {
    return symbol;
  }

  public static ComparisonOperator fromSymbol(String value) {
    if (value != null) {
      String trimmed = value.trim();
      if ("==".equals(trimmed)) {
        return EQ;
      }
      for (ComparisonOperator operator : values()) {
        if (operator.symbol.equals(trimmed) || operator.alias.equalsIgnoreCase(trimmed)) {
          return operator;
        }
      }
    }
    throw new UnsupportedOperationException("Unsupported comparator: " + value);
  }
}

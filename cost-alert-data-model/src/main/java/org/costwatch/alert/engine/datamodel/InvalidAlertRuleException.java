package org.costwatch.alert.engine.datamodel;

public class InvalidAlertRuleException extends IllegalArgumentException {
  public InvalidAlertRuleException(String message) {
    super(message);
  }
}

package org.costwatch.alert.engine.lifecycle;

public class AlertNotFoundException extends RuntimeException {
  public AlertNotFoundException(String alertId) {
    super("Alert not found: " + alertId);
  }
}

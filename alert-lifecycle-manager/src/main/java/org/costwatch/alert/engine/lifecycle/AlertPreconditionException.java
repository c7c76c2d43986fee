package org.costwatch.alert.engine.lifecycle;

import org.costwatch.alert.engine.datamodel.AlertStatus;

/** A transition was requested from a status that does not allow it. */
public class AlertPreconditionException extends IllegalStateException {
  private final String alertId;
  private final AlertStatus status;

  public AlertPreconditionException(String alertId, AlertStatus status, String action) {
    super(String.format("Cannot %s alert %s in status %s", action, alertId, status));
    this.alertId = alertId;
    this.status = status;
  }

  public String getAlertId() {
    return alertId;
  }

  public AlertStatus getStatus() {
    return status;
  }
}

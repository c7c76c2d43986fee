package org.costwatch.alert.engine.lifecycle;

import org.costwatch.alert.engine.datamodel.Alert;

/** Called after an alert has been persisted. */
public interface AlertListener {
  void onAlertCreated(Alert alert, AlertRequest request);
}

package org.costwatch.alert.engine;

import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.lifecycle.AlertListener;
import org.costwatch.alert.engine.lifecycle.AlertRequest;
import org.costwatch.alert.engine.notification.service.NotificationDispatcher;

/** Hands every new alert to the dispatcher with the targets of the rule that raised it. */
public class NotificationRoutingListener implements AlertListener {
  private final NotificationDispatcher notificationDispatcher;

  public NotificationRoutingListener(NotificationDispatcher notificationDispatcher) {
    this.notificationDispatcher = notificationDispatcher;
  }

  @Override
  public void onAlertCreated(Alert alert, AlertRequest request) {
    notificationDispatcher.dispatch(alert, request.getNotificationTargets());
  }
}

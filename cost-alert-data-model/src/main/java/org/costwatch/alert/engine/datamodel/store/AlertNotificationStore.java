package org.costwatch.alert.engine.datamodel.store;

import java.util.List;
import java.util.Optional;
import org.costwatch.alert.engine.datamodel.AlertNotification;
import org.costwatch.alert.engine.datamodel.NotificationStatus;

public interface AlertNotificationStore {

  AlertNotification insert(AlertNotification notification);

  Optional<AlertNotification> findById(String notificationId);

  /** Same contract as {@link AlertStore#compareAndSet}. */
  Optional<AlertNotification> compareAndSet(long expectedVersion, AlertNotification updated);

  List<AlertNotification> findByAlertId(String alertId);

  List<AlertNotification> findByStatus(NotificationStatus status);
}

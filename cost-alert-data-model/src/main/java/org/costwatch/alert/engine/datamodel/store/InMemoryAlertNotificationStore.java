package org.costwatch.alert.engine.datamodel.store;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.datamodel.AlertNotification;
import org.costwatch.alert.engine.datamodel.NotificationStatus;

public class InMemoryAlertNotificationStore implements AlertNotificationStore {
  private static final Comparator<AlertNotification> OLDEST_FIRST =
      Comparator.comparing(AlertNotification::getCreatedAt).thenComparing(AlertNotification::getId);

  private final ConcurrentMap<String, AlertNotification> notifications = new ConcurrentHashMap<>();

  @Override
  public AlertNotification insert(AlertNotification notification) {
    if (notifications.putIfAbsent(notification.getId(), notification) != null) {
      throw new IllegalStateException("Notification already exists: " + notification.getId());
    }
    return notification;
  }

  @Override
  public Optional<AlertNotification> findById(String notificationId) {
    return Optional.ofNullable(notifications.get(notificationId));
  }

  @Override
  public Optional<AlertNotification> compareAndSet(
      long expectedVersion, AlertNotification updated) {
    AtomicReference<AlertNotification> stored = new AtomicReference<>();
    notifications.computeIfPresent(
        updated.getId(),
        (id, current) -> {
          if (current.getVersion() != expectedVersion) {
            return current;
          }
          AlertNotification next = updated.toBuilder().version(expectedVersion + 1).build();
          stored.set(next);
          return next;
        });
    return Optional.ofNullable(stored.get());
  }

  @Override
  public List<AlertNotification> findByAlertId(String alertId) {
    return notifications.values().stream()
        .filter(notification -> alertId.equals(notification.getAlertId()))
        .sorted(OLDEST_FIRST)
        .collect(Collectors.toList());
  }

  @Override
  public List<AlertNotification> findByStatus(NotificationStatus status) {
    return notifications.values().stream()
        .filter(notification -> notification.getStatus() == status)
        .sorted(OLDEST_FIRST)
        .collect(Collectors.toList());
  }
}

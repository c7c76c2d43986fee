package org.costwatch.alert.engine.notification.service;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.AlertNotification;
import org.costwatch.alert.engine.datamodel.AlertStatus;
import org.costwatch.alert.engine.datamodel.NotificationStatus;
import org.costwatch.alert.engine.datamodel.NotificationTarget;
import org.costwatch.alert.engine.datamodel.Severity;
import org.costwatch.alert.engine.datamodel.observability.MetaAlertSink;
import org.costwatch.alert.engine.datamodel.store.AlertNotificationStore;
import org.costwatch.alert.engine.notification.service.notification.AlertMessageRenderer;
import org.costwatch.alert.engine.notification.service.notification.RenderedMessage;
import org.costwatch.alert.engine.notification.transport.DeliveryStatus;
import org.costwatch.alert.engine.notification.transport.NotificationDeliveryException;
import org.costwatch.alert.engine.notification.transport.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans an alert out to its targets and drives each notification to a terminal status.
 *
 * <p>Every (channel, recipient) pair becomes one persisted {@link AlertNotification}. Attempts run
 * on the scheduler, one at a time per notification, each bounded by the send timeout. Failed
 * attempts are rescheduled with exponential backoff until the retry budget is spent, after which
 * the notification is marked failed and reported to the {@link MetaAlertSink}. Only pending
 * notifications are ever attempted, so a restart that calls {@link #resumePending()} does not
 * resend anything already sent or delivered. An attempt that fires before the notification's next
 * attempt time is dropped, so a resumed notification never skips its backoff. Attempts cut short
 * by {@link #shutdown()} leave the notification pending without spending its retry budget.
 */
public class NotificationDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationDispatcher.class);
  private static final String NOTIFICATION_DELIVERED_COUNTER =
      "costwatch.alert.engine.notification.delivered";
  static final String TEST_ALERT_PREFIX = "test-";

  private final NotificationDispatcherConfig config;
  private final RetryPolicy retryPolicy;
  private final NotificationSenderRegistry senderRegistry;
  private final AlertNotificationStore notificationStore;
  private final MetaAlertSink metaAlertSink;
  private final AlertMessageRenderer renderer;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final ScheduledExecutorService scheduler;
  private final ExecutorService sendExecutor;

  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
  private final ConcurrentMap<String, CompletableFuture<AlertNotification>> outcomes =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveredCounter = new ConcurrentHashMap<>();

  public NotificationDispatcher(
      NotificationDispatcherConfig config,
      NotificationSenderRegistry senderRegistry,
      AlertNotificationStore notificationStore,
      MetaAlertSink metaAlertSink,
      Clock clock,
      MeterRegistry meterRegistry) {
    this(
        config,
        senderRegistry,
        notificationStore,
        metaAlertSink,
        clock,
        meterRegistry,
        Executors.newScheduledThreadPool(
            config.getWorkerThreads(),
            new ThreadFactoryBuilder()
                .setNameFormat("notification-dispatcher-%d")
                .setDaemon(true)
                .build()),
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("notification-sender-%d")
                .setDaemon(true)
                .build()));
  }

  NotificationDispatcher(
      NotificationDispatcherConfig config,
      NotificationSenderRegistry senderRegistry,
      AlertNotificationStore notificationStore,
      MetaAlertSink metaAlertSink,
      Clock clock,
      MeterRegistry meterRegistry,
      ScheduledExecutorService scheduler,
      ExecutorService sendExecutor) {
    this.config = config;
    this.retryPolicy = config.getRetryPolicy();
    this.senderRegistry = senderRegistry;
    this.notificationStore = notificationStore;
    this.metaAlertSink = metaAlertSink;
    this.renderer = new AlertMessageRenderer();
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.scheduler = scheduler;
    this.sendExecutor = sendExecutor;
  }

  /**
   * Creates one pending notification per distinct target and schedules the first attempts. Empty
   * {@code targets} fall back to the configured default targets.
   *
   * @return one future per notification, completed once it reaches sent, delivered or failed
   */
  public List<CompletableFuture<AlertNotification>> dispatch(
      Alert alert, List<NotificationTarget> targets) {
    Set<NotificationTarget> distinctTargets =
        new LinkedHashSet<>(targets.isEmpty() ? config.getDefaultTargets() : targets);
    if (distinctTargets.isEmpty()) {
      LOGGER.info("Alert {} has no notification targets", alert.getId());
      return List.of();
    }

    Instant now = clock.instant();
    List<CompletableFuture<AlertNotification>> futures = new ArrayList<>();
    for (NotificationTarget target : distinctTargets) {
      RenderedMessage message = renderer.render(alert, target.getChannel());
      AlertNotification notification =
          notificationStore.insert(
              AlertNotification.builder()
                  .id(UUID.randomUUID().toString())
                  .alertId(alert.getId())
                  .organizationId(alert.getOrganizationId())
                  .channel(target.getChannel())
                  .recipient(target.getRecipient())
                  .subject(message.getSubject())
                  .body(message.getBody())
                  .status(NotificationStatus.PENDING)
                  .createdAt(now)
                  .nextAttemptAt(now)
                  .version(1)
                  .build());
      futures.add(outcome(notification.getId()));
      schedule(notification.getId(), now);
    }
    LOGGER.info("Dispatching alert {} to {} targets", alert.getId(), futures.size());
    return futures;
  }

  /** Renders a synthetic alert for {@code organizationId} and delivers it like a real one. */
  public List<CompletableFuture<AlertNotification>> sendTestNotification(
      String organizationId, List<NotificationTarget> targets) {
    Preconditions.checkArgument(!targets.isEmpty(), "at least one target is required");
    Instant now = clock.instant();
    Alert testAlert =
        Alert.builder()
            .id(TEST_ALERT_PREFIX + UUID.randomUUID())
            .organizationId(organizationId)
            .kind(AlertKind.THRESHOLD)
            .title("Test notification")
            .description("This is a test notification from CostWatch. No action is required.")
            .severity(Severity.LOW)
            .status(AlertStatus.ACTIVE)
            .triggeredAt(now)
            .version(1)
            .updatedAt(now)
            .build();
    return dispatch(testAlert, targets);
  }

  /** Reschedules every persisted pending notification, honouring its next attempt time. */
  public int resumePending() {
    Instant now = clock.instant();
    List<AlertNotification> pending = notificationStore.findByStatus(NotificationStatus.PENDING);
    for (AlertNotification notification : pending) {
      outcome(notification.getId());
      schedule(
          notification.getId(),
          notification.getNextAttemptAt() == null ? now : notification.getNextAttemptAt());
    }
    LOGGER.info("Resumed {} pending notifications", pending.size());
    return pending.size();
  }

  /** Records that a notification handed over as sent has reached its recipient. */
  public AlertNotification confirmDelivery(String notificationId) {
    AlertNotification notification =
        notificationStore
            .findById(notificationId)
            .orElseThrow(
                () -> new IllegalArgumentException("Unknown notification: " + notificationId));
    if (notification.getStatus() == NotificationStatus.DELIVERED) {
      return notification;
    }
    Preconditions.checkState(
        notification.getStatus() == NotificationStatus.SENT,
        "Notification %s is %s, only sent notifications can be confirmed",
        notificationId,
        notification.getStatus());
    return notificationStore
        .compareAndSet(
            notification.getVersion(),
            notification.toBuilder()
                .status(NotificationStatus.DELIVERED)
                .deliveredAt(clock.instant())
                .build())
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "Notification " + notificationId + " changed while confirming delivery"));
  }

  public List<AlertNotification> getNotifications(String alertId) {
    return notificationStore.findByAlertId(alertId);
  }

  public void shutdown() {
    scheduler.shutdownNow();
    sendExecutor.shutdownNow();
  }

  private CompletableFuture<AlertNotification> outcome(String notificationId) {
    return outcomes.computeIfAbsent(notificationId, k -> new CompletableFuture<>());
  }

  private void schedule(String notificationId, Instant dueAt) {
    if (scheduler.isShutdown()) {
      LOGGER.info("Dispatcher is stopped, notification {} stays pending", notificationId);
      return;
    }
    Duration delay = Duration.between(clock.instant(), dueAt);
    try {
      scheduler.schedule(
          () -> runAttempt(notificationId, dueAt),
          delay.isNegative() ? 0 : delay.toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      if (!scheduler.isShutdown()) {
        throw e;
      }
      LOGGER.info("Dispatcher stopped, notification {} stays pending", notificationId);
    }
  }

  private void runAttempt(String notificationId, Instant dueAt) {
    try {
      attempt(notificationId, dueAt);
    } catch (RuntimeException e) {
      LOGGER.error("Notification {} attempt failed unexpectedly", notificationId, e);
      Optional.ofNullable(outcomes.remove(notificationId))
          .ifPresent(future -> future.completeExceptionally(e));
    }
  }

  private void attempt(String notificationId, Instant dueAt) {
    if (!inFlight.add(notificationId)) {
      LOGGER.debug("Notification {} already has an attempt in flight", notificationId);
      return;
    }
    Instant retryAt = null;
    try {
      Optional<AlertNotification> current = notificationStore.findById(notificationId);
      if (current.isEmpty() || current.get().getStatus() != NotificationStatus.PENDING) {
        current.ifPresent(this::complete);
        return;
      }
      AlertNotification notification = current.get();
      if (notification.getNextAttemptAt() != null
          && notification.getNextAttemptAt().isAfter(dueAt)) {
        LOGGER.debug(
            "Notification {} is due at {}, dropping attempt scheduled for {}",
            notificationId,
            notification.getNextAttemptAt(),
            dueAt);
        return;
      }

      Optional<NotificationSender> sender = senderRegistry.find(notification.getChannel());
      if (sender.isEmpty()) {
        String reason = "No sender registered for channel " + notification.getChannel();
        update(
                notification,
                notification.toBuilder()
                    .status(NotificationStatus.FAILED)
                    .lastError(reason)
                    .nextAttemptAt(null)
                    .build())
            .ifPresent(
                failed -> {
                  metaAlertSink.configurationError(
                      failed.getOrganizationId(), "notification " + notificationId, reason);
                  complete(failed);
                });
        return;
      }

      try {
        DeliveryStatus deliveryStatus = sendWithTimeout(sender.get(), notification);
        onSuccess(notification, deliveryStatus);
      } catch (NotificationDeliveryException e) {
        retryAt = onFailure(notification, e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.info("Attempt of notification {} interrupted, it stays pending", notificationId);
      } catch (RejectedExecutionException e) {
        if (!sendExecutor.isShutdown()) {
          throw e;
        }
        LOGGER.info("Dispatcher stopped, notification {} stays pending", notificationId);
      }
    } finally {
      inFlight.remove(notificationId);
    }
    if (retryAt != null) {
      schedule(notificationId, retryAt);
    }
  }

  private DeliveryStatus sendWithTimeout(
      NotificationSender sender, AlertNotification notification)
      throws NotificationDeliveryException, InterruptedException {
    Future<DeliveryStatus> future =
        sendExecutor.submit(
            () ->
                sender.send(
                    notification.getChannel(),
                    notification.getRecipient(),
                    notification.getSubject(),
                    notification.getBody()));
    Duration timeout = config.getSendTimeout();
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new NotificationDeliveryException("Send timed out after " + timeout, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof NotificationDeliveryException) {
        throw (NotificationDeliveryException) e.getCause();
      }
      throw new NotificationDeliveryException("Sender failed: " + e.getCause(), e.getCause());
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  private void onSuccess(AlertNotification notification, DeliveryStatus deliveryStatus) {
    Instant now = clock.instant();
    AlertNotification.AlertNotificationBuilder<?, ?> updated =
        notification.toBuilder()
            .attemptCount(notification.getAttemptCount() + 1)
            .sentAt(now)
            .nextAttemptAt(null)
            .lastError(null);
    if (deliveryStatus == DeliveryStatus.DELIVERED) {
      updated.status(NotificationStatus.DELIVERED).deliveredAt(now);
    } else {
      updated.status(NotificationStatus.SENT);
    }
    update(notification, updated.build())
        .ifPresent(
            stored -> {
              LOGGER.info(
                  "Notification {} of alert {} {} over {} to {}",
                  stored.getId(),
                  stored.getAlertId(),
                  stored.getStatus(),
                  stored.getChannel(),
                  stored.getRecipient());
              deliveredCounter
                  .computeIfAbsent(
                      stored.getOrganizationId(),
                      k ->
                          Counter.builder(NOTIFICATION_DELIVERED_COUNTER)
                              .tag("organizationId", k)
                              .register(meterRegistry))
                  .increment();
              complete(stored);
            });
  }

  /** Returns the time of the next attempt, or null when the notification has failed. */
  private Instant onFailure(AlertNotification notification, NotificationDeliveryException e) {
    int attempts = notification.getAttemptCount() + 1;
    if (retryPolicy.canRetry(notification.getRetryCount())) {
      int retry = notification.getRetryCount() + 1;
      Duration delay = retryPolicy.delayForRetry(retry);
      LOGGER.warn(
          "Attempt {} of notification {} over {} failed, retrying in {}: {}",
          attempts,
          notification.getId(),
          notification.getChannel(),
          delay,
          e.getMessage());
      return update(
              notification,
              notification.toBuilder()
                  .retryCount(retry)
                  .attemptCount(attempts)
                  .lastError(e.getMessage())
                  .nextAttemptAt(clock.instant().plus(delay))
                  .build())
          .map(AlertNotification::getNextAttemptAt)
          .orElse(null);
    }

    update(
            notification,
            notification.toBuilder()
                .status(NotificationStatus.FAILED)
                .attemptCount(attempts)
                .lastError(e.getMessage())
                .nextAttemptAt(null)
                .build())
        .ifPresent(
            failed -> {
              metaAlertSink.notificationExhausted(failed);
              complete(failed);
            });
    return null;
  }

  private Optional<AlertNotification> update(
      AlertNotification current, AlertNotification updated) {
    Optional<AlertNotification> stored =
        notificationStore.compareAndSet(current.getVersion(), updated);
    if (stored.isEmpty()) {
      LOGGER.warn("Notification {} changed during an attempt, dropping result", current.getId());
    }
    return stored;
  }

  private void complete(AlertNotification notification) {
    Optional.ofNullable(outcomes.remove(notification.getId()))
        .ifPresent(future -> future.complete(notification));
  }
}

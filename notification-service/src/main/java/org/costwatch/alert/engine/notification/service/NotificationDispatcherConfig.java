package org.costwatch.alert.engine.notification.service;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.costwatch.alert.engine.datamodel.NotificationChannelType;
import org.costwatch.alert.engine.datamodel.NotificationTarget;

/** Settings under {@code notification}. */
@Getter
public class NotificationDispatcherConfig {
  static final String MAX_RETRIES_CONFIG = "max.retries";
  static final String BACKOFF_BASE_CONFIG = "backoff.base";
  static final String BACKOFF_FACTOR_CONFIG = "backoff.factor";
  static final String BACKOFF_MAX_CONFIG = "backoff.max";
  static final String SEND_TIMEOUT_CONFIG = "send.timeout";
  static final String WORKER_THREADS_CONFIG = "worker.threads";
  static final String DEFAULT_TARGETS_CONFIG = "default.targets";
  private static final String TARGET_CHANNEL = "channel";
  private static final String TARGET_RECIPIENT = "recipient";

  private final RetryPolicy retryPolicy;
  private final Duration sendTimeout;
  private final int workerThreads;
  private final List<NotificationTarget> defaultTargets;

  private NotificationDispatcherConfig(
      RetryPolicy retryPolicy,
      Duration sendTimeout,
      int workerThreads,
      List<NotificationTarget> defaultTargets) {
    Preconditions.checkArgument(workerThreads > 0, "worker.threads must be positive");
    this.retryPolicy = retryPolicy;
    this.sendTimeout = sendTimeout;
    this.workerThreads = workerThreads;
    this.defaultTargets = List.copyOf(defaultTargets);
  }

  public static NotificationDispatcherConfig from(Config notificationConfig) {
    RetryPolicy retryPolicy =
        new RetryPolicy(
            notificationConfig.hasPath(MAX_RETRIES_CONFIG)
                ? notificationConfig.getInt(MAX_RETRIES_CONFIG)
                : RetryPolicy.DEFAULT_MAX_RETRIES,
            notificationConfig.hasPath(BACKOFF_BASE_CONFIG)
                ? notificationConfig.getDuration(BACKOFF_BASE_CONFIG)
                : RetryPolicy.DEFAULT_BACKOFF_BASE,
            notificationConfig.hasPath(BACKOFF_FACTOR_CONFIG)
                ? notificationConfig.getDouble(BACKOFF_FACTOR_CONFIG)
                : RetryPolicy.DEFAULT_BACKOFF_FACTOR,
            notificationConfig.hasPath(BACKOFF_MAX_CONFIG)
                ? notificationConfig.getDuration(BACKOFF_MAX_CONFIG)
                : RetryPolicy.DEFAULT_BACKOFF_MAX);
    List<NotificationTarget> defaultTargets =
        notificationConfig.hasPath(DEFAULT_TARGETS_CONFIG)
            ? notificationConfig.getConfigList(DEFAULT_TARGETS_CONFIG).stream()
                .map(
                    target ->
                        NotificationTarget.of(
                            NotificationChannelType.fromString(target.getString(TARGET_CHANNEL)),
                            target.getString(TARGET_RECIPIENT)))
                .collect(Collectors.toList())
            : List.of();
    return new NotificationDispatcherConfig(
        retryPolicy,
        notificationConfig.hasPath(SEND_TIMEOUT_CONFIG)
            ? notificationConfig.getDuration(SEND_TIMEOUT_CONFIG)
            : Duration.ofSeconds(10),
        notificationConfig.hasPath(WORKER_THREADS_CONFIG)
            ? notificationConfig.getInt(WORKER_THREADS_CONFIG)
            : 4,
        defaultTargets);
  }
}

package org.costwatch.alert.engine.notification.transport;

import com.typesafe.config.Config;
import java.time.Duration;

/** Settings under {@code notification.transport}. */
public class NotificationSenderConfig {
  private static final String HTTP_CONNECT_TIMEOUT = "http.connect.timeout";
  private static final String HTTP_READ_TIMEOUT = "http.read.timeout";
  private static final Duration DEFAULT_HTTP_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration DEFAULT_HTTP_READ_TIMEOUT = Duration.ofSeconds(10);

  private final Duration httpConnectTimeout;
  private final Duration httpReadTimeout;

  public static NotificationSenderConfig from(Config transportConfig) {
    return new NotificationSenderConfig(
        transportConfig.hasPath(HTTP_CONNECT_TIMEOUT)
            ? transportConfig.getDuration(HTTP_CONNECT_TIMEOUT)
            : DEFAULT_HTTP_CONNECT_TIMEOUT,
        transportConfig.hasPath(HTTP_READ_TIMEOUT)
            ? transportConfig.getDuration(HTTP_READ_TIMEOUT)
            : DEFAULT_HTTP_READ_TIMEOUT);
  }

  private NotificationSenderConfig(Duration httpConnectTimeout, Duration httpReadTimeout) {
    this.httpConnectTimeout = httpConnectTimeout;
    this.httpReadTimeout = httpReadTimeout;
  }

  public Duration getHttpConnectTimeout() {
    return httpConnectTimeout;
  }

  public Duration getHttpReadTimeout() {
    return httpReadTimeout;
  }
}

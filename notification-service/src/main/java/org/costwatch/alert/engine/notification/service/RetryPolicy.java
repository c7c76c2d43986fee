package org.costwatch.alert.engine.notification.service;

import com.google.common.base.Preconditions;
import java.time.Duration;

/**
 * Exponential backoff with a cap. Retry {@code n} (1-based) waits {@code base * factor^(n-1)},
 * never longer than {@code max}. A notification gets at most {@code maxRetries + 1} attempts.
 */
public class RetryPolicy {
  static final int DEFAULT_MAX_RETRIES = 5;
  static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(30);
  static final double DEFAULT_BACKOFF_FACTOR = 2.0;
  static final Duration DEFAULT_BACKOFF_MAX = Duration.ofMinutes(30);

  private final int maxRetries;
  private final Duration base;
  private final double factor;
  private final Duration max;

  public RetryPolicy(int maxRetries, Duration base, double factor, Duration max) {
    Preconditions.checkArgument(maxRetries >= 0, "max.retries must be >= 0");
    Preconditions.checkArgument(!base.isNegative(), "backoff.base must be >= 0");
    Preconditions.checkArgument(factor >= 1.0, "backoff.factor must be >= 1");
    Preconditions.checkArgument(max.compareTo(base) >= 0, "backoff.max must be >= backoff.base");
    this.maxRetries = maxRetries;
    this.base = base;
    this.factor = factor;
    this.max = max;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  /** Whether a notification that has been retried {@code retryCount} times may try again. */
  public boolean canRetry(int retryCount) {
    return retryCount < maxRetries;
  }

  public Duration delayForRetry(int retry) {
    Preconditions.checkArgument(retry >= 1, "retries are numbered from 1");
    double delayMillis = base.toMillis() * Math.pow(factor, retry - 1);
    if (delayMillis >= max.toMillis()) {
      return max;
    }
    return Duration.ofMillis((long) delayMillis);
  }
}

package org.costwatch.alert.engine.datamodel.metric;

/** Upstream data could not be fetched in time; callers skip the affected rule for this cycle. */
public class MetricUnavailableException extends Exception {
  public MetricUnavailableException(String message) {
    super(message);
  }

  public MetricUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

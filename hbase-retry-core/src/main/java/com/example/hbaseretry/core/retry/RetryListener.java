package com.example.hbaseretry.core.retry;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Listener notified before each retry attempt (never before the first attempt).
 *
 * <h3>Metrics Example</h3>
 *
 * <pre>{@code
 * RetryListener listener = (attempt, failure) ->
 *     metrics.increment("hbase.retries", "error", failure.getClass().getSimpleName());
 *
 * var policy = RetryPolicy.<Get>of(3, IOException.class).withListener(listener);
 * }</pre>
 */
@FunctionalInterface
public interface RetryListener {

  /**
   * Called after an expected failure, before the callback runs and the operation is invoked again.
   *
   * @param attempt number of the attempt that failed, 1-based
   * @param failure the failure that triggered the retry
   */
  void onRetry(int attempt, Exception failure);

  /** Returns a listener that does nothing. */
  static RetryListener noop() {
    return (attempt, failure) -> {};
  }

  /** Returns a listener that logs every retry at DEBUG level. */
  static RetryListener logging() {
    final var logger = System.getLogger(RetryListener.class.getName());
    return (attempt, failure) ->
        logger.log(DEBUG, "Retry after attempt {0} failed: {1}", attempt, failure.toString());
  }
}

package com.example.hbaseretry.core.config;

import com.example.hbaseretry.core.retry.RetryPolicy;
import java.util.Optional;

/**
 * Process-wide retry defaults.
 *
 * <p>The default retry budget can be supplied via system property or environment variable:
 *
 * <ul>
 *   <li>hbase.retry.count / HBASE_RETRY_COUNT (default 1)
 * </ul>
 *
 * <p>Blank, non-numeric or negative values are ignored. The value is read on every call, so
 * policies should be built once at startup and passed to the code that wraps operations.
 */
public final class RetryDefaults {

  public static final String RETRY_COUNT_PROPERTY = "hbase.retry.count";
  public static final String RETRY_COUNT_ENV = "HBASE_RETRY_COUNT";

  private RetryDefaults() {}

  /** Returns the configured default retry budget. */
  public static int retryBudget() {
    return Optional.ofNullable(System.getProperty(RETRY_COUNT_PROPERTY))
        .or(() -> Optional.ofNullable(System.getenv(RETRY_COUNT_ENV)))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .flatMap(
            val -> {
              try {
                return Optional.of(Integer.parseInt(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .filter(parsed -> parsed >= 0)
        .orElse(RetryPolicy.DEFAULT_RETRY_BUDGET);
  }

  /**
   * Creates a policy with the default retry budget.
   *
   * @param kinds exception classes considered transient
   * @param <A> argument type of the wrapped operations
   * @return policy without callback
   */
  @SafeVarargs
  public static <A> RetryPolicy<A> policy(final Class<? extends Exception>... kinds) {
    return RetryPolicy.of(retryBudget(), kinds);
  }
}

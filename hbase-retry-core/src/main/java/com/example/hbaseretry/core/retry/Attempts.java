package com.example.hbaseretry.core.retry;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

/**
 * Attempt bookkeeping for a single invocation of a wrapped operation.
 *
 * <p>Instances are never shared between invocations.
 */
final class Attempts<A, E extends Exception> {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private final RetryPolicy<A> policy;
  private final A args;
  private final String operation;
  private final AttemptHistory history = new AttemptHistory();
  private int retries;

  Attempts(final RetryPolicy<A> policy, final A args, final String operation) {
    this.policy = policy;
    this.args = args;
    this.operation = operation;
  }

  /**
   * Decides what to do with a failed attempt.
   *
   * <p>Returns normally when the operation should be invoked again, after the listener and the
   * callback have run. Otherwise rethrows {@code failure} unchanged.
   *
   * @param failure exception thrown by the attempt
   * @throws E the failure itself, if it is unexpected or the budget is exhausted
   */
  void onFailure(final Exception failure) throws E {
    @SuppressWarnings("unchecked")
    final E typedFailure = (E) failure;

    if (!policy.expectedErrors().matches(failure)) throw typedFailure;

    history.record(failure);
    if (retries >= policy.retryBudget()) {
      LOGGER.log(ERROR, "Got too many exceptions: {0}. Raising the last one.", history);
      throw typedFailure;
    }

    LOGGER.log(
        INFO,
        "Got expected exception {0} while running {1}. {2} attempts left.",
        failure.getClass().getSimpleName(),
        operation,
        policy.retryBudget() - retries);

    retries++;
    policy.listener().onRetry(retries, failure);
    if (policy.callback() != null) policy.callback().accept(args);
  }

  int retries() {
    return retries;
  }

  AttemptHistory history() {
    return history;
  }
}

package com.example.hbaseretry.core.retry;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Immutable retry configuration shared by every invocation of a wrapped operation.
 *
 * <p>A policy is built once and can wrap any number of operations:
 *
 * <pre>{@code
 * final var policy = RetryPolicy.<Get>of(2, TTransportException.class)
 *     .withCallback(get -> connection.reopen());
 *
 * final var get = policy.wrap(table::get);
 * final var scan = policy.wrapSequence(table::scan);
 * }</pre>
 *
 * @param expectedErrors classifier selecting the failures that are retried
 * @param retryBudget number of additional attempts after the first, must be >= 0
 * @param callback hook run with the original argument before each retry, may be null
 * @param listener listener notified before each retry
 * @param <A> argument type of the wrapped operations
 */
public record RetryPolicy<A>(
    ExpectedErrors expectedErrors,
    int retryBudget,
    Consumer<? super A> callback,
    RetryListener listener) {

  /** Retry budget used when none is configured. */
  public static final int DEFAULT_RETRY_BUDGET = 1;

  public RetryPolicy {
    Objects.requireNonNull(expectedErrors, "expectedErrors");
    Objects.requireNonNull(listener, "listener");
    if (retryBudget < 0) throw new IllegalArgumentException("retryBudget must be >= 0");
  }

  /**
   * Creates a policy retrying the given exception kinds.
   *
   * @param retryBudget number of additional attempts after the first
   * @param kinds exception classes considered transient
   * @param <A> argument type of the wrapped operations
   * @return policy without callback
   */
  @SafeVarargs
  public static <A> RetryPolicy<A> of(
      final int retryBudget, final Class<? extends Exception>... kinds) {
    return of(retryBudget, ExpectedErrors.of(kinds));
  }

  /**
   * Creates a policy retrying failures accepted by the classifier.
   *
   * @param retryBudget number of additional attempts after the first
   * @param expectedErrors classifier selecting the failures that are retried
   * @param <A> argument type of the wrapped operations
   * @return policy without callback
   */
  public static <A> RetryPolicy<A> of(final int retryBudget, final ExpectedErrors expectedErrors) {
    return new RetryPolicy<>(expectedErrors, retryBudget, null, RetryListener.noop());
  }

  /** Returns a policy that never retries. */
  public static <A> RetryPolicy<A> noRetry() {
    return of(0, ExpectedErrors.none());
  }

  /**
   * Returns a copy of this policy running {@code callback} before each retry.
   *
   * @param callback hook receiving the original argument, typically refreshing a stale resource
   * @return new policy
   */
  public RetryPolicy<A> withCallback(final Consumer<? super A> callback) {
    return new RetryPolicy<>(expectedErrors, retryBudget, callback, listener);
  }

  /**
   * Returns a copy of this policy notifying {@code listener} before each retry.
   *
   * @param listener retry listener
   * @return new policy
   */
  public RetryPolicy<A> withListener(final RetryListener listener) {
    return new RetryPolicy<>(expectedErrors, retryBudget, callback, listener);
  }

  /**
   * Wraps a single-shot operation with this policy.
   *
   * @see Retry#wrap(CheckedFunction, RetryPolicy)
   */
  public <R, E extends Exception> RetryableCall<A, R, E> wrap(
      final CheckedFunction<A, R, E> operation) {
    return Retry.wrap(operation, this);
  }

  /**
   * Wraps a sequence-producing operation with this policy.
   *
   * @see Retry#wrapSequence(CheckedFunction, RetryPolicy)
   */
  public <T, E extends Exception> RetryableSequence<A, T, E> wrapSequence(
      final CheckedFunction<A, Iterator<T>, E> operation) {
    return Retry.wrapSequence(operation, this);
  }
}

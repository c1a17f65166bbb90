package com.example.hbaseretry.core.retry;

import java.util.Objects;

/**
 * Single-shot operation re-executed while it fails with an expected error and budget remains.
 *
 * <p>The wrapper keeps the contract of the operation it wraps: same argument, same result and the
 * same exception the caller would have seen without retrying. Unexpected failures propagate on the
 * first occurrence. When the budget runs out the most recent failure is rethrown, after the full
 * attempt history has been logged.
 *
 * <p>Each call to {@link #apply(Object)} owns its own attempt counter and history, so one instance
 * can be used from several threads.
 *
 * @param <A> argument type
 * @param <R> result type
 * @param <E> checked exception type of the operation
 */
public final class RetryableCall<A, R, E extends Exception> implements CheckedFunction<A, R, E> {

  private final CheckedFunction<A, R, E> operation;
  private final RetryPolicy<A> policy;
  private final String name;

  RetryableCall(
      final CheckedFunction<A, R, E> operation, final RetryPolicy<A> policy, final String name) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.name = Objects.requireNonNull(name, "name");
  }

  @Override
  public R apply(final A args) throws E {
    final var attempts = new Attempts<A, E>(policy, args, name);
    while (true) {
      try {
        return operation.apply(args);
      } catch (final Exception e) {
        attempts.onFailure(e);
      }
    }
  }

  /**
   * Returns a copy of this call that uses {@code name} in log messages.
   *
   * @param name operation name, for example the Thrift method
   * @return renamed call
   */
  public RetryableCall<A, R, E> named(final String name) {
    return new RetryableCall<>(operation, policy, name);
  }

  public RetryPolicy<A> policy() {
    return policy;
  }

  @Override
  public String toString() {
    return "RetryableCall[" + name + "]";
  }
}

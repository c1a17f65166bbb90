package com.example.hbaseretry.core.retry;

import java.util.Iterator;

/**
 * Entry points for wrapping operations with a {@link RetryPolicy}.
 *
 * <p>Provides two kinds of wrappers:
 *
 * <ul>
 *   <li><b>Calls</b> - {@link #wrap(CheckedFunction, RetryPolicy)} re-executes a single-shot
 *       operation while it fails with an expected error.
 *   <li><b>Sequences</b> - {@link #wrapSequence(CheckedFunction, RetryPolicy)} retries an
 *       operation returning an iterator until its first element has been produced; the rest of
 *       the elements are not supervised.
 * </ul>
 *
 * <h2>Typical usage</h2>
 *
 * <pre>{@code
 * final var policy = RetryPolicy.<byte[]>of(1, TTransportException.class)
 *     .withCallback(row -> connection.reopen());
 *
 * final var getRow = Retry.wrap((byte[] row) -> client.getRow(table, row), policy);
 * final var result = getRow.apply(ByteStrings.ensureBytes("row-1"));
 * }</pre>
 *
 * <p>Failures always reach the caller in their original form. The retry layer never wraps or
 * translates an exception, it only decides whether to try again first.
 *
 * @see RetryPolicy
 * @see ExpectedErrors
 * @see RetryListener
 */
public final class Retry {

  private Retry() {}

  /**
   * Wraps a single-shot operation.
   *
   * @param operation operation to execute
   * @param policy retry policy
   * @param <A> argument type
   * @param <R> result type
   * @param <E> checked exception type of the operation
   * @return operation with the same contract and retry behavior
   */
  public static <A, R, E extends Exception> RetryableCall<A, R, E> wrap(
      final CheckedFunction<A, R, E> operation, final RetryPolicy<A> policy) {
    return new RetryableCall<>(operation, policy, String.valueOf(operation));
  }

  /**
   * Wraps an operation that takes no argument. The callback, if any, receives {@code null}.
   *
   * @param operation operation to execute
   * @param policy retry policy
   * @param <R> result type
   * @param <E> checked exception type of the operation
   * @return supplier with the same contract and retry behavior
   */
  public static <R, E extends Exception> CheckedSupplier<R, E> wrapSupplier(
      final CheckedSupplier<R, E> operation, final RetryPolicy<Void> policy) {
    final var call =
        new RetryableCall<Void, R, E>(ignored -> operation.get(), policy, String.valueOf(operation));
    return () -> call.apply(null);
  }

  /**
   * Wraps an operation returning an iterator.
   *
   * @param operation operation producing the iterator
   * @param policy retry policy applied to producing the iterator and its first element
   * @param <A> argument type
   * @param <T> element type
   * @param <E> checked exception type of the operation
   * @return sequence with the same elements and retry behavior
   */
  public static <A, T, E extends Exception> RetryableSequence<A, T, E> wrapSequence(
      final CheckedFunction<A, Iterator<T>, E> operation, final RetryPolicy<A> policy) {
    return new RetryableSequence<>(operation, policy, String.valueOf(operation));
  }

  /**
   * Wraps an iterator-producing operation that takes no argument.
   *
   * @param operation operation producing the iterator
   * @param policy retry policy applied to producing the iterator and its first element
   * @param <T> element type
   * @param <E> checked exception type of the operation
   * @return supplier of iterators with the same elements and retry behavior
   */
  public static <T, E extends Exception> CheckedSupplier<Iterator<T>, E> wrapSequenceSupplier(
      final CheckedSupplier<Iterator<T>, E> operation, final RetryPolicy<Void> policy) {
    final var sequence =
        new RetryableSequence<Void, T, E>(
            ignored -> operation.get(), policy, String.valueOf(operation));
    return () -> sequence.open(null);
  }
}

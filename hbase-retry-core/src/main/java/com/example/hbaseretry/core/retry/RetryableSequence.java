package com.example.hbaseretry.core.retry;

import java.util.Iterator;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Sequence-producing operation whose establishment is retried.
 *
 * <p>The policy covers invoking the operation and pulling the first element of the iterator it
 * returns. If either fails with an expected error, the operation is invoked again from scratch.
 * Once the first element is in hand the remaining elements are read from the same iterator with no
 * retry: elements already handed to the caller cannot be taken back, so a failure while draining
 * propagates as is.
 *
 * <p>Re-invoking the operation repeats whatever side effects it has. Whether that is acceptable is
 * up to the caller.
 *
 * <pre>{@code
 * final var scan = Retry.wrapSequence(
 *     (KeyRange range) -> client.scannerOpen(table, range),
 *     RetryPolicy.<KeyRange>of(2, TTransportException.class).withCallback(r -> client.reconnect()));
 *
 * final var rows = scan.open(KeyRange.prefix("user#"));
 * while (rows.hasNext()) process(rows.next());
 * }</pre>
 *
 * @param <A> argument type
 * @param <T> element type
 * @param <E> checked exception type of the operation
 */
public final class RetryableSequence<A, T, E extends Exception> {

  private final CheckedFunction<A, Iterator<T>, E> operation;
  private final RetryPolicy<A> policy;
  private final String name;

  RetryableSequence(
      final CheckedFunction<A, Iterator<T>, E> operation,
      final RetryPolicy<A> policy,
      final String name) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.name = Objects.requireNonNull(name, "name");
  }

  /**
   * Invokes the operation and pulls its first element, retrying according to the policy.
   *
   * @param args argument passed to the operation and to the callback
   * @return iterator yielding exactly what the operation's iterator yields
   * @throws E if the operation fails with an unexpected error, or with an expected one after the
   *     budget is exhausted
   */
  public Iterator<T> open(final A args) throws E {
    final var attempts = new Attempts<A, E>(policy, args, name);
    while (true) {
      final var iterator = new RetryingIterator<T>();
      try {
        iterator.establish(operation.apply(args));
        return iterator;
      } catch (final Exception e) {
        attempts.onFailure(e);
      }
    }
  }

  /**
   * Same as {@link #open(Object)}, exposed as a sequential ordered stream.
   *
   * @param args argument passed to the operation and to the callback
   * @return stream over the elements
   * @throws E under the same conditions as {@link #open(Object)}
   */
  public Stream<T> stream(final A args) throws E {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(open(args), Spliterator.ORDERED), false);
  }

  /**
   * Returns a copy of this sequence that uses {@code name} in log messages.
   *
   * @param name operation name
   * @return renamed sequence
   */
  public RetryableSequence<A, T, E> named(final String name) {
    return new RetryableSequence<>(operation, policy, name);
  }

  public RetryPolicy<A> policy() {
    return policy;
  }

  @Override
  public String toString() {
    return "RetryableSequence[" + name + "]";
  }
}

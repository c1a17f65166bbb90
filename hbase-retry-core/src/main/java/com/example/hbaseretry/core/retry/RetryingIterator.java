package com.example.hbaseretry.core.retry;

import static java.lang.System.Logger.Level.DEBUG;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Iterator over a producer whose first element was pulled under retry supervision.
 *
 * <p>States:
 *
 * <ul>
 *   <li>{@code START} - no producer yet. {@link #establish(Iterator)} pulls the first element; if
 *       that throws, the state stays {@code START} and a fresh producer may be tried.
 *   <li>{@code DRAINING} - the buffered first element is returned, then the remaining elements
 *       come straight from the producer. Nothing is retried here.
 *   <li>{@code TERMINAL} - the producer is exhausted or one of its failures escaped.
 * </ul>
 */
final class RetryingIterator<T> implements Iterator<T> {

  private static final System.Logger LOGGER = System.getLogger(RetryingIterator.class.getName());

  enum State {
    START,
    DRAINING,
    TERMINAL
  }

  private State state = State.START;
  private Iterator<T> producer;
  private T first;
  private boolean firstPending;

  /**
   * Pulls the first element from {@code candidate}.
   *
   * @param candidate producer returned by the latest invocation of the operation
   * @return false if the producer was empty
   * @throws RuntimeException whatever the producer throws while yielding its first element
   */
  boolean establish(final Iterator<T> candidate) {
    if (state != State.START) throw new IllegalStateException("Iterator already established");
    Objects.requireNonNull(candidate, "operation returned a null iterator");

    if (!candidate.hasNext()) {
      state = State.TERMINAL;
      LOGGER.log(DEBUG, "Producer is empty");
      return false;
    }

    first = candidate.next();
    firstPending = true;
    producer = candidate;
    state = State.DRAINING;
    LOGGER.log(DEBUG, "First element received, draining producer");
    return true;
  }

  State state() {
    return state;
  }

  @Override
  public boolean hasNext() {
    switch (state) {
      case START:
        throw new IllegalStateException("Iterator not established");
      case TERMINAL:
        return false;
      default:
        break;
    }

    if (firstPending) return true;

    try {
      if (producer.hasNext()) return true;
    } catch (final RuntimeException e) {
      terminate();
      throw e;
    }

    terminate();
    LOGGER.log(DEBUG, "Producer exhausted");
    return false;
  }

  @Override
  public T next() {
    if (!hasNext()) throw new NoSuchElementException();

    if (firstPending) {
      final var element = first;
      first = null;
      firstPending = false;
      return element;
    }

    try {
      return producer.next();
    } catch (final RuntimeException e) {
      terminate();
      throw e;
    }
  }

  private void terminate() {
    state = State.TERMINAL;
    producer = null;
  }
}

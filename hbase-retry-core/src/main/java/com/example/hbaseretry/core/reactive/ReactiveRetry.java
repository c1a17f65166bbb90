package com.example.hbaseretry.core.reactive;

import com.example.hbaseretry.core.retry.RetryableSequence;
import java.util.Iterator;
import reactor.core.publisher.Flux;

/**
 * Reactive access to a {@link RetryableSequence}.
 *
 * <pre>{@code
 * final var scan = policy.wrapSequence(table::scan);
 *
 * ReactiveRetry.flux(scan, KeyRange.prefix("user#"))
 *     .map(Row::value)
 *     .subscribe(System.out::println);
 * }</pre>
 *
 * <p>Establishing the sequence blocks the subscribing thread while attempts are made.
 */
public final class ReactiveRetry {
  private ReactiveRetry() {}

  /**
   * Returns a cold {@link Flux} over the sequence.
   *
   * <p>Every subscription opens the sequence again, with the full retry policy applied to
   * establishing it. A failure to establish is signalled through {@code onError}.
   *
   * @param sequence the sequence to open
   * @param args argument passed to the operation and to the callback
   * @param <A> argument type
   * @param <T> element type
   * @return flux emitting the elements of the sequence
   */
  public static <A, T> Flux<T> flux(final RetryableSequence<A, T, ?> sequence, final A args) {
    return Flux.defer(
        () -> {
          final Iterator<T> iterator;
          try {
            iterator = sequence.open(args);
          } catch (final Exception e) {
            return Flux.<T>error(e);
          }
          return Flux.<T>fromIterable(() -> iterator);
        });
  }
}

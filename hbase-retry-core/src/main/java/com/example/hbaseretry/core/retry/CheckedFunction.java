package com.example.hbaseretry.core.retry;

/**
 * Function that can throw a checked exception.
 *
 * <p>Operations taking several inputs pass them as a single argument value, typically a record.
 *
 * @param <A> argument type
 * @param <R> result type
 * @param <E> checked exception type
 */
@FunctionalInterface
public interface CheckedFunction<A, R, E extends Exception> {
  R apply(A args) throws E;
}

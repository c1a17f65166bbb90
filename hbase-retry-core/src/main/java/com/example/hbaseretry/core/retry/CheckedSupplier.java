package com.example.hbaseretry.core.retry;

/**
 * Supplier that can throw a checked exception.
 *
 * @param <R> result type
 * @param <E> checked exception type
 */
@FunctionalInterface
public interface CheckedSupplier<R, E extends Exception> {
  R get() throws E;
}

package com.example.hbaseretry.core.retry;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Classifies failures as expected (transient, worth another attempt) or not.
 *
 * <p>The usual classifier is a set of exception kinds. A failure matches when it is an instance of
 * one of them, so subclasses match the same way they would in a catch clause.
 *
 * <h3>Combining Classifiers</h3>
 *
 * <pre>{@code
 * var expected = ExpectedErrors.of(IOException.class)
 *     .or(ExpectedErrors.custom(e -> e.getMessage() != null && e.getMessage().contains("region moved")));
 * }</pre>
 */
@FunctionalInterface
public interface ExpectedErrors {

  /**
   * Determines if the failure should be retried.
   *
   * @param failure the exception thrown by the operation
   * @return true if the failure is expected
   */
  boolean matches(Exception failure);

  /**
   * Returns a classifier that matches nothing, which disables retrying.
   *
   * @return empty classifier
   */
  static ExpectedErrors none() {
    return failure -> false;
  }

  /**
   * Creates a classifier from a set of exception kinds.
   *
   * @param kinds exception classes considered transient
   * @return classifier matching instances of any of the kinds
   */
  @SafeVarargs
  static ExpectedErrors of(final Class<? extends Exception>... kinds) {
    return of(Arrays.asList(kinds));
  }

  /**
   * Creates a classifier from a collection of exception kinds.
   *
   * @param kinds exception classes considered transient
   * @return classifier matching instances of any of the kinds
   */
  static ExpectedErrors of(final Collection<Class<? extends Exception>> kinds) {
    final Set<Class<? extends Exception>> copy = Set.copyOf(kinds);
    if (copy.isEmpty()) return none();

    return failure -> {
      if (failure == null) return false;
      for (final var kind : copy) if (kind.isInstance(failure)) return true;
      return false;
    };
  }

  /**
   * Creates a custom classifier from a predicate.
   *
   * @param predicate the predicate to use for classification
   * @return custom classifier
   */
  static ExpectedErrors custom(final Predicate<? super Exception> predicate) {
    return predicate::test;
  }

  /**
   * Combines this classifier with another using OR logic.
   *
   * @param other the other classifier to combine with
   * @return combined classifier
   */
  default ExpectedErrors or(final ExpectedErrors other) {
    return failure -> this.matches(failure) || other.matches(failure);
  }
}

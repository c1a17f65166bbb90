package com.example.hbaseretry.core.config;

import com.example.hbaseretry.core.retry.ExpectedErrors;
import com.example.hbaseretry.core.retry.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Retry settings read from JSON.
 *
 * <pre>{@code
 * {
 *   "retryCount": 2,
 *   "expectedExceptions": ["java.io.IOException", "java.util.concurrent.TimeoutException"]
 * }
 * }</pre>
 *
 * @param retryCount additional attempts after the first; {@link RetryDefaults#retryBudget()} when
 *     absent
 * @param expectedExceptions fully qualified names of the exception classes to retry; nothing is
 *     retried when absent
 */
public record RetrySettings(Integer retryCount, List<String> expectedExceptions) {

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  public RetrySettings {
    if (retryCount != null && retryCount < 0)
      throw new IllegalArgumentException("retryCount must be >= 0");
    expectedExceptions = expectedExceptions == null ? List.of() : List.copyOf(expectedExceptions);
  }

  /**
   * Sets the supplier of the {@link ObjectMapper} to use for deserialization.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Parses settings from a JSON document.
   *
   * @param json the JSON text
   * @return parsed settings
   * @throws IllegalArgumentException if the document cannot be parsed
   */
  public static RetrySettings parse(final String json) {
    try {
      return mapperSupplier.get().readValue(json, RetrySettings.class);
    } catch (final IOException exception) {
      throw new IllegalArgumentException("Failed to parse retry settings", exception);
    }
  }

  /**
   * Reads settings from a JSON stream, for example a classpath resource.
   *
   * @param in the JSON stream, not closed by this method
   * @return parsed settings
   * @throws IllegalArgumentException if the stream cannot be read or parsed
   */
  public static RetrySettings load(final InputStream in) {
    try {
      return mapperSupplier.get().readValue(in, RetrySettings.class);
    } catch (final IOException exception) {
      throw new IllegalArgumentException("Failed to load retry settings", exception);
    }
  }

  /** Returns the retry budget, falling back to {@link RetryDefaults#retryBudget()}. */
  public int effectiveRetryCount() {
    return Optional.ofNullable(retryCount).orElseGet(RetryDefaults::retryBudget);
  }

  /**
   * Builds a policy, resolving exception names with the context class loader.
   *
   * @param <A> argument type of the wrapped operations
   * @return policy without callback
   * @throws IllegalArgumentException if a name is unknown or not an exception class
   */
  public <A> RetryPolicy<A> toPolicy() {
    return toPolicy(
        Optional.ofNullable(Thread.currentThread().getContextClassLoader())
            .orElse(RetrySettings.class.getClassLoader()));
  }

  /**
   * Builds a policy, resolving exception names with {@code loader}.
   *
   * @param loader class loader used to resolve the exception classes
   * @param <A> argument type of the wrapped operations
   * @return policy without callback
   * @throws IllegalArgumentException if a name is unknown or not an exception class
   */
  public <A> RetryPolicy<A> toPolicy(final ClassLoader loader) {
    final List<Class<? extends Exception>> kinds = new ArrayList<>();
    for (final var name : expectedExceptions) kinds.add(resolve(name, loader));
    return RetryPolicy.of(effectiveRetryCount(), ExpectedErrors.of(kinds));
  }

  private static Class<? extends Exception> resolve(final String name, final ClassLoader loader) {
    final Class<?> type;
    try {
      type = Class.forName(name.trim(), false, loader);
    } catch (final ClassNotFoundException e) {
      throw new IllegalArgumentException("Unknown exception class: " + name, e);
    }

    if (!Exception.class.isAssignableFrom(type)) {
      throw new IllegalArgumentException("Not an exception class: " + name);
    }
    return type.asSubclass(Exception.class);
  }
}

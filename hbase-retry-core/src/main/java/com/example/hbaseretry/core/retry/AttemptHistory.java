package com.example.hbaseretry.core.retry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Expected failures caught during one invocation, in the order they occurred. */
final class AttemptHistory {

  private final List<Exception> failures = new ArrayList<>();

  void record(final Exception failure) {
    failures.add(failure);
  }

  int size() {
    return failures.size();
  }

  List<Exception> failures() {
    return List.copyOf(failures);
  }

  Optional<Exception> last() {
    return failures.isEmpty() ? Optional.empty() : Optional.of(failures.get(failures.size() - 1));
  }

  @Override
  public String toString() {
    return failures.stream().map(Exception::toString).collect(Collectors.joining(", ", "[", "]"));
  }
}

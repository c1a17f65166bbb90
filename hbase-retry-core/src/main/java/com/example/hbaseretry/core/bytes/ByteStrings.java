package com.example.hbaseretry.core.bytes;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/** Helpers for row keys and other byte strings. */
public final class ByteStrings {

  static final byte[] EMPTY = new byte[0];

  private ByteStrings() {}

  /**
   * Converts text to bytes and leaves bytes as they are.
   *
   * @param value a {@code byte[]} or a {@link CharSequence}
   * @return {@code value} itself for byte arrays, the UTF-8 encoding for text
   * @throws IllegalArgumentException for any other type
   */
  public static byte[] ensureBytes(final Object value) {
    if (value instanceof byte[] bytes) return bytes;
    if (value instanceof CharSequence text) return text.toString().getBytes(StandardCharsets.UTF_8);

    throw new IllegalArgumentException(
        "input must be a text or byte string, got "
            + (value == null ? "null" : value.getClass().getSimpleName()));
  }

  /**
   * Compares two byte strings lexicographically, treating bytes as unsigned.
   *
   * @return negative, zero or positive as {@code left} sorts before, equal to or after {@code
   *     right}
   */
  public static int compare(final byte[] left, final byte[] right) {
    return Arrays.compareUnsigned(
        Objects.requireNonNull(left, "left"), Objects.requireNonNull(right, "right"));
  }

  /**
   * Renders a byte string for log messages. Printable ASCII is kept, other bytes are written as
   * {@code \xNN}.
   */
  public static String toStringBinary(final byte[] bytes) {
    if (bytes == null) return "null";

    final var result = new StringBuilder(bytes.length);
    for (final byte b : bytes) {
      final var ch = b & 0xFF;
      if (ch >= ' ' && ch <= '~' && ch != '\\') {
        result.append((char) ch);
      } else {
        result.append(String.format("\\x%02X", ch));
      }
    }
    return result.toString();
  }
}

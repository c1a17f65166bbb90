package com.example.hbaseretry.core.bytes;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Lexicographic successor of a byte string, used to turn a row prefix into an exclusive stop row.
 *
 * <pre>{@code
 * ByteSuccessor.successor(new byte[] {0x12, (byte) 0xFE}); // {0x12, 0xFF}
 * ByteSuccessor.successor(new byte[] {0x12, (byte) 0xFF}); // {0x13}
 * ByteSuccessor.successor(new byte[] {(byte) 0xFF});       // empty
 * }</pre>
 */
public final class ByteSuccessor {

  private ByteSuccessor() {}

  /**
   * Returns the shortest byte string that sorts after {@code key} when compared byte-wise as
   * unsigned values.
   *
   * <p>The last byte that is not {@code 0xFF} is incremented and everything after it is dropped.
   * If every byte is {@code 0xFF}, or {@code key} is empty, no such string exists and the result is
   * empty. {@code key} itself is not modified.
   *
   * @param key the byte string
   * @return the successor, or empty if there is none
   */
  public static Optional<byte[]> successor(final byte[] key) {
    Objects.requireNonNull(key, "key");

    // Search for the place where the trailing 0xFFs start
    var offset = key.length;
    while (offset > 0 && key[offset - 1] == (byte) 0xFF) offset--;

    if (offset == 0) return Optional.empty();

    final var next = Arrays.copyOf(key, offset);
    next[offset - 1]++;
    return Optional.of(next);
  }

  /**
   * Returns the successor of the UTF-8 encoding of {@code key}.
   *
   * @param key the text key
   * @return the successor, or empty if there is none
   */
  public static Optional<byte[]> successor(final String key) {
    return successor(ByteStrings.ensureBytes(key));
  }

  /**
   * Returns the row at which a scan for every row starting with {@code prefix} should stop.
   *
   * <p>When the prefix has no successor the scan has to run to the end of the table, which is
   * expressed by an empty stop row.
   *
   * @param prefix the row key prefix
   * @return the exclusive stop row, empty when unbounded
   */
  public static byte[] stopRowForPrefix(final byte[] prefix) {
    return successor(prefix).orElseGet(() -> ByteStrings.EMPTY.clone());
  }
}

package com.example.hbaseretry.core.bytes;

import java.util.Arrays;
import java.util.Objects;

/**
 * Half-open range of row keys, {@code [startRow, stopRow)}.
 *
 * <p>An empty stop row means the range runs to the end of the table. Arrays are copied on the way
 * in and on the way out.
 *
 * @param startRow first row key in the range (inclusive)
 * @param stopRow row key ending the range (exclusive), empty when unbounded
 */
public record KeyRange(byte[] startRow, byte[] stopRow) {

  public KeyRange {
    Objects.requireNonNull(startRow, "startRow");
    Objects.requireNonNull(stopRow, "stopRow");
    if (stopRow.length > 0 && ByteStrings.compare(startRow, stopRow) > 0) {
      throw new IllegalArgumentException(
          "Invalid range: "
              + ByteStrings.toStringBinary(startRow)
              + " > "
              + ByteStrings.toStringBinary(stopRow));
    }
    startRow = startRow.clone();
    stopRow = stopRow.clone();
  }

  /**
   * Creates the range covering every row that starts with {@code prefix}.
   *
   * @param prefix the row key prefix
   * @return range from {@code prefix} to its successor, unbounded if it has none
   */
  public static KeyRange prefix(final byte[] prefix) {
    return new KeyRange(prefix, ByteSuccessor.stopRowForPrefix(prefix));
  }

  /** Same as {@link #prefix(byte[])} for the UTF-8 encoding of {@code prefix}. */
  public static KeyRange prefix(final String prefix) {
    return prefix(ByteStrings.ensureBytes(prefix));
  }

  /** Returns the range covering the whole table. */
  public static KeyRange all() {
    return new KeyRange(ByteStrings.EMPTY, ByteStrings.EMPTY);
  }

  @Override
  public byte[] startRow() {
    return startRow.clone();
  }

  @Override
  public byte[] stopRow() {
    return stopRow.clone();
  }

  public boolean isUnboundedAbove() {
    return stopRow.length == 0;
  }

  /**
   * Checks whether {@code row} falls in this range.
   *
   * @param row the row key
   * @return true if {@code startRow <= row < stopRow}
   */
  public boolean contains(final byte[] row) {
    if (ByteStrings.compare(row, startRow) < 0) return false;
    return isUnboundedAbove() || ByteStrings.compare(row, stopRow) < 0;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof KeyRange other)) return false;
    return Arrays.equals(startRow, other.startRow) && Arrays.equals(stopRow, other.stopRow);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(startRow) + Arrays.hashCode(stopRow);
  }

  @Override
  public String toString() {
    return "KeyRange[startRow="
        + ByteStrings.toStringBinary(startRow)
        + ", stopRow="
        + ByteStrings.toStringBinary(stopRow)
        + "]";
  }
}

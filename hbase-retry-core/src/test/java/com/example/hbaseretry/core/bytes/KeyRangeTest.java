package com.example.hbaseretry.core.bytes;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.*;

class KeyRangeTest {

  private static byte[] bytes(final String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Nested
  @DisplayName("Prefix Ranges")
  class PrefixRanges {

    @Test
    @DisplayName("Should contain rows with the prefix and nothing after it")
    void shouldContainRowsWithPrefix() {
      final var range = KeyRange.prefix("user#");

      assertTrue(range.contains(bytes("user#")));
      assertTrue(range.contains(bytes("user#0001")));
      assertTrue(range.contains(new byte[] {'u', 's', 'e', 'r', '#', (byte) 0xFF, (byte) 0xFF}));
      assertFalse(range.contains(bytes("user$")));
      assertFalse(range.contains(bytes("user")));
      assertFalse(range.isUnboundedAbove());
      assertArrayEquals(bytes("user$"), range.stopRow());
    }

    @Test
    @DisplayName("Should be unbounded above when the prefix has no successor")
    void shouldBeUnboundedForMaxPrefix() {
      final var range = KeyRange.prefix(new byte[] {(byte) 0xFF, (byte) 0xFF});

      assertTrue(range.isUnboundedAbove());
      assertTrue(range.contains(new byte[] {(byte) 0xFF, (byte) 0xFF, 0x00}));
      assertFalse(range.contains(new byte[] {(byte) 0xFE}));
    }

    @Test
    @DisplayName("Empty prefix should cover the whole table")
    void emptyPrefixShouldCoverTable() {
      assertEquals(KeyRange.all(), KeyRange.prefix(new byte[0]));
      assertTrue(KeyRange.all().contains(new byte[0]));
      assertTrue(KeyRange.all().contains(bytes("anything")));
    }
  }

  @Nested
  @DisplayName("Validation & Value Semantics")
  class Validation {

    @Test
    @DisplayName("Should reject a start row after the stop row")
    void shouldRejectInvertedRange() {
      final var thrown =
          assertThrows(
              IllegalArgumentException.class, () -> new KeyRange(bytes("b"), bytes("a")));
      assertEquals("Invalid range: b > a", thrown.getMessage());
    }

    @Test
    @DisplayName("Should compare bytes as unsigned when validating")
    void shouldCompareUnsigned() {
      assertDoesNotThrow(() -> new KeyRange(new byte[] {0x7F}, new byte[] {(byte) 0x80}));
      assertThrows(
          IllegalArgumentException.class,
          () -> new KeyRange(new byte[] {(byte) 0x80}, new byte[] {0x7F}));
    }

    @Test
    @DisplayName("Should copy arrays in and out")
    void shouldCopyArrays() {
      final var start = bytes("a");
      final var range = new KeyRange(start, bytes("c"));

      start[0] = 'z';
      range.startRow()[0] = 'z';

      assertArrayEquals(bytes("a"), range.startRow());
    }

    @Test
    @DisplayName("Should compare by content")
    void shouldCompareByContent() {
      assertEquals(KeyRange.prefix("row"), new KeyRange(bytes("row"), bytes("rox")));
      assertEquals(
          KeyRange.prefix("row").hashCode(), new KeyRange(bytes("row"), bytes("rox")).hashCode());
      assertEquals("KeyRange[startRow=row, stopRow=rox]", KeyRange.prefix("row").toString());
    }
  }

  @Nested
  @DisplayName("ByteStrings")
  class ByteStringsTests {

    @Test
    @DisplayName("ensureBytes should keep bytes, encode text and reject anything else")
    void ensureBytesShouldConvertText() {
      final var raw = new byte[] {1, 2};

      assertSame(raw, ByteStrings.ensureBytes(raw));
      assertArrayEquals(bytes("row"), ByteStrings.ensureBytes("row"));
      assertArrayEquals(bytes("row"), ByteStrings.ensureBytes(new StringBuilder("row")));

      final var thrown =
          assertThrows(IllegalArgumentException.class, () -> ByteStrings.ensureBytes(42));
      assertEquals("input must be a text or byte string, got Integer", thrown.getMessage());
      assertThrows(IllegalArgumentException.class, () -> ByteStrings.ensureBytes(null));
    }

    @Test
    @DisplayName("compare should order bytes as unsigned and shorter prefixes first")
    void compareShouldBeUnsignedLexicographic() {
      assertTrue(ByteStrings.compare(new byte[] {0x7F}, new byte[] {(byte) 0x80}) < 0);
      assertTrue(ByteStrings.compare(bytes("ab"), bytes("abc")) < 0);
      assertEquals(0, ByteStrings.compare(bytes("abc"), bytes("abc")));
    }

    @Test
    @DisplayName("toStringBinary should escape non-printable bytes")
    void toStringBinaryShouldEscape() {
      assertEquals("row\\x00\\xFF", ByteStrings.toStringBinary(new byte[] {'r', 'o', 'w', 0, -1}));
      assertEquals("a\\x5Cb", ByteStrings.toStringBinary(bytes("a\\b")));
      assertEquals("null", ByteStrings.toStringBinary(null));
    }
  }
}

package com.example;

import com.example.hbaseretry.core.bytes.ByteStrings;
import com.example.hbaseretry.core.bytes.KeyRange;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory table standing in for a remote HBase table.
 *
 * <p>The "connection" can be dropped; scans then fail with {@link IOException} until {@link
 * #reconnect()} is called.
 */
public class FlakyTable {

  /** A row of the table. */
  public record Row(String key, String value) {}

  private final NavigableMap<byte[], String> rows = new TreeMap<>(ByteStrings::compare);
  private final AtomicInteger reconnects = new AtomicInteger(0);
  private final AtomicInteger scans = new AtomicInteger(0);
  private volatile boolean connected = true;

  public void put(final String key, final String value) {
    rows.put(ByteStrings.ensureBytes(key), value);
  }

  /** Simulates the server closing the connection. */
  public void dropConnection() {
    connected = false;
  }

  public void reconnect() {
    connected = true;
    reconnects.incrementAndGet();
  }

  /**
   * Opens a scanner over the rows in {@code range}.
   *
   * <p>The first element is read lazily, so a dropped connection surfaces when the caller asks for
   * it, as with a real scanner.
   *
   * @param range the rows to scan
   * @return iterator over matching rows, in key order
   * @throws IOException if the connection is down when the scanner is opened
   */
  public Iterator<Row> scan(final KeyRange range) throws IOException {
    scans.incrementAndGet();
    if (!connected) throw new IOException("connection reset");

    final var view =
        range.isUnboundedAbove()
            ? rows.tailMap(range.startRow(), true)
            : rows.subMap(range.startRow(), true, range.stopRow(), false);

    final List<Row> snapshot = new ArrayList<>();
    view.forEach((key, value) -> snapshot.add(new Row(new String(key, StandardCharsets.UTF_8), value)));
    return snapshot.iterator();
  }

  public int reconnects() {
    return reconnects.get();
  }

  public int scans() {
    return scans.get();
  }
}

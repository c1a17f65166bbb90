package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.FlakyTable.Row;
import com.example.hbaseretry.core.bytes.KeyRange;
import com.example.hbaseretry.core.config.RetryDefaults;
import com.example.hbaseretry.core.retry.RetryListener;
import com.example.hbaseretry.core.retry.RetryableSequence;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Demo application scanning a row prefix while surviving a dropped connection. */
public class App {
  private final RetryableSequence<KeyRange, Row, IOException> scan;

  /**
   * Constructs the application around a table, reconnecting before each retried scan.
   *
   * @param table the table to scan
   */
  public App(final FlakyTable table) {
    this.scan =
        RetryDefaults.<KeyRange>policy(IOException.class)
            .withCallback(range -> table.reconnect())
            .withListener(RetryListener.logging())
            .wrapSequence(table::scan)
            .named("scan");
  }

  /**
   * Entry point. Fills a table, drops its connection and prints the rows under one prefix.
   *
   * @param args CLI args (unused)
   * @throws Exception on unexpected failures
   */
  public static void main(String[] args) throws Exception {

    final var logger = System.getLogger(App.class.getName());

    final var table = new FlakyTable();
    table.put("user#0001", "alice");
    table.put("user#0002", "bob");
    table.put("user$", "not a user");
    table.put("video#0001", "intro");
    table.dropConnection();

    final var app = new App(table);
    for (final var row : app.scanPrefix("user#")) {
      logger.log(INFO, "%s = %s".formatted(row.key(), row.value()));
    }
  }

  /**
   * Returns every row whose key starts with {@code prefix}.
   *
   * @param prefix the row key prefix
   * @return the matching rows, in key order
   * @throws IOException if the table stays unreachable after the configured retries
   */
  public List<Row> scanPrefix(final String prefix) throws IOException {
    final var result = new ArrayList<Row>();
    scan.open(KeyRange.prefix(prefix)).forEachRemaining(result::add);
    return result;
  }
}

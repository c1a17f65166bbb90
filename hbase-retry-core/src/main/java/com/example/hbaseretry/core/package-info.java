/**
 * Root package for the hbase-retry library.
 *
 * <p>This package groups the primitives a higher-level HBase client uses around its I/O: retry
 * wrappers for calls and scans, and the byte-string successor used to build scan boundaries.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.hbaseretry.core.bytes.ByteSuccessor} - shortest byte string sorting
 *       after a given one, and stop rows for prefix scans.
 *   <li>{@link com.example.hbaseretry.core.bytes.KeyRange} - half-open row key range.
 *   <li>{@link com.example.hbaseretry.core.bytes.ByteStrings} - text/byte conversion, unsigned
 *       comparison and printable rendering of row keys.
 *   <li>{@link com.example.hbaseretry.core.retry.Retry} - wraps calls and iterator-producing
 *       operations with a {@link com.example.hbaseretry.core.retry.RetryPolicy}.
 *   <li>{@link com.example.hbaseretry.core.retry.RetryableCall} - single-shot operation with
 *       retry.
 *   <li>{@link com.example.hbaseretry.core.retry.RetryableSequence} - operation producing an
 *       iterator, retried until its first element is available.
 *   <li>{@link com.example.hbaseretry.core.config.RetryDefaults} - default retry budget from
 *       system properties or environment.
 *   <li>{@link com.example.hbaseretry.core.config.RetrySettings} - retry settings parsed from JSON.
 *   <li>{@link com.example.hbaseretry.core.reactive.ReactiveRetry} - exposes a retryable sequence
 *       as a Reactor {@code Flux}.
 * </ul>
 */
package com.example.hbaseretry.core;

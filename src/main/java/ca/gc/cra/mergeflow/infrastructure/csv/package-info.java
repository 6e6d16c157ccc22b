/**
 * Delimited-text decoding over merged source streams.
 * <p>Each source is parsed as its own segment with FastCSV, so rows never span sources and a source without a
 * trailing newline still terminates its last row.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.infrastructure.csv;

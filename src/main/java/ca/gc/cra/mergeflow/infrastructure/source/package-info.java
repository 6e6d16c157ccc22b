/**
 * Source adapters: files, globs and file URLs, in-memory payloads, and the scheme registry that resolves
 * textual specifications.
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.infrastructure.source;

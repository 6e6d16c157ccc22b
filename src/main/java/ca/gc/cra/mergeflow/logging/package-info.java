/**
 * Logging helpers. MERGEFLOW logs through SLF4J; the binding is chosen by the embedding application.
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.logging;

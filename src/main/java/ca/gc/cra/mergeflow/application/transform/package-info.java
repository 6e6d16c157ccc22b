/**
 * Decode-then-map composition turning record iterators into typed value iterators.
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.application.transform;

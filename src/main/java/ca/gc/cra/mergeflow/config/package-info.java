/**
 * YAML configuration binding and the composition root.
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.config;

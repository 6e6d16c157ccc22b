/**
 * Input validation helpers shared by configuration binding and adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.validation;

/**
 * Use cases that orchestrate source resolution, multiplexing and decoding.
 *
 * @since 0.1.0
 */
package ca.gc.cra.mergeflow.application.pipeline;

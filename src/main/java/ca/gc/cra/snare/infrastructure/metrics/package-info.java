/**
 * OpenTelemetry-backed implementation of the metrics port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure.metrics;

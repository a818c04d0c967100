/**
 * Application layer: ports, threat analysis, alerting, the recording pipeline, and listener control.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.application;

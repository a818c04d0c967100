/**
 * Ports between the SNARE capture pipeline and its adapters: decoy listeners and handlers, the event store,
 * metrics, and time.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.application.port;

/**
 * Adapters: sockets and protocol decoys, SQLite persistence, OpenTelemetry metrics, threads, and time.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure;

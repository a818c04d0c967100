/**
 * Read-side request and result types for the event store: pagination, allow-listed filters, and aggregate
 * statistics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.application.query;

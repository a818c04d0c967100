/**
 * SQLite persistence for attack events and alerts.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure.persistence;

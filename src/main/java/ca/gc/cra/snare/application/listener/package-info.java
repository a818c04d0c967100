/**
 * Lifecycle control for decoy listeners.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.application.listener;

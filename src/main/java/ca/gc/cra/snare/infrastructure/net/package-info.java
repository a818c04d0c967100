/**
 * Blocking-socket decoy listeners.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure.net;

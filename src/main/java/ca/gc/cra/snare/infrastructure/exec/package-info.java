/**
 * Named thread factories for listener and connection threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure.exec;

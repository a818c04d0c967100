/**
 * Scripted decoy exchanges, one {@link ca.gc.cra.snare.application.port.ConnectionHandler} per protocol.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure.protocol;

/**
 * SSH-like banner decoy.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure.protocol.ssh;

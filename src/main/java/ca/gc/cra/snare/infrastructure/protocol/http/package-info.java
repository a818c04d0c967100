/**
 * HTTP-like decoy and request summarization.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.infrastructure.protocol.http;

/**
 * <strong>Purpose:</strong> Input validation helpers shared by configuration, CLI, and query layers.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.
 * <p><strong>Security:</strong> Rejects control characters and out-of-range values before sockets are bound
 * or SQL statements are prepared.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.validation;

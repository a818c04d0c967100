/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound attacker-controlled text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from concurrent connection handlers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Provides truncation and redaction helpers so captured payloads and credentials
 * do not flood or leak into operator logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.snare.logging;

package ca.gc.cra.snare.application.port;

import ca.gc.cra.snare.domain.attack.CapturedAttack;

/**
 * Receives captures from decoy listeners once the client connection is closed.
 *
 * <p>Implementations are invoked concurrently from connection worker threads and must not throw; listeners
 * log and discard anything that escapes.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CaptureSink {
  /**
   * Accepts one captured attack.
   *
   * @param attack sanitized capture; never {@code null}
   */
  void accept(CapturedAttack attack);
}

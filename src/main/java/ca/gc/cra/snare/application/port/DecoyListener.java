package ca.gc.cra.snare.application.port;

import ca.gc.cra.snare.domain.attack.Protocol;

/**
 * <strong>What:</strong> A running decoy service bound to one address and port.
 * <p><strong>Lifecycle:</strong> {@link #start()} binds and returns once the socket is accepting;
 * {@link #stop()} stops accepting, lets in-flight connections finish their exchange, and is idempotent.</p>
 * <p><strong>Thread-safety:</strong> Lifecycle methods may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public interface DecoyListener {

  /**
   * Binds the listening socket and starts the accept loop.
   *
   * @throws ListenerBindException if the address or port cannot be bound, or the listener is already running
   */
  void start() throws ListenerBindException;

  /** Stops accepting connections; in-flight exchanges complete and their captures are delivered. */
  void stop();

  /** @return protocol served by this listener */
  Protocol protocol();

  /** @return configured bind host */
  String host();

  /**
   * Returns the bound port once started, otherwise the configured port.
   *
   * @return TCP port; resolves an ephemeral {@code 0} after {@link #start()}
   */
  int port();

  /** @return {@code true} while the accept loop is running */
  boolean isRunning();
}

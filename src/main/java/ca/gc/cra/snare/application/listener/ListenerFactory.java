package ca.gc.cra.snare.application.listener;

import ca.gc.cra.snare.application.port.DecoyListener;
import ca.gc.cra.snare.domain.attack.Protocol;

/**
 * Creates unstarted decoy listeners for the registry.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ListenerFactory {
  /**
   * Creates a listener for the protocol.
   *
   * @param protocol decoy protocol
   * @param host validated bind host
   * @param port validated port; {@code 0} requests an ephemeral port
   * @return unstarted listener
   */
  DecoyListener create(Protocol protocol, String host, int port);
}

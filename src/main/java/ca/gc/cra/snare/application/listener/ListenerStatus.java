package ca.gc.cra.snare.application.listener;

import ca.gc.cra.snare.domain.attack.Protocol;
import java.util.Objects;

/**
 * Snapshot of one registered listener.
 *
 * @param protocol decoy protocol
 * @param host bind host
 * @param port bound port
 * @param running whether the accept loop is live
 * @since 0.1.0
 */
public record ListenerStatus(Protocol protocol, String host, int port, boolean running) {
  public ListenerStatus {
    protocol = Objects.requireNonNull(protocol, "protocol");
    host = Objects.requireNonNull(host, "host");
  }
}

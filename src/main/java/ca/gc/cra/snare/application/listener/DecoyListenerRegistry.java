package ca.gc.cra.snare.application.listener;

import ca.gc.cra.snare.application.port.DecoyListener;
import ca.gc.cra.snare.application.port.ListenerBindException;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.validation.Net;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Inbound control surface that starts, stops, and lists decoy listeners by protocol.
 * <p><strong>Why:</strong> At most one listener runs per protocol; the registry enforces that and gives the CLI a
 * single place to shut everything down.</p>
 * <p><strong>Thread-safety:</strong> Methods are synchronized; listener start-up happens under the registry
 * monitor so two concurrent starts for one protocol cannot both bind.</p>
 *
 * @since 0.1.0
 */
public final class DecoyListenerRegistry {
  private static final Logger log = LoggerFactory.getLogger(DecoyListenerRegistry.class);

  private final ListenerFactory factory;
  private final Map<Protocol, DecoyListener> listeners = new EnumMap<>(Protocol.class);

  /**
   * Creates a registry.
   *
   * @param factory listener factory
   */
  public DecoyListenerRegistry(ListenerFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Creates and starts a listener for the protocol.
   *
   * @param protocol decoy protocol
   * @param host bind host
   * @param port bind port; {@code 0} requests an ephemeral port
   * @return status of the started listener, reporting the bound port
   * @throws ListenerBindException if a listener for the protocol is already running or the bind fails
   * @throws IllegalArgumentException if the host or port is invalid
   */
  public synchronized ListenerStatus start(Protocol protocol, String host, int port)
      throws ListenerBindException {
    Objects.requireNonNull(protocol, "protocol");
    String bindHost = Net.validateBindHost(host);
    int bindPort = Net.validatePort(protocol.label() + "Port", port, true);
    DecoyListener existing = listeners.get(protocol);
    if (existing != null && existing.isRunning()) {
      throw new ListenerBindException(existing.host(), existing.port(),
          new IllegalStateException(protocol + " listener already running"));
    }
    DecoyListener listener = factory.create(protocol, bindHost, bindPort);
    listener.start();
    listeners.put(protocol, listener);
    log.info("{} decoy listening on {}:{}", protocol, listener.host(), listener.port());
    return statusOf(listener);
  }

  /**
   * Stops the listener for the protocol, if any.
   *
   * @param protocol decoy protocol
   * @return {@code true} when a listener was registered
   */
  public synchronized boolean stop(Protocol protocol) {
    DecoyListener listener = listeners.remove(Objects.requireNonNull(protocol, "protocol"));
    if (listener == null) {
      return false;
    }
    listener.stop();
    log.info("{} decoy stopped", protocol);
    return true;
  }

  /** Stops every registered listener. */
  public synchronized void stopAll() {
    for (Protocol protocol : new ArrayList<>(listeners.keySet())) {
      stop(protocol);
    }
  }

  /**
   * Lists registered listeners in protocol order.
   *
   * @return status snapshots
   */
  public synchronized List<ListenerStatus> list() {
    List<ListenerStatus> out = new ArrayList<>(listeners.size());
    for (DecoyListener listener : listeners.values()) {
      out.add(statusOf(listener));
    }
    return List.copyOf(out);
  }

  private static ListenerStatus statusOf(DecoyListener listener) {
    return new ListenerStatus(listener.protocol(), listener.host(), listener.port(), listener.isRunning());
  }
}

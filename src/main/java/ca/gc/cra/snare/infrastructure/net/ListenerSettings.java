package ca.gc.cra.snare.infrastructure.net;

import ca.gc.cra.snare.validation.Net;
import ca.gc.cra.snare.validation.Numbers;

/**
 * Bind address and limits for one decoy listener.
 *
 * @param host bind host
 * @param port bind port; {@code 0} requests an ephemeral port
 * @param backlog accept queue length hint
 * @param maxConnections concurrent handler cap; {@code 0} means unbounded
 * @since 0.1.0
 */
public record ListenerSettings(String host, int port, int backlog, int maxConnections) {
  /** Accept backlog used when none is configured. */
  public static final int DEFAULT_BACKLOG = 50;

  public ListenerSettings {
    host = Net.validateBindHost(host);
    Net.validatePort("port", port, true);
    Numbers.requireRange("backlog", backlog, 1, 65_535);
    Numbers.requireRange("maxConnections", maxConnections, 0, 100_000);
  }

  /**
   * Settings with the default backlog and no admission gate.
   *
   * @param host bind host
   * @param port bind port
   * @return settings
   */
  public static ListenerSettings of(String host, int port) {
    return new ListenerSettings(host, port, DEFAULT_BACKLOG, 0);
  }
}

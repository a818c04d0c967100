package ca.gc.cra.snare.application.port;

/**
 * Raised when a decoy listener cannot bind its address and port.
 *
 * @since 0.1.0
 */
public class ListenerBindException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String host;
  private final int port;

  public ListenerBindException(String host, int port, Throwable cause) {
    super("failed to bind " + host + ":" + port + (cause == null ? "" : ": " + cause.getMessage()), cause);
    this.host = host;
    this.port = port;
  }

  /** @return host the listener attempted to bind */
  public String host() {
    return host;
  }

  /** @return port the listener attempted to bind */
  public int port() {
    return port;
  }
}

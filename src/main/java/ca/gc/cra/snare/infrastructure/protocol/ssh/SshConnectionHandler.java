package ca.gc.cra.snare.infrastructure.protocol.ssh;

import ca.gc.cra.snare.application.port.ConnectionHandler;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.RawCapture;
import ca.gc.cra.snare.infrastructure.protocol.SocketExchange;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> SSH-like decoy: announces an OpenSSH banner and captures the client's first message.
 * <p><strong>Why:</strong> Scanners and brute-force tools reveal their client version string (and sometimes
 * credentials) in the first packet after the banner.</p>
 * <p><strong>Thread-safety:</strong> Stateless; one instance serves all connections.</p>
 *
 * @since 0.1.0
 */
public final class SshConnectionHandler implements ConnectionHandler {
  private static final Logger log = LoggerFactory.getLogger(SshConnectionHandler.class);

  static final String BANNER = "SSH-2.0-OpenSSH_8.2p1 Ubuntu-4ubuntu0.3\r\n";
  static final int READ_BYTES = 1024;

  private final Duration readTimeout;

  /** Creates a handler with the default 30 second read timeout. */
  public SshConnectionHandler() {
    this(SocketExchange.DEFAULT_READ_TIMEOUT);
  }

  /**
   * Creates a handler.
   *
   * @param readTimeout how long to wait for the client's first message
   */
  public SshConnectionHandler(Duration readTimeout) {
    this.readTimeout = SocketExchange.requireTimeout(readTimeout);
  }

  @Override
  public Protocol protocol() {
    return Protocol.SSH;
  }

  @Override
  public RawCapture handle(Socket socket) {
    String payload = "";
    try {
      SocketExchange.applyTimeout(socket, readTimeout);
      SocketExchange.send(socket, BANNER);
      String received = SocketExchange.receive(socket, READ_BYTES);
      if (received != null) {
        payload = received.trim();
      }
    } catch (SocketTimeoutException ex) {
      log.debug("SSH client {} sent nothing within {}", socket.getRemoteSocketAddress(), readTimeout);
    } catch (IOException ex) {
      log.debug("SSH exchange with {} ended early: {}", socket.getRemoteSocketAddress(), ex.toString());
    }
    return new RawCapture(AttackType.SSH_BRUTE_FORCE, payload);
  }
}

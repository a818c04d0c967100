package ca.gc.cra.snare.infrastructure.protocol.ftp;

import ca.gc.cra.snare.application.port.ConnectionHandler;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.RawCapture;
import ca.gc.cra.snare.infrastructure.protocol.SocketExchange;
import ca.gc.cra.snare.logging.Logs;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> FTP-like decoy that walks a client through {@code USER}/{@code PASS} and always rejects
 * the login.
 * <p><strong>Why:</strong> Captures the credential pair a brute-force tool is trying.</p>
 * <p><strong>Protocol:</strong> At most {@value #MAX_COMMANDS} reads. {@code PASS} or end of stream ends the
 * exchange; unknown commands get a {@code 500} reply.</p>
 * <p><strong>Thread-safety:</strong> Stateless; per-connection state lives on the stack.</p>
 *
 * @since 0.1.0
 */
public final class FtpConnectionHandler implements ConnectionHandler {
  private static final Logger log = LoggerFactory.getLogger(FtpConnectionHandler.class);

  static final String BANNER = "220 FTP Server Ready\r\n";
  static final String PASSWORD_REQUIRED = "331 Password required\r\n";
  static final String LOGIN_INCORRECT = "530 Login incorrect\r\n";
  static final String NOT_UNDERSTOOD = "500 Command not understood\r\n";
  static final int MAX_COMMANDS = 4;
  static final int READ_BYTES = 1024;

  private final Duration readTimeout;

  /** Creates a handler with the default 30 second read timeout. */
  public FtpConnectionHandler() {
    this(SocketExchange.DEFAULT_READ_TIMEOUT);
  }

  /**
   * Creates a handler.
   *
   * @param readTimeout per-command read timeout
   */
  public FtpConnectionHandler(Duration readTimeout) {
    this.readTimeout = SocketExchange.requireTimeout(readTimeout);
  }

  @Override
  public Protocol protocol() {
    return Protocol.FTP;
  }

  @Override
  public RawCapture handle(Socket socket) {
    String username = "";
    String password = "";
    try {
      SocketExchange.applyTimeout(socket, readTimeout);
      SocketExchange.send(socket, BANNER);
      for (int i = 0; i < MAX_COMMANDS; i++) {
        String received = SocketExchange.receive(socket, READ_BYTES);
        if (received == null) {
          break;
        }
        String line = received.trim();
        if (isCommand(line, "USER")) {
          username = argument(line);
          SocketExchange.send(socket, PASSWORD_REQUIRED);
        } else if (isCommand(line, "PASS")) {
          password = argument(line);
          log.debug("FTP login attempt from {} user={} pass={}",
              socket.getRemoteSocketAddress(), Logs.truncate(username, 64), Logs.redact(password));
          SocketExchange.send(socket, LOGIN_INCORRECT);
          break;
        } else {
          SocketExchange.send(socket, NOT_UNDERSTOOD);
        }
      }
    } catch (IOException ex) {
      log.debug("FTP exchange with {} ended early: {}", socket.getRemoteSocketAddress(), ex.toString());
    }
    return new RawCapture(AttackType.FTP_BRUTE_FORCE, "USER=" + username + " PASS=" + password);
  }

  // Matched in place on the received text; upper-casing can change its length.
  private static boolean isCommand(String line, String verb) {
    return line.regionMatches(true, 0, verb, 0, verb.length());
  }

  private static String argument(String line) {
    return line.length() > 4 ? line.substring(4).trim() : "";
  }
}

package ca.gc.cra.snare.infrastructure.protocol.http;

import ca.gc.cra.snare.application.port.ConnectionHandler;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.RawCapture;
import ca.gc.cra.snare.infrastructure.protocol.SocketExchange;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.Socket;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> HTTP-like decoy that answers every request with a stock Apache "It works!" page.
 * <p><strong>Why:</strong> Web scanners fingerprint by the first request they send; the method, path, and headers
 * are what operators triage.</p>
 * <p><strong>Thread-safety:</strong> Stateless; one instance serves all connections.</p>
 *
 * @since 0.1.0
 */
public final class HttpConnectionHandler implements ConnectionHandler {
  private static final Logger log = LoggerFactory.getLogger(HttpConnectionHandler.class);

  static final String BODY = "<html><body><h1>It works!</h1></body></html>";
  // Byte-for-byte decoy response, including its off-by-one Content-Length.
  static final String RESPONSE = "HTTP/1.1 200 OK\r\n"
      + "Server: Apache/2.4.41 (Ubuntu)\r\n"
      + "Content-Type: text/html; charset=UTF-8\r\n"
      + "Content-Length: 45\r\n"
      + "Connection: close\r\n"
      + "\r\n"
      + BODY;
  static final int READ_BYTES = 4096;

  private final Duration readTimeout;

  /** Creates a handler with the default 30 second read timeout. */
  public HttpConnectionHandler() {
    this(SocketExchange.DEFAULT_READ_TIMEOUT);
  }

  /**
   * Creates a handler.
   *
   * @param readTimeout how long to wait for the request
   */
  public HttpConnectionHandler(Duration readTimeout) {
    this.readTimeout = SocketExchange.requireTimeout(readTimeout);
  }

  @Override
  public Protocol protocol() {
    return Protocol.HTTP;
  }

  @Override
  public RawCapture handle(Socket socket) {
    String request = "";
    try {
      SocketExchange.applyTimeout(socket, readTimeout);
      String received = SocketExchange.receive(socket, READ_BYTES);
      if (received != null) {
        request = received;
      }
      SocketExchange.send(socket, RESPONSE);
    } catch (IOException ex) {
      log.debug("HTTP exchange with {} ended early: {}", socket.getRemoteSocketAddress(), ex.toString());
    }
    return new RawCapture(AttackType.HTTP_PROBE, payloadFor(request));
  }

  static String payloadFor(String request) {
    HttpRequestSummary summary = HttpRequestSummary.parse(request);
    if (summary == null) {
      return "";
    }
    try {
      return summary.toPayload();
    } catch (UncheckedIOException ex) {
      log.warn("Could not render HTTP headers; keeping raw request line", ex);
      return "method=" + summary.method() + " path=" + summary.path();
    }
  }
}

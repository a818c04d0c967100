package ca.gc.cra.snare.infrastructure.protocol;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Blocking read/write helpers shared by the decoy handlers.
 *
 * <p>Reads decode UTF-8 with replacement characters for malformed input, so attacker bytes never raise a
 * decoding error.</p>
 *
 * @since 0.1.0
 */
public final class SocketExchange {
  /** Read timeout applied when a handler is built without one. */
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

  private SocketExchange() {}

  /**
   * Writes ASCII text and flushes.
   *
   * @param socket connected socket
   * @param text wire literal
   * @throws IOException if the peer reset or closed the connection
   */
  public static void send(Socket socket, String text) throws IOException {
    OutputStream out = socket.getOutputStream();
    out.write(text.getBytes(StandardCharsets.US_ASCII));
    out.flush();
  }

  /**
   * Performs a single read of at most {@code maxBytes}.
   *
   * @param socket connected socket
   * @param maxBytes read buffer size
   * @return decoded text, or {@code null} on end of stream
   * @throws IOException on timeout or connection failure
   */
  public static String receive(Socket socket, int maxBytes) throws IOException {
    byte[] buffer = new byte[maxBytes];
    InputStream in = socket.getInputStream();
    int read = in.read(buffer);
    if (read < 0) {
      return null;
    }
    return new String(buffer, 0, read, StandardCharsets.UTF_8);
  }

  /**
   * Applies a read timeout; {@link Duration#ZERO} blocks indefinitely.
   *
   * @param socket connected socket
   * @param timeout read timeout
   * @throws IOException if the socket is already closed
   */
  public static void applyTimeout(Socket socket, Duration timeout) throws IOException {
    socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
  }

  /**
   * Validates a handler read timeout.
   *
   * @param timeout candidate timeout; {@code null} selects {@link #DEFAULT_READ_TIMEOUT}
   * @return validated timeout
   * @throws IllegalArgumentException if negative
   */
  public static Duration requireTimeout(Duration timeout) {
    if (timeout == null) {
      return DEFAULT_READ_TIMEOUT;
    }
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("read timeout must not be negative");
    }
    return timeout;
  }
}

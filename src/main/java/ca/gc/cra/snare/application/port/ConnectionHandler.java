package ca.gc.cra.snare.application.port;

import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.RawCapture;
import java.net.Socket;

/**
 * <strong>What:</strong> Scripted exchange for one protocol decoy.
 * <p><strong>Why:</strong> Listeners stay protocol-agnostic; a handler owns the banner, the reads, and the
 * canned replies for its protocol and nothing else.</p>
 * <p><strong>Contract:</strong> Implementations must never throw. Timeouts, resets, and malformed input still
 * produce a capture, with whatever was read so far. The listener closes the socket after {@link #handle}
 * returns.</p>
 * <p><strong>Thread-safety:</strong> A single handler instance serves many connections concurrently and must
 * hold no per-connection state in fields.</p>
 *
 * @since 0.1.0
 */
public interface ConnectionHandler {

  /**
   * Returns the protocol this handler emulates.
   *
   * @return protocol tag
   */
  Protocol protocol();

  /**
   * Runs the scripted exchange over an accepted connection.
   *
   * @param socket connected client socket; owned by the caller
   * @return captured classification tag and unsanitized payload; never {@code null}
   */
  RawCapture handle(Socket socket);
}

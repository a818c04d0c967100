package ca.gc.cra.snare.domain.attack;

import java.util.Locale;

/**
 * <strong>What:</strong> Services emulated by SNARE decoy listeners.
 * <p><strong>Why:</strong> Used for routing listeners to their connection handlers, tagging persisted events,
 * and filtering queries.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 * <p><strong>Observability:</strong> Values surface in logs (MDC key {@code protocol}) and metric names.</p>
 *
 * @since 0.1.0
 */
public enum Protocol {
  /** SSH-like remote shell login. */
  SSH(2222),
  /** HTTP-like web server. */
  HTTP(8080),
  /** FTP-like file-transfer login. */
  FTP(2121);

  private final int defaultPort;

  Protocol(int defaultPort) {
    this.defaultPort = defaultPort;
  }

  /**
   * Returns the port this decoy listens on when the operator does not configure one.
   *
   * @return default TCP port
   */
  public int defaultPort() {
    return defaultPort;
  }

  /**
   * Returns the lower-case label used in thread names, config keys, and metric names.
   *
   * @return label such as {@code ssh}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a protocol name case-insensitively.
   *
   * @param value raw protocol string
   * @return parsed protocol
   * @throws IllegalArgumentException if the value is blank or not a known protocol
   */
  public static Protocol fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("protocol must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (Protocol protocol : values()) {
      if (protocol.name().equals(normalized)) {
        return protocol;
      }
    }
    throw new IllegalArgumentException("protocol must be one of SSH, HTTP, or FTP (was " + value + ")");
  }
}

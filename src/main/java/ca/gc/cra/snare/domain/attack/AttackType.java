package ca.gc.cra.snare.domain.attack;

import java.util.Locale;

/**
 * <strong>What:</strong> Classification tag attached by a connection handler to each capture.
 * <p><strong>Why:</strong> The threat analyzer derives the MEDIUM floor and the behavioural pattern from the
 * type; queries and statistics group by it.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum AttackType {
  /** Credential guessing against the SSH-like decoy. */
  SSH_BRUTE_FORCE("brute-force-ssh", Protocol.SSH, true, false),
  /** Request sent to the HTTP-like decoy. */
  HTTP_PROBE("http-probe", Protocol.HTTP, false, true),
  /** Credential guessing against the FTP-like decoy. */
  FTP_BRUTE_FORCE("brute-force-ftp", Protocol.FTP, true, false),
  /** Neutral fallback for unrecognized tags. */
  UNKNOWN("unknown", null, false, false);

  private final String alias;
  private final Protocol protocol;
  private final boolean bruteForce;
  private final boolean reconnaissance;

  AttackType(String alias, Protocol protocol, boolean bruteForce, boolean reconnaissance) {
    this.alias = alias;
    this.protocol = protocol;
    this.bruteForce = bruteForce;
    this.reconnaissance = reconnaissance;
  }

  /**
   * Returns the hyphenated alias (e.g. {@code brute-force-ssh}).
   *
   * @return alias accepted by {@link #fromString(String)}
   */
  public String alias() {
    return alias;
  }

  /**
   * Returns the protocol whose handler produces this type.
   *
   * @return protocol, or {@code null} for {@link #UNKNOWN}
   */
  public Protocol protocol() {
    return protocol;
  }

  /** @return {@code true} for credential-guessing types */
  public boolean isBruteForce() {
    return bruteForce;
  }

  /** @return {@code true} for probe-style types */
  public boolean isReconnaissance() {
    return reconnaissance;
  }

  /**
   * Parses an attack type by constant name or alias, case-insensitively.
   *
   * @param value raw text; may be {@code null}
   * @return parsed type, or {@link #UNKNOWN} when the text matches nothing
   */
  public static AttackType fromString(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    String trimmed = value.trim();
    String upper = trimmed.toUpperCase(Locale.ROOT);
    String lower = trimmed.toLowerCase(Locale.ROOT);
    for (AttackType type : values()) {
      if (type.name().equals(upper) || type.alias.equals(lower)) {
        return type;
      }
    }
    return UNKNOWN;
  }

  /**
   * Returns the type a decoy of the given protocol assigns to its captures.
   *
   * @param protocol decoy protocol
   * @return matching type, or {@link #UNKNOWN} when {@code protocol} is {@code null}
   */
  public static AttackType forProtocol(Protocol protocol) {
    for (AttackType type : values()) {
      if (type.protocol != null && type.protocol == protocol) {
        return type;
      }
    }
    return UNKNOWN;
  }

  /**
   * Strict variant of {@link #fromString(String)} used for query filters.
   *
   * @param value raw text
   * @return parsed type
   * @throws IllegalArgumentException if the text matches no constant or alias
   */
  public static AttackType parseStrict(String value) {
    AttackType parsed = fromString(value);
    if (parsed == UNKNOWN && (value == null || !"unknown".equalsIgnoreCase(value.trim()))) {
      throw new IllegalArgumentException("unknown attack_type: " + value);
    }
    return parsed;
  }
}

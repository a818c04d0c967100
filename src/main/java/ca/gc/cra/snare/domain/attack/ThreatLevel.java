package ca.gc.cra.snare.domain.attack;

import java.util.Locale;

/**
 * Ordinal severity derived from historical attack volume; declaration order is severity order.
 *
 * @since 0.1.0
 */
public enum ThreatLevel {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Indicates whether this level warrants an immediate block and a HIGH_THREAT alert.
   *
   * @return {@code true} for {@link #HIGH} and {@link #CRITICAL}
   */
  public boolean isHighOrAbove() {
    return compareTo(HIGH) >= 0;
  }

  /**
   * Parses a level name case-insensitively.
   *
   * @param value raw text
   * @return parsed level
   * @throws IllegalArgumentException if the value matches no level
   */
  public static ThreatLevel fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("threat_level must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown threat_level: " + value, ex);
    }
  }
}

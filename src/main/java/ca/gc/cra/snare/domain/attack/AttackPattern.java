package ca.gc.cra.snare.domain.attack;

import java.util.Locale;

/**
 * Coarse behavioural category derived from the attack type.
 *
 * @since 0.1.0
 */
public enum AttackPattern {
  /** Repeated credential guessing. */
  BRUTE_FORCE,
  /** Probing for exposed endpoints or banners. */
  RECONNAISSANCE,
  /** Anything else reaching a decoy. */
  EXPLOIT_ATTEMPT,
  /** Classification failed; only assigned when the analyzer could not run. */
  UNKNOWN;

  /**
   * Parses a pattern name case-insensitively, mapping unrecognized text to {@link #UNKNOWN}.
   *
   * @param value raw text; may be {@code null}
   * @return parsed pattern
   */
  public static AttackPattern fromString(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (AttackPattern pattern : values()) {
      if (pattern.name().equals(normalized)) {
        return pattern;
      }
    }
    return UNKNOWN;
  }
}

package ca.gc.cra.snare.application.query;

import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.ThreatLevel;
import ca.gc.cra.snare.validation.Strings;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Allow-list of filterable attack columns.
 * <p><strong>Why:</strong> Filter keys reach SQL as column names; only constants of this enum can ever be
 * spliced into a statement, and values are normalized to their stored form before binding.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum AttackFilter {
  PROTOCOL("protocol", value -> Protocol.fromString(value).name()),
  ATTACK_TYPE("attack_type", value -> AttackType.parseStrict(value).name()),
  SOURCE_IP("source_ip", value -> Strings.requirePrintableAscii("source_ip", value, 255)),
  THREAT_LEVEL("threat_level", value -> ThreatLevel.fromString(value).name());

  private final String key;
  private final UnaryOperator<String> normalizer;

  AttackFilter(String key, UnaryOperator<String> normalizer) {
    this.key = key;
    this.normalizer = normalizer;
  }

  /**
   * Returns the filter key, which doubles as the column name.
   *
   * @return key such as {@code source_ip}
   */
  public String column() {
    return key;
  }

  /**
   * Validates a raw filter value and converts it to the stored representation.
   *
   * @param value raw text
   * @return value to bind as a statement parameter
   * @throws IllegalArgumentException if the value is invalid for this column
   */
  public String normalize(String value) {
    if (value == null) {
      throw new IllegalArgumentException(key + " filter value must not be null");
    }
    return normalizer.apply(value);
  }

  /**
   * Resolves a filter key case-insensitively.
   *
   * @param key raw key
   * @return matching filter
   * @throws IllegalArgumentException if the key is not filterable
   */
  public static AttackFilter fromKey(String key) {
    if (key != null) {
      String normalized = key.trim().toLowerCase(Locale.ROOT);
      for (AttackFilter filter : values()) {
        if (filter.key.equals(normalized)) {
          return filter;
        }
      }
    }
    throw new IllegalArgumentException(
        "unsupported filter key '" + key + "' (allowed: protocol, attack_type, source_ip, threat_level)");
  }
}

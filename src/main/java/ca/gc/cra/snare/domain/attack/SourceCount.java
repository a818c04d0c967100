package ca.gc.cra.snare.domain.attack;

import java.util.Objects;

/**
 * Cumulative attack count for one source address, as reported in top-attacker rankings.
 *
 * @param sourceIp remote address text
 * @param count number of attacks observed
 * @since 0.1.0
 */
public record SourceCount(String sourceIp, long count) {

  public SourceCount {
    sourceIp = Objects.requireNonNull(sourceIp, "sourceIp");
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative");
    }
  }
}

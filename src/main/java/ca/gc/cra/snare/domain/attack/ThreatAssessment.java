package ca.gc.cra.snare.domain.attack;

import java.util.List;
import java.util.Objects;

/**
 * Analyzer verdict for one captured attack.
 *
 * @param threatLevel computed threat level
 * @param attackPattern computed behavioural pattern
 * @param recommendations ordered operator recommendations; copied defensively
 * @since 0.1.0
 */
public record ThreatAssessment(
    ThreatLevel threatLevel, AttackPattern attackPattern, List<String> recommendations) {

  /** Verdict used when classification could not run. */
  public static final ThreatAssessment UNCLASSIFIED =
      new ThreatAssessment(ThreatLevel.LOW, AttackPattern.UNKNOWN, List.of());

  public ThreatAssessment {
    threatLevel = Objects.requireNonNull(threatLevel, "threatLevel");
    attackPattern = Objects.requireNonNull(attackPattern, "attackPattern");
    recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
  }
}

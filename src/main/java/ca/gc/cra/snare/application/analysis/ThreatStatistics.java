package ca.gc.cra.snare.application.analysis;

import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.SourceCount;
import ca.gc.cra.snare.domain.attack.ThreatLevel;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of the analyzer's in-memory counters.
 *
 * @param countsByType cumulative count per attack type
 * @param topSources up to ten busiest sources, count descending, ties in first-seen order
 * @param countsByLevel cumulative count per assigned threat level
 * @since 0.1.0
 */
public record ThreatStatistics(
    Map<AttackType, Long> countsByType,
    List<SourceCount> topSources,
    Map<ThreatLevel, Long> countsByLevel) {

  public ThreatStatistics {
    countsByType = freeze(countsByType, AttackType.class);
    topSources = topSources == null ? List.of() : List.copyOf(topSources);
    countsByLevel = freeze(countsByLevel, ThreatLevel.class);
  }

  /**
   * Returns the number of attacks analyzed since start-up or the last reset.
   *
   * @return sum of {@link #countsByType()}
   */
  public long totalAttacks() {
    long total = 0;
    for (long count : countsByType.values()) {
      total += count;
    }
    return total;
  }

  private static <K extends Enum<K>> Map<K, Long> freeze(Map<K, Long> source, Class<K> type) {
    EnumMap<K, Long> copy = new EnumMap<>(type);
    if (source != null) {
      copy.putAll(source);
    }
    return Collections.unmodifiableMap(copy);
  }
}

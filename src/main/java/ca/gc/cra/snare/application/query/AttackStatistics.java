package ca.gc.cra.snare.application.query;

import ca.gc.cra.snare.domain.attack.SourceCount;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over every persisted attack.
 *
 * @param totalAttacks number of stored attack rows
 * @param uniqueSources number of distinct source addresses
 * @param countsByType row count per stored attack type name
 * @param countsByLevel row count per stored threat level name
 * @param topSources up to ten busiest sources, count descending then address ascending
 * @since 0.1.0
 */
public record AttackStatistics(
    long totalAttacks,
    long uniqueSources,
    Map<String, Long> countsByType,
    Map<String, Long> countsByLevel,
    List<SourceCount> topSources) {

  public AttackStatistics {
    countsByType = countsByType == null ? Map.of() : Map.copyOf(countsByType);
    countsByLevel = countsByLevel == null ? Map.of() : Map.copyOf(countsByLevel);
    topSources = topSources == null ? List.of() : List.copyOf(topSources);
  }
}

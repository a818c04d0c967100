package ca.gc.cra.snare.application.query;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validated attack listing request: a page plus equality filters keyed by allow-listed column.
 *
 * @param page pagination window
 * @param filters normalized filter values; unmodifiable
 * @since 0.1.0
 */
public record AttackQuery(Page page, Map<AttackFilter, String> filters) {

  public AttackQuery {
    page = Objects.requireNonNull(page, "page");
    filters = filters == null || filters.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(filters));
  }

  /**
   * Builds a query from loosely typed input, rejecting unknown keys and invalid values.
   *
   * @param limit rows per page (1..1000)
   * @param offset rows to skip
   * @param rawFilters key/value filters; may be {@code null}
   * @return validated query
   * @throws IllegalArgumentException on any invalid key, value, or pagination bound
   */
  public static AttackQuery of(int limit, int offset, Map<String, String> rawFilters) {
    Page page = new Page(limit, offset);
    if (rawFilters == null || rawFilters.isEmpty()) {
      return new AttackQuery(page, Map.of());
    }
    EnumMap<AttackFilter, String> filters = new EnumMap<>(AttackFilter.class);
    rawFilters.forEach((key, value) -> {
      AttackFilter filter = AttackFilter.fromKey(key);
      filters.put(filter, filter.normalize(value));
    });
    return new AttackQuery(page, filters);
  }

  /**
   * Returns an unfiltered query for the given page.
   *
   * @param page pagination window
   * @return query with no filters
   */
  public static AttackQuery all(Page page) {
    return new AttackQuery(page, Map.of());
  }
}

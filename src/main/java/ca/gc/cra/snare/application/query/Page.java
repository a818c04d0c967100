package ca.gc.cra.snare.application.query;

import ca.gc.cra.snare.validation.Numbers;

/**
 * Pagination window for store reads.
 *
 * @param limit maximum rows to return (1..1000)
 * @param offset rows to skip (non-negative)
 * @since 0.1.0
 */
public record Page(int limit, int offset) {
  /** Largest accepted page size. */
  public static final int MAX_LIMIT = 1000;
  /** Page size used when callers supply none. */
  public static final int DEFAULT_LIMIT = 100;

  public Page {
    Numbers.requireRange("limit", limit, 1, MAX_LIMIT);
    Numbers.requireRange("offset", offset, 0, Integer.MAX_VALUE);
  }

  /**
   * Returns the first page of {@link #DEFAULT_LIMIT} rows.
   *
   * @return default page
   */
  public static Page first() {
    return new Page(DEFAULT_LIMIT, 0);
  }

  /**
   * Parses textual pagination input such as query-string values.
   *
   * @param limit raw limit; {@code null} or blank selects {@link #DEFAULT_LIMIT}
   * @param offset raw offset; {@code null} or blank selects {@code 0}
   * @return validated page
   * @throws IllegalArgumentException if either value is non-numeric or out of range
   */
  public static Page parse(String limit, String offset) {
    int parsedLimit = (limit == null || limit.isBlank())
        ? DEFAULT_LIMIT
        : Numbers.parseInt("limit", limit, 1, MAX_LIMIT);
    int parsedOffset = (offset == null || offset.isBlank())
        ? 0
        : Numbers.parseInt("offset", offset, 0, Integer.MAX_VALUE);
    return new Page(parsedLimit, parsedOffset);
  }
}

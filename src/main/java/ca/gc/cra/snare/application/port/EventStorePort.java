package ca.gc.cra.snare.application.port;

import ca.gc.cra.snare.application.query.AttackQuery;
import ca.gc.cra.snare.application.query.AttackStatistics;
import ca.gc.cra.snare.application.query.Page;
import ca.gc.cra.snare.domain.alert.Alert;
import ca.gc.cra.snare.domain.attack.AttackEvent;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Durable store for classified attacks and the alerts they raise.
 * <p><strong>Why:</strong> Every decoy handler funnels into one store; the port keeps recording code free of
 * SQL and lets tests swap in failing or in-memory stores.</p>
 * <p><strong>Thread-safety:</strong> Implementations must serialize writes and must never expose partially
 * written rows to readers.</p>
 * <p><strong>Errors:</strong> Storage failures surface as {@link EventStoreException}; invalid arguments as
 * {@link IllegalArgumentException} before any statement runs.</p>
 *
 * @since 0.1.0
 */
public interface EventStorePort extends AutoCloseable {

  /**
   * Persists a classified, unpersisted attack event.
   *
   * @param event event with {@code id == null}
   * @return store-assigned identifier; strictly increasing across calls
   * @throws EventStoreException if the write fails
   */
  long recordAttack(AttackEvent event);

  /**
   * Lists attacks newest first.
   *
   * @param query validated page and filters
   * @return matching events ordered by id descending
   */
  List<AttackEvent> getAttacks(AttackQuery query);

  /**
   * Lists attacks using loosely typed filters.
   *
   * @param limit rows per page (1..1000)
   * @param offset rows to skip
   * @param filters filter map keyed by {@code protocol}, {@code attack_type}, {@code source_ip}, or
   *     {@code threat_level}
   * @return matching events ordered by id descending
   * @throws IllegalArgumentException on an unknown key, an invalid value, or a bad page bound
   */
  default List<AttackEvent> getAttacks(int limit, int offset, Map<String, String> filters) {
    return getAttacks(AttackQuery.of(limit, offset, filters));
  }

  /**
   * Fetches one attack.
   *
   * @param id store identifier
   * @return the event, or empty when no row has that id
   */
  Optional<AttackEvent> getAttackById(long id);

  /**
   * Aggregates over all stored attacks.
   *
   * @return totals, per-type and per-level counts, and the ten busiest sources
   */
  AttackStatistics getAttackStatistics();

  /**
   * Persists an alert.
   *
   * @param alert alert with {@code id == null}
   * @return store-assigned identifier
   */
  long recordAlert(Alert alert);

  /**
   * Lists alerts newest first.
   *
   * @param page pagination window
   * @return alerts ordered by id descending
   */
  List<Alert> getAlerts(Page page);

  /** Releases the underlying connection. */
  @Override
  void close();
}

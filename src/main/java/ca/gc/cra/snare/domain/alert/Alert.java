package ca.gc.cra.snare.domain.alert;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Secondary, higher-signal record raised when an attack crosses a severity or keyword
 * threshold.
 * <p><strong>Thread-safety:</strong> Immutable; alerts are never mutated after creation.</p>
 *
 * @param id store-assigned identifier; {@code null} until persisted
 * @param timestamp time of the triggering attack; never {@code null}
 * @param sourceIp remote address of the triggering attack; never blank
 * @param alertType reason for the alert; never {@code null}
 * @param detail bounded summary; never {@code null}
 * @param attackId id of the triggering attack event; {@code null} when that event was not persisted
 * @since 0.1.0
 */
public record Alert(
    Long id,
    Instant timestamp,
    String sourceIp,
    AlertType alertType,
    String detail,
    Long attackId) {

  public Alert {
    if (id != null && id <= 0) {
      throw new IllegalArgumentException("id must be positive (was " + id + ")");
    }
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(sourceIp, "sourceIp");
    if (sourceIp.isBlank()) {
      throw new IllegalArgumentException("sourceIp must not be blank");
    }
    alertType = Objects.requireNonNull(alertType, "alertType");
    detail = detail == null ? "" : detail;
  }

  /**
   * Returns the persisted copy of this alert.
   *
   * @param assignedId identifier returned by the store
   * @return alert carrying {@code assignedId}
   */
  public Alert withId(long assignedId) {
    if (id != null) {
      throw new IllegalStateException("alert already persisted with id " + id);
    }
    return new Alert(assignedId, timestamp, sourceIp, alertType, detail, attackId);
  }
}

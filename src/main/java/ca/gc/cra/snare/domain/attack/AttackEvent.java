package ca.gc.cra.snare.domain.attack;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Classified attack as stored in and returned by the event store.
 * <p><strong>Why:</strong> The durable record of attacker behaviour; never mutated once persisted.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @param id store-assigned identifier; {@code null} until persisted
 * @param timestamp capture time; never {@code null}
 * @param sourceIp remote address text; never blank
 * @param sourcePort remote TCP port (0-65535)
 * @param protocol decoy protocol; never {@code null}
 * @param attackType handler classification tag; never {@code null}
 * @param rawPayload HTML-entity-escaped payload; never {@code null}
 * @param threatLevel analyzer threat level; never {@code null}
 * @param attackPattern analyzer pattern; never {@code null}
 * @since 0.1.0
 */
public record AttackEvent(
    Long id,
    Instant timestamp,
    String sourceIp,
    int sourcePort,
    Protocol protocol,
    AttackType attackType,
    String rawPayload,
    ThreatLevel threatLevel,
    AttackPattern attackPattern) {

  private static final int MAX_PORT = 65_535;

  public AttackEvent {
    if (id != null && id <= 0) {
      throw new IllegalArgumentException("id must be positive (was " + id + ")");
    }
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    sourceIp = requireSourceIp(sourceIp);
    requireSourcePort(sourcePort);
    protocol = Objects.requireNonNull(protocol, "protocol");
    attackType = Objects.requireNonNull(attackType, "attackType");
    rawPayload = rawPayload == null ? "" : rawPayload;
    threatLevel = Objects.requireNonNull(threatLevel, "threatLevel");
    attackPattern = Objects.requireNonNull(attackPattern, "attackPattern");
  }

  /**
   * Returns the persisted copy of this event.
   *
   * @param assignedId identifier returned by the store
   * @return event carrying {@code assignedId}
   * @throws IllegalStateException if this event already has an id
   */
  public AttackEvent withId(long assignedId) {
    if (id != null) {
      throw new IllegalStateException("event already persisted with id " + id);
    }
    return new AttackEvent(
        assignedId, timestamp, sourceIp, sourcePort, protocol, attackType, rawPayload, threatLevel, attackPattern);
  }

  /** @return {@code true} once the store assigned an id */
  public boolean isPersisted() {
    return id != null;
  }

  static String requireSourceIp(String sourceIp) {
    Objects.requireNonNull(sourceIp, "sourceIp");
    String trimmed = sourceIp.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("sourceIp must not be blank");
    }
    return trimmed;
  }

  static void requireSourcePort(int sourcePort) {
    if (sourcePort < 0 || sourcePort > MAX_PORT) {
      throw new IllegalArgumentException("sourcePort must be between 0 and 65535 (was " + sourcePort + ")");
    }
  }
}

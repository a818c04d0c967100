package ca.gc.cra.snare.domain.attack;

import ca.gc.cra.snare.domain.util.Html;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> An attack observed on a decoy, before classification.
 * <p><strong>Why:</strong> Carries everything the analyzer and store need while making it impossible to persist an
 * unclassified event.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param timestamp capture time; never {@code null}
 * @param sourceIp remote address text; never blank
 * @param sourcePort remote TCP port (0-65535)
 * @param protocol decoy that captured the attack; never {@code null}
 * @param attackType handler classification tag; never {@code null}
 * @param rawPayload HTML-entity-escaped payload text; never {@code null}
 * @since 0.1.0
 */
public record CapturedAttack(
    Instant timestamp,
    String sourceIp,
    int sourcePort,
    Protocol protocol,
    AttackType attackType,
    String rawPayload) {

  public CapturedAttack {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    sourceIp = AttackEvent.requireSourceIp(sourceIp);
    AttackEvent.requireSourcePort(sourcePort);
    protocol = Objects.requireNonNull(protocol, "protocol");
    attackType = Objects.requireNonNull(attackType, "attackType");
    rawPayload = rawPayload == null ? "" : rawPayload;
  }

  /**
   * Builds a capture from a handler result, escaping the payload.
   *
   * @param timestamp capture time
   * @param sourceIp remote address text
   * @param sourcePort remote TCP port
   * @param protocol decoy protocol
   * @param capture handler result
   * @return sanitized capture
   */
  public static CapturedAttack of(
      Instant timestamp, String sourceIp, int sourcePort, Protocol protocol, RawCapture capture) {
    Objects.requireNonNull(capture, "capture");
    return new CapturedAttack(
        timestamp, sourceIp, sourcePort, protocol, capture.attackType(), Html.escape(capture.payload()));
  }

  /**
   * Attaches a classification, producing an event ready for its single persist call.
   *
   * @param threatLevel computed threat level
   * @param attackPattern computed pattern
   * @return unpersisted event (id {@code null})
   */
  public AttackEvent classify(ThreatLevel threatLevel, AttackPattern attackPattern) {
    return new AttackEvent(
        null, timestamp, sourceIp, sourcePort, protocol, attackType, rawPayload, threatLevel, attackPattern);
  }
}

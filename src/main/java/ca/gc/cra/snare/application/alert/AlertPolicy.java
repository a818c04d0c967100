package ca.gc.cra.snare.application.alert;

import ca.gc.cra.snare.application.port.EventStorePort;
import ca.gc.cra.snare.application.port.MetricsPort;
import ca.gc.cra.snare.domain.alert.Alert;
import ca.gc.cra.snare.domain.alert.AlertType;
import ca.gc.cra.snare.domain.attack.AttackEvent;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides whether a classified attack raises an alert and persists it.
 * <p><strong>Why:</strong> Operators want a short list of high-signal events: repeat offenders and payloads that
 * try to download or run tooling.</p>
 * <p><strong>Errors:</strong> Alert persistence failures are logged and counted under
 * {@code alert.persist.failure}; the attack row is never touched.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class AlertPolicy {
  private static final Logger log = LoggerFactory.getLogger(AlertPolicy.class);

  /** Lower-case substrings that flag a payload as a dangerous command. */
  public static final List<String> DANGEROUS_KEYWORDS =
      List.of("wget", "curl", "chmod", "rm -rf", "bash", "nc ", "python", "perl");

  static final int DETAIL_DATA_CHARS = 200;

  private final EventStorePort store;
  private final MetricsPort metrics;

  /**
   * Creates a policy writing alerts to the given store.
   *
   * @param store alert destination
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   */
  public AlertPolicy(EventStorePort store, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Evaluates an event and, when it qualifies, persists an alert for it.
   *
   * @param event classified event; its id (when present) is linked from the alert
   * @return the alert raised (carrying its id when persisted), or empty when the event does not qualify
   */
  public Optional<Alert> evaluate(AttackEvent event) {
    Objects.requireNonNull(event, "event");
    Optional<AlertType> type = alertTypeFor(event);
    if (type.isEmpty()) {
      return Optional.empty();
    }
    Alert alert = new Alert(
        null, event.timestamp(), event.sourceIp(), type.get(), detailFor(event), event.id());
    metrics.increment("alert.raised");
    try {
      long id = store.recordAlert(alert);
      log.info("Alert {} raised for {} (attack id {})", type.get(), event.sourceIp(), event.id());
      return Optional.of(alert.withId(id));
    } catch (RuntimeException ex) {
      metrics.increment("alert.persist.failure");
      log.error("Failed to persist {} alert for {}", type.get(), event.sourceIp(), ex);
      return Optional.of(alert);
    }
  }

  /**
   * Determines which alert, if any, an event warrants. The keyword check takes precedence.
   *
   * @param event classified event
   * @return alert type, or empty when the event does not qualify
   */
  static Optional<AlertType> alertTypeFor(AttackEvent event) {
    if (containsDangerousKeyword(event.rawPayload())) {
      return Optional.of(AlertType.DANGEROUS_COMMAND);
    }
    if (event.threatLevel().isHighOrAbove()) {
      return Optional.of(AlertType.HIGH_THREAT);
    }
    return Optional.empty();
  }

  static boolean containsDangerousKeyword(String payload) {
    if (payload == null || payload.isEmpty()) {
      return false;
    }
    String lower = payload.toLowerCase(Locale.ROOT);
    for (String keyword : DANGEROUS_KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  static String detailFor(AttackEvent event) {
    String payload = event.rawPayload();
    String data = payload.length() > DETAIL_DATA_CHARS ? payload.substring(0, DETAIL_DATA_CHARS) : payload;
    return "threat_level=" + event.threatLevel()
        + " attack_type=" + event.attackType()
        + " data=" + data;
  }
}

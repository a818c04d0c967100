package ca.gc.cra.snare.domain.attack;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AttackTypeTest {

  @Test
  void parsesNamesAndAliases() {
    assertEquals(AttackType.SSH_BRUTE_FORCE, AttackType.fromString("brute-force-ssh"));
    assertEquals(AttackType.HTTP_PROBE, AttackType.fromString("http_probe"));
    assertEquals(AttackType.FTP_BRUTE_FORCE, AttackType.fromString(" BRUTE-FORCE-FTP "));
  }

  @Test
  void unknownTextFallsBackLeniently() {
    assertEquals(AttackType.UNKNOWN, AttackType.fromString("telnet-scan"));
    assertEquals(AttackType.UNKNOWN, AttackType.fromString(null));
  }

  @Test
  void strictParsingRejectsUnknownText() {
    assertThrows(IllegalArgumentException.class, () -> AttackType.parseStrict("telnet-scan"));
    assertEquals(AttackType.UNKNOWN, AttackType.parseStrict("unknown"));
  }

  @Test
  void bruteForceAndReconnaissanceFlags() {
    assertTrue(AttackType.SSH_BRUTE_FORCE.isBruteForce());
    assertTrue(AttackType.FTP_BRUTE_FORCE.isBruteForce());
    assertFalse(AttackType.HTTP_PROBE.isBruteForce());
    assertTrue(AttackType.HTTP_PROBE.isReconnaissance());
    assertFalse(AttackType.UNKNOWN.isBruteForce());
  }

  @Test
  void eachProtocolMapsToItsDecoyType() {
    assertEquals(AttackType.SSH_BRUTE_FORCE, AttackType.forProtocol(Protocol.SSH));
    assertEquals(AttackType.HTTP_PROBE, AttackType.forProtocol(Protocol.HTTP));
    assertEquals(AttackType.FTP_BRUTE_FORCE, AttackType.forProtocol(Protocol.FTP));
    assertEquals(AttackType.UNKNOWN, AttackType.forProtocol(null));
  }
}

package ca.gc.cra.snare.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateBindHostAcceptsWildcardAndLoopback() {
    assertEquals("0.0.0.0", Net.validateBindHost("0.0.0.0"));
    assertEquals("127.0.0.1", Net.validateBindHost(" 127.0.0.1 "));
    assertEquals("localhost", Net.validateBindHost("localhost"));
  }

  @Test
  void validateBindHostStripsIpv6Brackets() {
    assertEquals("::1", Net.validateBindHost("[::1]"));
  }

  @Test
  void validateBindHostRejectsBadOctet() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateBindHost("10.0.0.300"));
  }

  @Test
  void validateBindHostRejectsUnclosedBracket() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateBindHost("[::1"));
  }

  @Test
  void validatePortHonoursEphemeralFlag() {
    assertEquals(0, Net.validatePort("sshPort", 0, true));
    assertThrows(IllegalArgumentException.class, () -> Net.validatePort("sshPort", 0, false));
    assertThrows(IllegalArgumentException.class, () -> Net.validatePort("sshPort", 70_000, true));
  }
}

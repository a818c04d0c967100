package ca.gc.cra.snare.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"-v", "sshPort=2022", "--DRY-RUN", " ", "host=127.0.0.1"});

    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--dry-run"));
    assertFalse(input.help());
    assertArrayEquals(new String[] {"sshPort=2022", "host=127.0.0.1"}, input.keyValueArgs());
  }

  @Test
  void helpAliasesNormalize() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}

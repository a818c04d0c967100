package ca.gc.cra.snare.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.infrastructure.net.ListenerSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SnareConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    SnareConfig config = SnareConfig.defaults();

    assertEquals("0.0.0.0", config.host());
    assertEquals(2222, config.port(Protocol.SSH));
    assertEquals(8080, config.port(Protocol.HTTP));
    assertEquals(2121, config.port(Protocol.FTP));
    assertEquals(EnumSet.allOf(Protocol.class), config.protocols());
    assertEquals(Duration.ofSeconds(30), config.sshTimeout());
    assertEquals(50, config.backlog());
    assertEquals(0, config.maxConnections());
    assertEquals("otlp", config.metricsExporter());
    assertTrue(config.database().endsWith(Path.of(".snare", "snare.db")));
    assertFalse(config.dryRun());
  }

  @Test
  void fromMapParsesEveryKey() {
    Map<String, String> kv = new HashMap<>();
    kv.put("db", "/var/lib/snare/events.db");
    kv.put("host", "127.0.0.1");
    kv.put("sshPort", "22022");
    kv.put("httpPort", "8081");
    kv.put("ftpPort", "2100");
    kv.put("protocols", "ssh, ftp");
    kv.put("sshTimeoutMillis", "5000");
    kv.put("readTimeoutMillis", "7000");
    kv.put("backlog", "10");
    kv.put("maxConnections", "64");
    kv.put("metricsExporter", "NONE");
    kv.put("otelEndpoint", "http://collector:4317");
    kv.put("otelResourceAttributes", "site=dmz");
    kv.put("dryRun", "true");

    SnareConfig config = SnareConfig.fromMap(kv);

    assertEquals(Path.of("/var/lib/snare/events.db").toAbsolutePath(), config.database());
    assertEquals("127.0.0.1", config.host());
    assertEquals(22022, config.port(Protocol.SSH));
    assertEquals(EnumSet.of(Protocol.SSH, Protocol.FTP), config.protocols());
    assertEquals(Duration.ofMillis(5000), config.sshTimeout());
    assertEquals(Duration.ofMillis(7000), config.readTimeout());
    assertEquals(new ListenerSettings("127.0.0.1", 2100, 10, 64), config.listenerSettings(Protocol.FTP));
    assertEquals("none", config.metricsExporter());
    assertEquals("http://collector:4317", config.otelEndpoint());
    assertEquals("site=dmz", config.otelResourceAttributes());
    assertTrue(config.dryRun());
  }

  @Test
  void enabledProtocolsMustUseDistinctPorts() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SnareConfig.fromMap(Map.of("sshPort", "9000", "ftpPort", "9000")));
    assertTrue(ex.getMessage().contains("must differ"), ex.getMessage());
  }

  @Test
  void disabledProtocolMayShareAPort() {
    SnareConfig config = SnareConfig.fromMap(Map.of("protocols", "ssh", "sshPort", "9000", "ftpPort", "9000"));

    assertEquals(EnumSet.of(Protocol.SSH), config.protocols());
  }

  @Test
  void ephemeralPortsMayRepeat() {
    SnareConfig config = SnareConfig.fromMap(Map.of("sshPort", "0", "httpPort", "0", "ftpPort", "0"));

    assertEquals(0, config.port(Protocol.HTTP));
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> SnareConfig.fromMap(Map.of("protocols", "telnet")));
    assertThrows(IllegalArgumentException.class, () -> SnareConfig.fromMap(Map.of("sshPort", "70000")));
    assertThrows(IllegalArgumentException.class, () -> SnareConfig.fromMap(Map.of("metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class, () -> SnareConfig.fromMap(Map.of("otelEndpoint", "ftp://x")));
    assertThrows(IllegalArgumentException.class, () -> SnareConfig.fromMap(Map.of("host", "not a host")));
    assertThrows(IllegalArgumentException.class, () -> SnareConfig.fromMap(Map.of("backlog", "0")));
  }
}

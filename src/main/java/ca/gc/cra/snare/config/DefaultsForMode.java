package ca.gc.cra.snare.config;

import ca.gc.cra.snare.domain.attack.Protocol;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Supplies flattened default configuration maps for each SNARE CLI mode.
 *
 * <p>Keys match those accepted by {@link SnareConfig#fromMap(Map)} and by the YAML {@code serve} section.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (currently {@code serve})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "serve" -> buildServeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildServeDefaults() {
    SnareConfig defaults = SnareConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("db", defaults.database().toString());
    map.put("host", defaults.host());
    StringJoiner protocols = new StringJoiner(",");
    for (Protocol protocol : Protocol.values()) {
      map.put(SnareConfig.portKey(protocol), Integer.toString(defaults.port(protocol)));
      protocols.add(protocol.label());
    }
    map.put("protocols", protocols.toString());
    map.put("sshTimeoutMillis", Long.toString(defaults.sshTimeout().toMillis()));
    map.put("readTimeoutMillis", Long.toString(defaults.readTimeout().toMillis()));
    map.put("backlog", Integer.toString(defaults.backlog()));
    map.put("maxConnections", Integer.toString(defaults.maxConnections()));
    map.put("dryRun", "false");
    return map;
  }
}

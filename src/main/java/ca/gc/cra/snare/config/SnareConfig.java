package ca.gc.cra.snare.config;

import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.infrastructure.net.ListenerSettings;
import ca.gc.cra.snare.validation.Net;
import ca.gc.cra.snare.validation.Numbers;
import ca.gc.cra.snare.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Validated settings for {@code snare serve}.
 * <p><strong>Why:</strong> Turns the merged CLI/YAML/default string map into typed values once, before any socket
 * is bound or database opened.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param database SQLite database file
 * @param host bind host shared by all decoys
 * @param ports configured port per protocol ({@code 0} requests an ephemeral port)
 * @param protocols enabled decoys; never empty
 * @param sshTimeout SSH read timeout
 * @param readTimeout read timeout for the HTTP and FTP decoys
 * @param backlog accept backlog per listener
 * @param maxConnections concurrent handler cap per listener; {@code 0} means unbounded
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint override; empty to use the environment
 * @param otelResourceAttributes extra resource attributes; empty for none
 * @param dryRun print the plan without binding
 * @since 0.1.0
 */
public record SnareConfig(
    Path database,
    String host,
    Map<Protocol, Integer> ports,
    Set<Protocol> protocols,
    Duration sshTimeout,
    Duration readTimeout,
    int backlog,
    int maxConnections,
    String metricsExporter,
    String otelEndpoint,
    String otelResourceAttributes,
    boolean dryRun) {

  static final String DEFAULT_HOST = "0.0.0.0";
  static final int DEFAULT_TIMEOUT_MILLIS = 30_000;
  private static final int MAX_TIMEOUT_MILLIS = 600_000;
  private static final int MAX_CONNECTIONS = 100_000;
  private static final int MAX_ATTRIBUTES_LENGTH = 4_096;

  public SnareConfig {
    database = Objects.requireNonNull(database, "database");
    host = Net.validateBindHost(host);
    protocols = protocols == null || protocols.isEmpty()
        ? Set.of()
        : Collections.unmodifiableSet(EnumSet.copyOf(protocols));
    if (protocols.isEmpty()) {
      throw new IllegalArgumentException("at least one protocol must be enabled");
    }
    EnumMap<Protocol, Integer> portCopy = new EnumMap<>(Protocol.class);
    for (Protocol protocol : Protocol.values()) {
      Integer port = ports == null ? null : ports.get(protocol);
      portCopy.put(protocol, Net.validatePort(portKey(protocol), port == null ? protocol.defaultPort() : port, true));
    }
    ports = Collections.unmodifiableMap(portCopy);
    requireDistinctPorts(protocols, ports);
    sshTimeout = Objects.requireNonNull(sshTimeout, "sshTimeout");
    readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
    Numbers.requireRange("backlog", backlog, 1, 65_535);
    Numbers.requireRange("maxConnections", maxConnections, 0, MAX_CONNECTIONS);
    metricsExporter = normalizeExporter(metricsExporter);
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint.trim();
    otelResourceAttributes = otelResourceAttributes == null ? "" : otelResourceAttributes.trim();
  }

  /**
   * Returns the built-in configuration: every decoy on its default port, bound to all interfaces.
   *
   * @return default configuration
   */
  public static SnareConfig defaults() {
    return new SnareConfig(
        defaultDatabase(),
        DEFAULT_HOST,
        Map.of(),
        EnumSet.allOf(Protocol.class),
        Duration.ofMillis(DEFAULT_TIMEOUT_MILLIS),
        Duration.ofMillis(DEFAULT_TIMEOUT_MILLIS),
        ListenerSettings.DEFAULT_BACKLOG,
        0,
        "otlp",
        "",
        "",
        false);
  }

  /**
   * Parses a flat key/value map; missing keys fall back to {@link #defaults()}.
   *
   * @param args merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static SnareConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);
    SnareConfig defaults = defaults();

    Path database = parsePath("db", kv.get("db"), defaults.database());
    String host = Strings.trimToNull(kv.get("host"));
    Map<Protocol, Integer> ports = new EnumMap<>(Protocol.class);
    for (Protocol protocol : Protocol.values()) {
      ports.put(protocol, parseBoundedInt(kv, portKey(protocol), protocol.defaultPort(), 0, 65_535));
    }
    Set<Protocol> protocols = parseProtocols(kv.get("protocols"), defaults.protocols());
    int sshTimeout = parseBoundedInt(kv, "sshTimeoutMillis", DEFAULT_TIMEOUT_MILLIS, 0, MAX_TIMEOUT_MILLIS);
    int readTimeout = parseBoundedInt(kv, "readTimeoutMillis", DEFAULT_TIMEOUT_MILLIS, 0, MAX_TIMEOUT_MILLIS);
    int backlog = parseBoundedInt(kv, "backlog", defaults.backlog(), 1, 65_535);
    int maxConnections = parseBoundedInt(kv, "maxConnections", defaults.maxConnections(), 0, MAX_CONNECTIONS);

    String endpoint = Strings.trimToNull(kv.get("otelEndpoint"));
    if (endpoint != null) {
      validateEndpoint(endpoint);
    }
    String attributes = Strings.trimToNull(kv.get("otelResourceAttributes"));
    if (attributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_ATTRIBUTES_LENGTH);
    }

    return new SnareConfig(
        database,
        host == null ? defaults.host() : host,
        ports,
        protocols,
        Duration.ofMillis(sshTimeout),
        Duration.ofMillis(readTimeout),
        backlog,
        maxConnections,
        kv.getOrDefault("metricsExporter", defaults.metricsExporter()),
        endpoint,
        attributes,
        parseBoolean(kv.get("dryRun"), false));
  }

  /**
   * Returns the listener settings for one protocol.
   *
   * @param protocol decoy protocol
   * @return bind settings
   */
  public ListenerSettings listenerSettings(Protocol protocol) {
    return new ListenerSettings(host, ports.get(protocol), backlog, maxConnections);
  }

  /**
   * Returns the configured port for a protocol.
   *
   * @param protocol decoy protocol
   * @return port
   */
  public int port(Protocol protocol) {
    return ports.get(protocol);
  }

  static String portKey(Protocol protocol) {
    return protocol.label() + "Port";
  }

  private static void requireDistinctPorts(Set<Protocol> enabled, Map<Protocol, Integer> ports) {
    Map<Integer, Protocol> seen = new HashMap<>();
    for (Protocol protocol : enabled) {
      int port = ports.get(protocol);
      if (port == 0) {
        continue;
      }
      Protocol clash = seen.putIfAbsent(port, protocol);
      if (clash != null) {
        throw new IllegalArgumentException(
            portKey(clash) + " and " + portKey(protocol) + " must differ (both " + port + ")");
      }
    }
  }

  private static Set<Protocol> parseProtocols(String raw, Set<Protocol> fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    EnumSet<Protocol> protocols = EnumSet.noneOf(Protocol.class);
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        protocols.add(Protocol.fromString(token));
      }
    }
    return protocols;
  }

  private static String normalizeExporter(String raw) {
    String normalized = raw == null || raw.isBlank() ? "otlp" : raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return (int) Numbers.requireRange(key, defaultValue, min, max);
    }
    return Numbers.parseInt(key, raw, min, max);
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Path parsePath(String name, String value, Path fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static Path defaultDatabase() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".snare", "snare.db");
  }
}

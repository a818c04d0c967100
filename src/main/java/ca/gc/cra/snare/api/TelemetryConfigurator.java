package ca.gc.cra.snare.api;

import ca.gc.cra.snare.config.SnareConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes telemetry settings as {@code otel.*} system properties ahead of OpenTelemetry bootstrapping.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Copies exporter, endpoint, and resource attributes from the validated config. Blank values leave any
   * environment-provided setting in place.
   *
   * @param config validated configuration
   * @return properties that were set, for logging and tests
   */
  static Map<String, String> configureMetrics(SnareConfig config) {
    Map<String, String> properties = new LinkedHashMap<>();
    properties.put("otel.metrics.exporter", config.metricsExporter());
    properties.put("otel.exporter.otlp.endpoint", config.otelEndpoint());
    properties.put("otel.resource.attributes", config.otelResourceAttributes());

    Map<String, String> applied = new LinkedHashMap<>();
    properties.forEach((key, value) -> {
      if (value != null && !value.isBlank()) {
        System.setProperty(key, value);
        applied.put(key, value);
      }
    });
    log.debug("Telemetry properties applied: {}", applied.keySet());
    return applied;
  }
}

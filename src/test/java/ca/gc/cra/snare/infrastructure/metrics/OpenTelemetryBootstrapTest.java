package ca.gc.cra.snare.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneYieldsNoopMeter() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    try {
      assertTrue(result.isNoop());
      result.meter().counterBuilder("attack.captured").build().add(1);
    } finally {
      result.close();
    }
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=lab, broken, =x ,site=dmz");

    assertEquals(2, attributes.size());
    assertEquals("lab", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("dmz", attributes.get(AttributeKey.stringKey("site")));
  }
}

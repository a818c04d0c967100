package ca.gc.cra.snare.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("snare.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementsBecomeCounterWithServiceResource() {
    adapter.increment("attack.captured");
    adapter.increment("attack.captured");
    adapter.forceFlush();

    MetricData counter = metric("attack.captured");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("attack.captured", point.getAttributes().get(METRIC_KEY));
    assertEquals("snare", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals(OpenTelemetryBootstrap.INSTRUMENTATION_SCOPE, counter.getInstrumentationScopeInfo().getName());
  }

  @Test
  void observationsBecomeHistogramUnderSanitizedName() {
    adapter.observe("attack.record.latencyNanos", 500L);
    adapter.observe("attack.record.latencyNanos", 1_500L);
    adapter.forceFlush();

    MetricData histogram = metric("attack.record.latencynanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(2_000.0, point.getSum());
    assertEquals("attack.record.latencyNanos", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("listener.connection.rejected", OpenTelemetryMetricsAdapter.sanitizeName("listener.connection.rejected"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("alert_raised_", OpenTelemetryMetricsAdapter.sanitizeName("alert raised!"));
    assertEquals("snare.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private MetricData metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(candidate -> candidate.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}

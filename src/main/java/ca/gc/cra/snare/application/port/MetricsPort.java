package ca.gc.cra.snare.application.port;

/**
 * <strong>What:</strong> Port abstracting SNARE metrics emission.
 * <p><strong>Why:</strong> Lets the recording pipeline count captures, persist failures, and alerts without
 * binding to a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates from every connection
 * worker.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code attack.persisted},
 * {@code attack.record.latencyNanos}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code alert.raised}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value such as nanoseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}

package ca.gc.cra.snare.config;

import ca.gc.cra.snare.application.alert.AlertPolicy;
import ca.gc.cra.snare.application.analysis.ThreatAnalyzer;
import ca.gc.cra.snare.application.listener.DecoyListenerRegistry;
import ca.gc.cra.snare.application.listener.ListenerFactory;
import ca.gc.cra.snare.application.pipeline.AttackRecorder;
import ca.gc.cra.snare.application.port.ClockPort;
import ca.gc.cra.snare.application.port.ConnectionHandler;
import ca.gc.cra.snare.application.port.DecoyListener;
import ca.gc.cra.snare.application.port.EventStorePort;
import ca.gc.cra.snare.application.port.MetricsPort;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.snare.infrastructure.net.ListenerSettings;
import ca.gc.cra.snare.infrastructure.net.SocketDecoyListener;
import ca.gc.cra.snare.infrastructure.persistence.SqliteEventStore;
import ca.gc.cra.snare.infrastructure.protocol.ftp.FtpConnectionHandler;
import ca.gc.cra.snare.infrastructure.protocol.http.HttpConnectionHandler;
import ca.gc.cra.snare.infrastructure.protocol.ssh.SshConnectionHandler;
import ca.gc.cra.snare.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the SNARE capture pipeline to concrete adapters.
 * <p><strong>Why:</strong> The analyzer and store are process-wide singletons by construction here, not by global
 * state; tests build their own graph with in-memory or temporary stores.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} stops every listener, then closes the store and flushes
 * metrics.</p>
 * <p><strong>Thread-safety:</strong> Construct on one thread during start-up; the exposed services are
 * themselves thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final SnareConfig config;
  private final EventStorePort store;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ThreatAnalyzer analyzer;
  private final AttackRecorder recorder;
  private final DecoyListenerRegistry registry;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates the production graph: SQLite at {@link SnareConfig#database()} and OpenTelemetry metrics.
   *
   * @param config validated configuration
   */
  public CompositionRoot(SnareConfig config) {
    this(config, SqliteEventStore.open(config.database()), new OpenTelemetryMetricsAdapter(),
        new SystemClockAdapter());
  }

  /**
   * Creates a graph over explicit adapters.
   *
   * @param config validated configuration
   * @param store event store; closed by {@link #close()}
   * @param metrics metrics sink; closed by {@link #close()} when it is {@link AutoCloseable}
   * @param clock timestamp source for captures
   */
  public CompositionRoot(SnareConfig config, EventStorePort store, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.analyzer = new ThreatAnalyzer();
    this.recorder = new AttackRecorder(analyzer, store, new AlertPolicy(store, this.metrics), this.metrics);
    this.registry = new DecoyListenerRegistry(listenerFactory());
  }

  /** @return the shared threat analyzer */
  public ThreatAnalyzer analyzer() {
    return analyzer;
  }

  /** @return the shared event store */
  public EventStorePort store() {
    return store;
  }

  /** @return the recording pipeline fed by every listener */
  public AttackRecorder recorder() {
    return recorder;
  }

  /** @return registry controlling the decoy listeners */
  public DecoyListenerRegistry registry() {
    return registry;
  }

  /**
   * Builds the scripted exchange for a protocol using the configured timeouts.
   *
   * @param protocol decoy protocol
   * @return new handler
   */
  public ConnectionHandler handlerFor(Protocol protocol) {
    return switch (protocol) {
      case SSH -> new SshConnectionHandler(config.sshTimeout());
      case HTTP -> new HttpConnectionHandler(config.readTimeout());
      case FTP -> new FtpConnectionHandler(config.readTimeout());
    };
  }

  private ListenerFactory listenerFactory() {
    return (protocol, host, port) -> {
      ListenerSettings settings =
          new ListenerSettings(host, port, config.backlog(), config.maxConnections());
      DecoyListener listener = new SocketDecoyListener(handlerFor(protocol), recorder, settings, clock, metrics);
      log.debug("Created {} listener for {}:{}", protocol, host, port);
      return listener;
    };
  }

  /** Idempotent; later calls return immediately. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    registry.stopAll();
    try {
      store.close();
    } catch (RuntimeException ex) {
      log.warn("Event store did not close cleanly", ex);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Metrics adapter did not close cleanly", ex);
      }
    }
  }
}

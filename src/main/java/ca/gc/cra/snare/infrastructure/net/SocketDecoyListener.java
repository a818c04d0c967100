package ca.gc.cra.snare.infrastructure.net;

import ca.gc.cra.snare.application.port.CaptureSink;
import ca.gc.cra.snare.application.port.ClockPort;
import ca.gc.cra.snare.application.port.ConnectionHandler;
import ca.gc.cra.snare.application.port.DecoyListener;
import ca.gc.cra.snare.application.port.ListenerBindException;
import ca.gc.cra.snare.application.port.MetricsPort;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.CapturedAttack;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.RawCapture;
import ca.gc.cra.snare.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import javax.net.ServerSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> TCP decoy listener that runs one {@link ConnectionHandler} per accepted connection.
 * <p><strong>Why:</strong> All three decoys share the same accept/dispatch/close lifecycle; only the scripted
 * exchange differs, so it is composed in rather than subclassed.</p>
 * <p><strong>Threading:</strong> One daemon accept thread ({@code snare-<protocol>-accept}) plus a cached pool of
 * daemon workers ({@code snare-<protocol>-conn-N}). Without an admission gate the pool is unbounded.</p>
 * <p><strong>Ordering:</strong> For each connection the handler runs, the socket is closed, and only then is the
 * capture forwarded to the sink on the same worker thread.</p>
 * <p><strong>Observability:</strong> Counts {@code listener.connection.accepted} and
 * {@code listener.connection.rejected}.</p>
 *
 * @since 0.1.0
 */
public final class SocketDecoyListener implements DecoyListener {
  private static final Logger log = LoggerFactory.getLogger(SocketDecoyListener.class);
  private static final long ACCEPT_JOIN_MILLIS = 2_000L;
  static final long ACCEPT_BACKOFF_MILLIS = 100L;

  private final ConnectionHandler handler;
  private final CaptureSink sink;
  private final ListenerSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Semaphore admission;
  private final ServerSocketFactory socketFactory;

  private final Object lifecycle = new Object();
  private volatile boolean running;
  private ServerSocket serverSocket;
  private ExecutorService workers;
  private Thread acceptThread;
  private volatile int boundPort;

  /**
   * Creates an unstarted listener.
   *
   * @param handler scripted exchange for the protocol
   * @param sink destination for captures
   * @param settings bind address and limits
   * @param clock timestamp source for captures
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   */
  public SocketDecoyListener(
      ConnectionHandler handler,
      CaptureSink sink,
      ListenerSettings settings,
      ClockPort clock,
      MetricsPort metrics) {
    this(handler, sink, settings, clock, metrics, ServerSocketFactory.getDefault());
  }

  SocketDecoyListener(
      ConnectionHandler handler,
      CaptureSink sink,
      ListenerSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      ServerSocketFactory socketFactory) {
    this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.admission = settings.maxConnections() > 0 ? new Semaphore(settings.maxConnections()) : null;
    this.boundPort = settings.port();
  }

  @Override
  public void start() throws ListenerBindException {
    synchronized (lifecycle) {
      if (running) {
        throw new ListenerBindException(settings.host(), boundPort,
            new IllegalStateException(protocol() + " listener already running"));
      }
      ServerSocket socket = null;
      try {
        socket = socketFactory.createServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(settings.host(), settings.port()), settings.backlog());
      } catch (IOException | RuntimeException ex) {
        closeQuietly(socket);
        throw new ListenerBindException(settings.host(), settings.port(), ex);
      }
      serverSocket = socket;
      boundPort = socket.getLocalPort();
      String label = protocol().label();
      workers = ExecutorFactories.newConnectionPool("snare-" + label + "-conn",
          (t, ex) -> log.error("Uncaught failure on {}", t.getName(), ex));
      running = true;
      acceptThread = ExecutorFactories.newAcceptThread("snare-" + label + "-accept", this::acceptLoop,
          (t, ex) -> log.error("{} accept loop terminated unexpectedly", protocol(), ex));
      acceptThread.start();
      log.info("{} listener bound to {}:{}", protocol(), settings.host(), boundPort);
    }
  }

  @Override
  public void stop() {
    Thread acceptor;
    synchronized (lifecycle) {
      if (!running) {
        return;
      }
      running = false;
      closeQuietly(serverSocket);
      workers.shutdown();
      acceptor = acceptThread;
    }
    try {
      acceptor.join(ACCEPT_JOIN_MILLIS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    log.info("{} listener on {}:{} stopped", protocol(), settings.host(), boundPort);
  }

  /**
   * Waits for in-flight connections to finish after {@link #stop()}.
   *
   * @param timeout maximum wait
   * @return {@code true} when every worker finished
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
    ExecutorService pool;
    synchronized (lifecycle) {
      pool = workers;
    }
    return pool == null || pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public Protocol protocol() {
    return handler.protocol();
  }

  @Override
  public String host() {
    return settings.host();
  }

  @Override
  public int port() {
    return boundPort;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void acceptLoop() {
    ServerSocket socket = serverSocket;
    while (running) {
      Socket client;
      try {
        client = socket.accept();
      } catch (IOException ex) {
        if (!running || socket.isClosed()) {
          break;
        }
        log.warn("{} accept failed; retrying in {} ms: {}", protocol(), ACCEPT_BACKOFF_MILLIS, ex.toString());
        // Persistent failures such as fd exhaustion must not spin the accept thread.
        try {
          Thread.sleep(ACCEPT_BACKOFF_MILLIS);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          break;
        }
        continue;
      }
      dispatch(client);
    }
    log.debug("{} accept loop exited", protocol());
  }

  private void dispatch(Socket client) {
    if (admission != null && !admission.tryAcquire()) {
      metrics.increment("listener.connection.rejected");
      log.debug("{} connection from {} rejected; {} handlers already running",
          protocol(), client.getRemoteSocketAddress(), settings.maxConnections());
      closeQuietly(client);
      return;
    }
    metrics.increment("listener.connection.accepted");
    try {
      workers.execute(() -> serve(client));
    } catch (RejectedExecutionException ex) {
      log.debug("{} listener stopping; dropping connection from {}", protocol(), client.getRemoteSocketAddress());
      release();
      closeQuietly(client);
    }
  }

  private void serve(Socket client) {
    try {
      Instant timestamp = clock.now();
      SocketAddress remote = client.getRemoteSocketAddress();
      String sourceIp = remote instanceof InetSocketAddress inet && inet.getAddress() != null
          ? inet.getAddress().getHostAddress()
          : "unknown";
      int sourcePort = client.getPort();
      RawCapture capture;
      try {
        capture = handler.handle(client);
      } catch (RuntimeException ex) {
        log.error("{} handler failed for {}:{}", protocol(), sourceIp, sourcePort, ex);
        capture = new RawCapture(AttackType.forProtocol(protocol()), "");
      } finally {
        closeQuietly(client);
      }
      try {
        sink.accept(CapturedAttack.of(timestamp, sourceIp, sourcePort, protocol(), capture));
      } catch (RuntimeException ex) {
        log.error("{} capture from {}:{} could not be recorded", protocol(), sourceIp, sourcePort, ex);
      }
    } finally {
      release();
    }
  }

  private void release() {
    if (admission != null) {
      admission.release();
    }
  }

  private static void closeQuietly(AutoCloseable closeable) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception ex) {
      log.debug("Ignoring close failure: {}", ex.toString());
    }
  }
}

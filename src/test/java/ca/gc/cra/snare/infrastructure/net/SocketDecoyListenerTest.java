package ca.gc.cra.snare.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.snare.application.port.ConnectionHandler;
import ca.gc.cra.snare.application.port.ListenerBindException;
import ca.gc.cra.snare.application.port.RecordingMetricsPort;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.CapturedAttack;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.RawCapture;
import ca.gc.cra.snare.infrastructure.protocol.ftp.FtpConnectionHandler;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.net.ServerSocketFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SocketDecoyListenerTest {
  private static final String LOOPBACK = "127.0.0.1";
  private static final Instant FIXED = Instant.parse("2024-05-01T00:00:00Z");

  private final BlockingQueue<CapturedAttack> captures = new LinkedBlockingQueue<>();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private SocketDecoyListener first;
  private SocketDecoyListener second;

  @AfterEach
  void stopListeners() {
    if (first != null) {
      first.stop();
    }
    if (second != null) {
      second.stop();
    }
  }

  @Test
  void ephemeralPortServesFtpAndForwardsCapture() throws Exception {
    first = listener(new FtpConnectionHandler(Duration.ofSeconds(5)), ListenerSettings.of(LOOPBACK, 0));
    first.start();
    assertTrue(first.isRunning());
    assertTrue(first.port() > 0);

    try (Socket client = new Socket(InetAddress.getLoopbackAddress(), first.port())) {
      client.setSoTimeout(5_000);
      BufferedReader in = new BufferedReader(new InputStreamReader(client.getInputStream(), StandardCharsets.US_ASCII));
      OutputStream out = client.getOutputStream();
      assertEquals("220 FTP Server Ready", in.readLine());
      out.write("USER bob\r\n".getBytes(StandardCharsets.US_ASCII));
      out.flush();
      assertEquals("331 Password required", in.readLine());
      out.write("PASS hunter2\r\n".getBytes(StandardCharsets.US_ASCII));
      out.flush();
      assertEquals("530 Login incorrect", in.readLine());
    }

    CapturedAttack capture = captures.poll(5, TimeUnit.SECONDS);
    assertNotNull(capture);
    assertEquals(Protocol.FTP, capture.protocol());
    assertEquals(AttackType.FTP_BRUTE_FORCE, capture.attackType());
    assertEquals("USER=bob PASS=hunter2", capture.rawPayload());
    assertEquals(LOOPBACK, capture.sourceIp());
    assertEquals(FIXED, capture.timestamp());
    assertEquals(1, metrics.count("listener.connection.accepted"));
  }

  @Test
  void secondListenerOnSamePortFailsAndStaysStopped() throws Exception {
    first = listener(new FtpConnectionHandler(), ListenerSettings.of(LOOPBACK, 0));
    first.start();
    second = listener(new FtpConnectionHandler(), ListenerSettings.of(LOOPBACK, first.port()));

    ListenerBindException ex = assertThrows(ListenerBindException.class, second::start);

    assertEquals(first.port(), ex.port());
    assertFalse(second.isRunning());
    assertTrue(first.isRunning());
  }

  @Test
  void startingTwiceFails() throws Exception {
    first = listener(new FtpConnectionHandler(), ListenerSettings.of(LOOPBACK, 0));
    first.start();

    assertThrows(ListenerBindException.class, first::start);
  }

  @Test
  void stopLetsInFlightHandlerFinish() throws Exception {
    BlockingHandler handler = new BlockingHandler();
    first = listener(handler, ListenerSettings.of(LOOPBACK, 0));
    first.start();

    try (Socket client = new Socket(InetAddress.getLoopbackAddress(), first.port())) {
      assertTrue(handler.entered.await(5, TimeUnit.SECONDS));
      first.stop();
      assertFalse(first.isRunning());

      handler.release.countDown();
      assertTrue(first.awaitQuiescence(Duration.ofSeconds(5)));
    }

    CapturedAttack capture = captures.poll(5, TimeUnit.SECONDS);
    assertNotNull(capture);
    assertEquals("finished", capture.rawPayload());
  }

  @Test
  void stoppedListenerRefusesConnections() throws Exception {
    first = listener(new FtpConnectionHandler(), ListenerSettings.of(LOOPBACK, 0));
    first.start();
    int port = first.port();
    first.stop();

    assertThrows(IOException.class, () -> new Socket(InetAddress.getLoopbackAddress(), port).close());
  }

  @Test
  void admissionGateRejectsConnectionsBeyondLimit() throws Exception {
    BlockingHandler handler = new BlockingHandler();
    first = listener(handler, new ListenerSettings(LOOPBACK, 0, ListenerSettings.DEFAULT_BACKLOG, 1));
    first.start();

    try (Socket busy = new Socket(InetAddress.getLoopbackAddress(), first.port())) {
      assertTrue(handler.entered.await(5, TimeUnit.SECONDS));
      try (Socket extra = new Socket(InetAddress.getLoopbackAddress(), first.port())) {
        extra.setSoTimeout(5_000);
        assertEquals(-1, extra.getInputStream().read());
      }
      assertEquals(1, metrics.count("listener.connection.rejected"));
    } finally {
      handler.release.countDown();
    }
  }

  @Test
  void handlerFailureStillProducesCapture() throws Exception {
    ConnectionHandler exploding = new ConnectionHandler() {
      @Override
      public Protocol protocol() {
        return Protocol.SSH;
      }

      @Override
      public RawCapture handle(Socket socket) {
        throw new IllegalStateException("boom");
      }
    };
    first = listener(exploding, ListenerSettings.of(LOOPBACK, 0));
    first.start();

    new Socket(InetAddress.getLoopbackAddress(), first.port()).close();

    CapturedAttack capture = captures.poll(5, TimeUnit.SECONDS);
    assertNotNull(capture);
    assertEquals(AttackType.SSH_BRUTE_FORCE, capture.attackType());
    assertEquals("", capture.rawPayload());
  }

  @Test
  void failingAcceptBacksOffAndRecovers() throws Exception {
    FailingAcceptFactory factory = new FailingAcceptFactory(3);
    first = new SocketDecoyListener(new FtpConnectionHandler(Duration.ofMillis(200)), captures::add,
        ListenerSettings.of(LOOPBACK, 0), FIXED::toEpochMilli, metrics, factory);
    long startedAt = System.nanoTime();
    first.start();

    try (Socket client = new Socket(InetAddress.getLoopbackAddress(), first.port())) {
      assertNotNull(captures.poll(5, TimeUnit.SECONDS));
    }

    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    assertTrue(first.isRunning());
    assertTrue(elapsedMillis >= 3 * SocketDecoyListener.ACCEPT_BACKOFF_MILLIS - 50, "elapsed " + elapsedMillis);
    assertTrue(factory.attempts.get() <= 5, "accept attempts " + factory.attempts.get());
  }

  private SocketDecoyListener listener(ConnectionHandler handler, ListenerSettings settings) {
    return new SocketDecoyListener(handler, captures::add, settings, FIXED::toEpochMilli, metrics);
  }

  /** Server sockets whose first {@code failures} accepts fail the way fd exhaustion does. */
  private static final class FailingAcceptFactory extends ServerSocketFactory {
    final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger failuresLeft;

    FailingAcceptFactory(int failures) {
      this.failuresLeft = new AtomicInteger(failures);
    }

    @Override
    public ServerSocket createServerSocket() throws IOException {
      return new ServerSocket() {
        @Override
        public Socket accept() throws IOException {
          attempts.incrementAndGet();
          if (failuresLeft.getAndDecrement() > 0) {
            throw new IOException("Too many open files");
          }
          return super.accept();
        }
      };
    }

    @Override
    public ServerSocket createServerSocket(int port) throws IOException {
      throw new UnsupportedOperationException();
    }

    @Override
    public ServerSocket createServerSocket(int port, int backlog) throws IOException {
      throw new UnsupportedOperationException();
    }

    @Override
    public ServerSocket createServerSocket(int port, int backlog, InetAddress address) throws IOException {
      throw new UnsupportedOperationException();
    }
  }

  private static final class BlockingHandler implements ConnectionHandler {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);

    @Override
    public Protocol protocol() {
      return Protocol.FTP;
    }

    @Override
    public RawCapture handle(Socket socket) {
      entered.countDown();
      try {
        release.await(10, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      return new RawCapture(AttackType.FTP_BRUTE_FORCE, "finished");
    }
  }
}

package ca.gc.cra.snare.infrastructure.protocol;

import ca.gc.cra.snare.application.port.ConnectionHandler;
import ca.gc.cra.snare.domain.attack.RawCapture;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Accepts one loopback connection and runs a handler against it, for exercising scripted exchanges with a real
 * client socket.
 */
public final class LoopbackServer implements AutoCloseable {
  private final ServerSocket server;
  private final ExecutorService executor = Executors.newSingleThreadExecutor();
  private final Future<RawCapture> capture;

  public LoopbackServer(ConnectionHandler handler) throws IOException {
    server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    capture = executor.submit(() -> {
      try (Socket socket = server.accept()) {
        return handler.handle(socket);
      }
    });
  }

  public Socket connect() throws IOException {
    Socket client = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
    client.setSoTimeout(5_000);
    return client;
  }

  public RawCapture capture() throws Exception {
    return capture.get(10, TimeUnit.SECONDS);
  }

  public static BufferedReader reader(Socket socket) throws IOException {
    return new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
  }

  public static void write(Socket socket, String text) throws IOException {
    socket.getOutputStream().write(text.getBytes(StandardCharsets.US_ASCII));
    socket.getOutputStream().flush();
  }

  @Override
  public void close() throws IOException {
    executor.shutdownNow();
    server.close();
  }
}

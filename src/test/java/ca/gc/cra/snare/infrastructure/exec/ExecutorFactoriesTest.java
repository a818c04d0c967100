package ca.gc.cra.snare.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void connectionPoolNamesDaemonThreads() throws Exception {
    ExecutorService pool = ExecutorFactories.newConnectionPool("snare-test-conn", null);
    try {
      Future<Thread> worker = pool.submit(Thread::currentThread);
      Thread thread = worker.get(5, TimeUnit.SECONDS);
      assertTrue(thread.getName().startsWith("snare-test-conn-"));
      assertTrue(thread.isDaemon());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void acceptThreadRoutesFailuresToHandler() throws Exception {
    AtomicReference<Throwable> seen = new AtomicReference<>();
    CountDownLatch done = new CountDownLatch(1);
    Thread thread = ExecutorFactories.newAcceptThread("snare-test-accept", () -> {
      throw new IllegalStateException("boom");
    }, (t, ex) -> {
      seen.set(ex);
      done.countDown();
    });

    assertTrue(thread.isDaemon());
    assertEquals("snare-test-accept", thread.getName());
    thread.start();
    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertEquals("boom", seen.get().getMessage());
  }
}

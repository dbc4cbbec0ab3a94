package logsink;

import logsink.lifecycle.SharedRef;
import logsink.sink.LogRotateSink;
import logsink.sink.LogRotateSinkHandle;
import logsink.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SinkManagerTest {

  @TempDir
  Path dir;

  private static SharedRef<SinkManager> open() {
    return open(new LogSinkConfig());
  }

  private static SharedRef<SinkManager> open(LogSinkConfig config) {
    return SinkManager.getInstance(true, config.setCloseAtExit(false));
  }

  // ── Lifetime ────────────────────────────────────────────────────

  @Test
  void sameManagerWhileReferencesAreOpen() {
    try (SharedRef<SinkManager> a = open();
         SharedRef<SinkManager> b = open()) {
      assertSame(a.get(), b.get());
      assertTrue(SinkManager.isLive());
    }
    assertFalse(SinkManager.isLive());
  }

  @Test
  void handleKeepsManagerAlive() {
    MemorySink sink = new MemorySink();
    MemorySinkHandle handle;
    try (SharedRef<SinkManager> ref = open()) {
      handle = ref.get().sinks(MemorySink.KIND).newSink(() -> sink);
    }

    assertTrue(SinkManager.isLive());
    assertFalse(sink.closed);

    handle.close();

    assertFalse(SinkManager.isLive());
    assertTrue(sink.closed);
  }

  @Test
  void newManagerAfterTeardown() {
    SinkManager first;
    try (SharedRef<SinkManager> ref = open()) {
      first = ref.get();
    }
    try (SharedRef<SinkManager> ref = open()) {
      assertNotSame(first, ref.get());
      assertTrue(ref.get().worker().isAccepting());
    }
    assertFalse(first.worker().isAccepting());
  }

  @Test
  void invalidConfigFailsAndNextCallRetries() {
    assertThrows(IllegalArgumentException.class, () -> open(new LogSinkConfig().setQueueCapacity(0)));
    assertFalse(SinkManager.isLive());

    try (SharedRef<SinkManager> ref = open()) {
      assertNotNull(ref.get());
    }
  }

  @Test
  void builtInKindsAreRegistered() {
    try (SharedRef<SinkManager> ref = open()) {
      SinkManager manager = ref.get();
      assertEquals("syslog", manager.syslogSinks().kind().name());
      assertFalse(manager.syslogSinks().multipleInstancesAllowed());
      assertTrue(manager.logRotateSinks().multipleInstancesAllowed());
      assertTrue(manager.colorTermSinks().multipleInstancesAllowed());
      assertSame(manager.logRotateSinks(), manager.sinks(LogRotateSink.KIND));
    }
  }

  // ── Delivery ────────────────────────────────────────────────────

  @Test
  void logReachesEverySinkOfEveryKind() throws Exception {
    try (SharedRef<SinkManager> ref = open()) {
      SinkManager manager = ref.get();
      try (MemorySinkHandle a = manager.sinks(MemorySink.KIND).newSink("a", MemorySink::new);
           MemorySinkHandle b = manager.sinks(MemorySink.KIND).newSink("b", MemorySink::new);
           MemorySinkHandle c = manager.sinks(MemorySink.SINGLE_KIND).newSink(MemorySink::new)) {

        assertTrue(manager.log(LogLevel.INFO, "one"));
        assertTrue(manager.log(LogMessage.of(LogLevel.WARNING, "two")));
        assertTrue(manager.worker().awaitDrained(5000));

        assertEquals(List.of("one", "two"), a.lines());
        assertEquals(List.of("one", "two"), b.lines());
        assertEquals(List.of("one", "two"), c.lines());
      }
    }
  }

  @Test
  void failingSinkIsCountedAndSkipped() throws Exception {
    CountingMetrics metrics = new CountingMetrics();
    try (SharedRef<SinkManager> ref = open(new LogSinkConfig().setMetrics(metrics))) {
      SinkManager manager = ref.get();
      try (MemorySinkHandle bad = manager.sinks(MemorySink.KIND).newSink(MemorySink::new);
           MemorySinkHandle good = manager.sinks(MemorySink.KIND).newSink(MemorySink::new)) {
        bad.setFailing(true);

        manager.log(LogLevel.INFO, "x");
        assertTrue(manager.worker().awaitDrained(5000));

        assertEquals(List.of("x"), good.lines());
        assertEquals(1, metrics.failures.get());
        assertEquals(1, metrics.delivered.get());
        assertEquals(2, metrics.live.get("memory"));
      }
    }
  }

  @Test
  void liveSinkGaugeMatchesFinalCountAfterConcurrentChurn() throws Exception {
    CountingMetrics metrics = new CountingMetrics();
    try (SharedRef<SinkManager> ref = open(new LogSinkConfig().setMetrics(metrics))) {
      SinkAccess<MemorySink, MemorySinkHandle> memory = ref.get().sinks(MemorySink.KIND);
      int threads = 6;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<MemorySinkHandle>> kept = new ArrayList<>();
      try {
        for (int t = 0; t < threads; t++) {
          kept.add(pool.submit(() -> {
            start.await();
            for (int i = 0; i < 50; i++) {
              try (MemorySinkHandle temporary = memory.newSink(MemorySink::new)) {
                memory.remove(temporary);
              }
            }
            return memory.newSink(MemorySink::new);
          }));
        }
        start.countDown();

        List<MemorySinkHandle> survivors = new ArrayList<>();
        for (Future<MemorySinkHandle> f : kept) {
          survivors.add(f.get(10, TimeUnit.SECONDS));
        }
        assertEquals(threads, memory.size());
        assertEquals(threads, metrics.live.get("memory"));

        for (MemorySinkHandle survivor : survivors) {
          memory.remove(survivor);
          survivor.close();
        }
        assertEquals(0, metrics.live.get("memory"));
      } finally {
        pool.shutdownNow();
      }
    }
  }

  @Test
  void shutdownDrainsQueueBeforeClosingSinks() throws Exception {
    Path logFile;
    try (SharedRef<SinkManager> ref = open()) {
      SinkManager manager = ref.get();
      try (LogRotateSinkHandle file = manager.logRotateSinks()
          .newSink("app", () -> new LogRotateSink(dir, "app"))) {
        logFile = Path.of(file.logFileName());
        for (int i = 0; i < 20; i++) {
          manager.log(LogLevel.INFO, "line-" + i);
        }
      }
    }

    assertFalse(SinkManager.isLive());
    List<String> lines = Files.readAllLines(logFile);
    assertEquals(20, lines.size());
    assertTrue(lines.get(0).endsWith("]: line-0"));
    assertTrue(lines.get(19).contains(" INFO ["));
  }

  @Test
  void logRotateHandleOperations() throws Exception {
    try (SharedRef<SinkManager> ref = open()) {
      SinkAccess<LogRotateSink, LogRotateSinkHandle> files = ref.get().logRotateSinks();
      try (LogRotateSinkHandle file = files.newSink("app", () -> new LogRotateSink(dir, "app"))) {
        file.setMaxLogSize(1024);
        file.setMaxArchiveLogCount(2);
        file.setFlushPolicy(1);
        file.save("direct");

        assertEquals(1024, file.getMaxLogSize());
        assertEquals(2, file.getMaxArchiveLogCount());
        assertEquals(List.of("direct"), Files.readAllLines(dir.resolve("app.log")));

        String moved = file.changeLogFile(dir.resolve("moved"));
        assertEquals(dir.resolve("moved").resolve("app.log").toString(), moved);
        assertEquals(moved, file.logFileName());
        files.remove(file);
      }
    }
  }

  private static final class CountingMetrics implements MetricsExporter {
    final AtomicInteger delivered = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    final Map<String, Integer> live = new ConcurrentHashMap<>();

    @Override
    public void incrementDelivered() {
      delivered.incrementAndGet();
    }

    @Override
    public void incrementDropped() {
    }

    @Override
    public void incrementDeliveryFailure(String kind) {
      failures.incrementAndGet();
    }

    @Override
    public void recordQueueDepth(int depth) {
    }

    @Override
    public void recordLiveSinks(String kind, int count) {
      live.put(kind, count);
    }
  }
}

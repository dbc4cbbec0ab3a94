package logsink;

import logsink.lifecycle.SharedRef;
import logsink.registry.InstanceLimitExceededException;
import logsink.registry.InvalidKeyException;
import logsink.registry.NameAlreadyExistsException;
import logsink.registry.UnknownNameException;
import logsink.sink.SyslogSink;
import logsink.sink.SyslogSinkHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntFunction;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class SinkAccessTest {

  private SharedRef<SinkManager> ref;
  private SinkAccess<MemorySink, MemorySinkHandle> memory;

  @BeforeEach
  void setUp() {
    ref = SinkManager.getInstance(true, new LogSinkConfig().setCloseAtExit(false));
    memory = ref.get().sinks(MemorySink.KIND);
  }

  @AfterEach
  void tearDown() {
    ref.close();
  }

  // ── Creation ────────────────────────────────────────────────────

  @Test
  void unnamedSinksGetDistinctKeys() {
    try (MemorySinkHandle a = memory.newSink(MemorySink::new);
         MemorySinkHandle b = memory.newSink(MemorySink::new)) {
      assertNotEquals(a.key(), b.key());
      assertEquals(2, memory.size());
      assertTrue(memory.names().isEmpty());
      assertEquals("memory", a.kind());
      memory.remove(a);
      memory.remove(b);
    }
  }

  @Test
  void duplicateNameIsRejected() {
    try (MemorySinkHandle first = memory.newSink("app", MemorySink::new)) {
      NameAlreadyExistsException e = assertThrows(NameAlreadyExistsException.class,
          () -> memory.newSink("app", MemorySink::new));
      assertTrue(e.getMessage().contains("app"));
      assertEquals(1, memory.size());
      memory.remove(first);
    }
  }

  @Test
  void failingFactoryRollsBackReservation() {
    assertThrows(IllegalStateException.class, () -> memory.newSink("app", () -> {
      throw new IllegalStateException("cannot open");
    }));
    assertTrue(memory.names().isEmpty());
    assertEquals(0, memory.size());

    try (MemorySinkHandle handle = memory.newSink("app", MemorySink::new)) {
      assertEquals(Set.of("app"), memory.names());
      memory.remove(handle);
    }
  }

  @Test
  void nullFromFactoryIsRejected() {
    assertThrows(NullPointerException.class, () -> memory.newSink("app", () -> null));
    assertTrue(memory.names().isEmpty());
  }

  // ── Lookup by name ──────────────────────────────────────────────

  @Test
  void newHandleAliasesNamedSink() {
    try (MemorySinkHandle created = memory.newSink("app", MemorySink::new);
         MemorySinkHandle alias = memory.newHandle("app")) {
      assertEquals(created.key(), alias.key());

      alias.setFailing(true);
      memory.receive(LogMessage.of(LogLevel.INFO, "lost"));
      alias.setFailing(false);
      memory.receive(LogMessage.of(LogLevel.INFO, "kept"));

      assertEquals(List.of("kept"), created.lines());
      memory.remove("app");
    }
  }

  @Test
  void newHandleForUnknownNameThrows() {
    assertThrows(UnknownNameException.class, () -> memory.newHandle("ghost"));
  }

  // ── Removal ─────────────────────────────────────────────────────

  @Test
  void removeInvalidatesEveryAlias() {
    try (MemorySinkHandle created = memory.newSink("app", MemorySink::new);
         MemorySinkHandle alias = memory.newHandle("app")) {
      int key = created.key();

      memory.remove(created);

      assertFalse(created.isValid());
      assertFalse(alias.isValid());
      assertFalse(memory.contains(key));
      assertTrue(memory.names().isEmpty());
      InvalidKeyException e = assertThrows(InvalidKeyException.class, alias::lines);
      assertEquals(key, e.key());
      assertThrows(InvalidKeyException.class, () -> memory.remove(alias));
    }
  }

  @Test
  void removeClosesSinkAndFreesNameAndKey() {
    MemorySink sink = new MemorySink();
    int key;
    try (MemorySinkHandle handle = memory.newSink("app", () -> sink)) {
      key = handle.key();
      memory.remove("app");
    }
    assertTrue(sink.closed);

    try (MemorySinkHandle again = memory.newSink("app", MemorySink::new)) {
      assertEquals(key, again.key());
      memory.remove(again);
    }
  }

  @Test
  void removeUnknownNameThrows() {
    assertThrows(UnknownNameException.class, () -> memory.remove("ghost"));
  }

  @Test
  void removeRejectsHandleFromAnotherKind() {
    SinkAccess<MemorySink, MemorySinkHandle> single = ref.get().sinks(MemorySink.SINGLE_KIND);
    try (MemorySinkHandle foreign = single.newSink(MemorySink::new)) {
      assertThrows(IllegalArgumentException.class, () -> memory.remove(foreign));
      assertTrue(foreign.isValid());
      single.remove(foreign);
    }
  }

  // ── Single-instance kinds ───────────────────────────────────────

  @Test
  void singleInstanceKindAllowsOneLiveSink() {
    SinkAccess<MemorySink, MemorySinkHandle> single = ref.get().sinks(MemorySink.SINGLE_KIND);
    assertFalse(single.multipleInstancesAllowed());

    try (MemorySinkHandle only = single.newSink("first", MemorySink::new)) {
      assertThrows(InstanceLimitExceededException.class, () -> single.newSink("second", MemorySink::new));
      assertThrows(InstanceLimitExceededException.class, () -> single.newSink(MemorySink::new));
      assertEquals(Set.of("first"), single.names());

      single.remove(only);
    }
    try (MemorySinkHandle replacement = single.newSink("second", MemorySink::new)) {
      assertTrue(replacement.isValid());
      single.remove(replacement);
    }
  }

  @Test
  void syslogIsSingleInstance() {
    List<String> sent = new CopyOnWriteArrayList<>();
    PrintStream quiet = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
    SinkAccess<SyslogSink, SyslogSinkHandle> syslog = ref.get().syslogSinks();

    try (SyslogSinkHandle handle = syslog.newSink("syslog", () -> new SyslogSink("svc", sent::add, quiet))) {
      assertThrows(InstanceLimitExceededException.class,
          () -> syslog.newSink("other", () -> new SyslogSink("svc", sent::add, quiet)));

      handle.setIdentity("svc-2");
      handle.setFacility(SyslogSink.LOG_DAEMON);
      assertEquals("svc-2", handle.getIdentity());
      assertEquals(SyslogSink.LOG_DAEMON, handle.getFacility());

      syslog.remove(handle);
    }
    assertEquals(0, syslog.size());
  }

  // ── Concurrent creation ─────────────────────────────────────────

  @Test
  void concurrentCreatorsOfOneNameGetOneSink() throws Exception {
    List<MemorySink> built = new CopyOnWriteArrayList<>();
    List<Outcome> outcomes = race(8, i -> () -> memory.newSink("a", tracking(built)));

    MemorySinkHandle winner = winnerOf(outcomes, NameAlreadyExistsException.class);
    assertEquals(1, memory.size());
    assertEquals(Set.of("a"), memory.names());
    assertEquals(1, built.stream().filter(sink -> !sink.closed).count());

    memory.remove(winner);
    winner.close();
  }

  @Test
  void concurrentCreatorsOfSingleInstanceKindGetOneSink() throws Exception {
    SinkAccess<MemorySink, MemorySinkHandle> single = ref.get().sinks(MemorySink.SINGLE_KIND);
    List<MemorySink> built = new CopyOnWriteArrayList<>();
    List<Outcome> outcomes = race(8, i -> () -> single.newSink("single-" + i, tracking(built)));

    MemorySinkHandle winner = winnerOf(outcomes, InstanceLimitExceededException.class);
    assertEquals(1, single.size());
    assertEquals(1, single.names().size());
    // creators that got past the first capacity check built a payload; all but the winner's were closed
    assertEquals(1, built.stream().filter(sink -> !sink.closed).count());
    assertTrue(winner.isValid());

    single.remove(winner);
    winner.close();
  }

  private static Supplier<MemorySink> tracking(List<MemorySink> built) {
    return () -> {
      MemorySink sink = new MemorySink();
      built.add(sink);
      try {
        // widen the window between the first capacity check and the insert
        Thread.sleep(20);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return sink;
    };
  }

  private static List<Outcome> race(int threads, IntFunction<Callable<MemorySinkHandle>> task)
      throws InterruptedException {
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<MemorySinkHandle>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        Callable<MemorySinkHandle> call = task.apply(i);
        futures.add(pool.submit(() -> {
          start.await();
          return call.call();
        }));
      }
      start.countDown();

      List<Outcome> outcomes = new ArrayList<>();
      for (Future<MemorySinkHandle> f : futures) {
        try {
          outcomes.add(new Outcome(f.get(10, TimeUnit.SECONDS), null));
        } catch (ExecutionException e) {
          outcomes.add(new Outcome(null, e.getCause()));
        } catch (TimeoutException e) {
          fail("newSink did not return in time");
        }
      }
      return outcomes;
    } finally {
      pool.shutdownNow();
    }
  }

  private static MemorySinkHandle winnerOf(List<Outcome> outcomes, Class<? extends Throwable> loserFailure) {
    List<MemorySinkHandle> winners = new ArrayList<>();
    for (Outcome outcome : outcomes) {
      if (outcome.handle != null) {
        winners.add(outcome.handle);
      } else {
        assertInstanceOf(loserFailure, outcome.failure);
      }
    }
    assertEquals(1, winners.size());
    return winners.get(0);
  }

  private static final class Outcome {
    final MemorySinkHandle handle;
    final Throwable failure;

    Outcome(MemorySinkHandle handle, Throwable failure) {
      this.handle = handle;
      this.failure = failure;
    }
  }

  // ── Handles ─────────────────────────────────────────────────────

  @Test
  void closedHandleRejectsOperations() {
    MemorySinkHandle handle = memory.newSink("app", MemorySink::new);
    handle.close();

    assertTrue(handle.isClosed());
    assertThrows(IllegalStateException.class, handle::lines);
    assertEquals(Set.of("app"), memory.names());
    memory.remove("app");
  }

  @Test
  void handleContextBacksOneHandle() {
    try (MemorySinkHandle handle = memory.newSink(MemorySink::new)) {
      HandleContext<MemorySink> context = new HandleContext<>(ref.get().retain(), handle.key(), memory);
      try (MemorySinkHandle first = new MemorySinkHandle(context)) {
        assertEquals(handle.key(), first.key());
        assertThrows(IllegalStateException.class, () -> new MemorySinkHandle(context));
      }
      memory.remove(handle);
    }
  }
}

package logsink;

import logsink.lifecycle.SharedRef;
import logsink.lifecycle.SharedSingleton;
import logsink.sink.ColorTermSink;
import logsink.sink.ColorTermSinkHandle;
import logsink.sink.LogRotateSink;
import logsink.sink.LogRotateSinkHandle;
import logsink.sink.SyslogSink;
import logsink.sink.SyslogSinkHandle;
import logsink.spi.MetricsExporter;
import logsink.worker.LogWorker;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide owner of the {@link LogWorker} and of one {@link SinkAccess}
 * façade per sink kind.
 *
 * <p>There is at most one live manager per process. Callers obtain counted
 * references through {@link #getInstance(boolean)}; every {@link SinkHandle}
 * holds one as well. The {@code scopeLifetime} flag of the first call that
 * builds the manager fixes the lifetime policy:
 * <ul>
 *   <li>{@code false} (the usual choice): the manager keeps itself alive until
 *       the JVM exits, or until {@link #releaseKeepAlive()} is called;</li>
 *   <li>{@code true}: the manager is shut down as soon as the last reference
 *       and the last handle are closed, which suits tests and embedding.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SharedRef<SinkManager> ref = SinkManager.getInstance(false)) {
 *   SinkManager manager = ref.get();
 *   ColorTermSinkHandle console = manager.colorTermSinks()
 *       .newSink("console", () -> new ColorTermSink(System.out));
 *   manager.log(LogLevel.WARNING, "disk almost full");
 * }
 * }</pre>
 *
 * <p>Shutting a manager down drains the worker queue first, then retires and
 * closes every sink.
 *
 * @see SinkAccess
 * @see SharedSingleton
 */
public final class SinkManager {
  private static final Logger logger = Logger.getLogger(SinkManager.class.getName());

  private static final SharedSingleton<SinkManager> SINGLETON =
      new SharedSingleton<>("SinkManager", SinkManager::shutdown);

  private final LogWorker worker;
  private final MetricsExporter metrics;
  private final Map<SinkKind<?, ?>, SinkAccess<?, ?>> facades = new ConcurrentHashMap<>();
  private final Thread shutdownHook;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private SinkManager(LogSinkConfig config) {
    this.metrics = config.getMetrics() != null ? config.getMetrics() : MetricsExporter.NOOP;
    this.worker = LogWorker.builder()
        .queueCapacity(config.getQueueCapacity())
        .drainTimeoutMs(config.getDrainTimeoutMs())
        .threadNamePrefix(config.getThreadNamePrefix())
        .metrics(metrics)
        .build();
    sinks(SyslogSink.KIND);
    sinks(LogRotateSink.KIND);
    sinks(ColorTermSink.KIND);
    if (config.isCloseAtExit()) {
      this.shutdownHook = new Thread(this::closeResources, "logsink-shutdown");
      Runtime.getRuntime().addShutdownHook(shutdownHook);
    } else {
      this.shutdownHook = null;
    }
  }

  /**
   * Returns a new reference to the manager, building it with default settings
   * if none is live.
   *
   * @param scopeLifetime lifetime policy; only honored by the first successful call
   * @return a reference to close when done
   */
  public static SharedRef<SinkManager> getInstance(boolean scopeLifetime) {
    return getInstance(scopeLifetime, new LogSinkConfig());
  }

  /**
   * Returns a new reference to the manager, building it from {@code config} if
   * none is live.
   *
   * @param scopeLifetime lifetime policy; only honored by the first successful call
   * @param config settings used only if this call builds the manager
   * @return a reference to close when done
   * @throws IllegalArgumentException if this call builds the manager and
   *     {@code config} is invalid; the next call retries
   */
  public static SharedRef<SinkManager> getInstance(boolean scopeLifetime, LogSinkConfig config) {
    Objects.requireNonNull(config, "config");
    return SINGLETON.acquire(scopeLifetime, () -> new SinkManager(config));
  }

  /**
   * Drops the manager's keep-alive reference so that it shuts down once every
   * caller reference and handle is closed. Idempotent.
   */
  public static void releaseKeepAlive() {
    SINGLETON.releaseKeepAlive();
  }

  /**
   * Returns whether a manager is currently live.
   *
   * @return {@code true} between construction and shutdown
   */
  public static boolean isLive() {
    return SINGLETON.isLive();
  }

  public SinkAccess<SyslogSink, SyslogSinkHandle> syslogSinks() {
    return sinks(SyslogSink.KIND);
  }

  public SinkAccess<LogRotateSink, LogRotateSinkHandle> logRotateSinks() {
    return sinks(LogRotateSink.KIND);
  }

  public SinkAccess<ColorTermSink, ColorTermSinkHandle> colorTermSinks() {
    return sinks(ColorTermSink.KIND);
  }

  /**
   * Returns the façade for {@code kind}, creating it and attaching it to the
   * worker on first use.
   *
   * @param kind the sink kind
   * @param <S> the sink payload type
   * @param <H> the handle type
   * @return the façade for that kind
   */
  @SuppressWarnings("unchecked")
  public <S, H extends SinkHandle<S>> SinkAccess<S, H> sinks(SinkKind<S, H> kind) {
    Objects.requireNonNull(kind, "kind");
    return (SinkAccess<S, H>) facades.computeIfAbsent(kind, k -> attach(kind));
  }

  private <S, H extends SinkHandle<S>> SinkAccess<S, H> attach(SinkKind<S, H> kind) {
    SinkAccess<S, H> access = new SinkAccess<>(this, kind, metrics);
    worker.addReceiver(access);
    logger.log(Level.FINE, "Attached sink kind {0}", kind.name());
    return access;
  }

  /**
   * Queues a message for every live sink.
   *
   * @param level the severity
   * @param text the message text
   * @return {@code false} if the worker queue was full or closed
   */
  public boolean log(LogLevel level, String text) {
    return worker.submit(LogMessage.of(level, text));
  }

  /**
   * Queues a message for every live sink.
   *
   * @param message the message
   * @return {@code false} if the worker queue was full or closed
   */
  public boolean log(LogMessage message) {
    return worker.submit(message);
  }

  public LogWorker worker() {
    return worker;
  }

  SharedRef<SinkManager> retain() {
    return SINGLETON.retain(this);
  }

  private void shutdown() {
    if (shutdownHook != null) {
      try {
        Runtime.getRuntime().removeShutdownHook(shutdownHook);
      } catch (IllegalStateException e) {
        logger.log(Level.FINE, "JVM already shutting down; hook stays registered", e);
      }
    }
    closeResources();
  }

  private void closeResources() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    try {
      worker.close();
    } catch (RuntimeException e) {
      first = e;
    }
    for (SinkAccess<?, ?> access : facades.values()) {
      try {
        access.destroyAll();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    logger.log(Level.FINE, "SinkManager shut down");
    if (first != null) {
      throw first;
    }
  }
}

package logsink;

import logsink.lifecycle.SharedRef;
import logsink.registry.InstanceLimitExceededException;
import logsink.registry.InvalidKeyException;
import logsink.registry.KeyRegistry;
import logsink.registry.LockedResource;
import logsink.registry.NameAlreadyExistsException;
import logsink.registry.NameRegistry;
import logsink.registry.UnknownNameException;
import logsink.spi.MetricsExporter;
import logsink.worker.MessageReceiver;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Façade for one sink kind: creates sinks, hands out handles, looks sinks up by
 * name and retires them.
 *
 * <p>Each façade combines a {@link KeyRegistry} that owns the sinks and a
 * {@link NameRegistry} that indexes them by name. Obtain façades from the
 * {@link SinkManager}; there is exactly one per kind.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (SharedRef<SinkManager> manager = SinkManager.getInstance(false);
 *      LogRotateSinkHandle file = manager.get().logRotateSinks()
 *          .newSink("app", () -> new LogRotateSink(logDir, "app"))) {
 *   file.setMaxLogSize(10 * 1024 * 1024);
 *   manager.get().log(LogLevel.INFO, "started");
 * }
 *
 * // elsewhere, without carrying the handle around:
 * try (LogRotateSinkHandle file = manager.get().logRotateSinks().newHandle("app")) {
 *   file.flush();
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>All operations are thread-safe. Creation and removal are atomic with
 * respect to both registries: a call that throws leaves them unchanged.
 *
 * @param <S> the sink payload type
 * @param <H> the handle type
 * @see SinkKind
 * @see SinkHandle
 */
public final class SinkAccess<S, H extends SinkHandle<S>> implements MessageReceiver {
  private static final Logger logger = Logger.getLogger(SinkAccess.class.getName());

  private final SinkManager owner;
  private final SinkKind<S, H> kind;
  private final boolean multipleInstances;
  private final MetricsExporter metrics;
  private final KeyRegistry<S> sinks = new KeyRegistry<>();
  private final NameRegistry names = new NameRegistry();
  // pairs insert+setKey and remove+removeKey, and orders live-sink gauge updates;
  // never held across sink code
  private final ReentrantLock bookkeeping = new ReentrantLock();

  SinkAccess(SinkManager owner, SinkKind<S, H> kind, MetricsExporter metrics) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Set<SinkOption> options = Objects.requireNonNull(kind.options(), "options");
    this.multipleInstances = options.contains(SinkOption.MULTIPLE_INSTANCES);
  }

  /**
   * Creates an unnamed sink.
   *
   * @param factory builds the sink; ownership passes to the registry
   * @return a handle to the new sink
   * @throws InstanceLimitExceededException if the kind allows one sink and one exists
   */
  public H newSink(Supplier<? extends S> factory) {
    return newSink("", factory);
  }

  /**
   * Creates a sink, registered under {@code name} unless it is empty.
   *
   * @param name the sink name, or {@code ""} for an unnamed sink
   * @param factory builds the sink; ownership passes to the registry
   * @return a handle to the new sink
   * @throws InstanceLimitExceededException if the kind allows one sink and one exists
   * @throws NameAlreadyExistsException if another sink of this kind has {@code name}
   */
  public H newSink(String name, Supplier<? extends S> factory) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(factory, "factory");
    requireCapacity();
    boolean named = !name.isEmpty();
    if (named && !names.reserve(name)) {
      throw new NameAlreadyExistsException(name);
    }
    S sink = null;
    int key = KeyRegistry.INVALID_KEY;
    try {
      sink = Objects.requireNonNull(factory.get(), "sink factory returned null");
      bookkeeping.lock();
      try {
        requireCapacity();
        key = sinks.insert(sink);
        if (named) {
          names.setKey(name, key);
        }
        metrics.recordLiveSinks(kind.name(), sinks.size());
      } finally {
        bookkeeping.unlock();
      }
      H handle = wrap(key);
      logger.log(Level.FINE, "Created {0} sink key={1} name=''{2}''", new Object[] {kind.name(), key, name});
      return handle;
    } catch (RuntimeException | Error e) {
      if (key != KeyRegistry.INVALID_KEY) {
        destroy(key);
      } else {
        if (named) {
          names.remove(name);
        }
        if (sink != null) {
          release(sink);
        }
      }
      throw e;
    }
  }

  /**
   * Returns a new handle to the sink registered under {@code name}.
   *
   * @param name the sink name
   * @return a new handle aliasing the existing sink
   * @throws UnknownNameException if no sink has {@code name}, or its creation
   *     has not completed yet
   */
  public H newHandle(String name) {
    Objects.requireNonNull(name, "name");
    int key = names.getKey(name);
    if (key == KeyRegistry.INVALID_KEY) {
      throw new UnknownNameException(name, "Sink name not ready: " + name);
    }
    return wrap(key);
  }

  /**
   * Retires the sink behind {@code handle}, frees its key and every name that
   * points at it, then releases the sink. Other handles to the same sink fail
   * with {@link InvalidKeyException} from then on. The handle itself stays
   * open and must still be closed.
   *
   * @param handle a handle created by this façade
   * @throws InvalidKeyException if the sink was already removed
   * @throws IllegalArgumentException if the handle belongs to another kind
   */
  public void remove(H handle) {
    Objects.requireNonNull(handle, "handle");
    if (handle.access() != this) {
      throw new IllegalArgumentException("Handle belongs to another sink kind: " + handle.kind());
    }
    destroy(handle.key());
  }

  /**
   * Retires the sink registered under {@code name}.
   *
   * @param name the sink name
   * @throws UnknownNameException if no finalized sink has {@code name}
   */
  public void remove(String name) {
    Objects.requireNonNull(name, "name");
    int key = names.getKey(name);
    if (key == KeyRegistry.INVALID_KEY) {
      throw new UnknownNameException(name, "Sink name not ready: " + name);
    }
    destroy(key);
  }

  /**
   * Hands {@code message} to every live sink of this kind. A sink that fails is
   * logged and skipped.
   *
   * @param message the message
   */
  @Override
  public void receive(LogMessage message) {
    for (int key : sinks.keys()) {
      try (LockedResource<S> locked = sinks.access(key)) {
        kind.deliver(locked.get(), message);
        metrics.incrementDelivered();
      } catch (InvalidKeyException e) {
        // removed after the key snapshot was taken
        continue;
      } catch (Exception e) {
        metrics.incrementDeliveryFailure(kind.name());
        logger.log(Level.WARNING, "Delivery to " + kind.name() + " sink key=" + key + " failed", e);
      }
    }
  }

  <R> R invoke(int key, Function<? super S, ? extends R> operation) {
    try (LockedResource<S> locked = sinks.access(key)) {
      return operation.apply(locked.get());
    }
  }

  void destroy(int key) {
    S sink;
    bookkeeping.lock();
    try {
      sink = sinks.remove(key);
      names.removeKey(key);
      metrics.recordLiveSinks(kind.name(), sinks.size());
    } finally {
      bookkeeping.unlock();
    }
    logger.log(Level.FINE, "Removed {0} sink key={1}", new Object[] {kind.name(), key});
    release(sink);
  }

  /** Retires every sink of this kind; used when the manager shuts down. */
  void destroyAll() {
    for (int key : sinks.keys()) {
      try {
        destroy(key);
      } catch (InvalidKeyException e) {
        logger.log(Level.FINE, "Sink key {0} already removed", key);
      }
    }
  }

  private H wrap(int key) {
    SharedRef<SinkManager> ref = owner.retain();
    try {
      return Objects.requireNonNull(kind.newHandle(new HandleContext<>(ref, key, this)),
          "newHandle returned null");
    } catch (RuntimeException e) {
      ref.close();
      throw e;
    }
  }

  private void requireCapacity() {
    if (!multipleInstances && sinks.size() > 0) {
      throw new InstanceLimitExceededException(kind.name());
    }
  }

  private void release(S sink) {
    try {
      kind.close(sink);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to close retired " + kind.name() + " sink", e);
    }
  }

  public SinkKind<S, H> kind() {
    return kind;
  }

  public boolean multipleInstancesAllowed() {
    return multipleInstances;
  }

  public boolean contains(int key) {
    return sinks.contains(key);
  }

  /**
   * Returns the number of live sinks of this kind.
   *
   * @return live sink count
   */
  public int size() {
    return sinks.size();
  }

  /**
   * Returns the names currently registered, including reservations whose sink
   * is still being created.
   *
   * @return a sorted, unmodifiable snapshot
   */
  public Set<String> names() {
    return names.names();
  }
}

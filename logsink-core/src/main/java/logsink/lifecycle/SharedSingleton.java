package logsink.lifecycle;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lazily constructed, reference-counted holder for a single shared instance.
 *
 * <p>Callers obtain the instance through {@link #acquire}, which returns a
 * {@link SharedRef}; the instance stays alive while at least one reference is
 * open. The first successful {@code acquire} decides the lifetime policy for
 * good:
 * <ul>
 *   <li>{@code scopeLifetime=false}: the holder keeps a keep-alive reference of
 *       its own, so the instance outlives every caller (typically until process
 *       exit) unless {@link #releaseKeepAlive()} is called;</li>
 *   <li>{@code scopeLifetime=true}: no keep-alive reference; the instance is
 *       destroyed as soon as the last {@link SharedRef} is closed.</li>
 * </ul>
 * The flag passed to later calls is ignored.
 *
 * <p>Construction runs under the holder's lock: concurrent callers block until
 * the first caller has finished building the instance and then all receive
 * that same instance, never a partially built one. Teardown runs on the thread
 * that closes the last reference, outside the lock, so other threads can keep
 * using the holder meanwhile; an {@code acquire} arriving during teardown waits
 * for it to finish before building a successor, so at most one instance exists
 * at any time. If the factory
 * throws, the exception reaches the caller that triggered construction and
 * nothing is recorded; the next {@code acquire} tries again.
 *
 * <p>After a scope-bound instance has been destroyed, the next {@code acquire}
 * builds a fresh one under the same policy.
 *
 * <p>This class is thread-safe.
 *
 * @param <T> the instance type
 */
public final class SharedSingleton<T> {
  private static final Logger logger = Logger.getLogger(SharedSingleton.class.getName());

  private final String name;
  private final Consumer<? super T> destroyer;
  private final Object lock = new Object();

  private Entry<T> live;
  private Entry<T> tearingDown;
  private Boolean scopeLifetime;
  private boolean keepAliveReleased;

  /**
   * Creates an empty holder.
   *
   * @param name a label used in log messages
   * @param destroyer tears the instance down once its last reference is closed
   */
  public SharedSingleton(String name, Consumer<? super T> destroyer) {
    this.name = Objects.requireNonNull(name, "name");
    this.destroyer = Objects.requireNonNull(destroyer, "destroyer");
  }

  /**
   * Returns a new reference to the live instance, building it with
   * {@code factory} if none exists.
   *
   * @param scopeLifetime lifetime policy; only the first successful call counts
   * @param factory builds the instance; only invoked when none is live
   * @return a new reference, to be closed by the caller
   * @throws RuntimeException whatever {@code factory} throws; nothing is cached
   */
  public SharedRef<T> acquire(boolean scopeLifetime, Supplier<? extends T> factory) {
    Objects.requireNonNull(factory, "factory");
    synchronized (lock) {
      awaitTeardown();
      if (live == null) {
        T instance = Objects.requireNonNull(factory.get(), "factory returned null");
        if (this.scopeLifetime == null) {
          this.scopeLifetime = scopeLifetime;
        }
        live = new Entry<>(instance);
        if (!this.scopeLifetime && !keepAliveReleased) {
          live.pinned = true;
          live.refs++;
        }
        logger.log(Level.FINE, "Created {0} (scopeLifetime={1}, pinned={2})",
            new Object[] {name, this.scopeLifetime, live.pinned});
      }
      live.refs++;
      return new SharedRef<>(this, live);
    }
  }

  /**
   * Returns a new reference to {@code instance}, which must be the live one.
   *
   * @param instance the instance to retain
   * @return a new reference, to be closed by the caller
   * @throws IllegalStateException if {@code instance} is not live anymore
   */
  public SharedRef<T> retain(T instance) {
    synchronized (lock) {
      if (live == null || live.instance != instance) {
        throw new IllegalStateException(name + " instance is no longer live");
      }
      live.refs++;
      return new SharedRef<>(this, live);
    }
  }

  /**
   * Drops the keep-alive reference, so the live instance is destroyed once the
   * callers' references are closed, and stops pinning instances built later.
   * Idempotent.
   */
  public void releaseKeepAlive() {
    Entry<T> unpinned = null;
    synchronized (lock) {
      keepAliveReleased = true;
      if (live != null && live.pinned) {
        live.pinned = false;
        unpinned = live;
      }
    }
    if (unpinned != null) {
      release(unpinned);
    }
  }

  /**
   * Returns whether an instance is currently live.
   *
   * @return {@code true} between construction and teardown
   */
  public boolean isLive() {
    synchronized (lock) {
      return live != null;
    }
  }

  /**
   * Returns the number of open references to the live instance, the keep-alive
   * reference included.
   *
   * @return the reference count, {@code 0} when nothing is live
   */
  public int referenceCount() {
    synchronized (lock) {
      return live == null ? 0 : live.refs;
    }
  }

  /**
   * Returns the policy recorded by the first successful construction.
   *
   * @return the {@code scopeLifetime} flag, or empty before the first construction
   */
  public Optional<Boolean> scopeLifetime() {
    synchronized (lock) {
      return Optional.ofNullable(scopeLifetime);
    }
  }

  SharedRef<T> copy(Entry<T> entry) {
    synchronized (lock) {
      if (live != entry) {
        throw new IllegalStateException(name + " instance is no longer live");
      }
      entry.refs++;
      return new SharedRef<>(this, entry);
    }
  }

  void release(Entry<T> entry) {
    synchronized (lock) {
      entry.refs--;
      if (entry.refs > 0 || live != entry) {
        return;
      }
      live = null;
      tearingDown = entry;
    }
    logger.log(Level.FINE, "Destroying {0}", name);
    try {
      destroyer.accept(entry.instance);
    } finally {
      synchronized (lock) {
        tearingDown = null;
        lock.notifyAll();
      }
    }
  }

  // Called with the lock held.
  private void awaitTeardown() {
    boolean interrupted = false;
    while (tearingDown != null) {
      try {
        lock.wait();
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  static final class Entry<T> {
    final T instance;
    int refs;
    boolean pinned;

    Entry(T instance) {
      this.instance = instance;
    }
  }
}

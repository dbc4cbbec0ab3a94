package logsink.registry;

import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Exclusive, lock-held view of a registry-owned resource.
 *
 * <p>The lock is acquired when the accessor is created and released by
 * {@link #close()}, so the usual shape is a try-with-resources block:
 * <pre>{@code
 * try (LockedResource<LogRotateSink> locked = registry.access(key)) {
 *   locked.get().flush();
 * }
 * }</pre>
 *
 * <p>An accessor cannot be copied. {@link #moveTo()} hands the lock and the
 * reference to a new accessor and leaves this one inert: {@link #get()} then
 * throws and {@link #close()} does nothing. Both the move and the close must
 * happen on the thread that acquired the lock.
 *
 * <p>Keep the critical section short: the lock is registry-wide, so every
 * other caller of the same registry waits until this accessor is closed.
 *
 * @param <T> the resource type
 */
public final class LockedResource<T> implements AutoCloseable {
  private final Lock lock;
  private T resource;
  private boolean held;

  /**
   * Acquires {@code lock} and exposes {@code resource} until closed.
   *
   * @param lock the lock guarding {@code resource}
   * @param resource the protected resource
   */
  public LockedResource(Lock lock, T resource) {
    this.lock = Objects.requireNonNull(lock, "lock");
    lock.lock();
    this.resource = resource;
    this.held = true;
  }

  private LockedResource(T resource, Lock heldLock) {
    this.lock = heldLock;
    this.resource = resource;
    this.held = true;
  }

  // Wraps a lock the calling thread already holds.
  static <T> LockedResource<T> adopt(Lock heldLock, T resource) {
    return new LockedResource<>(resource, heldLock);
  }

  /**
   * Returns the protected resource.
   *
   * @return the resource
   * @throws IllegalStateException if this accessor was closed or moved
   */
  public T get() {
    if (!held) {
      throw new IllegalStateException("Accessor no longer holds the lock");
    }
    return resource;
  }

  /**
   * Returns whether this accessor still owns the lock.
   *
   * @return {@code true} until closed or moved
   */
  public boolean isHeld() {
    return held;
  }

  /**
   * Transfers lock ownership and the resource reference to a new accessor.
   *
   * @return the accessor that now owns the lock
   * @throws IllegalStateException if this accessor was closed or moved
   */
  public LockedResource<T> moveTo() {
    T moved = get();
    held = false;
    resource = null;
    return new LockedResource<>(moved, lock);
  }

  /**
   * Releases the lock. Calling this more than once, or after {@link #moveTo()},
   * has no effect.
   */
  @Override
  public void close() {
    if (!held) {
      return;
    }
    held = false;
    resource = null;
    lock.unlock();
  }
}

package logsink.lifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counted reference to the instance held by a {@link SharedSingleton}.
 *
 * <p>Each reference must be closed exactly once; closing it again is a no-op.
 * Closing the last open reference of an unpinned instance destroys it, on the
 * closing thread.
 *
 * @param <T> the instance type
 */
public final class SharedRef<T> implements AutoCloseable {
  private final SharedSingleton<T> owner;
  private final SharedSingleton.Entry<T> entry;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  SharedRef(SharedSingleton<T> owner, SharedSingleton.Entry<T> entry) {
    this.owner = owner;
    this.entry = entry;
  }

  /**
   * Returns the shared instance.
   *
   * @return the instance
   * @throws IllegalStateException if this reference was closed
   */
  public T get() {
    if (closed.get()) {
      throw new IllegalStateException("Reference already closed");
    }
    return entry.instance;
  }

  /**
   * Opens another reference to the same instance.
   *
   * @return a new reference, to be closed independently
   * @throws IllegalStateException if this reference was closed
   */
  public SharedRef<T> copy() {
    if (closed.get()) {
      throw new IllegalStateException("Reference already closed");
    }
    return owner.copy(entry);
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      owner.release(entry);
    }
  }
}

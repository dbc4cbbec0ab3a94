package logsink;

import logsink.lifecycle.SharedRef;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Caller-side token for one sink: its key plus a counted reference to the
 * {@link SinkManager} that owns it.
 *
 * <p>As long as a handle is open, the manager and its worker cannot be torn
 * down. Close handles when done with them; several handles may point at the
 * same sink (see {@link SinkAccess#newHandle(String)}).
 *
 * <p>Subclasses expose the operations of their sink kind through
 * {@link #call} and {@link #run}, which lock the sink for the duration of the
 * operation. Handles can only be constructed from a {@link HandleContext}
 * minted by the façade.
 *
 * @param <S> the sink payload type
 */
public abstract class SinkHandle<S> implements AutoCloseable {
  private final SharedRef<SinkManager> manager;
  private final int key;
  private final SinkAccess<S, ?> access;

  protected SinkHandle(HandleContext<S> context) {
    context.consume();
    this.manager = context.manager();
    this.key = context.key();
    this.access = context.access();
  }

  /**
   * Returns the registry key of the sink.
   *
   * @return the key, never {@code 0}
   */
  public final int key() {
    return key;
  }

  /**
   * Returns the name of the sink kind.
   *
   * @return the kind name
   */
  public final String kind() {
    return access.kind().name();
  }

  /**
   * Returns whether the sink behind this handle is still registered.
   *
   * @return {@code false} once the sink was removed
   */
  public final boolean isValid() {
    return access.contains(key);
  }

  /**
   * Returns whether this handle has been closed.
   *
   * @return {@code true} after {@link #close()}
   */
  public final boolean isClosed() {
    return manager.isClosed();
  }

  final SinkAccess<S, ?> access() {
    return access;
  }

  /**
   * Runs {@code operation} on the sink while holding its lock and returns its
   * result.
   *
   * @param operation the operation
   * @param <R> the result type
   * @return the operation's result
   * @throws logsink.registry.InvalidKeyException if the sink was removed
   * @throws IllegalStateException if this handle was closed
   */
  protected final <R> R call(Function<? super S, ? extends R> operation) {
    requireOpen();
    return access.invoke(key, operation);
  }

  /**
   * Runs {@code operation} on the sink while holding its lock.
   *
   * @param operation the operation
   * @throws logsink.registry.InvalidKeyException if the sink was removed
   * @throws IllegalStateException if this handle was closed
   */
  protected final void run(Consumer<? super S> operation) {
    requireOpen();
    access.invoke(key, sink -> {
      operation.accept(sink);
      return null;
    });
  }

  private void requireOpen() {
    if (manager.isClosed()) {
      throw new IllegalStateException("Handle for sink key " + key + " is closed");
    }
  }

  /**
   * Drops this handle's reference to the manager. The sink itself stays
   * registered. Idempotent.
   */
  @Override
  public void close() {
    manager.close();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[kind=" + kind() + ", key=" + key + "]";
  }
}

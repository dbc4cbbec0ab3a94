package logsink;

import java.util.EnumSet;
import java.util.Set;

/**
 * Describes one kind of sink to the {@link SinkAccess} façade: how messages are
 * delivered into a sink, how handles are minted and how a retired sink is
 * released.
 *
 * <p>Implementations are stateless and used as map keys by
 * {@link SinkManager#sinks(SinkKind)}, so each kind should be a single shared
 * constant.
 *
 * @param <S> the sink payload type
 * @param <H> the handle type callers receive
 */
public interface SinkKind<S, H extends SinkHandle<S>> {

  /**
   * Returns a short name for logs, metrics and error messages.
   *
   * @return the kind name
   */
  String name();

  /**
   * Returns the options of this kind. Defaults to allowing several live sinks.
   *
   * @return the option set
   */
  default Set<SinkOption> options() {
    return EnumSet.of(SinkOption.MULTIPLE_INSTANCES);
  }

  /**
   * Delivers one message into a sink. Called on the worker thread while the
   * sink's registry lock is held. Closing the last handle from here shuts the
   * manager down on the worker thread without waiting for the worker to stop;
   * every sink is closed before this call returns.
   *
   * @param sink the sink
   * @param message the message
   * @throws Exception if delivery fails; logged and counted, never rethrown
   */
  void deliver(S sink, LogMessage message) throws Exception;

  /**
   * Wraps a freshly minted context in the kind's handle type.
   *
   * @param context the context, to be passed to the handle constructor
   * @return the new handle
   */
  H newHandle(HandleContext<S> context);

  /**
   * Releases a sink that has been removed from its registry. Called outside
   * every registry lock. The default does nothing.
   *
   * @param sink the retired sink
   * @throws Exception if releasing fails; logged, the bookkeeping is already gone
   */
  default void close(S sink) throws Exception {
  }
}

package logsink;

import logsink.lifecycle.SharedRef;

/**
 * Everything a {@link SinkHandle} is built from. Only {@link SinkAccess} can
 * create one, which keeps handle construction in the façade's hands even
 * though handle classes live elsewhere. A context can back a single handle.
 *
 * @param <S> the sink payload type
 */
public final class HandleContext<S> {
  private final SharedRef<SinkManager> manager;
  private final int key;
  private final SinkAccess<S, ?> access;
  private boolean consumed;

  HandleContext(SharedRef<SinkManager> manager, int key, SinkAccess<S, ?> access) {
    this.manager = manager;
    this.key = key;
    this.access = access;
  }

  synchronized void consume() {
    if (consumed) {
      throw new IllegalStateException("HandleContext already used for sink key " + key);
    }
    consumed = true;
  }

  SharedRef<SinkManager> manager() {
    return manager;
  }

  int key() {
    return key;
  }

  SinkAccess<S, ?> access() {
    return access;
  }
}

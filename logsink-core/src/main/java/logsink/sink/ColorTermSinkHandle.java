package logsink.sink;

import logsink.HandleContext;
import logsink.SinkHandle;

/**
 * Handle to a {@link ColorTermSink}. The sink has no settings, so the handle
 * only keeps the manager alive and identifies the sink for removal.
 */
public final class ColorTermSinkHandle extends SinkHandle<ColorTermSink> {

  public ColorTermSinkHandle(HandleContext<ColorTermSink> context) {
    super(context);
  }
}

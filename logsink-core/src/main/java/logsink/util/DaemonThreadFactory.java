package logsink.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the log worker: daemon threads named {@code <prefix>1},
 * {@code <prefix>2}, ..., so a worker that is never closed does not keep the
 * JVM alive. An exception escaping a thread is logged at SEVERE rather than
 * printed to stderr, which may itself be a sink.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String prefix;
  private final AtomicInteger sequence = new AtomicInteger();

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread worker = new Thread(task, prefix + sequence.incrementAndGet());
    worker.setDaemon(true);
    worker.setUncaughtExceptionHandler(DaemonThreadFactory::logUncaught);
    return worker;
  }

  /** Returns how many threads this factory has created so far. */
  public int createdCount() {
    return sequence.get();
  }

  private static void logUncaught(Thread thread, Throwable error) {
    logger.log(Level.SEVERE, "Uncaught exception on " + thread.getName(), error);
  }
}

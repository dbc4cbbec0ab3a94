package logsink.worker;

import logsink.LogMessage;
import logsink.spi.MetricsExporter;
import logsink.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded message pump shared by every sink.
 *
 * <p>Messages are offered to a bounded queue by {@link #submit} and drained by
 * one daemon thread, which hands each message to every registered
 * {@link MessageReceiver} in registration order. Submission never blocks: a
 * full queue rejects the message and counts it as dropped.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and
 * implements {@link AutoCloseable} for graceful shutdown with a configurable
 * drain timeout.
 *
 * @see LogWorker.Builder
 */
public final class LogWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LogWorker.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<LogMessage> queue;
  private final ExecutorService executor;
  private final List<MessageReceiver> receivers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private volatile Thread workerThread;

  private final Object progress = new Object();
  private long accepted;
  private long processed;

  private LogWorker(Builder builder) {
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
    this.executor = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory(Objects.requireNonNull(builder.threadNamePrefix, "threadNamePrefix")));
    executor.submit(this::workerLoop);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a receiver for all messages processed from now on.
   *
   * @param receiver the receiver
   */
  public void addReceiver(MessageReceiver receiver) {
    receivers.add(Objects.requireNonNull(receiver, "receiver"));
  }

  /**
   * Offers a message to the queue. Returns {@code false} if the queue is full
   * or the worker is no longer accepting messages.
   *
   * @param message the message
   * @return {@code true} if the message was accepted
   */
  public boolean submit(LogMessage message) {
    Objects.requireNonNull(message, "message");
    if (!accepting.get()) {
      metrics.incrementDropped();
      return false;
    }
    boolean enqueued;
    synchronized (progress) {
      enqueued = queue.offer(message);
      if (enqueued) {
        accepted++;
      }
    }
    if (!enqueued) {
      metrics.incrementDropped();
    }
    metrics.recordQueueDepth(queue.size());
    return enqueued;
  }

  /**
   * Waits until every message accepted so far has been handed to the receivers.
   *
   * @param timeoutMs maximum time to wait in milliseconds
   * @return {@code true} if the queue drained in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitDrained(long timeoutMs) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    synchronized (progress) {
      while (processed < accepted) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs <= 0) {
          return false;
        }
        progress.wait(remainingMs);
      }
      return true;
    }
  }

  public int queueDepth() {
    return queue.size();
  }

  public boolean isAccepting() {
    return accepting.get();
  }

  private void workerLoop() {
    workerThread = Thread.currentThread();
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        LogMessage message = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (message == null) {
          if (!running.get()) break;
          continue;
        }
        try {
          dispatch(message);
        } finally {
          synchronized (progress) {
            processed++;
            progress.notifyAll();
          }
        }
        metrics.recordQueueDepth(queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Log worker loop error", t);
      }
    }
  }

  private void dispatch(LogMessage message) {
    for (MessageReceiver receiver : receivers) {
      try {
        receiver.receive(message);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Message receiver failed", e);
      }
    }
  }

  /**
   * Stops accepting messages, drains what is queued within the drain timeout,
   * then stops the worker thread. Idempotent.
   *
   * <p>When called from a receiver on the worker thread itself, returns without
   * waiting; the thread drains the queue and exits once the receiver returns.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    executor.shutdown();
    if (Thread.currentThread() == workerThread) {
      return;
    }
    try {
      if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: " + queue.size());
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link LogWorker}. */
  public static final class Builder {
    private int queueCapacity = 10_000;
    private long drainTimeoutMs = 5000;
    private String threadNamePrefix = "logsink-worker-";
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the bounded capacity of the message queue.
     *
     * <p>Optional. Defaults to {@code 10000}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of queued messages
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for queued messages on close.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the worker thread name prefix.
     *
     * <p>Optional. Defaults to {@code "logsink-worker-"}.
     *
     * @param threadNamePrefix the prefix
     * @return this builder
     */
    public Builder threadNamePrefix(String threadNamePrefix) {
      this.threadNamePrefix = threadNamePrefix;
      return this;
    }

    /**
     * Sets the metrics exporter for queue depth and drop counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds and starts the worker.
     *
     * @return a new {@link LogWorker}
     * @throws NullPointerException if {@code threadNamePrefix} is null
     * @throws IllegalArgumentException if {@code queueCapacity <= 0} or
     *     {@code drainTimeoutMs < 0}
     */
    public LogWorker build() {
      return new LogWorker(this);
    }
  }
}

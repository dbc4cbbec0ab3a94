package logsink;

import logsink.spi.MetricsExporter;

/**
 * Settings for the {@link SinkManager} and its worker. Only the call that
 * actually builds the manager uses them; later calls to
 * {@link SinkManager#getInstance(boolean, LogSinkConfig)} ignore their config.
 * Values are validated when the worker is built.
 */
public final class LogSinkConfig {
  private int queueCapacity = 10_000;
  private long drainTimeoutMs = 5000L;
  private String threadNamePrefix = "logsink-worker-";
  private boolean closeAtExit = true;
  private MetricsExporter metrics = MetricsExporter.NOOP;

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public LogSinkConfig setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
    return this;
  }

  public long getDrainTimeoutMs() {
    return drainTimeoutMs;
  }

  public LogSinkConfig setDrainTimeoutMs(long drainTimeoutMs) {
    this.drainTimeoutMs = drainTimeoutMs;
    return this;
  }

  public String getThreadNamePrefix() {
    return threadNamePrefix;
  }

  public LogSinkConfig setThreadNamePrefix(String threadNamePrefix) {
    this.threadNamePrefix = threadNamePrefix;
    return this;
  }

  /**
   * Whether a JVM shutdown hook drains the worker and closes all sinks of a
   * manager that is still live at exit.
   *
   * @return {@code true} by default
   */
  public boolean isCloseAtExit() {
    return closeAtExit;
  }

  public LogSinkConfig setCloseAtExit(boolean closeAtExit) {
    this.closeAtExit = closeAtExit;
    return this;
  }

  public MetricsExporter getMetrics() {
    return metrics;
  }

  public LogSinkConfig setMetrics(MetricsExporter metrics) {
    this.metrics = metrics;
    return this;
  }
}

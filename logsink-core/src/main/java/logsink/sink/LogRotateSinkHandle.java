package logsink.sink;

import logsink.HandleContext;
import logsink.SinkHandle;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Handle to a {@link LogRotateSink}. Every call locks the sink for its
 * duration, so writes through the handle never interleave with the worker's.
 */
public final class LogRotateSinkHandle extends SinkHandle<LogRotateSink> {

  public LogRotateSinkHandle(HandleContext<LogRotateSink> context) {
    super(context);
  }

  /**
   * Appends an entry directly, bypassing the worker queue.
   *
   * @param logEntry the text to append
   */
  public void save(String logEntry) {
    Objects.requireNonNull(logEntry, "logEntry");
    run(sink -> sink.save(logEntry));
  }

  /**
   * Switches the sink to another file.
   *
   * @param logDirectory the new directory
   * @param newName the new base name; empty keeps the current one
   * @return the new file path, or an empty string if the switch failed
   */
  public String changeLogFile(Path logDirectory, String newName) {
    return call(sink -> sink.changeLogFile(logDirectory, newName));
  }

  public String changeLogFile(Path logDirectory) {
    return changeLogFile(logDirectory, "");
  }

  public String logFileName() {
    return call(LogRotateSink::logFileName);
  }

  public void setMaxArchiveLogCount(int maxSize) {
    run(sink -> sink.setMaxArchiveLogCount(maxSize));
  }

  public int getMaxArchiveLogCount() {
    return call(LogRotateSink::getMaxArchiveLogCount);
  }

  /**
   * Sets how often the file is flushed.
   *
   * @param flushPolicy {@code 0} never, otherwise every {@code flushPolicy} writes
   */
  public void setFlushPolicy(int flushPolicy) {
    run(sink -> sink.setFlushPolicy(flushPolicy));
  }

  public void flush() {
    run(LogRotateSink::flush);
  }

  public void setMaxLogSize(long maxFileSizeInBytes) {
    run(sink -> sink.setMaxLogSize(maxFileSizeInBytes));
  }

  public long getMaxLogSize() {
    return call(LogRotateSink::getMaxLogSize);
  }
}

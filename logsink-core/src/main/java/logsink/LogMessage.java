package logsink;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Immutable log record queued on the {@link logsink.worker.LogWorker} and
 * delivered to every live sink.
 *
 * @param timestamp when the message was produced
 * @param level its severity
 * @param threadName the producing thread
 * @param source call site ({@code File.java:42} or similar), may be empty
 * @param text the message text
 */
public record LogMessage(Instant timestamp, LogLevel level, String threadName, String source, String text) {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss.SSSSSS").withZone(ZoneId.systemDefault());

  public LogMessage {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(threadName, "threadName");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(text, "text");
  }

  /**
   * Creates a message stamped now, on the calling thread, without source location.
   *
   * @param level the severity
   * @param text the message text
   * @return a new message
   */
  public static LogMessage of(LogLevel level, String text) {
    return new LogMessage(Instant.now(), level, Thread.currentThread().getName(), "", text);
  }

  /**
   * Renders the default single-line form:
   * {@code 2024/05/01 12:00:00.123456 INFO [main File.java:42]: text}.
   *
   * @return the formatted line, without trailing newline
   */
  public String toText() {
    StringBuilder sb = new StringBuilder(64 + text.length());
    sb.append(TIMESTAMP_FORMAT.format(timestamp))
        .append(' ')
        .append(level.name())
        .append(" [")
        .append(threadName);
    if (!source.isEmpty()) {
      sb.append(' ').append(source);
    }
    sb.append("]: ").append(text);
    return sb.toString();
  }
}

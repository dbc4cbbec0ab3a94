package logsink.sink;

import logsink.HandleContext;
import logsink.LogLevel;
import logsink.LogMessage;
import logsink.SinkKind;
import logsink.SinkOption;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.net.SocketException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sink that forwards messages to syslog.
 *
 * <p>Each message becomes one line {@code <PRI>identity: header text}, where
 * {@code PRI} is the facility plus the severity mapped from the message level.
 * Only one syslog sink may be live at a time, since syslog identity and
 * options are process-wide settings.
 *
 * <p>Not thread-safe on its own: the registry lock serializes every access.
 */
public final class SyslogSink implements AutoCloseable {

  public static final int LOG_EMERG = 0;
  public static final int LOG_ALERT = 1;
  public static final int LOG_CRIT = 2;
  public static final int LOG_ERR = 3;
  public static final int LOG_WARNING = 4;
  public static final int LOG_NOTICE = 5;
  public static final int LOG_INFO = 6;
  public static final int LOG_DEBUG = 7;

  public static final int LOG_KERN = 0;
  public static final int LOG_USER = 1 << 3;
  public static final int LOG_DAEMON = 3 << 3;
  public static final int LOG_LOCAL0 = 16 << 3;
  public static final int LOG_LOCAL7 = 23 << 3;

  /** Include the process id after the identity. */
  public static final int LOG_PID = 0x01;
  /** Also print each line to standard error. */
  public static final int LOG_PERROR = 0x20;

  /** The syslog kind: a single live instance. */
  public static final SinkKind<SyslogSink, SyslogSinkHandle> KIND = new SinkKind<>() {
    @Override
    public String name() {
      return "syslog";
    }

    @Override
    public Set<SinkOption> options() {
      return EnumSet.noneOf(SinkOption.class);
    }

    @Override
    public void deliver(SyslogSink sink, LogMessage message) {
      sink.syslog(message);
    }

    @Override
    public SyslogSinkHandle newHandle(HandleContext<SyslogSink> context) {
      return new SyslogSinkHandle(context);
    }

    @Override
    public void close(SyslogSink sink) throws IOException {
      sink.close();
    }
  };

  private final SyslogTransport transport;
  private final PrintStream stderr;
  private final Map<LogLevel, Integer> levelMap = new EnumMap<>(LogLevel.class);
  private String identity;
  private String logHeader = "";
  private int facility = LOG_USER;
  private int option;

  /**
   * Creates a sink that sends to the local syslog daemon over UDP.
   *
   * @param identity the program name prepended to every line
   * @return the new sink
   * @throws UncheckedIOException if no socket can be opened
   */
  public static SyslogSink udp(String identity) {
    try {
      return new SyslogSink(identity, new UdpSyslogTransport(), System.err);
    } catch (SocketException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Creates a sink over an arbitrary transport.
   *
   * @param identity the program name prepended to every line
   * @param transport where rendered lines go; owned by the sink from now on
   * @param stderr where lines are echoed when {@link #LOG_PERROR} is set
   */
  public SyslogSink(String identity, SyslogTransport transport, PrintStream stderr) {
    this.identity = Objects.requireNonNull(identity, "identity");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.stderr = Objects.requireNonNull(stderr, "stderr");
    levelMap.put(LogLevel.DEBUG, LOG_DEBUG);
    levelMap.put(LogLevel.INFO, LOG_INFO);
    levelMap.put(LogLevel.WARNING, LOG_WARNING);
    levelMap.put(LogLevel.FATAL, LOG_CRIT);
  }

  /**
   * Sends one message.
   *
   * @param message the message
   * @throws UncheckedIOException if the transport fails
   */
  public void syslog(LogMessage message) {
    String line = render(message);
    if ((option & LOG_PERROR) != 0) {
      stderr.println(line.substring(line.indexOf('>') + 1));
    }
    try {
      transport.send(line);
    } catch (IOException e) {
      throw new UncheckedIOException("syslog send failed", e);
    }
  }

  String render(LogMessage message) {
    int priority = facility | severityOf(message.level());
    StringBuilder sb = new StringBuilder();
    sb.append('<').append(priority).append('>').append(identity);
    if ((option & LOG_PID) != 0) {
      sb.append('[').append(ProcessHandle.current().pid()).append(']');
    }
    sb.append(": ");
    if (!logHeader.isEmpty()) {
      sb.append(logHeader).append(' ');
    }
    sb.append(message.text());
    return sb.toString();
  }

  public int severityOf(LogLevel level) {
    return levelMap.getOrDefault(level, LOG_INFO);
  }

  public void setLogHeader(String logHeader) {
    this.logHeader = Objects.requireNonNull(logHeader, "logHeader");
  }

  public String getLogHeader() {
    return logHeader;
  }

  public void echoToStderr() {
    option |= LOG_PERROR;
  }

  public void setIdentity(String identity) {
    this.identity = Objects.requireNonNull(identity, "identity");
  }

  public String getIdentity() {
    return identity;
  }

  public void setFacility(int facility) {
    if (facility < LOG_KERN || facility > LOG_LOCAL7 || (facility & 0x07) != 0) {
      throw new IllegalArgumentException("Invalid syslog facility: " + facility);
    }
    this.facility = facility;
  }

  public int getFacility() {
    return facility;
  }

  public void setOption(int option) {
    this.option = option;
  }

  public int getOption() {
    return option;
  }

  /**
   * Replaces the level-to-severity entries given in {@code map}; levels not in
   * the map keep their current severity.
   *
   * @param map level to syslog severity ({@link #LOG_EMERG}..{@link #LOG_DEBUG})
   */
  public void setLevelMap(Map<LogLevel, Integer> map) {
    map.values().forEach(SyslogSink::checkSeverity);
    levelMap.putAll(map);
  }

  public void setLevel(LogLevel level, int severity) {
    Objects.requireNonNull(level, "level");
    checkSeverity(severity);
    levelMap.put(level, severity);
  }

  private static void checkSeverity(Integer severity) {
    if (severity == null || severity < LOG_EMERG || severity > LOG_DEBUG) {
      throw new IllegalArgumentException("Invalid syslog severity: " + severity);
    }
  }

  @Override
  public void close() throws IOException {
    transport.close();
  }
}

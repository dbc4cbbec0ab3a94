package logsink.sink;

import logsink.HandleContext;
import logsink.LogLevel;
import logsink.SinkHandle;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Handle to the {@link SyslogSink}. Every call locks the sink for its
 * duration; arguments are copied before the call returns.
 */
public final class SyslogSinkHandle extends SinkHandle<SyslogSink> {

  public SyslogSinkHandle(HandleContext<SyslogSink> context) {
    super(context);
  }

  public void setLogHeader(String header) {
    Objects.requireNonNull(header, "header");
    run(sink -> sink.setLogHeader(header));
  }

  /** Mirrors every line to standard error (the {@code LOG_PERROR} option). */
  public void echoToStderr() {
    run(SyslogSink::echoToStderr);
  }

  public void setIdentity(String identity) {
    Objects.requireNonNull(identity, "identity");
    run(sink -> sink.setIdentity(identity));
  }

  public void setFacility(int facility) {
    run(sink -> sink.setFacility(facility));
  }

  public void setOption(int option) {
    run(sink -> sink.setOption(option));
  }

  public void setLevelMap(Map<LogLevel, Integer> map) {
    Map<LogLevel, Integer> copy = new EnumMap<>(LogLevel.class);
    copy.putAll(Objects.requireNonNull(map, "map"));
    run(sink -> sink.setLevelMap(copy));
  }

  public void setLevel(LogLevel level, int severity) {
    run(sink -> sink.setLevel(level, severity));
  }

  public String getIdentity() {
    return call(SyslogSink::getIdentity);
  }

  public int getFacility() {
    return call(SyslogSink::getFacility);
  }

  public int getOption() {
    return call(SyslogSink::getOption);
  }
}

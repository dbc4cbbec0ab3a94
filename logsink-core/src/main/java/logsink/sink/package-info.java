/**
 * Built-in sink kinds and their handles.
 *
 * <ul>
 *   <li>{@link logsink.sink.SyslogSink} / {@link logsink.sink.SyslogSinkHandle}:
 *       syslog lines over a {@link logsink.sink.SyslogTransport}; one live
 *       instance at most</li>
 *   <li>{@link logsink.sink.LogRotateSink} / {@link logsink.sink.LogRotateSinkHandle}:
 *       size-rotated, gzip-archived log files</li>
 *   <li>{@link logsink.sink.ColorTermSink} / {@link logsink.sink.ColorTermSinkHandle}:
 *       ANSI-colored terminal output</li>
 * </ul>
 *
 * <p>Each payload class exposes its kind as a {@code KIND} constant, which
 * {@link logsink.SinkManager} registers on construction.
 */
package logsink.sink;

package logsink.sink;

import java.io.IOException;

/**
 * Carries rendered syslog lines to a syslog daemon.
 *
 * @see UdpSyslogTransport
 */
public interface SyslogTransport extends AutoCloseable {

  /**
   * Sends one rendered line, {@code <PRI>} prefix included.
   *
   * @param line the line, without trailing newline
   * @throws IOException if sending fails
   */
  void send(String line) throws IOException;

  @Override
  default void close() throws IOException {
  }
}

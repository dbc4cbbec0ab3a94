package logsink.sink;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Sends each syslog line as one UDP datagram (RFC 3164 transport). Lines
 * longer than 1024 bytes of UTF-8 are truncated at the last whole character.
 */
public final class UdpSyslogTransport implements SyslogTransport {
  public static final int DEFAULT_PORT = 514;

  // RFC 3164 caps a packet at 1024 bytes
  private static final int MAX_DATAGRAM_BYTES = 1024;

  private final InetSocketAddress target;
  private final DatagramSocket socket;

  /**
   * Targets the local syslog daemon on the default port.
   *
   * @throws SocketException if no socket can be opened
   */
  public UdpSyslogTransport() throws SocketException {
    this(new InetSocketAddress(InetAddress.getLoopbackAddress(), DEFAULT_PORT));
  }

  /**
   * Targets the given address.
   *
   * @param target the syslog daemon address
   * @throws SocketException if no socket can be opened
   */
  public UdpSyslogTransport(InetSocketAddress target) throws SocketException {
    this.target = Objects.requireNonNull(target, "target");
    this.socket = new DatagramSocket();
  }

  @Override
  public void send(String line) throws IOException {
    byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
    int length = Math.min(bytes.length, MAX_DATAGRAM_BYTES);
    // back off to a character boundary: never cut a multi-byte sequence
    while (length < bytes.length && (bytes[length] & 0xC0) == 0x80) {
      length--;
    }
    socket.send(new DatagramPacket(bytes, length, target));
  }

  @Override
  public void close() {
    socket.close();
  }
}

package ca.gc.cra.rdt.infrastructure.net;

import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.domain.net.Datagram;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DatagramPort} backed by a bound {@link DatagramSocket}.
 * <p><strong>Thread-safety:</strong> {@link #send} may run concurrently with one thread in {@link #receive};
 * the receive buffer is confined to the reading thread.</p>
 * <p><strong>Observability:</strong> Logs bind and close at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class UdpDatagramAdapter implements DatagramPort {
  private static final Logger log = LoggerFactory.getLogger(UdpDatagramAdapter.class);
  /** Largest UDP payload over IPv4. */
  public static final int MAX_DATAGRAM = 65_507;

  private final DatagramSocket socket;
  private final byte[] receiveBuffer = new byte[MAX_DATAGRAM];

  private UdpDatagramAdapter(DatagramSocket socket) {
    this.socket = socket;
  }

  /**
   * Binds a UDP socket.
   *
   * @param bindAddress local address; port {@code 0} picks an ephemeral port
   * @return bound adapter
   * @throws IOException if the socket cannot be bound
   */
  public static UdpDatagramAdapter bind(InetSocketAddress bindAddress) throws IOException {
    Objects.requireNonNull(bindAddress, "bindAddress");
    DatagramSocket socket = new DatagramSocket(bindAddress);
    log.debug("Bound UDP socket on {}", socket.getLocalSocketAddress());
    return new UdpDatagramAdapter(socket);
  }

  @Override
  public void send(SocketAddress address, byte[] bytes) throws IOException {
    socket.send(new DatagramPacket(bytes, bytes.length, address));
  }

  @Override
  public Optional<Datagram> receive(Duration timeout) throws IOException {
    int millis = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    DatagramPacket packet = new DatagramPacket(receiveBuffer, receiveBuffer.length);
    try {
      socket.setSoTimeout(millis);
      socket.receive(packet);
    } catch (SocketTimeoutException ex) {
      return Optional.empty();
    }
    byte[] bytes = Arrays.copyOfRange(packet.getData(), packet.getOffset(), packet.getOffset() + packet.getLength());
    return Optional.of(new Datagram(packet.getSocketAddress(), bytes));
  }

  @Override
  public SocketAddress localAddress() {
    return socket.getLocalSocketAddress();
  }

  @Override
  public void close() {
    if (!socket.isClosed()) {
      log.debug("Closing UDP socket on {}", socket.getLocalSocketAddress());
      socket.close();
    }
  }
}

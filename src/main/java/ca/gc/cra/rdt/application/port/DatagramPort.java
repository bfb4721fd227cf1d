package ca.gc.cra.rdt.application.port;

import ca.gc.cra.rdt.domain.net.Datagram;
import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Optional;

/**
 * <strong>What:</strong> Port over an unreliable datagram transport.
 * <p><strong>Why:</strong> Keeps engines independent of sockets so they can run over UDP, a lossy
 * simulator or an in-memory network.</p>
 * <p><strong>Thread-safety:</strong> {@link #send} may be called concurrently with a single thread blocked in
 * {@link #receive}.</p>
 *
 * @since 0.1.0
 */
public interface DatagramPort extends Closeable {
  /**
   * Sends one datagram. Delivery is not guaranteed.
   *
   * @param address destination
   * @param bytes datagram contents
   * @throws IOException if the transport rejects the datagram; callers treat this as loss
   */
  void send(SocketAddress address, byte[] bytes) throws IOException;

  /**
   * Waits for the next datagram.
   *
   * @param timeout maximum wait
   * @return datagram, or empty when the timeout elapsed
   * @throws IOException if the transport failed or was closed
   */
  Optional<Datagram> receive(Duration timeout) throws IOException;

  /**
   * Returns the local address this port is bound to.
   *
   * @return bound address
   */
  SocketAddress localAddress();

  /** Releases the transport; idempotent. */
  @Override
  void close();
}

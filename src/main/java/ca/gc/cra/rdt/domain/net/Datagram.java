package ca.gc.cra.rdt.domain.net;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketAddress;
import java.util.Arrays;
import java.util.Objects;

/**
 * Raw datagram received from, or destined to, a remote address.
 *
 * @param address remote socket address; never {@code null}
 * @param bytes datagram contents; copied on construction
 * @since 0.1.0
 */
public record Datagram(SocketAddress address, byte[] bytes) {
  /**
   * Validates and copies the datagram contents.
   *
   * @throws NullPointerException if {@code address} is {@code null}
   */
  public Datagram {
    Objects.requireNonNull(address, "address");
    bytes = bytes != null ? bytes.clone() : new byte[0];
  }

  /**
   * Provides the datagram contents without additional copying.
   *
   * @return internal byte array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Bytes are copied on construction and decoded immediately.")
  public byte[] bytes() {
    return bytes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Datagram other)) {
      return false;
    }
    return address.equals(other.address) && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * address.hashCode() + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Datagram{address=" + address + ", length=" + bytes.length + '}';
  }
}

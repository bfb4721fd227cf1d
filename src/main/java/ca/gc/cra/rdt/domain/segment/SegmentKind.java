package ca.gc.cra.rdt.domain.segment;

import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of segment kinds recognised on the wire.
 * <p><strong>Why:</strong> Validates which flag combinations are meaningful once, at parse time, so
 * later stages never inspect raw flag bits.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum SegmentKind {
  /** Payload-bearing unit; the ACK flag may be piggybacked. */
  DATA,
  /** Pure acknowledgment without payload. */
  ACK,
  /** Connection request carrying the initiator's initial sequence number. */
  SYN,
  /** Second handshake message. */
  SYN_ACK,
  /** Teardown request without acknowledgment. */
  FIN,
  /** Teardown request piggybacking an acknowledgment. */
  FIN_ACK;

  /** FIN flag bit. */
  public static final int FLAG_FIN = 0x01;
  /** SYN flag bit. */
  public static final int FLAG_SYN = 0x02;
  /** ACK flag bit. */
  public static final int FLAG_ACK = 0x10;

  private static final int KNOWN_FLAGS = FLAG_FIN | FLAG_SYN | FLAG_ACK;

  /**
   * Classifies a flag byte and payload length into a kind.
   *
   * @param flags raw flag bits (only the low byte is considered)
   * @param payloadLength payload length in bytes
   * @return kind when the combination is legal; empty for unknown bits, SYN+FIN, or payload on a
   *     control segment
   */
  public static Optional<SegmentKind> classify(int flags, int payloadLength) {
    if ((flags & ~KNOWN_FLAGS) != 0) {
      return Optional.empty();
    }
    boolean syn = (flags & FLAG_SYN) != 0;
    boolean fin = (flags & FLAG_FIN) != 0;
    boolean ack = (flags & FLAG_ACK) != 0;
    if (syn && fin) {
      return Optional.empty();
    }
    if (syn || fin) {
      if (payloadLength > 0) {
        return Optional.empty();
      }
      if (syn) {
        return Optional.of(ack ? SYN_ACK : SYN);
      }
      return Optional.of(ack ? FIN_ACK : FIN);
    }
    if (ack && payloadLength == 0) {
      return Optional.of(ACK);
    }
    return Optional.of(DATA);
  }

  /**
   * Returns whether this kind opens a connection.
   *
   * @return {@code true} for {@link #SYN} and {@link #SYN_ACK}
   */
  public boolean isSyn() {
    return this == SYN || this == SYN_ACK;
  }

  /**
   * Returns whether this kind closes one direction of a connection.
   *
   * @return {@code true} for {@link #FIN} and {@link #FIN_ACK}
   */
  public boolean isFin() {
    return this == FIN || this == FIN_ACK;
  }
}

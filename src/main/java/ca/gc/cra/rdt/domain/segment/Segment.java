package ca.gc.cra.rdt.domain.segment;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable framed unit exchanged by engines and connections.
 * <p><strong>Why:</strong> Carries sequencing, acknowledgment, flow-control and integrity fields in a
 * single value that both the packet engine and the byte-stream layer understand.</p>
 * <p><strong>Role:</strong> Domain value object produced by {@link SegmentCodec#decode(byte[])} and
 * by the factories below.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payload is copied on construction.</p>
 * <p><strong>Performance:</strong> {@link #isCorrupt()} recomputes the digest on every call.</p>
 *
 * @param flags flag bits, see {@link SegmentKind}
 * @param seq 32-bit sequence number (packet index or byte offset)
 * @param ack 32-bit acknowledgment number
 * @param window 16-bit receiver-advertised free capacity
 * @param checksum carried integrity digest
 * @param payload payload bytes; never {@code null}
 * @since 0.1.0
 */
public record Segment(int flags, long seq, long ack, int window, int checksum, byte[] payload) {
  /** Largest advertisable window. */
  public static final int MAX_WINDOW = 0xFFFF;

  /**
   * Validates field ranges and the flag combination.
   *
   * @throws IllegalArgumentException when a field is outside its wire range or the flags do not
   *     form a legal {@link SegmentKind}
   */
  public Segment {
    payload = payload != null ? payload.clone() : new byte[0];
    if (flags < 0 || flags > 0xFF) {
      throw new IllegalArgumentException("flags must fit in one byte (was " + flags + ")");
    }
    requireWire("seq", seq);
    requireWire("ack", ack);
    if (window < 0 || window > MAX_WINDOW) {
      throw new IllegalArgumentException("window must be between 0 and " + MAX_WINDOW + " (was " + window + ")");
    }
    if (SegmentKind.classify(flags, payload.length).isEmpty()) {
      throw new IllegalArgumentException(
          "illegal flag combination 0x" + Integer.toHexString(flags) + " with " + payload.length + " payload bytes");
    }
  }

  /**
   * Builds a segment and stamps the checksum over its fields.
   *
   * @param flags flag bits
   * @param seq sequence position; folded into 32 bits
   * @param ack acknowledgment position; folded into 32 bits
   * @param window advertised window
   * @param payload payload bytes; {@code null} is treated as empty
   * @return checksummed segment
   */
  public static Segment of(int flags, long seq, long ack, int window, byte[] payload) {
    byte[] body = payload != null ? payload : new byte[0];
    long wireSeq = SequenceNumbers.toWire(seq);
    long wireAck = SequenceNumbers.toWire(ack);
    int checksum = Checksums.compute(flags, wireSeq, wireAck, window, body);
    return new Segment(flags, wireSeq, wireAck, window, checksum, body);
  }

  /**
   * Builds a packet-engine data unit.
   *
   * @param seq packet index
   * @param payload unit payload
   * @return checksummed DATA segment without the ACK flag
   */
  public static Segment data(long seq, byte[] payload) {
    return of(0, seq, 0L, 0, payload);
  }

  /**
   * Builds a packet-engine acknowledgment.
   *
   * @param ack acknowledged packet index (cumulative or selective depending on policy)
   * @return checksummed ACK segment
   */
  public static Segment ack(long ack) {
    return of(SegmentKind.FLAG_ACK, 0L, ack, 0, null);
  }

  /**
   * Returns the kind implied by the flags and payload.
   *
   * @return segment kind; never {@code null}
   */
  public SegmentKind kind() {
    return SegmentKind.classify(flags, payload.length).orElseThrow();
  }

  /**
   * Returns whether the ACK flag is set, i.e. whether {@link #ack()} is meaningful.
   *
   * @return {@code true} when acknowledgment fields may be trusted (if not corrupt)
   */
  public boolean hasAck() {
    return (flags & SegmentKind.FLAG_ACK) != 0;
  }

  /**
   * Recomputes the digest and compares it with the carried checksum.
   *
   * @return {@code true} when any covered field or payload byte differs from what was checksummed
   */
  public boolean isCorrupt() {
    return checksum != Checksums.compute(flags, seq, ack, window, payload);
  }

  /**
   * Returns the payload length without copying.
   *
   * @return payload length in bytes
   */
  public int length() {
    return payload.length;
  }

  /**
   * Provides the payload without additional copying.
   *
   * @return internal payload array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Payload is copied on construction; engines read it on the hot path.")
  public byte[] payload() {
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Segment other)) {
      return false;
    }
    return flags == other.flags
        && seq == other.seq
        && ack == other.ack
        && window == other.window
        && checksum == other.checksum
        && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(flags, seq, ack, window, checksum);
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "Segment{"
        + "kind=" + SegmentKind.classify(flags, payload.length).map(Enum::name).orElse("INVALID")
        + ", seq=" + seq
        + ", ack=" + ack
        + ", window=" + window
        + ", len=" + payload.length
        + '}';
  }

  private static void requireWire(String name, long value) {
    if (value < 0 || value >= SequenceNumbers.MODULUS) {
      throw new IllegalArgumentException(name + " must be a 32-bit unsigned value (was " + value + ")");
    }
  }
}

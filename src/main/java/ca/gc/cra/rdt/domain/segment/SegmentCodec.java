package ca.gc.cra.rdt.domain.segment;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Big-endian wire codec for {@link Segment}.
 *
 * <pre>
 *  0      1          5          9      11         15
 *  +------+----------+----------+------+----------+-----------
 *  |flags |   seq    |   ack    |window| checksum | payload...
 *  +------+----------+----------+------+----------+-----------
 * </pre>
 *
 * @since 0.1.0
 */
public final class SegmentCodec {
  /** Fixed header length in bytes. */
  public static final int HEADER_LENGTH = 15;

  private SegmentCodec() {
    // Utility
  }

  /**
   * Serializes a segment, carrying its checksum verbatim.
   *
   * @param segment segment to encode; must not be {@code null}
   * @return freshly allocated datagram bytes
   */
  public static byte[] encode(Segment segment) {
    byte[] payload = segment.payload();
    ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + payload.length).order(ByteOrder.BIG_ENDIAN);
    buffer.put((byte) segment.flags());
    buffer.putInt((int) segment.seq());
    buffer.putInt((int) segment.ack());
    buffer.putShort((short) segment.window());
    buffer.putInt(segment.checksum());
    buffer.put(payload);
    return buffer.array();
  }

  /**
   * Parses datagram bytes into a segment without verifying the checksum.
   *
   * @param datagram raw bytes; {@code null} is treated as malformed
   * @return parsed segment, possibly corrupt
   * @throws MalformedSegmentException when the buffer is too short or the flags are not a legal kind
   */
  public static Segment decode(byte[] datagram) throws MalformedSegmentException {
    if (datagram == null || datagram.length < HEADER_LENGTH) {
      throw new MalformedSegmentException(
          "datagram shorter than header (" + (datagram == null ? 0 : datagram.length) + " < " + HEADER_LENGTH + ")");
    }
    ByteBuffer buffer = ByteBuffer.wrap(datagram).order(ByteOrder.BIG_ENDIAN);
    try {
      int flags = buffer.get() & 0xFF;
      long seq = buffer.getInt() & 0xFFFF_FFFFL;
      long ack = buffer.getInt() & 0xFFFF_FFFFL;
      int window = buffer.getShort() & 0xFFFF;
      int checksum = buffer.getInt();
      byte[] payload = new byte[buffer.remaining()];
      buffer.get(payload);
      if (SegmentKind.classify(flags, payload.length).isEmpty()) {
        throw new MalformedSegmentException(
            "illegal flag combination 0x" + Integer.toHexString(flags) + " with " + payload.length + " payload bytes");
      }
      return new Segment(flags, seq, ack, window, checksum, payload);
    } catch (BufferUnderflowException ex) {
      throw new MalformedSegmentException("truncated segment header");
    }
  }
}

package ca.gc.cra.rdt.domain.segment;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class SegmentCodecTest {

  @Test
  void encodeWritesBigEndianHeaderThenPayload() {
    Segment segment = Segment.of(SegmentKind.FLAG_ACK, 0x01020304L, 0x0A0B0C0DL, 0x1234, "hi".getBytes(StandardCharsets.US_ASCII));

    byte[] wire = SegmentCodec.encode(segment);

    assertEquals(SegmentCodec.HEADER_LENGTH + 2, wire.length);
    assertEquals(0x10, wire[0]);
    assertArrayEquals(new byte[] {1, 2, 3, 4}, java.util.Arrays.copyOfRange(wire, 1, 5));
    assertArrayEquals(new byte[] {0x0A, 0x0B, 0x0C, 0x0D}, java.util.Arrays.copyOfRange(wire, 5, 9));
    assertEquals(0x12, wire[9]);
    assertEquals(0x34, wire[10]);
    assertEquals('h', wire[15]);
    assertEquals('i', wire[16]);
  }

  @Test
  void decodeRestoresFieldsAndVerifiesChecksum() throws MalformedSegmentException {
    Segment original = Segment.of(0, 4_000_000_000L, 0L, 0, new byte[] {9, 8, 7});

    Segment decoded = SegmentCodec.decode(SegmentCodec.encode(original));

    assertEquals(original, decoded);
    assertEquals(SegmentKind.DATA, decoded.kind());
    assertEquals(4_000_000_000L, decoded.seq());
    assertFalse(decoded.isCorrupt());
  }

  @Test
  void everySingleBitFlipIsDetected() throws MalformedSegmentException {
    byte[] wire = SegmentCodec.encode(Segment.of(SegmentKind.FLAG_ACK, 77L, 12L, 512, "payload!".getBytes(StandardCharsets.US_ASCII)));

    for (int bit = 0; bit < wire.length * 8; bit++) {
      byte[] flipped = wire.clone();
      flipped[bit / 8] ^= (byte) (1 << (bit % 8));
      Segment decoded;
      try {
        decoded = SegmentCodec.decode(flipped);
      } catch (MalformedSegmentException ex) {
        continue;
      }
      assertTrue(decoded.isCorrupt(), "bit " + bit + " flip went unnoticed");
    }
  }

  @Test
  void shortDatagramIsMalformed() {
    assertThrows(MalformedSegmentException.class, () -> SegmentCodec.decode(new byte[14]));
    assertThrows(MalformedSegmentException.class, () -> SegmentCodec.decode(null));
  }

  @Test
  void illegalFlagsAreMalformed() {
    byte[] wire = SegmentCodec.encode(Segment.of(SegmentKind.FLAG_SYN, 1L, 0L, 0, null));
    wire[0] = (byte) (SegmentKind.FLAG_SYN | SegmentKind.FLAG_FIN);
    assertThrows(MalformedSegmentException.class, () -> SegmentCodec.decode(wire));

    byte[] unknown = SegmentCodec.encode(Segment.ack(3L));
    unknown[0] = (byte) 0x80;
    assertThrows(MalformedSegmentException.class, () -> SegmentCodec.decode(unknown));
  }

  @Test
  void synWithPayloadIsMalformed() {
    byte[] data = SegmentCodec.encode(Segment.data(0L, new byte[] {1}));
    data[0] = (byte) SegmentKind.FLAG_SYN;
    assertThrows(MalformedSegmentException.class, () -> SegmentCodec.decode(data));
  }
}

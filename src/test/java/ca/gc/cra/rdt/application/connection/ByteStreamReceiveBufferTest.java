package ca.gc.cra.rdt.application.connection;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ByteStreamReceiveBufferTest {

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.US_ASCII);
  }

  private static String readAll(ByteStreamReceiveBuffer buffer) {
    byte[] target = new byte[buffer.readableBytes()];
    int n = buffer.read(target, 0, target.length);
    return new String(target, 0, n, StandardCharsets.US_ASCII);
  }

  @Test
  void reordersAndDeliversContiguousBytes() {
    ByteStreamReceiveBuffer buffer = new ByteStreamReceiveBuffer(100, 1_000);

    assertEquals(SegmentDisposition.BUFFERED, buffer.offer(1_005, bytes("world")));
    assertEquals(1, buffer.bufferedOutOfOrder());
    assertEquals(0, buffer.readableBytes());

    assertEquals(SegmentDisposition.DELIVERED, buffer.offer(1_000, bytes("hello")));
    assertEquals(1_010L, buffer.rcvNext());
    assertEquals(0, buffer.bufferedOutOfOrder());
    assertEquals("helloworld", readAll(buffer));
  }

  @Test
  void overlappingRetransmissionOnlyStoresNewBytes() {
    ByteStreamReceiveBuffer buffer = new ByteStreamReceiveBuffer(100, 0);
    buffer.offer(0, bytes("abcd"));

    assertEquals(SegmentDisposition.DELIVERED, buffer.offer(2, bytes("cdef")));
    assertEquals(SegmentDisposition.DUPLICATE, buffer.offer(0, bytes("abcdef")));
    assertEquals(SegmentDisposition.DUPLICATE, buffer.offer(1, bytes("b")));
    assertEquals("abcdef", readAll(buffer));
  }

  @Test
  void bytesBeyondTheAdvertisedWindowAreRejectedOrTrimmed() {
    ByteStreamReceiveBuffer buffer = new ByteStreamReceiveBuffer(8, 0);

    assertEquals(SegmentDisposition.DELIVERED, buffer.offer(0, bytes("0123456789")));
    assertEquals(8, buffer.readableBytes());
    assertEquals(8L, buffer.rcvNext());
    assertEquals(SegmentDisposition.OUT_OF_WINDOW, buffer.offer(8, bytes("89")));
  }

  @Test
  void zeroAdvertisementTriggersWindowUpdateAfterRead() {
    ByteStreamReceiveBuffer buffer = new ByteStreamReceiveBuffer(4, 0);
    buffer.offer(0, bytes("full"));

    assertEquals(0, buffer.advertise());
    assertFalse(buffer.needsWindowUpdate());

    byte[] target = new byte[2];
    assertEquals(2, buffer.read(target, 0, 2));
    assertArrayEquals(bytes("fu"), target);
    assertTrue(buffer.needsWindowUpdate());
    assertEquals(2, buffer.advertise());
    assertFalse(buffer.needsWindowUpdate());
  }

  @Test
  void partialReadsSpanChunks() {
    ByteStreamReceiveBuffer buffer = new ByteStreamReceiveBuffer(64, 0);
    buffer.offer(0, bytes("abc"));
    buffer.offer(3, bytes("defgh"));

    byte[] target = new byte[4];
    assertEquals(4, buffer.read(target, 0, 4));
    assertArrayEquals(bytes("abcd"), target);
    Arrays.fill(target, (byte) 0);
    assertEquals(4, buffer.read(target, 0, 4));
    assertArrayEquals(bytes("efgh"), target);
    assertEquals(0, buffer.readableBytes());
  }

  @Test
  void finConsumesOneSequenceNumber() {
    ByteStreamReceiveBuffer buffer = new ByteStreamReceiveBuffer(64, 10);
    buffer.offer(10, bytes("x"));

    buffer.consumeFin();

    assertEquals(12L, buffer.rcvNext());
  }
}

package ca.gc.cra.rdt.application.connection;

import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Receive side of the byte stream: reorders out-of-order bytes, drains contiguous bytes into a
 * readable queue and computes the advertised window.
 *
 * <p>Accepts bytes in {@code [rcvNext, rcvNext + free)} where {@code free = capacity - readable}.
 * Overlaps with bytes already held are trimmed, as are bytes past the right edge. The reorder map
 * never holds an entry below {@code rcvNext}. Not thread-safe; the connection lock guards it.</p>
 *
 * @since 0.1.0
 */
final class ByteStreamReceiveBuffer {
  private final int capacity;
  private final NavigableMap<Long, byte[]> outOfOrder = new TreeMap<>();
  private final Deque<byte[]> readable = new ArrayDeque<>();
  private long rcvNext;
  private int readableBytes;
  private int headOffset;
  private boolean advertisedZero;

  ByteStreamReceiveBuffer(int capacity, long rcvNext) {
    this.capacity = capacity;
    this.rcvNext = rcvNext;
  }

  /**
   * Offers a data segment's payload.
   *
   * @param seq unwrapped byte offset of the first payload byte
   * @param payload payload bytes, non-empty
   * @return {@link SegmentDisposition#DELIVERED} when the cursor advanced,
   *     {@link SegmentDisposition#BUFFERED} when held for reordering,
   *     {@link SegmentDisposition#DUPLICATE} when every byte was already held or delivered,
   *     {@link SegmentDisposition#OUT_OF_WINDOW} when it starts at or past the right edge
   */
  SegmentDisposition offer(long seq, byte[] payload) {
    long end = seq + payload.length;
    long rightEdge = rcvNext + free();
    if (end <= rcvNext) {
      return SegmentDisposition.DUPLICATE;
    }
    if (seq >= rightEdge) {
      return SegmentDisposition.OUT_OF_WINDOW;
    }
    long start = Math.max(seq, rcvNext);
    long stop = Math.min(end, rightEdge);
    boolean stored = false;
    long cursor = start;
    Map.Entry<Long, byte[]> floor = outOfOrder.floorEntry(cursor);
    if (floor != null) {
      cursor = Math.max(cursor, floor.getKey() + floor.getValue().length);
    }
    while (cursor < stop) {
      Map.Entry<Long, byte[]> next = outOfOrder.ceilingEntry(cursor);
      long gapEnd = next == null ? stop : Math.min(stop, next.getKey());
      if (gapEnd > cursor) {
        outOfOrder.put(cursor, Arrays.copyOfRange(payload, (int) (cursor - seq), (int) (gapEnd - seq)));
        stored = true;
      }
      if (next == null || next.getKey() >= stop) {
        break;
      }
      cursor = Math.max(cursor, next.getKey() + next.getValue().length);
    }
    if (!stored) {
      return SegmentDisposition.DUPLICATE;
    }
    long before = rcvNext;
    drain();
    return rcvNext > before ? SegmentDisposition.DELIVERED : SegmentDisposition.BUFFERED;
  }

  /** Consumes the sequence number of an in-order FIN. */
  void consumeFin() {
    rcvNext++;
  }

  /**
   * Copies readable bytes into {@code target}.
   *
   * @param target destination
   * @param offset destination offset
   * @param length maximum bytes to copy
   * @return bytes copied
   */
  int read(byte[] target, int offset, int length) {
    int copied = 0;
    while (copied < length && !readable.isEmpty()) {
      byte[] head = readable.peekFirst();
      int n = Math.min(length - copied, head.length - headOffset);
      System.arraycopy(head, headOffset, target, offset + copied, n);
      copied += n;
      headOffset += n;
      if (headOffset == head.length) {
        readable.pollFirst();
        headOffset = 0;
      }
    }
    readableBytes -= copied;
    return copied;
  }

  /**
   * Returns the window to put on an outgoing segment and remembers whether it was zero.
   *
   * @return free space, at most 65535
   */
  int advertise() {
    int window = free();
    advertisedZero = window == 0;
    return window;
  }

  /**
   * Returns whether the last advertisement was zero and space has since been freed.
   *
   * @return {@code true} when a window update acknowledgment is due
   */
  boolean needsWindowUpdate() {
    return advertisedZero && free() > 0;
  }

  int free() {
    return capacity - readableBytes;
  }

  long rcvNext() {
    return rcvNext;
  }

  int readableBytes() {
    return readableBytes;
  }

  int bufferedOutOfOrder() {
    return outOfOrder.size();
  }

  private void drain() {
    while (!outOfOrder.isEmpty() && outOfOrder.firstKey() == rcvNext) {
      byte[] chunk = outOfOrder.pollFirstEntry().getValue();
      readable.addLast(chunk);
      readableBytes += chunk.length;
      rcvNext += chunk.length;
    }
  }
}

package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.segment.SequenceNumbers;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Selective Repeat receiver with a reorder buffer.
 *
 * <p>Packets in {@code [rcvBase, rcvBase + N)} are acknowledged individually and buffered; contiguous
 * runs from {@code rcvBase} drain to the application. Packets in {@code [rcvBase - N, rcvBase)} are
 * re-acknowledged because the sender may have lost our first acknowledgment. Anything else is
 * dropped silently.</p>
 *
 * @since 0.1.0
 */
public final class SelectiveRepeatReceiveWindow implements ReceiveWindow {
  private final int windowSize;
  private final NavigableMap<Long, byte[]> buffer = new TreeMap<>();
  private long rcvBase;

  /**
   * Creates the receiver.
   *
   * @param windowSize window N; must match the sender's
   */
  public SelectiveRepeatReceiveWindow(int windowSize) {
    this.windowSize = windowSize;
  }

  @Override
  public ReceiveResult onData(Segment segment) {
    long seq = SequenceNumbers.unwrap(rcvBase, segment.seq());
    if (seq >= rcvBase && seq < rcvBase + windowSize) {
      Optional<Segment> ack = Optional.of(Segment.ack(seq));
      if (buffer.containsKey(seq)) {
        return new ReceiveResult(SegmentDisposition.DUPLICATE, ack, List.of());
      }
      buffer.put(seq, segment.payload());
      if (seq != rcvBase) {
        return new ReceiveResult(SegmentDisposition.BUFFERED, ack, List.of());
      }
      List<byte[]> delivered = new ArrayList<>();
      while (buffer.containsKey(rcvBase)) {
        delivered.add(buffer.remove(rcvBase));
        rcvBase++;
      }
      return new ReceiveResult(SegmentDisposition.DELIVERED, ack, delivered);
    }
    if (seq >= rcvBase - windowSize && seq < rcvBase) {
      return ReceiveResult.discard(SegmentDisposition.DUPLICATE, Segment.ack(seq));
    }
    return ReceiveResult.discard(SegmentDisposition.OUT_OF_WINDOW, null);
  }

  @Override
  public ReceiveResult onCorrupt() {
    return ReceiveResult.discard(SegmentDisposition.CORRUPT, null);
  }

  @Override
  public long deliveryPoint() {
    return rcvBase;
  }

  /**
   * Returns the number of packets held ahead of the delivery point.
   *
   * @return buffered packet count
   */
  public int buffered() {
    return buffer.size();
  }
}

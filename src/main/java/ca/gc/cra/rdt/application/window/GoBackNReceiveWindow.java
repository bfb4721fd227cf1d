package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.segment.SequenceNumbers;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.util.List;
import java.util.Optional;

/**
 * Go-Back-N receiver: accepts only the expected packet and acknowledges cumulatively.
 *
 * <p>Anything else is discarded and the last cumulative acknowledgment re-sent. Before the first
 * packet has been delivered there is no acknowledgment to repeat, so nothing is sent.</p>
 *
 * @since 0.1.0
 */
public final class GoBackNReceiveWindow implements ReceiveWindow {
  private long expected;

  @Override
  public ReceiveResult onData(Segment segment) {
    long seq = SequenceNumbers.unwrap(expected, segment.seq());
    if (seq == expected) {
      expected++;
      return new ReceiveResult(
          SegmentDisposition.DELIVERED, Optional.of(Segment.ack(expected - 1)), List.of(segment.payload()));
    }
    SegmentDisposition disposition = seq < expected ? SegmentDisposition.DUPLICATE : SegmentDisposition.OUT_OF_WINDOW;
    return ReceiveResult.discard(disposition, lastAck());
  }

  @Override
  public ReceiveResult onCorrupt() {
    return ReceiveResult.discard(SegmentDisposition.CORRUPT, lastAck());
  }

  @Override
  public long deliveryPoint() {
    return expected;
  }

  private Segment lastAck() {
    return expected > 0 ? Segment.ack(expected - 1) : null;
  }
}

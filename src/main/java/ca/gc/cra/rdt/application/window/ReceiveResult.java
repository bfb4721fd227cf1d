package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of offering one data segment to a receive window.
 *
 * @param disposition how the segment was handled
 * @param ack acknowledgment to send back, if any
 * @param delivered payloads released in order to the application, possibly empty
 * @since 0.1.0
 */
public record ReceiveResult(SegmentDisposition disposition, Optional<Segment> ack, List<byte[]> delivered) {
  public ReceiveResult {
    Objects.requireNonNull(disposition, "disposition");
    ack = Objects.requireNonNullElse(ack, Optional.empty());
    delivered = delivered == null ? List.of() : List.copyOf(delivered);
  }

  static ReceiveResult discard(SegmentDisposition disposition, Segment ack) {
    return new ReceiveResult(disposition, Optional.ofNullable(ack), List.of());
  }
}

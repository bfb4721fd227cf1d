package ca.gc.cra.rdt.domain.transport;

import java.util.Locale;

/**
 * Outcome of processing one inbound datagram.
 *
 * <p>Every value other than {@link #DELIVERED}, {@link #BUFFERED} and {@link #ACKNOWLEDGED} is a
 * recoverable discard: counted, logged at debug and never surfaced to the application.</p>
 *
 * @since 0.1.0
 */
public enum SegmentDisposition {
  /** Payload reached the application stream or delivery queue. */
  DELIVERED,
  /** Payload accepted ahead of the delivery point and held for reordering. */
  BUFFERED,
  /** Acknowledgment or control segment consumed. */
  ACKNOWLEDGED,
  /** Datagram could not be parsed. */
  MALFORMED,
  /** Checksum mismatch. */
  CORRUPT,
  /** Already delivered or already acknowledged. */
  DUPLICATE,
  /** Outside the receive window, or acknowledging something never sent. */
  OUT_OF_WINDOW,
  /** Control segment with no transition from the current connection state. */
  ILLEGAL_TRANSITION;

  /**
   * Returns whether the segment was discarded.
   *
   * @return {@code true} for every disposition that does not consume the segment
   */
  public boolean isDiscard() {
    return this != DELIVERED && this != BUFFERED && this != ACKNOWLEDGED;
  }

  /**
   * Returns the metric suffix for this disposition.
   *
   * @return dotted metric name such as {@code segment.corrupt}
   */
  public String metricName() {
    return "segment." + name().toLowerCase(Locale.ROOT);
  }
}

package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.domain.segment.Segment;

/**
 * Receiver half of the windowed engine: decides acceptance, buffering, delivery and the
 * acknowledgment to return for each arrival.
 *
 * <p>Not thread-safe; the owning receiver endpoint serializes calls.</p>
 *
 * @since 0.1.0
 */
public interface ReceiveWindow {
  /**
   * Offers a structurally valid, non-corrupt data segment.
   *
   * @param segment arriving data
   * @return disposition, acknowledgment and delivered payloads
   */
  ReceiveResult onData(Segment segment);

  /**
   * Handles a corrupt arrival whose fields cannot be trusted.
   *
   * @return disposition and the acknowledgment to re-send, if the policy re-sends one
   */
  ReceiveResult onCorrupt();

  /**
   * Returns the next packet index expected in order.
   *
   * @return delivery point
   */
  long deliveryPoint();
}

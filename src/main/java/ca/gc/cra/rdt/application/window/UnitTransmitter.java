package ca.gc.cra.rdt.application.window;

/**
 * Frames an outstanding unit into a segment and hands it to the datagram port.
 *
 * <p>Invoked under the send window lock; implementations must not block.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface UnitTransmitter {
  /**
   * Transmits one unit.
   *
   * @param unit unit to send
   * @param retransmission {@code true} when the unit was sent before
   */
  void transmit(OutstandingUnit unit, boolean retransmission);
}

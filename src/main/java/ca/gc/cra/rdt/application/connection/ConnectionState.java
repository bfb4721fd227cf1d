package ca.gc.cra.rdt.application.connection;

/**
 * States of the connection state machine.
 *
 * @since 0.1.0
 */
public enum ConnectionState {
  CLOSED,
  LISTEN,
  SYN_SENT,
  SYN_RCVD,
  ESTABLISHED,
  FIN_WAIT_1,
  FIN_WAIT_2,
  CLOSE_WAIT,
  LAST_ACK,
  TIME_WAIT;

  /**
   * Returns whether application data may still be written in this state.
   *
   * @return {@code true} in ESTABLISHED and CLOSE_WAIT
   */
  public boolean canWrite() {
    return this == ESTABLISHED || this == CLOSE_WAIT;
  }

  /**
   * Returns whether inbound data segments are still accepted in this state.
   *
   * @return {@code true} once established and until the peer's FIN is processed
   */
  public boolean acceptsData() {
    return this == ESTABLISHED || this == FIN_WAIT_1 || this == FIN_WAIT_2;
  }
}

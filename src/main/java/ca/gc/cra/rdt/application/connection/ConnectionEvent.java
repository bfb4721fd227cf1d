package ca.gc.cra.rdt.application.connection;

/**
 * Inputs of the connection state machine.
 *
 * <p>{@link #RECV_ACK} means an acknowledgment that newly covers our outstanding SYN or FIN; data
 * acknowledgments are not state machine events.</p>
 *
 * @since 0.1.0
 */
public enum ConnectionEvent {
  LISTEN,
  CONNECT,
  RECV_SYN,
  RECV_SYN_ACK,
  RECV_ACK,
  RECV_FIN,
  CLOSE,
  TIMEOUT
}

package ca.gc.cra.rdt.application.connection;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Connection state machine as an explicit table of (state, event) to
 * (next state, action).
 * <p><strong>Why:</strong> Keeps every legal transition in one place; anything absent is an illegal
 * transition that the connection ignores and counts.</p>
 * <p><strong>Thread-safety:</strong> Immutable after class initialization.</p>
 *
 * @since 0.1.0
 */
public final class TransitionTable {

  /** Side effect performed by the connection when a transition fires. */
  public enum Action {
    /** State change only. */
    NONE,
    /** Send our SYN. */
    SEND_SYN,
    /** Send SYN-ACK. */
    SEND_SYN_ACK,
    /** Send (or re-send) an acknowledgment. */
    SEND_ACK,
    /** Send our FIN. */
    SEND_FIN,
    /** Acknowledge the peer's FIN and start the TIME_WAIT grace timer. */
    SEND_ACK_AND_WAIT,
    /** Release the connection. */
    RELEASE,
    /** Acknowledge a FIN that arrived before our own FIN was acknowledged; replay it in FIN_WAIT_2. */
    DEFER_FIN
  }

  /**
   * Result of a table lookup.
   *
   * @param next state after the transition
   * @param action side effect to perform
   */
  public record Transition(ConnectionState next, Action action) {}

  private static final Map<ConnectionState, Map<ConnectionEvent, Transition>> TABLE = build();

  private TransitionTable() {}

  /**
   * Looks up the transition for a state and event.
   *
   * @param state current state
   * @param event input event
   * @return transition, or empty when the pair is illegal
   */
  public static Optional<Transition> lookup(ConnectionState state, ConnectionEvent event) {
    Map<ConnectionEvent, Transition> row = TABLE.get(state);
    return row == null ? Optional.empty() : Optional.ofNullable(row.get(event));
  }

  private static Map<ConnectionState, Map<ConnectionEvent, Transition>> build() {
    Map<ConnectionState, Map<ConnectionEvent, Transition>> table = new EnumMap<>(ConnectionState.class);
    // passive open
    put(table, ConnectionState.CLOSED, ConnectionEvent.LISTEN, ConnectionState.LISTEN, Action.NONE);
    put(table, ConnectionState.LISTEN, ConnectionEvent.RECV_SYN, ConnectionState.SYN_RCVD, Action.SEND_SYN_ACK);
    put(table, ConnectionState.SYN_RCVD, ConnectionEvent.RECV_ACK, ConnectionState.ESTABLISHED, Action.NONE);
    // active open
    put(table, ConnectionState.CLOSED, ConnectionEvent.CONNECT, ConnectionState.SYN_SENT, Action.SEND_SYN);
    put(table, ConnectionState.SYN_SENT, ConnectionEvent.RECV_SYN_ACK, ConnectionState.ESTABLISHED, Action.SEND_ACK);
    // passive close
    put(table, ConnectionState.ESTABLISHED, ConnectionEvent.RECV_FIN, ConnectionState.CLOSE_WAIT, Action.SEND_ACK);
    put(table, ConnectionState.CLOSE_WAIT, ConnectionEvent.CLOSE, ConnectionState.LAST_ACK, Action.SEND_FIN);
    put(table, ConnectionState.LAST_ACK, ConnectionEvent.RECV_ACK, ConnectionState.CLOSED, Action.RELEASE);
    // active close
    put(table, ConnectionState.ESTABLISHED, ConnectionEvent.CLOSE, ConnectionState.FIN_WAIT_1, Action.SEND_FIN);
    put(table, ConnectionState.FIN_WAIT_1, ConnectionEvent.RECV_ACK, ConnectionState.FIN_WAIT_2, Action.NONE);
    put(table, ConnectionState.FIN_WAIT_2, ConnectionEvent.RECV_FIN, ConnectionState.TIME_WAIT, Action.SEND_ACK_AND_WAIT);
    put(table, ConnectionState.TIME_WAIT, ConnectionEvent.TIMEOUT, ConnectionState.CLOSED, Action.RELEASE);
    // re-acknowledging self-loops for lost handshake and teardown acknowledgments
    put(table, ConnectionState.ESTABLISHED, ConnectionEvent.RECV_SYN_ACK, ConnectionState.ESTABLISHED, Action.SEND_ACK);
    put(table, ConnectionState.CLOSE_WAIT, ConnectionEvent.RECV_FIN, ConnectionState.CLOSE_WAIT, Action.SEND_ACK);
    put(table, ConnectionState.LAST_ACK, ConnectionEvent.RECV_FIN, ConnectionState.LAST_ACK, Action.SEND_ACK);
    put(table, ConnectionState.TIME_WAIT, ConnectionEvent.RECV_FIN, ConnectionState.TIME_WAIT, Action.SEND_ACK_AND_WAIT);
    put(table, ConnectionState.FIN_WAIT_1, ConnectionEvent.RECV_FIN, ConnectionState.FIN_WAIT_1, Action.DEFER_FIN);

    Map<ConnectionState, Map<ConnectionEvent, Transition>> frozen = new EnumMap<>(ConnectionState.class);
    for (Map.Entry<ConnectionState, Map<ConnectionEvent, Transition>> entry : table.entrySet()) {
      frozen.put(entry.getKey(), Collections.unmodifiableMap(entry.getValue()));
    }
    return Collections.unmodifiableMap(frozen);
  }

  private static void put(
      Map<ConnectionState, Map<ConnectionEvent, Transition>> table,
      ConnectionState from,
      ConnectionEvent event,
      ConnectionState to,
      Action action) {
    table.computeIfAbsent(from, k -> new EnumMap<>(ConnectionEvent.class)).put(event, new Transition(to, action));
  }
}

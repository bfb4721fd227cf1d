package ca.gc.cra.rdt.application.connection;

/**
 * Connection-level timers that are not retransmission timers.
 *
 * @since 0.1.0
 */
enum ConnectionTimer {
  /** Zero-window probe interval. */
  PERSIST,
  /** TIME_WAIT grace period. */
  TIME_WAIT
}

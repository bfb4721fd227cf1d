/**
 * Connection-oriented byte stream: handshake and teardown state machine, byte-offset send window
 * with flow control, reordering receive buffer and adaptive retransmission timing.
 * <p><strong>Role:</strong> Application layer over {@code DatagramPort}; the connection lock guards every
 * type in this package.</p>
 * <p><strong>Metrics:</strong> Counters under {@code connection.*}.</p>
 */
package ca.gc.cra.rdt.application.connection;

/**
 * Windowed retransmission engine: send windows for cumulative and selective acknowledgment, the
 * matching receive windows, and the packet-granular sender and receiver endpoints built on them.
 * <p><strong>Concurrency:</strong> Each endpoint owns one {@link java.util.concurrent.locks.ReentrantLock};
 * window methods and timer callbacks run under it.</p>
 */
package ca.gc.cra.rdt.application.window;

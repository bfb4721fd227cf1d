/**
 * Datagram port adapters: a UDP socket binding and a lossy channel decorator for exercising recovery paths.
 * <p><strong>Role:</strong> Adapter layer implementing {@code DatagramPort}.</p>
 * <p><strong>Concurrency:</strong> One receiving thread per port; sends may come from any thread.</p>
 */
package ca.gc.cra.rdt.infrastructure.net;

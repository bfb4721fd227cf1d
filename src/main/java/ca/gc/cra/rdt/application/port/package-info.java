/**
 * Ports through which the transport engines reach time, timers, metrics and the datagram network.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters live under {@code infrastructure}.</p>
 */
package ca.gc.cra.rdt.application.port;

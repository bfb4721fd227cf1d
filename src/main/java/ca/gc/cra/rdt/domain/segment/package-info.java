/**
 * Segment model, wire codec and integrity digest shared by every transport layer.
 * <p><strong>Role:</strong> Domain layer; no dependencies on ports or adapters.</p>
 * <p><strong>Concurrency:</strong> Types are immutable or stateless utilities.</p>
 * <p><strong>Security:</strong> The digest detects accidental corruption only; it is not a MAC.</p>
 */
package ca.gc.cra.rdt.domain.segment;

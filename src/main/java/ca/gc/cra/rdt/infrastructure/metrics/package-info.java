/**
 * Metrics adapters that bridge the transport metrics port to OpenTelemetry or no-op implementations.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; instruments are created once per key and cached.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code sender.*}, {@code receiver.*} and {@code connection.*}
 * namespaces.</p>
 * <p><strong>Security:</strong> Payload bytes are never exported; only counts and timings.</p>
 */
package ca.gc.cra.rdt.infrastructure.metrics;

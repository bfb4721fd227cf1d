package ca.gc.cra.rdt.application.port;

/**
 * <strong>What:</strong> Port abstracting transport metrics emission.
 * <p><strong>Why:</strong> Allows engines and connections to record counters and observations without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like retransmissions or corrupt arrivals.</li>
 *   <li>Record numeric observations for RTT samples and payload sizes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from application,
 * reader and timer threads.</p>
 * <p><strong>Performance:</strong> Calls are made while holding endpoint locks and must not block.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code connection.retransmit.timeout}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code sender.segment.corrupt}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p><strong>Concurrency:</strong> Thread-safe.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}

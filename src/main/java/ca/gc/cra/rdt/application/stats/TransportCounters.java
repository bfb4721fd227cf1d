package ca.gc.cra.rdt.application.stats;

import ca.gc.cra.rdt.application.port.MetricsPort;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import ca.gc.cra.rdt.domain.transport.TransportStatistics;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Local counters for one endpoint, mirrored to a {@link MetricsPort} under a dotted prefix.
 *
 * <p>Counters are kept locally so {@link #snapshot} works with {@link MetricsPort#NO_OP}.</p>
 *
 * @since 0.1.0
 */
public final class TransportCounters {
  public static final String SEGMENTS_SENT = "segments.sent";
  public static final String SEGMENTS_RECEIVED = "segments.received";
  public static final String SEND_FAILED = "segments.sendFailed";
  public static final String RETRANSMIT_TIMEOUT = "retransmit.timeout";
  public static final String PROBE_SENT = "probe.sent";
  public static final String ACK_DUPLICATE_SENT = "ack.duplicateSent";
  public static final String ACK_DUPLICATE_RECEIVED = "ack.duplicateReceived";
  public static final String BYTES_SENT = "bytes.sent";
  public static final String UNITS_DELIVERED = "delivered.units";
  public static final String BYTES_DELIVERED = "delivered.bytes";
  public static final String DELIVERY_QUEUE_FULL = "delivered.queueFull";
  public static final String RTT_SAMPLE = "rtt.sampleNanos";

  private final MetricsPort metrics;
  private final String prefix;
  private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();

  /**
   * Creates counters for one endpoint.
   *
   * @param metrics metrics sink; {@code null} means {@link MetricsPort#NO_OP}
   * @param prefix dotted metric prefix such as {@code sender} or {@code connection}
   */
  public TransportCounters(MetricsPort metrics, String prefix) {
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  public void increment(String name) {
    counters.computeIfAbsent(name, k -> new LongAdder()).increment();
    metrics.increment(prefix + "." + name);
  }

  /**
   * Adds {@code delta} to a local counter and records it as an observation of the same name.
   *
   * @param name counter name
   * @param delta non-negative amount
   */
  public void add(String name, long delta) {
    counters.computeIfAbsent(name, k -> new LongAdder()).add(delta);
    metrics.observe(prefix + "." + name, delta);
  }

  /**
   * Records an observation without affecting local counters.
   *
   * @param name metric name
   * @param value observed value
   */
  public void observe(String name, long value) {
    metrics.observe(prefix + "." + name, value);
  }

  public void record(SegmentDisposition disposition) {
    increment(disposition.metricName());
  }

  public long count(String name) {
    LongAdder adder = counters.get(name);
    return adder == null ? 0L : adder.sum();
  }

  public long count(SegmentDisposition disposition) {
    return count(disposition.metricName());
  }

  public String prefix() {
    return prefix;
  }

  /**
   * Builds a statistics snapshot.
   *
   * @param estimatedRtt current RTT estimate, or {@code null} when not tracked
   * @param rto current retransmission timeout
   * @return immutable snapshot
   */
  public TransportStatistics snapshot(Duration estimatedRtt, Duration rto) {
    Map<SegmentDisposition, Long> dispositions = new EnumMap<>(SegmentDisposition.class);
    for (SegmentDisposition disposition : SegmentDisposition.values()) {
      long value = count(disposition);
      if (value > 0) {
        dispositions.put(disposition, value);
      }
    }
    return new TransportStatistics(
        count(SEGMENTS_SENT),
        count(SEGMENTS_RECEIVED),
        count(RETRANSMIT_TIMEOUT),
        count(PROBE_SENT),
        count(ACK_DUPLICATE_SENT),
        count(ACK_DUPLICATE_RECEIVED),
        count(BYTES_SENT),
        count(UNITS_DELIVERED),
        count(BYTES_DELIVERED),
        dispositions,
        estimatedRtt,
        rto);
  }
}

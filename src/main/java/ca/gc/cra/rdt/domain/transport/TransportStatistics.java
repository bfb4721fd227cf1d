package ca.gc.cra.rdt.domain.transport;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time transfer statistics for one endpoint or connection.
 *
 * @param segmentsSent datagrams handed to the port, retransmissions included
 * @param segmentsReceived datagrams read from the port
 * @param timeoutRetransmissions units resent because their timer expired
 * @param probesSent zero-window probes sent
 * @param duplicateAcksSent acknowledgments re-sent for duplicate, stale or corrupt arrivals
 * @param duplicateAcksReceived acknowledgments that covered nothing new
 * @param bytesSent payload bytes handed to the send window (first transmissions only)
 * @param unitsDelivered payload units delivered in order to the application
 * @param bytesDelivered payload bytes delivered in order to the application
 * @param dispositions inbound segment count per disposition
 * @param estimatedRtt smoothed RTT estimate; {@link Duration#ZERO} when not tracked
 * @param retransmissionTimeout current retransmission timeout
 * @since 0.1.0
 */
public record TransportStatistics(
    long segmentsSent,
    long segmentsReceived,
    long timeoutRetransmissions,
    long probesSent,
    long duplicateAcksSent,
    long duplicateAcksReceived,
    long bytesSent,
    long unitsDelivered,
    long bytesDelivered,
    Map<SegmentDisposition, Long> dispositions,
    Duration estimatedRtt,
    Duration retransmissionTimeout) {

  /** Copies the disposition map and normalizes missing durations. */
  public TransportStatistics {
    EnumMap<SegmentDisposition, Long> copy = new EnumMap<>(SegmentDisposition.class);
    if (dispositions != null) {
      copy.putAll(dispositions);
    }
    dispositions = Map.copyOf(copy);
    estimatedRtt = Objects.requireNonNullElse(estimatedRtt, Duration.ZERO);
    retransmissionTimeout = Objects.requireNonNullElse(retransmissionTimeout, Duration.ZERO);
  }

  /**
   * Returns the count recorded for a disposition.
   *
   * @param disposition disposition to look up
   * @return count, zero when never recorded
   */
  public long count(SegmentDisposition disposition) {
    return dispositions.getOrDefault(disposition, 0L);
  }

  /**
   * Sums every discard disposition.
   *
   * @return number of inbound segments that were discarded
   */
  public long discarded() {
    long total = 0;
    for (Map.Entry<SegmentDisposition, Long> entry : dispositions.entrySet()) {
      if (entry.getKey().isDiscard()) {
        total += entry.getValue();
      }
    }
    return total;
  }
}

package ca.gc.cra.rdt.infrastructure.net;

import java.time.Duration;

/**
 * Snapshot of what an {@link UnreliableDatagramPort} did to outbound datagrams.
 *
 * @param sent datagrams offered to the channel
 * @param lost datagrams dropped
 * @param corrupted datagrams with inverted bytes
 * @param duplicated datagrams delivered twice
 * @param totalDelay sum of applied delays
 * @since 0.1.0
 */
public record ChannelStatistics(long sent, long lost, long corrupted, long duplicated, Duration totalDelay) {

  public double lossRate() {
    return sent == 0 ? 0.0 : (double) lost / sent;
  }

  public double corruptRate() {
    return sent == 0 ? 0.0 : (double) corrupted / sent;
  }

  public Duration averageDelay() {
    return sent == 0 ? Duration.ZERO : totalDelay.dividedBy(sent);
  }
}

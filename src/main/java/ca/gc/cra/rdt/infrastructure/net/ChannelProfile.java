package ca.gc.cra.rdt.infrastructure.net;

import ca.gc.cra.rdt.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Impairments applied by {@link UnreliableDatagramPort}.
 *
 * @param lossRate probability a datagram is dropped
 * @param corruptRate probability 1 to 5 bytes of a datagram are inverted
 * @param duplicateRate probability a datagram is delivered twice
 * @param minDelay lower bound of the per-datagram delay
 * @param maxDelay upper bound of the per-datagram delay
 * @param seed random seed; identical seeds replay identical impairment decisions
 * @since 0.1.0
 */
public record ChannelProfile(
    double lossRate, double corruptRate, double duplicateRate, Duration minDelay, Duration maxDelay, long seed) {

  public ChannelProfile {
    requireProbability("lossRate", lossRate);
    requireProbability("corruptRate", corruptRate);
    requireProbability("duplicateRate", duplicateRate);
    Objects.requireNonNull(minDelay, "minDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    Numbers.requireRange("minDelay", minDelay, Duration.ZERO, Duration.ofMinutes(1));
    Numbers.requireRange("maxDelay", maxDelay, minDelay, Duration.ofMinutes(1));
  }

  /**
   * Returns a profile that forwards every datagram unchanged and immediately.
   *
   * @return perfect channel
   */
  public static ChannelProfile perfect() {
    return new ChannelProfile(0.0, 0.0, 0.0, Duration.ZERO, Duration.ZERO, 0L);
  }

  /**
   * Returns a copy with only loss and corruption set.
   *
   * @param lossRate drop probability
   * @param corruptRate corruption probability
   * @param seed random seed
   * @return lossy profile without delay or duplication
   */
  public static ChannelProfile lossy(double lossRate, double corruptRate, long seed) {
    return new ChannelProfile(lossRate, corruptRate, 0.0, Duration.ZERO, Duration.ZERO, seed);
  }

  public boolean delays() {
    return maxDelay.compareTo(Duration.ZERO) > 0;
  }

  private static void requireProbability(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new IllegalArgumentException(name + " must be between 0.0 and 1.0 (was " + value + ")");
    }
  }
}

package ca.gc.cra.rdt.application.connection;

import java.time.Duration;

/**
 * Smoothed round-trip estimator producing the adaptive retransmission timeout.
 *
 * <pre>
 * estimatedRTT = 0.875 * estimatedRTT + 0.125 * sample
 * devRTT       = 0.75  * devRTT       + 0.25  * |sample - estimatedRTT|
 * RTO          = clamp(estimatedRTT + 4 * devRTT, minRto, maxRto)
 * </pre>
 *
 * <p>Before the first sample the estimate is the initial timeout and the deviation is zero, so the
 * initial RTO equals the configured initial timeout. Deviation is computed against the freshly
 * updated estimate. Not thread-safe; the connection lock guards it.</p>
 *
 * @since 0.1.0
 */
public final class RttEstimator {
  private static final double ALPHA = 0.125;
  private static final double BETA = 0.25;

  private final long minRtoNanos;
  private final long maxRtoNanos;
  private double estimatedNanos;
  private double deviationNanos;
  private long samples;

  /**
   * Creates an estimator.
   *
   * @param initialRto timeout before any sample
   * @param minRto lower clamp
   * @param maxRto upper clamp
   */
  public RttEstimator(Duration initialRto, Duration minRto, Duration maxRto) {
    this.minRtoNanos = minRto.toNanos();
    this.maxRtoNanos = maxRto.toNanos();
    this.estimatedNanos = initialRto.toNanos();
    this.deviationNanos = 0d;
  }

  /**
   * Folds one RTT sample into the estimate.
   *
   * @param sample measured round trip of a unit transmitted exactly once
   */
  public void addSample(Duration sample) {
    double value = Math.max(0L, sample.toNanos());
    estimatedNanos = (1 - ALPHA) * estimatedNanos + ALPHA * value;
    deviationNanos = (1 - BETA) * deviationNanos + BETA * Math.abs(value - estimatedNanos);
    samples++;
  }

  public Duration estimatedRtt() {
    return Duration.ofNanos(Math.round(estimatedNanos));
  }

  public Duration deviation() {
    return Duration.ofNanos(Math.round(deviationNanos));
  }

  /**
   * Returns the clamped retransmission timeout.
   *
   * @return {@code clamp(estimatedRTT + 4 * devRTT, minRto, maxRto)}
   */
  public Duration retransmissionTimeout() {
    long rto = Math.round(estimatedNanos + 4 * deviationNanos);
    return Duration.ofNanos(Math.max(minRtoNanos, Math.min(maxRtoNanos, rto)));
  }

  public long samples() {
    return samples;
  }
}

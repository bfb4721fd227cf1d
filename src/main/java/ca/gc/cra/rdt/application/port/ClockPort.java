package ca.gc.cra.rdt.application.port;

/**
 * <strong>What:</strong> Port supplying monotonic timestamps to send windows and RTT estimation.
 * <p><strong>Why:</strong> Lets tests drive round-trip samples and send timestamps deterministically.</p>
 * <p><strong>Role:</strong> Domain port consumed by the windowed engine and the connection layer.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#nanoTime()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current monotonic time.
   *
   * @return nanoseconds from an arbitrary fixed origin; only differences are meaningful
   */
  long nowNanos();

  /** Default {@link ClockPort} using {@link System#nanoTime()}. */
  ClockPort SYSTEM = System::nanoTime;
}

package ca.gc.cra.rdt.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Keyed countdown timers for retransmission, persist and grace periods.
 * <p><strong>Role:</strong> Port consumed by send windows and connections; one live timer per key.</p>
 * <p><strong>Thread-safety:</strong> Callers hold the owning endpoint's lock. Callbacks run under that same
 * lock, so a {@link #cancel} that returned is never followed by the cancelled callback.</p>
 *
 * @param <K> timer key type
 * @since 0.1.0
 */
public interface TimerService<K> {
  /**
   * Starts (or replaces) the timer for {@code key}.
   *
   * @param key timer key
   * @param delay countdown
   * @param onFire callback run once when the countdown elapses
   */
  void start(K key, Duration delay, Runnable onFire);

  /**
   * Cancels the timer for {@code key}.
   *
   * @param key timer key
   * @return {@code true} when a live timer was cancelled
   */
  boolean cancel(K key);

  /**
   * Restarts a timer with its last callback.
   *
   * @param key timer key
   * @param delay new countdown
   * @return {@code false} when the key has no callback to restart
   */
  boolean restart(K key, Duration delay);

  /**
   * Returns whether a timer for {@code key} is counting down.
   *
   * @param key timer key
   * @return {@code true} when live
   */
  boolean isActive(K key);

  /** Cancels every timer owned by this service. */
  void cancelAll();
}

package ca.gc.cra.rdt.validation;

import java.time.Duration;

/**
 * <strong>What:</strong> Numeric validation helpers used by transport configuration parsing.
 * <p><strong>Why:</strong> Rejects window sizes, timeouts and buffer capacities that would stall or overflow an
 * endpoint before any socket or timer is allocated.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, ms)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a duration falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate duration; must not be {@code null}
   * @param min minimum inclusive duration
   * @param max maximum inclusive duration
   * @return the validated duration
   * @throws IllegalArgumentException if {@code value} is {@code null} or outside {@code [min, max]}
   */
  public static Duration requireRange(String name, Duration value, Duration min, Duration max) {
    if (value == null) {
      throw new IllegalArgumentException(label(name) + " must not be null");
    }
    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min.toMillis() + " ms and " + max.toMillis()
              + " ms (was " + value.toMillis() + " ms)");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}

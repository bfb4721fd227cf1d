package ca.gc.cra.rdt.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Acknowledgment policies supported by the windowed retransmission engine.
 * <p><strong>Role:</strong> Configuration enum selecting the send and receive window implementations.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 * <p><strong>Observability:</strong> Values appear in endpoint startup logs.</p>
 *
 * @since 0.1.0
 */
public enum AckPolicy {
  /** Cumulative acknowledgment; one timer; whole window resent on timeout (Go-Back-N). */
  GO_BACK_N,
  /** Individual acknowledgment; one timer per unit; receiver reorder buffer (Selective Repeat). */
  SELECTIVE_REPEAT;

  /**
   * Parses a policy name, defaulting to {@link #GO_BACK_N} when blank.
   *
   * @param value textual representation such as {@code gbn}, {@code go-back-n} or {@code sr}
   * @return parsed policy
   * @throws IllegalArgumentException if the string does not match a known policy
   */
  public static AckPolicy fromString(String value) {
    if (value == null || value.isBlank()) {
      return GO_BACK_N;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "gbn", "go_back_n", "gobackn", "cumulative" -> GO_BACK_N;
      case "sr", "selective_repeat", "selectiverepeat", "selective" -> SELECTIVE_REPEAT;
      default -> throw new IllegalArgumentException(
          "ackPolicy must be one of GO_BACK_N or SELECTIVE_REPEAT (was " + value + ")");
    };
  }
}

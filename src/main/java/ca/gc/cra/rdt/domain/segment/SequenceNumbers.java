package ca.gc.cra.rdt.domain.segment;

/**
 * Helpers for 32-bit wrapping sequence arithmetic.
 *
 * <p>Engines track sequence positions as unbounded {@code long}s and only fold them into 32 bits at
 * the wire boundary. Incoming wire values are unwrapped to the position closest to a local
 * reference (the receive cursor or the send base).</p>
 *
 * @since 0.1.0
 */
public final class SequenceNumbers {
  /** Size of the wire sequence space. */
  public static final long MODULUS = 1L << 32;

  private static final long MASK = MODULUS - 1;
  private static final long HALF = MODULUS >>> 1;

  private SequenceNumbers() {
    // Utility
  }

  /**
   * Folds an unbounded position into the 32-bit wire space.
   *
   * @param position local sequence position (may be negative)
   * @return value in {@code [0, 2^32)}
   */
  public static long toWire(long position) {
    return position & MASK;
  }

  /**
   * Resolves a wire value to the unbounded position nearest to {@code reference}.
   *
   * @param reference local position the value is expected to be near
   * @param wire 32-bit wire value
   * @return position congruent to {@code wire} modulo 2^32 within half the space of {@code reference}
   */
  public static long unwrap(long reference, long wire) {
    long delta = (toWire(wire) - toWire(reference)) & MASK;
    if (delta >= HALF) {
      delta -= MODULUS;
    }
    return reference + delta;
  }
}

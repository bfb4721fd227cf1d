package ca.gc.cra.rdt.domain.segment;

/**
 * Signals a datagram that cannot be parsed into a {@link Segment} at all.
 *
 * <p>Distinct from checksum corruption, which yields a structurally valid but corrupt segment.</p>
 *
 * @since 0.1.0
 */
public final class MalformedSegmentException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message diagnostic detail
   */
  public MalformedSegmentException(String message) {
    super(message);
  }
}

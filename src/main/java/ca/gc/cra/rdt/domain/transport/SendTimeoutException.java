package ca.gc.cra.rdt.domain.transport;

import java.time.Duration;

/**
 * Raised when an operation deadline elapses. The endpoint remains usable.
 *
 * @since 0.1.0
 */
public final class SendTimeoutException extends TransportException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param operation operation that timed out (e.g. {@code write})
   * @param timeout deadline that elapsed
   */
  public SendTimeoutException(String operation, Duration timeout) {
    super(operation + " timed out after " + timeout.toMillis() + " ms");
  }
}

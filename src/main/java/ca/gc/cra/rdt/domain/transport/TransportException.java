package ca.gc.cra.rdt.domain.transport;

import java.io.IOException;

/**
 * Base type for application-visible transport failures.
 *
 * @since 0.1.0
 */
public class TransportException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message diagnostic detail
   */
  public TransportException(String message) {
    super(message);
  }

  /**
   * Creates the exception with a cause.
   *
   * @param message diagnostic detail
   * @param cause underlying failure
   */
  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}

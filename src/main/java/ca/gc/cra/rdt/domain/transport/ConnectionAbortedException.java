package ca.gc.cra.rdt.domain.transport;

/**
 * Raised when an operation waits on, or is attempted against, an endpoint that was aborted or
 * released.
 *
 * @since 0.1.0
 */
public final class ConnectionAbortedException extends TransportException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message diagnostic detail
   */
  public ConnectionAbortedException(String message) {
    super(message);
  }

  /**
   * Creates the exception with the failure that released the endpoint.
   *
   * @param message diagnostic detail
   * @param cause failure that released the endpoint
   */
  public ConnectionAbortedException(String message, Throwable cause) {
    super(message, cause);
  }
}

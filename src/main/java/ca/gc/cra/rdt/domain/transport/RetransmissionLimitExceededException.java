package ca.gc.cra.rdt.domain.transport;

/**
 * Fatal failure raised when a unit exhausts its retransmission budget.
 *
 * <p>The owning endpoint is released; blocked and later operations rethrow this exception.</p>
 *
 * @since 0.1.0
 */
public final class RetransmissionLimitExceededException extends TransportException {
  private static final long serialVersionUID = 1L;

  private final long sequence;
  private final int transmissions;

  /**
   * Creates the exception.
   *
   * @param sequence sequence position of the failing unit
   * @param transmissions number of times the unit was transmitted
   */
  public RetransmissionLimitExceededException(long sequence, int transmissions) {
    super("unit " + sequence + " unacknowledged after " + transmissions + " transmissions");
    this.sequence = sequence;
    this.transmissions = transmissions;
  }

  /**
   * Returns the sequence position of the failing unit.
   *
   * @return sequence position
   */
  public long sequence() {
    return sequence;
  }

  /**
   * Returns how many times the unit was transmitted before giving up.
   *
   * @return transmission count
   */
  public int transmissions() {
    return transmissions;
  }
}

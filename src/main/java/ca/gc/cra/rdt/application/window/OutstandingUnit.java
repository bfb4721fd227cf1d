package ca.gc.cra.rdt.application.window;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;

/**
 * One in-flight unit owned by a send window.
 *
 * <p>Mutable; every access happens under the owning window's lock.</p>
 *
 * @since 0.1.0
 */
public final class OutstandingUnit {
  private final long seq;
  private final long span;
  private final int flags;
  private final byte[] payload;
  private final long firstSentNanos;
  private long lastSentNanos;
  private int transmissions;
  private boolean acknowledged;

  OutstandingUnit(long seq, long span, int flags, byte[] payload, long firstSentNanos, int transmissions) {
    this.seq = seq;
    this.span = span;
    this.flags = flags;
    this.payload = payload;
    this.firstSentNanos = firstSentNanos;
    this.lastSentNanos = firstSentNanos;
    this.transmissions = transmissions;
  }

  /** Sequence position of the first unit element (packet index or byte offset). */
  public long seq() {
    return seq;
  }

  /** Sequence space consumed: 1 for a packet or SYN/FIN, payload length for bytes. */
  public long span() {
    return span;
  }

  /** Exclusive end of the unit in sequence space. */
  public long end() {
    return seq + span;
  }

  public int flags() {
    return flags;
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Units are internal to the send window and never mutated.")
  public byte[] payload() {
    return payload;
  }

  public long firstSentNanos() {
    return firstSentNanos;
  }

  public long lastSentNanos() {
    return lastSentNanos;
  }

  public int transmissions() {
    return transmissions;
  }

  public boolean acknowledged() {
    return acknowledged;
  }

  void markAcknowledged() {
    acknowledged = true;
  }

  void recordTransmission(long nowNanos) {
    lastSentNanos = nowNanos;
    transmissions++;
  }

  /**
   * Drops the acknowledged front of a byte unit that was only partially covered.
   *
   * @param newSeq first sequence position still unacknowledged; must lie inside this unit
   * @return trimmed copy keeping the send history
   */
  OutstandingUnit trimFront(long newSeq) {
    int drop = (int) (newSeq - seq);
    byte[] rest = Arrays.copyOfRange(payload, drop, payload.length);
    OutstandingUnit trimmed = new OutstandingUnit(newSeq, span - drop, flags, rest, firstSentNanos, transmissions);
    trimmed.lastSentNanos = lastSentNanos;
    return trimmed;
  }

  @Override
  public String toString() {
    return "OutstandingUnit{seq=" + seq + ", span=" + span + ", transmissions=" + transmissions
        + ", acknowledged=" + acknowledged + '}';
  }
}

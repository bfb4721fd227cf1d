package ca.gc.cra.rdt.application.connection;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.TimerService;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.application.window.CumulativeSendWindow;
import ca.gc.cra.rdt.application.window.OutstandingUnit;
import ca.gc.cra.rdt.application.window.UnitTransmitter;
import ca.gc.cra.rdt.domain.segment.SequenceNumbers;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cumulative send window over byte offsets with receiver-advertised flow control and adaptive
 * retransmission timing.
 *
 * <p>Admission is bounded by {@code min(localCap, peerWindow)} bytes in flight. Acknowledgments that
 * newly cover a unit transmitted exactly once feed the {@link RttEstimator} (Karn's rule).</p>
 *
 * @since 0.1.0
 */
public final class ByteStreamSendWindow extends CumulativeSendWindow {
  private final int localCap;
  private final RttEstimator rtt;
  private int peerWindow;

  /**
   * Creates the window.
   *
   * @param lock connection lock
   * @param timers retransmission timers bound to {@code lock}
   * @param transmitter frames units with the current acknowledgment and window
   * @param clock monotonic clock for RTT samples
   * @param counters connection counters
   * @param maxRetries retransmissions allowed per unit
   * @param initialSeq initial sequence number; the SYN occupies it
   * @param localCap local cap on bytes in flight
   * @param rtt estimator supplying the retransmission timeout
   */
  public ByteStreamSendWindow(
      ReentrantLock lock,
      TimerService<Long> timers,
      UnitTransmitter transmitter,
      ClockPort clock,
      TransportCounters counters,
      int maxRetries,
      long initialSeq,
      int localCap,
      RttEstimator rtt) {
    super(lock, timers, transmitter, clock, counters, maxRetries, initialSeq);
    this.localCap = localCap;
    this.rtt = rtt;
  }

  @Override
  protected long capacity() {
    return Math.min(localCap, peerWindow) - (nextSeq - base);
  }

  /**
   * Applies an acknowledgment carrying the peer's advertised window.
   *
   * @param ackWire 32-bit acknowledgment number (next byte the peer expects)
   * @param window peer's advertised free space
   * @return disposition of the acknowledgment
   */
  public SegmentDisposition onAcknowledgment(long ackWire, int window) {
    lock.lock();
    try {
      long ack = SequenceNumbers.unwrap(base, ackWire);
      if (ack >= base && ack <= nextSeq && window != peerWindow) {
        peerWindow = window;
        signalChanged();
      }
      return acknowledgeThrough(ack);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public SegmentDisposition onAckReceived(long ackWire) {
    return onAcknowledgment(ackWire, peerWindow());
  }

  @Override
  protected void onUnitsAcknowledged(List<OutstandingUnit> covered) {
    if (covered.isEmpty()) {
      return;
    }
    OutstandingUnit newest = covered.get(covered.size() - 1);
    if (newest.transmissions() == 1) {
      long sample = clock.nowNanos() - newest.firstSentNanos();
      rtt.addSample(Duration.ofNanos(sample));
      counters.observe(TransportCounters.RTT_SAMPLE, sample);
    }
  }

  /**
   * Transmits one data chunk. Caller holds the lock and obtained capacity via {@link #awaitCapacity}.
   *
   * @param chunk payload bytes, owned by the window from now on
   * @return byte offset of the chunk
   */
  public long transmitChunk(byte[] chunk) {
    lock.lock();
    try {
      return transmitNew(0, chunk, chunk.length);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records the window advertised in the peer's SYN or SYN-ACK.
   *
   * @param window advertised window
   */
  public void setPeerWindow(int window) {
    lock.lock();
    try {
      peerWindow = window;
      signalChanged();
    } finally {
      lock.unlock();
    }
  }

  public int peerWindow() {
    lock.lock();
    try {
      return peerWindow;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the bytes that may be sent now.
   *
   * @return {@code min(localCap, peerWindow) - inFlight}, never negative
   */
  public long available() {
    lock.lock();
    try {
      return Math.max(0L, capacity());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Duration retransmissionTimeout() {
    return rtt.retransmissionTimeout();
  }
}

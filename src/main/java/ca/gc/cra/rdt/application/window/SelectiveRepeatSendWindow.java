package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.TimerService;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.domain.segment.SequenceNumbers;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selective Repeat send window: each packet is acknowledged individually and owns its own timer.
 *
 * <p>The base slides past the contiguous acknowledged prefix; acknowledged packets above a gap stay
 * in the window, marked, until the gap closes. A marked packet is never retransmitted.</p>
 *
 * @since 0.1.0
 */
public final class SelectiveRepeatSendWindow extends AbstractSendWindow {
  private static final Logger log = LoggerFactory.getLogger(SelectiveRepeatSendWindow.class);

  private final int windowSize;
  private final Duration timeout;

  /**
   * Creates the window starting at packet 0.
   *
   * @param lock endpoint lock
   * @param timers timer service bound to {@code lock}
   * @param transmitter frames and sends packets
   * @param clock monotonic clock
   * @param counters endpoint counters
   * @param windowSize window N
   * @param timeout fixed per-packet retransmission timeout
   * @param maxRetries retransmissions allowed per packet
   */
  public SelectiveRepeatSendWindow(
      ReentrantLock lock,
      TimerService<Long> timers,
      UnitTransmitter transmitter,
      ClockPort clock,
      TransportCounters counters,
      int windowSize,
      Duration timeout,
      int maxRetries) {
    super(lock, timers, transmitter, clock, counters, maxRetries, 0L);
    this.windowSize = windowSize;
    this.timeout = timeout;
  }

  @Override
  protected long capacity() {
    return windowSize - (nextSeq - base);
  }

  @Override
  protected void onTransmitted(OutstandingUnit unit) {
    long seq = unit.seq();
    timers.start(seq, timeout, () -> onTimeout(seq));
  }

  @Override
  public SegmentDisposition onAckReceived(long ackWire) {
    lock.lock();
    try {
      long seq = SequenceNumbers.unwrap(base, ackWire);
      if (seq >= nextSeq) {
        log.debug("Ignoring acknowledgment {} for a packet never sent (next {})", seq, nextSeq);
        return SegmentDisposition.OUT_OF_WINDOW;
      }
      OutstandingUnit unit = seq < base ? null : outstanding.get(seq);
      if (unit == null || unit.acknowledged()) {
        counters.increment(TransportCounters.ACK_DUPLICATE_RECEIVED);
        return SegmentDisposition.DUPLICATE;
      }
      unit.markAcknowledged();
      timers.cancel(seq);
      slideBase();
      signalChanged();
      return SegmentDisposition.ACKNOWLEDGED;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Duration retransmissionTimeout() {
    return timeout;
  }

  public int windowSize() {
    return windowSize;
  }

  private void slideBase() {
    while (!outstanding.isEmpty()) {
      Map.Entry<Long, OutstandingUnit> first = outstanding.firstEntry();
      if (!first.getValue().acknowledged()) {
        base = first.getKey();
        return;
      }
      outstanding.pollFirstEntry();
    }
    base = nextSeq;
  }

  private void onTimeout(long seq) {
    OutstandingUnit unit = outstanding.get(seq);
    if (unit == null || unit.acknowledged()) {
      return;
    }
    if (retransmit(unit)) {
      timers.start(seq, timeout, () -> onTimeout(seq));
    }
  }
}

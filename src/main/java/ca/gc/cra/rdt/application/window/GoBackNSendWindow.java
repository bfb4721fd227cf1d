package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.TimerService;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.domain.segment.SequenceNumbers;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Go-Back-N send window over packet indices: at most {@code windowSize} unacknowledged packets, an
 * acknowledgment {@code k} covers every packet up to and including {@code k}.
 *
 * @since 0.1.0
 */
public final class GoBackNSendWindow extends CumulativeSendWindow {
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
   * @param timeout fixed retransmission timeout
   * @param maxRetries retransmissions allowed per packet
   */
  public GoBackNSendWindow(
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
  public SegmentDisposition onAckReceived(long ackWire) {
    lock.lock();
    try {
      long ack = SequenceNumbers.unwrap(base, ackWire);
      return acknowledgeThrough(ack + 1);
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
}

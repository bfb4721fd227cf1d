package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.TimerService;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Send window acknowledged cumulatively, with one timer tracking the oldest outstanding unit.
 *
 * <p>On timeout every unit in {@code [base, nextSeq)} is retransmitted and the timer restarted.</p>
 *
 * @since 0.1.0
 */
public abstract class CumulativeSendWindow extends AbstractSendWindow {
  private static final Logger log = LoggerFactory.getLogger(CumulativeSendWindow.class);

  /** Key of the single retransmission timer. */
  public static final Long OLDEST_TIMER = Long.MIN_VALUE;

  protected CumulativeSendWindow(
      ReentrantLock lock,
      TimerService<Long> timers,
      UnitTransmitter transmitter,
      ClockPort clock,
      TransportCounters counters,
      int maxRetries,
      long initialSeq) {
    super(lock, timers, transmitter, clock, counters, maxRetries, initialSeq);
  }

  @Override
  protected void onTransmitted(OutstandingUnit unit) {
    if (!timers.isActive(OLDEST_TIMER)) {
      armTimer();
    }
  }

  /**
   * Acknowledges every sequence position below {@code exclusiveUpTo}.
   *
   * @param exclusiveUpTo first position not acknowledged
   * @return {@link SegmentDisposition#DUPLICATE} when nothing new is covered,
   *     {@link SegmentDisposition#OUT_OF_WINDOW} when it covers positions never sent,
   *     otherwise {@link SegmentDisposition#ACKNOWLEDGED}
   */
  protected SegmentDisposition acknowledgeThrough(long exclusiveUpTo) {
    lock.lock();
    try {
      if (exclusiveUpTo <= base) {
        counters.increment(TransportCounters.ACK_DUPLICATE_RECEIVED);
        return SegmentDisposition.DUPLICATE;
      }
      if (exclusiveUpTo > nextSeq) {
        log.debug("Ignoring acknowledgment {} beyond next sequence {}", exclusiveUpTo, nextSeq);
        return SegmentDisposition.OUT_OF_WINDOW;
      }
      List<OutstandingUnit> covered = new ArrayList<>();
      Iterator<Map.Entry<Long, OutstandingUnit>> it = outstanding.headMap(exclusiveUpTo, false).entrySet().iterator();
      OutstandingUnit straddling = null;
      while (it.hasNext()) {
        OutstandingUnit unit = it.next().getValue();
        it.remove();
        if (unit.end() <= exclusiveUpTo) {
          unit.markAcknowledged();
          covered.add(unit);
        } else {
          straddling = unit.trimFront(exclusiveUpTo);
        }
      }
      if (straddling != null) {
        outstanding.put(straddling.seq(), straddling);
      }
      base = exclusiveUpTo;
      onUnitsAcknowledged(covered);
      if (outstanding.isEmpty()) {
        timers.cancel(OLDEST_TIMER);
      } else {
        armTimer();
      }
      signalChanged();
      return SegmentDisposition.ACKNOWLEDGED;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Hook invoked under the lock after units were fully acknowledged.
   *
   * @param covered units acknowledged by this acknowledgment, in sequence order
   */
  protected void onUnitsAcknowledged(List<OutstandingUnit> covered) {
    // no-op by default
  }

  /** Retransmits the whole window and restarts the timer. */
  protected void onTimeout() {
    if (outstanding.isEmpty()) {
      return;
    }
    log.debug("{} timeout; resending {} units from {}", counters.prefix(), outstanding.size(), base);
    for (OutstandingUnit unit : new ArrayList<>(outstanding.values())) {
      if (!retransmit(unit)) {
        return;
      }
    }
    armTimer();
  }

  private void armTimer() {
    timers.start(OLDEST_TIMER, retransmissionTimeout(), this::onTimeout);
  }
}

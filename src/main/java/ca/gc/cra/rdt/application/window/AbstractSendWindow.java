package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.TimerService;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.domain.transport.ConnectionAbortedException;
import ca.gc.cra.rdt.domain.transport.RetransmissionLimitExceededException;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import ca.gc.cra.rdt.domain.transport.SendTimeoutException;
import ca.gc.cra.rdt.domain.transport.TransportException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded set of in-flight units with blocking admission and timeout-driven
 * retransmission.
 * <p><strong>Why:</strong> Shares admission, bookkeeping and the retry budget between the cumulative and
 * selective policies, which differ only in how acknowledgments and timeouts are applied.</p>
 * <p><strong>Role:</strong> Application service owned by one sender endpoint or one connection.</p>
 * <p><strong>Thread-safety:</strong> Every method acquires the endpoint lock supplied at construction. Timer
 * callbacks run under the same lock.</p>
 * <p><strong>Observability:</strong> Counts {@code segments.sent}, {@code retransmit.timeout} and
 * {@code ack.duplicateReceived} under the endpoint prefix.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractSendWindow {
  private static final Logger log = LoggerFactory.getLogger(AbstractSendWindow.class);

  protected final ReentrantLock lock;
  protected final NavigableMap<Long, OutstandingUnit> outstanding = new TreeMap<>();
  protected final TimerService<Long> timers;
  protected final ClockPort clock;
  protected final TransportCounters counters;

  private final Condition changed;
  private final UnitTransmitter transmitter;
  private final int maxRetries;
  private Consumer<TransportException> failureListener = ex -> {};
  private TransportException failure;

  /** Lowest unacknowledged sequence position. */
  protected long base;
  /** Sequence position the next new unit will use. */
  protected long nextSeq;

  /**
   * Creates a send window.
   *
   * @param lock endpoint lock
   * @param timers timer service bound to {@code lock}
   * @param transmitter frames and sends units
   * @param clock monotonic clock for send timestamps
   * @param counters endpoint counters
   * @param maxRetries retransmissions allowed per unit
   * @param initialSeq first sequence position
   */
  protected AbstractSendWindow(
      ReentrantLock lock,
      TimerService<Long> timers,
      UnitTransmitter transmitter,
      ClockPort clock,
      TransportCounters counters,
      int maxRetries,
      long initialSeq) {
    this.lock = Objects.requireNonNull(lock, "lock");
    this.timers = Objects.requireNonNull(timers, "timers");
    this.transmitter = Objects.requireNonNull(transmitter, "transmitter");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.counters = Objects.requireNonNull(counters, "counters");
    this.maxRetries = maxRetries;
    this.changed = lock.newCondition();
    this.base = initialSeq;
    this.nextSeq = initialSeq;
  }

  /**
   * Remaining admission capacity in sequence units (packets or bytes).
   *
   * @return units that may be sent now; zero or negative when the window is full
   */
  protected abstract long capacity();

  /**
   * Called after a unit's first transmission so the policy can arm its timer.
   *
   * @param unit freshly transmitted unit
   */
  protected abstract void onTransmitted(OutstandingUnit unit);

  /**
   * Applies an inbound acknowledgment number.
   *
   * @param ackWire 32-bit acknowledgment number from the wire
   * @return disposition of the acknowledgment
   */
  public abstract SegmentDisposition onAckReceived(long ackWire);

  /**
   * Returns the timeout used when arming retransmission timers.
   *
   * @return current retransmission timeout
   */
  public abstract Duration retransmissionTimeout();

  /**
   * Registers the callback invoked once when the window fails. Runs under the endpoint lock.
   *
   * @param listener failure callback
   */
  public void setFailureListener(Consumer<TransportException> listener) {
    lock.lock();
    try {
      this.failureListener = Objects.requireNonNull(listener, "listener");
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until the window admits new units.
   *
   * @param timeout maximum wait
   * @return available capacity, always positive
   * @throws SendTimeoutException when the deadline elapses first
   * @throws TransportException when the window failed or was released
   * @throws InterruptedException if the caller is interrupted
   */
  public long awaitCapacity(Duration timeout) throws TransportException, InterruptedException {
    lock.lock();
    try {
      long remaining = timeout.toNanos();
      while (true) {
        throwIfFailed();
        long available = capacity();
        if (available > 0) {
          return available;
        }
        if (remaining <= 0L) {
          throw new SendTimeoutException("send", timeout);
        }
        remaining = changed.awaitNanos(remaining);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for capacity and transmits one new unit.
   *
   * @param flags segment flags to record with the unit
   * @param payload unit payload
   * @param span sequence space consumed
   * @param timeout maximum wait for capacity
   * @return sequence position assigned to the unit
   * @throws TransportException when the window failed, was released or the deadline elapsed
   * @throws InterruptedException if the caller is interrupted
   */
  public long send(int flags, byte[] payload, long span, Duration timeout)
      throws TransportException, InterruptedException {
    lock.lock();
    try {
      awaitCapacity(timeout);
      return transmitNew(flags, payload, span);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Transmits a control unit (SYN or FIN) that consumes one sequence number regardless of capacity.
   *
   * @param flags control flags
   * @return sequence position of the control unit
   * @throws TransportException when the window failed or was released
   */
  public long sendControl(int flags) throws TransportException {
    lock.lock();
    try {
      throwIfFailed();
      return transmitNew(flags, new byte[0], 1L);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records and transmits a new unit at {@link #nextSeq}. Caller holds the lock and has checked capacity.
   *
   * @param flags segment flags
   * @param payload payload bytes, owned by the window from now on
   * @param span sequence space consumed
   * @return sequence position assigned to the unit
   */
  protected long transmitNew(int flags, byte[] payload, long span) {
    long seq = nextSeq;
    OutstandingUnit unit = new OutstandingUnit(seq, span, flags, payload, clock.nowNanos(), 1);
    outstanding.put(seq, unit);
    nextSeq += span;
    if (payload.length > 0) {
      counters.add(TransportCounters.BYTES_SENT, payload.length);
    }
    counters.increment(TransportCounters.SEGMENTS_SENT);
    transmitter.transmit(unit, false);
    onTransmitted(unit);
    return seq;
  }

  /**
   * Retransmits a unit after a timeout, failing the window when the retry budget is exhausted.
   *
   * @param unit unit to resend
   * @return {@code false} when the window failed instead
   */
  protected boolean retransmit(OutstandingUnit unit) {
    if (unit.transmissions() - 1 >= maxRetries) {
      log.warn("Unit {} exceeded {} retransmissions; failing {}", unit.seq(), maxRetries, counters.prefix());
      fail(new RetransmissionLimitExceededException(unit.seq(), unit.transmissions()));
      return false;
    }
    unit.recordTransmission(clock.nowNanos());
    counters.increment(TransportCounters.RETRANSMIT_TIMEOUT);
    counters.increment(TransportCounters.SEGMENTS_SENT);
    log.debug("Retransmitting unit {} (transmission {})", unit.seq(), unit.transmissions());
    transmitter.transmit(unit, true);
    return true;
  }

  /**
   * Fails the window: cancels timers, drops outstanding units and wakes every waiter.
   *
   * @param cause failure to report to waiters and later callers
   */
  public void fail(TransportException cause) {
    lock.lock();
    try {
      if (failure != null) {
        return;
      }
      failure = cause;
      timers.cancelAll();
      outstanding.clear();
      changed.signalAll();
      failureListener.accept(cause);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Releases the window without a protocol failure. Waiters receive {@link ConnectionAbortedException}.
   *
   * @param reason diagnostic detail
   */
  public void release(String reason) {
    lock.lock();
    try {
      if (failure != null) {
        return;
      }
      failure = new ConnectionAbortedException(reason);
      timers.cancelAll();
      outstanding.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until every outstanding unit is acknowledged.
   *
   * @param timeout maximum wait
   * @return {@code true} when drained, {@code false} on timeout
   * @throws TransportException when the window failed while waiting
   * @throws InterruptedException if the caller is interrupted
   */
  public boolean awaitAcknowledged(Duration timeout) throws TransportException, InterruptedException {
    lock.lock();
    try {
      long remaining = timeout.toNanos();
      while (!outstanding.isEmpty()) {
        throwIfFailed();
        if (remaining <= 0L) {
          return false;
        }
        remaining = changed.awaitNanos(remaining);
      }
      throwIfFailed();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Wakes threads blocked on capacity or drain. Caller holds the lock. */
  protected void signalChanged() {
    changed.signalAll();
  }

  /**
   * Rethrows the failure recorded by {@link #fail} or {@link #release}.
   *
   * @throws TransportException when the window is no longer usable
   */
  public void throwIfFailed() throws TransportException {
    lock.lock();
    try {
      if (failure instanceof RetransmissionLimitExceededException limit) {
        throw limit;
      }
      if (failure != null) {
        throw new ConnectionAbortedException(failure.getMessage(), failure);
      }
    } finally {
      lock.unlock();
    }
  }

  public TransportException failure() {
    lock.lock();
    try {
      return failure;
    } finally {
      lock.unlock();
    }
  }

  public long base() {
    lock.lock();
    try {
      return base;
    } finally {
      lock.unlock();
    }
  }

  public long nextSeq() {
    lock.lock();
    try {
      return nextSeq;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether every transmitted unit has been acknowledged.
   *
   * @return {@code true} when nothing is in flight
   */
  public boolean isDrained() {
    lock.lock();
    try {
      return outstanding.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copies the outstanding units for inspection.
   *
   * @return units in sequence order
   */
  public List<OutstandingUnit> outstandingUnits() {
    lock.lock();
    try {
      return new ArrayList<>(outstanding.values());
    } finally {
      lock.unlock();
    }
  }
}

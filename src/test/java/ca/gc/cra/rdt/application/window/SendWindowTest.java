package ca.gc.cra.rdt.application.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.domain.transport.RetransmissionLimitExceededException;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import ca.gc.cra.rdt.domain.transport.SendTimeoutException;
import ca.gc.cra.rdt.domain.transport.TransportException;
import ca.gc.cra.rdt.testutil.ManualClock;
import ca.gc.cra.rdt.testutil.ManualTimerService;
import ca.gc.cra.rdt.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.Test;

class SendWindowTest {
  private static final Duration TIMEOUT = Duration.ofMillis(100);

  private final ReentrantLock lock = new ReentrantLock();
  private final ManualTimerService<Long> timers = new ManualTimerService<>();
  private final ManualClock clock = new ManualClock();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final TransportCounters counters = new TransportCounters(metrics, "sender");
  private final List<Long> firstSends = new ArrayList<>();
  private final List<Long> retransmissions = new ArrayList<>();
  private final UnitTransmitter transmitter = (unit, retransmission) -> {
    if (retransmission) {
      retransmissions.add(unit.seq());
    } else {
      firstSends.add(unit.seq());
    }
  };

  private GoBackNSendWindow goBackN(int window, int maxRetries) {
    return new GoBackNSendWindow(lock, timers, transmitter, clock, counters, window, TIMEOUT, maxRetries);
  }

  private SelectiveRepeatSendWindow selectiveRepeat(int window, int maxRetries) {
    return new SelectiveRepeatSendWindow(lock, timers, transmitter, clock, counters, window, TIMEOUT, maxRetries);
  }

  private static void send(AbstractSendWindow window, int count) throws Exception {
    for (int i = 0; i < count; i++) {
      window.send(0, new byte[] {(byte) i}, 1L, Duration.ZERO);
    }
  }

  @Test
  void goBackNWindowOfFourResendsEverythingAfterTheLoss() throws Exception {
    GoBackNSendWindow window = goBackN(4, 10);
    send(window, 4);
    assertEquals(0, window.capacity());
    assertThrows(SendTimeoutException.class, () -> window.send(0, new byte[] {9}, 1L, Duration.ZERO));

    // packet 2 is lost; 0 and 1 are acknowledged, 3 provokes a duplicate ACK of 1
    assertEquals(SegmentDisposition.ACKNOWLEDGED, window.onAckReceived(0));
    assertEquals(SegmentDisposition.ACKNOWLEDGED, window.onAckReceived(1));
    send(window, 2);
    assertEquals(SegmentDisposition.DUPLICATE, window.onAckReceived(1));
    assertEquals(2L, window.base());
    assertEquals(6L, window.nextSeq());

    assertTrue(timers.fire(CumulativeSendWindow.OLDEST_TIMER));

    assertEquals(List.of(2L, 3L, 4L, 5L), retransmissions);
    assertTrue(timers.isActive(CumulativeSendWindow.OLDEST_TIMER));
    assertEquals(4, metrics.count("sender.retransmit.timeout"));
    assertEquals(1, metrics.count("sender.ack.duplicateReceived"));

    window.onAckReceived(5);
    assertTrue(window.isDrained());
    assertFalse(timers.isActive(CumulativeSendWindow.OLDEST_TIMER));
  }

  @Test
  void selectiveRepeatResendsOnlyTheMissingUnit() throws Exception {
    SelectiveRepeatSendWindow window = selectiveRepeat(4, 10);
    send(window, 4);

    window.onAckReceived(0);
    window.onAckReceived(1);
    window.onAckReceived(3);
    send(window, 2);
    window.onAckReceived(4);
    window.onAckReceived(5);
    assertEquals(2L, window.base());
    assertFalse(timers.isActive(3L));

    assertTrue(timers.fire(2L));
    assertFalse(timers.fire(3L));

    assertEquals(List.of(2L), retransmissions);
    window.onAckReceived(2);
    assertEquals(6L, window.base());
    assertTrue(window.isDrained());
  }

  @Test
  void selectiveRepeatCountsRepeatedAcknowledgmentAsDuplicate() throws Exception {
    SelectiveRepeatSendWindow window = selectiveRepeat(4, 10);
    send(window, 2);

    assertEquals(SegmentDisposition.ACKNOWLEDGED, window.onAckReceived(1));
    assertEquals(SegmentDisposition.DUPLICATE, window.onAckReceived(1));
    assertEquals(SegmentDisposition.OUT_OF_WINDOW, window.onAckReceived(7));
    assertEquals(0L, window.base());
  }

  @Test
  void cumulativeAcknowledgmentBeyondNextSequenceIsIgnored() throws Exception {
    GoBackNSendWindow window = goBackN(4, 10);
    send(window, 2);

    assertEquals(SegmentDisposition.OUT_OF_WINDOW, window.onAckReceived(5));
    assertEquals(0L, window.base());
  }

  @Test
  void exhaustingRetriesFailsTheWindow() throws Exception {
    GoBackNSendWindow window = goBackN(2, 2);
    AtomicReference<TransportException> reported = new AtomicReference<>();
    window.setFailureListener(reported::set);
    send(window, 1);

    assertTrue(timers.fire(CumulativeSendWindow.OLDEST_TIMER));
    assertTrue(timers.fire(CumulativeSendWindow.OLDEST_TIMER));
    assertTrue(timers.fire(CumulativeSendWindow.OLDEST_TIMER));

    assertEquals(2, retransmissions.size());
    RetransmissionLimitExceededException failure =
        assertInstanceOf(RetransmissionLimitExceededException.class, window.failure());
    assertEquals(0L, failure.sequence());
    assertEquals(3, failure.transmissions());
    assertSame(failure, reported.get());
    assertTrue(timers.activeKeys().isEmpty());
    assertThrows(RetransmissionLimitExceededException.class, () -> window.send(0, new byte[] {1}, 1L, Duration.ZERO));
  }

  @Test
  void randomTracesNeverExceedTheWindow() throws Exception {
    Random random = new Random(42);
    for (int trial = 0; trial < 20; trial++) {
      int size = 1 + random.nextInt(8);
      AbstractSendWindow window = trial % 2 == 0 ? goBackN(size, 1_000) : selectiveRepeat(size, 1_000);
      long lastBase = window.base();
      for (int step = 0; step < 500; step++) {
        int op = random.nextInt(3);
        if (op == 0 && window.capacity() > 0) {
          window.send(0, new byte[] {1}, 1L, Duration.ZERO);
        } else if (op == 1) {
          long candidate = Math.max(0L, window.base() - 2 + random.nextInt(size + 4));
          window.onAckReceived(candidate);
        } else if (!timers.activeKeys().isEmpty()) {
          timers.fire(timers.activeKeys().iterator().next());
        }
        long inFlight = window.nextSeq() - window.base();
        assertTrue(inFlight >= 0 && inFlight <= size, "in flight " + inFlight + " exceeds window " + size);
        assertTrue(window.base() >= lastBase, "base moved backwards");
        lastBase = window.base();
      }
      timers.cancelAll();
    }
  }

  @Test
  void awaitAcknowledgedReportsTimeoutWithoutFailing() throws Exception {
    GoBackNSendWindow window = goBackN(4, 10);
    send(window, 1);

    assertFalse(window.awaitAcknowledged(Duration.ofMillis(10)));
    window.onAckReceived(0);
    assertTrue(window.awaitAcknowledged(Duration.ZERO));
  }
}

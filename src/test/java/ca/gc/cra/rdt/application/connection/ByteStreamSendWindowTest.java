package ca.gc.cra.rdt.application.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.application.window.CumulativeSendWindow;
import ca.gc.cra.rdt.application.window.OutstandingUnit;
import ca.gc.cra.rdt.domain.segment.SegmentKind;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import ca.gc.cra.rdt.domain.transport.SendTimeoutException;
import ca.gc.cra.rdt.testutil.ManualClock;
import ca.gc.cra.rdt.testutil.ManualTimerService;
import ca.gc.cra.rdt.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ByteStreamSendWindowTest {
  private static final long ISS = 100L;
  private static final int MSS = 512;

  private final ManualTimerService<Long> timers = new ManualTimerService<>();
  private final ManualClock clock = new ManualClock();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<OutstandingUnit> sent = new ArrayList<>();
  private final List<OutstandingUnit> resent = new ArrayList<>();
  private RttEstimator rtt;
  private ByteStreamSendWindow window;

  @BeforeEach
  void setUp() throws Exception {
    rtt = new RttEstimator(Duration.ofSeconds(1), Duration.ofMillis(10), Duration.ofSeconds(60));
    window = new ByteStreamSendWindow(
        new ReentrantLock(),
        timers,
        (unit, retransmission) -> (retransmission ? resent : sent).add(unit),
        clock,
        new TransportCounters(metrics, "connection"),
        5,
        ISS,
        65_535,
        rtt);
    window.sendControl(SegmentKind.FLAG_SYN);
  }

  @Test
  void peerWindowOfOneKilobyteBoundsAFiveKilobyteWrite() throws Exception {
    window.onAcknowledgment(ISS + 1, 1_024);
    int total = 5_120;
    int written = 0;
    int rounds = 0;

    while (written < total) {
      while (written < total && window.available() > 0) {
        int length = (int) Math.min(Math.min(MSS, window.available()), total - written);
        window.transmitChunk(new byte[length]);
        written += length;
        assertTrue(window.nextSeq() - window.base() <= 1_024, "in flight exceeds the advertised window");
      }
      rounds++;
      assertThrows(SendTimeoutException.class, () -> window.awaitCapacity(Duration.ZERO));
      window.onAcknowledgment(window.nextSeq(), 1_024);
    }

    assertEquals(5, rounds);
    assertEquals(ISS + 1 + total, window.base());
    assertTrue(window.isDrained());
    assertEquals(total, metrics.observed("connection.bytes.sent").stream().mapToLong(Long::longValue).sum());
  }

  @Test
  void shrinkingWindowStopsAdmissionUntilUpdated() throws Exception {
    window.onAcknowledgment(ISS + 1, 600);
    window.transmitChunk(new byte[500]);

    window.onAcknowledgment(ISS + 1, 0);

    assertEquals(0L, window.available());
    assertEquals(0, window.peerWindow());
    window.onAcknowledgment(ISS + 501, 0);
    assertTrue(window.isDrained());
    assertEquals(0L, window.available());

    window.onAcknowledgment(ISS + 501, 300);
    assertEquals(300L, window.available());
  }

  @Test
  void samplesOnlyUnitsTransmittedOnce() throws Exception {
    clock.advance(Duration.ofMillis(30));
    window.onAcknowledgment(ISS + 1, 4_096);
    assertEquals(1L, rtt.samples());
    assertEquals(List.of(Duration.ofMillis(30).toNanos()), metrics.observed("connection.rtt.sampleNanos"));

    window.transmitChunk(new byte[100]);
    assertTrue(timers.fire(CumulativeSendWindow.OLDEST_TIMER));
    assertEquals(1, resent.size());
    clock.advance(Duration.ofMillis(5));
    window.onAcknowledgment(ISS + 101, 4_096);

    assertEquals(1L, rtt.samples());
  }

  @Test
  void partialAcknowledgmentTrimsTheOutstandingChunk() throws Exception {
    window.onAcknowledgment(ISS + 1, 4_096);
    window.transmitChunk(new byte[100]);

    assertEquals(SegmentDisposition.ACKNOWLEDGED, window.onAcknowledgment(ISS + 41, 4_096));

    List<OutstandingUnit> outstanding = window.outstandingUnits();
    assertEquals(1, outstanding.size());
    assertEquals(ISS + 41, outstanding.get(0).seq());
    assertEquals(60, outstanding.get(0).payload().length);

    assertTrue(timers.fire(CumulativeSendWindow.OLDEST_TIMER));
    assertEquals(ISS + 41, resent.get(0).seq());
  }

  @Test
  void staleAcknowledgmentDoesNotTouchThePeerWindow() throws Exception {
    window.onAcknowledgment(ISS + 1, 2_000);
    window.transmitChunk(new byte[10]);
    window.onAcknowledgment(ISS + 11, 2_000);

    assertEquals(SegmentDisposition.DUPLICATE, window.onAcknowledgment(ISS + 1, 0));
    assertEquals(2_000, window.peerWindow());
  }
}

package ca.gc.cra.rdt.application.window;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.config.TransportConfig;
import ca.gc.cra.rdt.domain.net.Datagram;
import ca.gc.cra.rdt.domain.segment.MalformedSegmentException;
import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.segment.SegmentCodec;
import ca.gc.cra.rdt.domain.segment.SegmentKind;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import ca.gc.cra.rdt.domain.transport.TransportStatistics;
import ca.gc.cra.rdt.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rdt.testutil.InMemoryDatagramNetwork;
import ca.gc.cra.rdt.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class WindowedEngineTest {
  private ScheduledExecutorService scheduler;
  private InMemoryDatagramNetwork network;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    scheduler = ExecutorFactories.newTimerScheduler("engine-test", null);
    network = new InMemoryDatagramNetwork();
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  private WindowedRetransmissionEngine engine(String policy) {
    TransportConfig config = TransportConfig.fromMap(Map.of(
        "ackPolicy", policy,
        "windowSize", "4",
        "rto.minMillis", "10",
        "rto.initialMillis", "40",
        "pollIntervalMillis", "10"));
    return new WindowedRetransmissionEngine(config, scheduler, metrics, ClockPort.SYSTEM);
  }

  @ParameterizedTest
  @ValueSource(strings = {"gbn", "sr"})
  void deliversEveryPacketOnceInOrderOverALossyNetwork(String policy) throws Exception {
    Random random = new Random(11);
    Set<Long> droppedOnce = ConcurrentHashMap.newKeySet();
    network.dropWhen((from, to, bytes) -> {
      Segment segment = decode(bytes);
      if (segment.kind() == SegmentKind.DATA && segment.seq() % 3 == 1) {
        return droppedOnce.add(segment.seq());
      }
      synchronized (random) {
        return random.nextInt(10) == 0;
      }
    });
    network.duplicateWhen((from, to, bytes) -> decode(bytes).seq() % 5 == 0);
    WindowedRetransmissionEngine engine = engine(policy);
    DatagramPort receiverPort = network.open();
    int count = 30;

    try (WindowedReceiver receiver = engine.newReceiver(receiverPort);
        WindowedSender sender = engine.newSender(network.open(), receiverPort.localAddress())) {
      for (int i = 0; i < count; i++) {
        assertEquals(i, sender.send(new byte[] {(byte) i, 42}, Duration.ofSeconds(10)));
      }
      assertTrue(sender.awaitAcknowledged(Duration.ofSeconds(10)));

      for (int i = 0; i < count; i++) {
        byte[] payload = receiver.receive(Duration.ofSeconds(5)).orElseThrow();
        assertArrayEquals(new byte[] {(byte) i, 42}, payload);
      }
      assertTrue(receiver.receive(Duration.ofMillis(50)).isEmpty());
      assertEquals(count, receiver.deliveryPoint());

      TransportStatistics senderStats = sender.statistics();
      assertTrue(senderStats.timeoutRetransmissions() > 0);
      assertTrue(senderStats.segmentsSent() >= count);
      TransportStatistics receiverStats = receiver.statistics();
      assertEquals(count, receiverStats.unitsDelivered());
      assertTrue(receiverStats.count(SegmentDisposition.DUPLICATE) > 0
          || receiverStats.count(SegmentDisposition.BUFFERED) > 0
          || receiverStats.count(SegmentDisposition.OUT_OF_WINDOW) > 0);
    }
    assertTrue(metrics.count("sender.retransmit.timeout") > 0);
  }

  @ParameterizedTest
  @ValueSource(strings = {"gbn", "sr"})
  void corruptDatagramsAreCountedAndRecovered(String policy) throws Exception {
    Set<Long> corrupted = ConcurrentHashMap.newKeySet();
    DatagramPort receiverPort = network.open();
    DatagramPort corruptingPort = new CorruptingPort(network.open(), corrupted);
    WindowedRetransmissionEngine engine = engine(policy);

    try (WindowedReceiver receiver = engine.newReceiver(receiverPort);
        WindowedSender sender = engine.newSender(corruptingPort, receiverPort.localAddress())) {
      for (int i = 0; i < 6; i++) {
        sender.send(new byte[] {(byte) i}, Duration.ofSeconds(5));
      }
      assertTrue(sender.awaitAcknowledged(Duration.ofSeconds(10)));
      for (int i = 0; i < 6; i++) {
        assertArrayEquals(new byte[] {(byte) i}, receiver.receive(Duration.ofSeconds(5)).orElseThrow());
      }
      assertTrue(receiver.statistics().count(SegmentDisposition.CORRUPT) >= 1);
    }
  }

  private static Segment decode(byte[] bytes) {
    try {
      return SegmentCodec.decode(bytes);
    } catch (MalformedSegmentException ex) {
      throw new IllegalStateException(ex);
    }
  }

  /** Flips one payload bit on the first transmission of every even packet. */
  private static final class CorruptingPort implements DatagramPort {
    private final DatagramPort delegate;
    private final Set<Long> corrupted;

    private CorruptingPort(DatagramPort delegate, Set<Long> corrupted) {
      this.delegate = delegate;
      this.corrupted = corrupted;
    }

    @Override
    public void send(SocketAddress address, byte[] bytes) throws IOException {
      Segment segment = decode(bytes);
      if (segment.kind() == SegmentKind.DATA && segment.seq() % 2 == 0 && corrupted.add(segment.seq())) {
        byte[] copy = bytes.clone();
        copy[copy.length - 1] ^= 0x01;
        delegate.send(address, copy);
        return;
      }
      delegate.send(address, bytes);
    }

    @Override
    public Optional<Datagram> receive(Duration timeout) throws IOException {
      return delegate.receive(timeout);
    }

    @Override
    public SocketAddress localAddress() {
      return delegate.localAddress();
    }

    @Override
    public void close() {
      delegate.close();
    }
  }
}

package ca.gc.cra.rdt.application.window;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.config.TransportConfig;
import ca.gc.cra.rdt.domain.net.Datagram;
import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.segment.SegmentCodec;
import ca.gc.cra.rdt.domain.transport.TransportException;
import ca.gc.cra.rdt.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rdt.testutil.InMemoryDatagramNetwork;
import ca.gc.cra.rdt.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.Test;

class WindowedReceiverTest {
  private static final TransportConfig CONFIG = TransportConfig.fromMap(Map.of(
      "ackPolicy", "gbn",
      "windowSize", "2",
      "pollIntervalMillis", "10"));

  @Test
  void fullDeliveryQueueDropsArrivalsUntilDrained() throws Exception {
    InMemoryDatagramNetwork network = new InMemoryDatagramNetwork();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    DatagramPort senderPort = network.open();
    WindowedReceiver receiver = new WindowedReceiver(
        network.open(), CONFIG, new GoBackNReceiveWindow(), new TransportCounters(metrics, "receiver"), 4);

    for (int seq = 0; seq < 4; seq++) {
      receiver.onDatagram(data(senderPort.localAddress(), seq));
    }

    assertEquals(3L, receiver.deliveryPoint());
    assertEquals(1, metrics.count("receiver.delivered.queueFull"));

    assertArrayEquals(new byte[] {0}, receiver.receive(Duration.ZERO).orElseThrow());
    receiver.onDatagram(data(senderPort.localAddress(), 3));

    assertEquals(4L, receiver.deliveryPoint());
    for (int seq = 1; seq < 4; seq++) {
      assertArrayEquals(new byte[] {(byte) seq}, receiver.receive(Duration.ZERO).orElseThrow());
    }
    receiver.close();
  }

  @Test
  void capacityBelowTheWindowIsRejected() {
    InMemoryDatagramNetwork network = new InMemoryDatagramNetwork();

    assertThrows(IllegalArgumentException.class, () -> new WindowedReceiver(network.open(), CONFIG,
        new GoBackNReceiveWindow(), new TransportCounters(new RecordingMetricsPort(), "receiver"), 1));
  }

  @Test
  void portFailureIsRethrownFromReceive() throws Exception {
    ScheduledExecutorService scheduler = ExecutorFactories.newTimerScheduler("receiver-test", null);
    try {
      WindowedRetransmissionEngine engine =
          new WindowedRetransmissionEngine(CONFIG, scheduler, new RecordingMetricsPort(), ClockPort.SYSTEM);
      try (WindowedReceiver receiver = engine.newReceiver(new FailingPort())) {
        TransportException failure =
            assertThrows(TransportException.class, () -> receiver.receive(Duration.ofSeconds(5)));
        assertTrue(failure.getCause() instanceof IOException);
        assertThrows(TransportException.class, () -> receiver.receive(Duration.ZERO));
      }
    } finally {
      scheduler.shutdownNow();
    }
  }

  private static Datagram data(SocketAddress from, long seq) {
    return new Datagram(from, SegmentCodec.encode(Segment.data(seq, new byte[] {(byte) seq})));
  }

  /** Port whose socket dies on the first read. */
  private static final class FailingPort implements DatagramPort {
    private final SocketAddress address = new InetSocketAddress("127.0.0.1", 40_999);

    @Override
    public void send(SocketAddress target, byte[] bytes) throws IOException {
      throw new IOException("socket closed");
    }

    @Override
    public Optional<Datagram> receive(Duration timeout) throws IOException {
      throw new IOException("socket closed");
    }

    @Override
    public SocketAddress localAddress() {
      return address;
    }

    @Override
    public void close() {}
  }
}

package ca.gc.cra.rdt.config;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rdt.application.connection.ConnectionState;
import ca.gc.cra.rdt.application.connection.ReliableConnection;
import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.application.window.WindowedReceiver;
import ca.gc.cra.rdt.application.window.WindowedSender;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TransportFactoryTest {

  private static Map<String, String> settings(String peer) {
    Map<String, String> settings = new HashMap<>(DefaultsForProfile.asFlatMap("server"));
    settings.put("bind", "127.0.0.1:0");
    settings.put("rto.minMillis", "20");
    settings.put("rto.initialMillis", "100");
    settings.put("timeWaitMillis", "50");
    settings.put("pollIntervalMillis", "10");
    if (peer != null) {
      settings.put("peer", peer);
    }
    return settings;
  }

  private static String hostPort(DatagramPort port) {
    return "127.0.0.1:" + ((InetSocketAddress) port.localAddress()).getPort();
  }

  @Test
  void packetEndpointsDeliverOverLoopbackUdp() throws Exception {
    try (TransportFactory receiving = TransportFactory.fromSettings(settings(null))) {
      DatagramPort receiverPort = receiving.openPort();
      WindowedReceiver receiver = receiving.engine().newReceiver(receiverPort);
      try (TransportFactory sending = TransportFactory.fromSettings(settings(hostPort(receiverPort)))) {
        WindowedSender sender = sending.openSender();
        try {
          for (int i = 0; i < 12; i++) {
            sender.send(("unit-" + i).getBytes(StandardCharsets.US_ASCII), Duration.ofSeconds(5));
          }
          assertTrue(sender.awaitAcknowledged(Duration.ofSeconds(5)));
          for (int i = 0; i < 12; i++) {
            Optional<byte[]> unit = receiver.receive(Duration.ofSeconds(5));
            assertEquals("unit-" + i, new String(unit.orElseThrow(), StandardCharsets.US_ASCII));
          }
        } finally {
          sender.close();
          receiver.close();
        }
      }
    }
  }

  @Test
  void connectionsHandshakeAndStreamOverLoopbackUdp() throws Exception {
    try (TransportFactory serverSide = TransportFactory.fromSettings(settings(null))) {
      DatagramPort serverPort = serverSide.openPort();
      ReliableConnection server = serverSide.newConnection(serverPort);
      server.listen();
      try (TransportFactory clientSide = TransportFactory.fromSettings(settings(hostPort(serverPort)))) {
        ReliableConnection client = clientSide.connect();
        try {
          server.accept(Duration.ofSeconds(5));
          client.write("hello over udp".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(5));

          byte[] buffer = new byte[64];
          int n = server.read(buffer, Duration.ofSeconds(5));

          byte[] expected = "hello over udp".getBytes(StandardCharsets.UTF_8);
          assertEquals(expected.length, n);
          assertArrayEquals(expected, Arrays.copyOf(buffer, n));
          assertEquals(ConnectionState.ESTABLISHED, client.state());
        } finally {
          client.abort();
          server.abort();
        }
      }
    }
  }

  @Test
  void senderWithoutPeerIsRejected() {
    try (TransportFactory factory = TransportFactory.fromSettings(settings(null))) {
      assertThrows(IllegalStateException.class, factory::openSender);
    }
  }

  @Test
  void invalidSettingsFailFast() {
    Map<String, String> bad = settings(null);
    bad.put("windowSize", "0");

    assertThrows(IllegalArgumentException.class, () -> TransportFactory.fromSettings(bad));
  }
}

package ca.gc.cra.rdt.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TransportConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    TransportConfig config = TransportConfig.defaults();

    assertEquals(AckPolicy.GO_BACK_N, config.ackPolicy());
    assertEquals(5, config.windowSize());
    assertEquals(1024, config.mss());
    assertEquals(Duration.ofSeconds(1), config.initialRto());
    assertEquals(10, config.maxRetries());
    assertEquals(4096, config.receiveBufferBytes());
  }

  @Test
  void fromMapParsesEveryKey() {
    Map<String, String> values = new HashMap<>();
    values.put("ackPolicy", "selective-repeat");
    values.put("windowSize", "12");
    values.put("mss", "512");
    values.put("rto.initialMillis", "400");
    values.put("rto.minMillis", "100");
    values.put("rto.maxMillis", "8000");
    values.put("maxRetries", "7");
    values.put("receiveBufferBytes", "2048");
    values.put("sendWindowBytes", "8192");
    values.put("timeWaitMillis", "0");
    values.put("pollIntervalMillis", "20");
    values.put("connectTimeoutMillis", "3000");
    values.put("closeTimeoutMillis", "4000");
    values.put("writeTimeoutMillis", "5000");
    values.put("bind", "127.0.0.1:0");
    values.put("peer", "[::1]:9000");

    TransportConfig config = TransportConfig.fromMap(values);

    assertEquals(AckPolicy.SELECTIVE_REPEAT, config.ackPolicy());
    assertEquals(12, config.windowSize());
    assertEquals(512, config.mss());
    assertEquals(Duration.ofMillis(400), config.initialRto());
    assertEquals(Duration.ofMillis(100), config.minRto());
    assertEquals(Duration.ofMillis(8000), config.maxRto());
    assertEquals(7, config.maxRetries());
    assertEquals(2048, config.receiveBufferBytes());
    assertEquals(8192, config.sendWindowBytes());
    assertEquals(Duration.ZERO, config.timeWait());
    assertEquals(Duration.ofMillis(20), config.pollInterval());
    assertEquals(Duration.ofSeconds(3), config.connectTimeout());
    assertEquals(Duration.ofSeconds(4), config.closeTimeout());
    assertEquals(Duration.ofSeconds(5), config.writeTimeout());
    assertEquals(new InetSocketAddress("127.0.0.1", 0), config.bindAddress());
    assertEquals(9000, config.peerAddress().getPort());
  }

  @Test
  void flatMapRoundTripsThroughFromMap() {
    TransportConfig original = TransportConfig.fromMap(Map.of("ackPolicy", "sr", "peer", "127.0.0.1:9000"));

    assertEquals(original, TransportConfig.fromMap(original.asFlatMap()));
  }

  @ParameterizedTest
  @CsvSource({
      "windowSize, 0",
      "windowSize, 5000",
      "mss, 0",
      "mss, 70000",
      "maxRetries, 0",
      "receiveBufferBytes, 70000",
      "rto.minMillis, 0",
      "pollIntervalMillis, 0",
      "ackPolicy, stop-and-wait",
      "windowSize, four",
      "peer, localhost",
  })
  void rejectsInvalidValues(String key, String value) {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> TransportConfig.fromMap(Map.of(key, value)));
    assertTrue(ex.getMessage().contains(key.equals("ackPolicy") ? "ackPolicy" : key), ex.getMessage());
  }

  @Test
  void initialRtoMustLieBetweenBounds() {
    assertThrows(IllegalArgumentException.class, () -> TransportConfig.fromMap(
        Map.of("rto.minMillis", "500", "rto.initialMillis", "100")));
    assertThrows(IllegalArgumentException.class, () -> TransportConfig.fromMap(
        Map.of("rto.maxMillis", "500", "rto.initialMillis", "1000")));
  }

  @Test
  void ackPolicyAcceptsAliases() {
    assertEquals(AckPolicy.GO_BACK_N, AckPolicy.fromString("Go-Back-N"));
    assertEquals(AckPolicy.GO_BACK_N, AckPolicy.fromString(null));
    assertEquals(AckPolicy.SELECTIVE_REPEAT, AckPolicy.fromString("SR"));
  }
}

package ca.gc.cra.rdt.config;

import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.segment.SegmentCodec;
import ca.gc.cra.rdt.validation.Net;
import ca.gc.cra.rdt.validation.Numbers;
import ca.gc.cra.rdt.validation.Strings;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration shared by the windowed engine and the connection layer.
 *
 * @param ackPolicy acknowledgment policy of the windowed engine
 * @param windowSize packet window N of the windowed engine
 * @param mss maximum payload bytes per connection segment
 * @param initialRto retransmission timeout before any RTT sample; fixed timeout of the windowed engine
 * @param minRto lower clamp of the adaptive retransmission timeout
 * @param maxRto upper clamp of the adaptive retransmission timeout
 * @param maxRetries retransmissions allowed per unit before the endpoint fails
 * @param receiveBufferBytes receive buffer capacity; bounds the advertised window
 * @param sendWindowBytes local cap on unacknowledged bytes in flight
 * @param timeWait TIME_WAIT grace period
 * @param pollInterval reader thread receive timeout
 * @param connectTimeout default deadline of {@code connect}/{@code accept}
 * @param closeTimeout default deadline of {@code close}
 * @param writeTimeout default deadline of {@code write}/{@code send}
 * @param bindAddress local bind address for UDP ports
 * @param peerAddress remote address for sender/client profiles; {@code null} when not configured
 * @since 0.1.0
 */
public record TransportConfig(
    AckPolicy ackPolicy,
    int windowSize,
    int mss,
    Duration initialRto,
    Duration minRto,
    Duration maxRto,
    int maxRetries,
    int receiveBufferBytes,
    int sendWindowBytes,
    Duration timeWait,
    Duration pollInterval,
    Duration connectTimeout,
    Duration closeTimeout,
    Duration writeTimeout,
    InetSocketAddress bindAddress,
    InetSocketAddress peerAddress) {

  /** Largest UDP payload minus the segment header. */
  public static final int MAX_MSS = 65_507 - SegmentCodec.HEADER_LENGTH;

  private static final int DEFAULT_WINDOW_SIZE = 5;
  private static final int MAX_WINDOW_SIZE = 1_024;
  private static final int DEFAULT_MSS = 1_024;
  private static final int DEFAULT_MAX_RETRIES = 10;
  private static final int MAX_RETRIES_LIMIT = 1_000;
  private static final int DEFAULT_RECEIVE_BUFFER = 4_096;
  private static final int DEFAULT_SEND_WINDOW = 65_535;
  private static final int MAX_SEND_WINDOW = 16 * 1_024 * 1_024;
  private static final Duration MIN_DURATION = Duration.ofMillis(1);
  private static final Duration MAX_RTO = Duration.ofMinutes(10);
  private static final Duration MAX_DEADLINE = Duration.ofHours(1);

  /**
   * Validates ranges and the ordering {@code minRto <= initialRto <= maxRto}.
   *
   * @throws IllegalArgumentException when a value is out of range
   */
  public TransportConfig {
    ackPolicy = Objects.requireNonNullElse(ackPolicy, AckPolicy.GO_BACK_N);
    Numbers.requireRange("windowSize", windowSize, 1, MAX_WINDOW_SIZE);
    Numbers.requireRange("mss", mss, 1, MAX_MSS);
    Numbers.requireRange("rto.minMillis", minRto, MIN_DURATION, MAX_RTO);
    Numbers.requireRange("rto.maxMillis", maxRto, minRto, MAX_RTO);
    Numbers.requireRange("rto.initialMillis", initialRto, minRto, maxRto);
    Numbers.requireRange("maxRetries", maxRetries, 1, MAX_RETRIES_LIMIT);
    Numbers.requireRange("receiveBufferBytes", receiveBufferBytes, 1, Segment.MAX_WINDOW);
    Numbers.requireRange("sendWindowBytes", sendWindowBytes, 1, MAX_SEND_WINDOW);
    Numbers.requireRange("timeWaitMillis", timeWait, Duration.ZERO, MAX_RTO);
    Numbers.requireRange("pollIntervalMillis", pollInterval, MIN_DURATION, Duration.ofSeconds(10));
    Numbers.requireRange("connectTimeoutMillis", connectTimeout, MIN_DURATION, MAX_DEADLINE);
    Numbers.requireRange("closeTimeoutMillis", closeTimeout, MIN_DURATION, MAX_DEADLINE);
    Numbers.requireRange("writeTimeoutMillis", writeTimeout, MIN_DURATION, MAX_DEADLINE);
    bindAddress = Objects.requireNonNullElseGet(bindAddress, () -> new InetSocketAddress(0));
  }

  /**
   * Provides defaults matching a small LAN-style link: window 5, MSS 1024, 4 KiB receive buffer.
   *
   * @return default configuration
   */
  public static TransportConfig defaults() {
    return new TransportConfig(
        AckPolicy.GO_BACK_N,
        DEFAULT_WINDOW_SIZE,
        DEFAULT_MSS,
        Duration.ofSeconds(1),
        Duration.ofMillis(200),
        Duration.ofSeconds(60),
        DEFAULT_MAX_RETRIES,
        DEFAULT_RECEIVE_BUFFER,
        DEFAULT_SEND_WINDOW,
        Duration.ofSeconds(2),
        Duration.ofMillis(100),
        Duration.ofSeconds(5),
        Duration.ofSeconds(10),
        Duration.ofSeconds(30),
        new InetSocketAddress(0),
        null);
  }

  /**
   * Parses flattened {@code key=value} settings, falling back to {@link #defaults()} per key.
   *
   * @param values flat settings; may be {@code null}
   * @return parsed configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static TransportConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : new HashMap<>(values);
    TransportConfig defaults = defaults();
    String bind = kv.get("bind");
    String peer = kv.get("peer");
    return new TransportConfig(
        Strings.isBlank(kv.get("ackPolicy")) ? defaults.ackPolicy() : AckPolicy.fromString(kv.get("ackPolicy")),
        parseInt(kv, "windowSize", defaults.windowSize()),
        parseInt(kv, "mss", defaults.mss()),
        parseMillis(kv, "rto.initialMillis", defaults.initialRto()),
        parseMillis(kv, "rto.minMillis", defaults.minRto()),
        parseMillis(kv, "rto.maxMillis", defaults.maxRto()),
        parseInt(kv, "maxRetries", defaults.maxRetries()),
        parseInt(kv, "receiveBufferBytes", defaults.receiveBufferBytes()),
        parseInt(kv, "sendWindowBytes", defaults.sendWindowBytes()),
        parseMillis(kv, "timeWaitMillis", defaults.timeWait()),
        parseMillis(kv, "pollIntervalMillis", defaults.pollInterval()),
        parseMillis(kv, "connectTimeoutMillis", defaults.connectTimeout()),
        parseMillis(kv, "closeTimeoutMillis", defaults.closeTimeout()),
        parseMillis(kv, "writeTimeoutMillis", defaults.writeTimeout()),
        Strings.isBlank(bind) ? defaults.bindAddress() : Net.parseHostPort("bind", bind),
        Strings.isBlank(peer) ? null : Net.parseHostPort("peer", peer));
  }

  /**
   * Renders this configuration as flattened {@code key=value} settings accepted by {@link #fromMap}.
   *
   * @return ordered, unmodifiable map
   */
  public Map<String, String> asFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("ackPolicy", ackPolicy.name());
    map.put("windowSize", Integer.toString(windowSize));
    map.put("mss", Integer.toString(mss));
    map.put("rto.initialMillis", Long.toString(initialRto.toMillis()));
    map.put("rto.minMillis", Long.toString(minRto.toMillis()));
    map.put("rto.maxMillis", Long.toString(maxRto.toMillis()));
    map.put("maxRetries", Integer.toString(maxRetries));
    map.put("receiveBufferBytes", Integer.toString(receiveBufferBytes));
    map.put("sendWindowBytes", Integer.toString(sendWindowBytes));
    map.put("timeWaitMillis", Long.toString(timeWait.toMillis()));
    map.put("pollIntervalMillis", Long.toString(pollInterval.toMillis()));
    map.put("connectTimeoutMillis", Long.toString(connectTimeout.toMillis()));
    map.put("closeTimeoutMillis", Long.toString(closeTimeout.toMillis()));
    map.put("writeTimeoutMillis", Long.toString(writeTimeout.toMillis()));
    map.put("bind", hostPort(bindAddress));
    map.put("peer", peerAddress == null ? "" : hostPort(peerAddress));
    return Collections.unmodifiableMap(map);
  }

  private static String hostPort(InetSocketAddress address) {
    String host = address.getHostString();
    if (host.indexOf(':') >= 0) {
      host = '[' + host + ']';
    }
    return host + ':' + address.getPort();
  }

  private static int parseInt(Map<String, String> kv, String key, int defaultValue) {
    String raw = kv.get(key);
    if (Strings.isBlank(raw)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static Duration parseMillis(Map<String, String> kv, String key, Duration defaultValue) {
    String raw = kv.get(key);
    if (Strings.isBlank(raw)) {
      return defaultValue;
    }
    try {
      return Duration.ofMillis(Long.parseLong(raw.trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a whole number of milliseconds (was " + raw + ")", ex);
    }
  }
}

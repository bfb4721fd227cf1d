package ca.gc.cra.rdt.config;

import ca.gc.cra.rdt.application.connection.ReliableConnection;
import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.application.port.MetricsPort;
import ca.gc.cra.rdt.application.window.WindowedReceiver;
import ca.gc.cra.rdt.application.window.WindowedRetransmissionEngine;
import ca.gc.cra.rdt.application.window.WindowedSender;
import ca.gc.cra.rdt.domain.transport.TransportException;
import ca.gc.cra.rdt.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rdt.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.rdt.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rdt.infrastructure.net.UdpDatagramAdapter;
import ca.gc.cra.rdt.logging.LoggingConfigurator;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns configuration into running endpoints.
 * <p><strong>Why:</strong> Keeps socket binding, metrics selection and scheduler ownership in one place so
 * engines and connections only see ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the shared timer scheduler and the metrics adapter.</li>
 *   <li>Bind UDP ports from {@code bind} and target {@code peer}.</li>
 *   <li>Create packet endpoints through {@link WindowedRetransmissionEngine} and byte-stream
 *       {@link ReliableConnection}s.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods may be called from any thread; {@link #close()} once.</p>
 *
 * @since 0.1.0
 */
public final class TransportFactory implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TransportFactory.class);

  private final TransportConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ScheduledExecutorService scheduler;
  private final WindowedRetransmissionEngine engine;

  /**
   * Creates a factory with an explicit metrics sink.
   *
   * @param config transport configuration
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public TransportFactory(TransportConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? new NoOpMetricsAdapter() : metrics;
    this.clock = ClockPort.SYSTEM;
    this.scheduler = ExecutorFactories.newTimerScheduler("rdt-timer", null);
    this.engine = new WindowedRetransmissionEngine(config, scheduler, this.metrics, clock);
  }

  /**
   * Builds a factory from flattened settings such as those returned by
   * {@link ConfigLoader#effectiveSettings}.
   *
   * @param settings effective settings, including {@code metricsExporter} and {@code verbose}
   * @return configured factory
   * @throws IllegalArgumentException when a value is invalid
   */
  public static TransportFactory fromSettings(Map<String, String> settings) {
    Objects.requireNonNull(settings, "settings");
    if (Boolean.parseBoolean(settings.getOrDefault("verbose", "false").trim())) {
      LoggingConfigurator.enableVerboseLogging();
    }
    TransportConfig config = TransportConfig.fromMap(settings);
    String exporter = settings.getOrDefault("metricsExporter", "none").trim().toLowerCase(Locale.ROOT);
    MetricsPort metrics = "none".equals(exporter) ? new NoOpMetricsAdapter() : new OpenTelemetryMetricsAdapter(exporter);
    log.info("Transport factory ready (policy={}, window={}, mss={}, metrics={})",
        config.ackPolicy(), config.windowSize(), config.mss(), exporter);
    return new TransportFactory(config, metrics);
  }

  public TransportConfig config() {
    return config;
  }

  public WindowedRetransmissionEngine engine() {
    return engine;
  }

  /**
   * Binds a UDP port on the configured {@code bind} address.
   *
   * @return bound port
   * @throws IOException if the socket cannot be bound
   */
  public DatagramPort openPort() throws IOException {
    return UdpDatagramAdapter.bind(config.bindAddress());
  }

  /**
   * Opens a packet sender on a fresh UDP port targeting the configured peer.
   *
   * @return started sender
   * @throws IOException if the socket cannot be bound
   * @throws IllegalStateException when no peer is configured
   */
  public WindowedSender openSender() throws IOException {
    InetSocketAddress peer = requirePeer();
    return engine.newSender(openPort(), peer);
  }

  /**
   * Opens a packet receiver on the configured bind address.
   *
   * @return started receiver
   * @throws IOException if the socket cannot be bound
   */
  public WindowedReceiver openReceiver() throws IOException {
    return engine.newReceiver(openPort());
  }

  /**
   * Creates an unopened connection over {@code port}.
   *
   * @param port datagram port; owned by the connection from now on
   * @return connection in CLOSED
   */
  public ReliableConnection newConnection(DatagramPort port) {
    return new ReliableConnection(port, config, scheduler, metrics, clock);
  }

  /**
   * Connects to the configured peer and waits for the handshake.
   *
   * @return established connection
   * @throws IOException if binding fails or the handshake does not complete in time
   * @throws InterruptedException if the caller is interrupted
   */
  public ReliableConnection connect() throws IOException, InterruptedException {
    InetSocketAddress peer = requirePeer();
    ReliableConnection connection = newConnection(openPort());
    try {
      connection.connect(peer, config.connectTimeout());
    } catch (TransportException | RuntimeException ex) {
      connection.abort();
      throw ex;
    }
    return connection;
  }

  /**
   * Binds the configured address and starts listening.
   *
   * @return listening connection; call {@link ReliableConnection#accept} to wait for a peer
   * @throws IOException if the socket cannot be bound
   */
  public ReliableConnection listen() throws IOException {
    ReliableConnection connection = newConnection(openPort());
    connection.listen();
    return connection;
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
    try {
      if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
        log.warn("Timer scheduler did not terminate within 1s");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }

  private InetSocketAddress requirePeer() {
    InetSocketAddress peer = config.peerAddress();
    if (peer == null) {
      throw new IllegalStateException("peer address is not configured");
    }
    return peer;
  }
}

package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.config.TransportConfig;
import ca.gc.cra.rdt.domain.net.Datagram;
import ca.gc.cra.rdt.domain.segment.MalformedSegmentException;
import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.segment.SegmentCodec;
import ca.gc.cra.rdt.domain.segment.SegmentKind;
import ca.gc.cra.rdt.domain.transport.ConnectionAbortedException;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import ca.gc.cra.rdt.domain.transport.TransportException;
import ca.gc.cra.rdt.domain.transport.TransportStatistics;
import ca.gc.cra.rdt.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rdt.infrastructure.timer.ScheduledTimerService;
import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Sending endpoint of the windowed engine.
 * <p><strong>Why:</strong> Pipelines up to N packets to one receiver and recovers from loss with the
 * configured acknowledgment policy.</p>
 * <p><strong>Role:</strong> Application endpoint; the application thread calls {@link #send}, a reader thread
 * feeds acknowledgments into the send window, and the timer thread drives retransmissions.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; all window state is guarded by one lock.</p>
 * <p><strong>Observability:</strong> Counters under {@code sender.*}; reader thread logs with MDC {@code rdt.peer}.</p>
 *
 * @since 0.1.0
 */
public final class WindowedSender implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WindowedSender.class);

  private final DatagramPort port;
  private final SocketAddress peer;
  private final TransportConfig config;
  private final TransportCounters counters;
  private final ReentrantLock lock = new ReentrantLock();
  private final ScheduledTimerService<Long> timers;
  private final AbstractSendWindow window;
  private final Thread reader;
  private volatile boolean running = true;

  WindowedSender(
      DatagramPort port,
      SocketAddress peer,
      TransportConfig config,
      ScheduledExecutorService scheduler,
      TransportCounters counters,
      ClockPort clock) {
    this.port = Objects.requireNonNull(port, "port");
    this.peer = Objects.requireNonNull(peer, "peer");
    this.config = Objects.requireNonNull(config, "config");
    this.counters = Objects.requireNonNull(counters, "counters");
    this.timers = new ScheduledTimerService<>(lock, scheduler);
    this.window = WindowedRetransmissionEngine.newSendWindow(config, lock, timers, this::transmit, clock, counters);
    this.window.setFailureListener(ex -> log.error("Sender to {} failed: {}", peer, ex.getMessage()));
    this.reader = ExecutorFactories.newReaderThread("rdt-sender", this::readLoop, null);
  }

  void start() {
    log.info("Sender {} -> {} started (policy={}, window={})",
        port.localAddress(), peer, config.ackPolicy(), config.windowSize());
    reader.start();
  }

  /**
   * Sends one payload using the configured write timeout.
   *
   * @param payload packet payload; at most {@link TransportConfig#MAX_MSS} bytes
   * @return packet index assigned to the payload
   * @throws TransportException when the window stays full past the deadline or the sender failed
   * @throws InterruptedException if the caller is interrupted while waiting for capacity
   */
  public long send(byte[] payload) throws TransportException, InterruptedException {
    return send(payload, config.writeTimeout());
  }

  /**
   * Sends one payload, waiting while {@code nextSeq >= base + N}.
   *
   * @param payload packet payload; at most {@link TransportConfig#MAX_MSS} bytes
   * @param timeout maximum wait for window capacity
   * @return packet index assigned to the payload
   * @throws TransportException when the window stays full past the deadline or the sender failed
   * @throws InterruptedException if the caller is interrupted while waiting for capacity
   */
  public long send(byte[] payload, Duration timeout) throws TransportException, InterruptedException {
    Objects.requireNonNull(payload, "payload");
    if (payload.length > TransportConfig.MAX_MSS) {
      throw new IllegalArgumentException("payload exceeds " + TransportConfig.MAX_MSS + " bytes");
    }
    if (!running) {
      throw new ConnectionAbortedException("sender closed");
    }
    return window.send(0, payload.clone(), 1L, timeout);
  }

  /**
   * Waits until every sent packet is acknowledged.
   *
   * @param timeout maximum wait
   * @return {@code true} when everything was acknowledged in time
   * @throws TransportException when the sender failed while waiting
   * @throws InterruptedException if the caller is interrupted
   */
  public boolean awaitAcknowledged(Duration timeout) throws TransportException, InterruptedException {
    return window.awaitAcknowledged(timeout);
  }

  /**
   * Returns a statistics snapshot.
   *
   * @return counters accumulated since start
   */
  public TransportStatistics statistics() {
    return counters.snapshot(null, window.retransmissionTimeout());
  }

  AbstractSendWindow window() {
    return window;
  }

  @Override
  public void close() {
    if (!running) {
      return;
    }
    running = false;
    window.release("sender closed");
    reader.interrupt();
    port.close();
    log.info("Sender {} -> {} closed", port.localAddress(), peer);
  }

  private void transmit(OutstandingUnit unit, boolean retransmission) {
    Segment segment = Segment.data(unit.seq(), unit.payload());
    try {
      port.send(peer, SegmentCodec.encode(segment));
      if (log.isTraceEnabled()) {
        log.trace("{} {}", retransmission ? "Resent" : "Sent", segment);
      }
    } catch (IOException ex) {
      counters.increment(TransportCounters.SEND_FAILED);
      log.debug("Send of packet {} failed; treating as loss", unit.seq(), ex);
    }
  }

  private void readLoop() {
    MDC.put("rdt.peer", String.valueOf(peer));
    try {
      while (running) {
        Optional<Datagram> datagram = port.receive(config.pollInterval());
        if (datagram.isPresent()) {
          onDatagram(datagram.get());
        }
      }
    } catch (IOException ex) {
      if (running) {
        log.error("Sender reader stopped", ex);
        window.fail(new TransportException("datagram port failed", ex));
      }
    } finally {
      MDC.remove("rdt.peer");
    }
  }

  private void onDatagram(Datagram datagram) {
    counters.increment(TransportCounters.SEGMENTS_RECEIVED);
    SegmentDisposition disposition;
    try {
      Segment segment = SegmentCodec.decode(datagram.bytes());
      if (segment.isCorrupt()) {
        disposition = SegmentDisposition.CORRUPT;
      } else if (segment.kind() != SegmentKind.ACK) {
        disposition = SegmentDisposition.ILLEGAL_TRANSITION;
      } else {
        disposition = window.onAckReceived(segment.ack());
      }
    } catch (MalformedSegmentException ex) {
      log.debug("Malformed datagram from {}: {}", datagram.address(), ex.getMessage());
      disposition = SegmentDisposition.MALFORMED;
    }
    counters.record(disposition);
    if (disposition.isDiscard()) {
      log.debug("Acknowledgment discarded: {}", disposition);
    }
  }
}

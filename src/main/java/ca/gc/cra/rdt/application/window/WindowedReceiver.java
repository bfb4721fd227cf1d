package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.config.TransportConfig;
import ca.gc.cra.rdt.domain.net.Datagram;
import ca.gc.cra.rdt.domain.segment.MalformedSegmentException;
import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.segment.SegmentCodec;
import ca.gc.cra.rdt.domain.segment.SegmentKind;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import ca.gc.cra.rdt.domain.transport.TransportException;
import ca.gc.cra.rdt.domain.transport.TransportStatistics;
import ca.gc.cra.rdt.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rdt.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Receiving endpoint of the windowed engine.
 * <p><strong>Role:</strong> A reader thread validates arrivals, runs them through the policy's
 * {@link ReceiveWindow}, returns acknowledgments to the sending address and queues in-order payloads for
 * {@link #receive}. The delivery queue is bounded: while it cannot hold a full window of payloads, arrivals
 * are dropped unacknowledged and the sender's retransmission timer resends them once the caller drains.</p>
 * <p><strong>Thread-safety:</strong> {@link #receive} may be called from any thread; window state is touched
 * only by the reader thread under the endpoint lock.</p>
 * <p><strong>Observability:</strong> Counters under {@code receiver.*}; reader logs carry MDC {@code rdt.peer}.</p>
 *
 * @since 0.1.0
 */
public final class WindowedReceiver implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WindowedReceiver.class);
  private static final int PREVIEW_BYTES = 32;
  static final int DEFAULT_DELIVERY_CAPACITY = 4_096;

  private final DatagramPort port;
  private final TransportConfig config;
  private final ReceiveWindow window;
  private final TransportCounters counters;
  private final ReentrantLock lock = new ReentrantLock();
  private final BlockingQueue<byte[]> delivered;
  private final Thread reader;
  private volatile boolean running = true;
  private volatile TransportException failure;

  WindowedReceiver(DatagramPort port, TransportConfig config, ReceiveWindow window, TransportCounters counters) {
    this(port, config, window, counters, DEFAULT_DELIVERY_CAPACITY);
  }

  WindowedReceiver(
      DatagramPort port, TransportConfig config, ReceiveWindow window, TransportCounters counters, int capacity) {
    this.port = Objects.requireNonNull(port, "port");
    this.config = Objects.requireNonNull(config, "config");
    if (capacity < config.windowSize()) {
      throw new IllegalArgumentException("delivery capacity " + capacity + " below window " + config.windowSize());
    }
    this.delivered = new ArrayBlockingQueue<>(capacity);
    this.window = Objects.requireNonNull(window, "window");
    this.counters = Objects.requireNonNull(counters, "counters");
    this.reader = ExecutorFactories.newReaderThread("rdt-receiver", this::readLoop, null);
  }

  void start() {
    log.info("Receiver on {} started (policy={}, window={})",
        port.localAddress(), config.ackPolicy(), config.windowSize());
    reader.start();
  }

  /**
   * Takes the next in-order payload. Payloads delivered before the datagram port failed are still
   * returned; once they are drained the failure is rethrown.
   *
   * @param timeout maximum wait
   * @return payload, or empty when nothing was delivered in time
   * @throws TransportException when the reader stopped because the datagram port failed
   * @throws InterruptedException if the caller is interrupted
   */
  public Optional<byte[]> receive(Duration timeout) throws TransportException, InterruptedException {
    long slice = config.pollInterval().toNanos();
    long deadline = System.nanoTime() + timeout.toNanos();
    long remaining = timeout.toNanos();
    do {
      byte[] next = delivered.poll(Math.min(Math.max(remaining, 0L), slice), TimeUnit.NANOSECONDS);
      if (next != null) {
        return Optional.of(next);
      }
      TransportException cause = failure;
      if (cause != null) {
        throw cause;
      }
      remaining = deadline - System.nanoTime();
    } while (remaining > 0);
    return Optional.empty();
  }

  /**
   * Returns the next packet index the receiver expects in order.
   *
   * @return delivery point
   */
  public long deliveryPoint() {
    lock.lock();
    try {
      return window.deliveryPoint();
    } finally {
      lock.unlock();
    }
  }

  public TransportStatistics statistics() {
    return counters.snapshot(null, config.initialRto());
  }

  @Override
  public void close() {
    if (!running) {
      return;
    }
    running = false;
    reader.interrupt();
    port.close();
    log.info("Receiver on {} closed", port.localAddress());
  }

  private void readLoop() {
    try {
      while (running) {
        Optional<Datagram> datagram = port.receive(config.pollInterval());
        if (datagram.isPresent()) {
          MDC.put("rdt.peer", String.valueOf(datagram.get().address()));
          onDatagram(datagram.get());
        }
      }
    } catch (IOException ex) {
      if (running) {
        failure = new TransportException("datagram port failed", ex);
        log.error("Receiver reader stopped", ex);
      }
    } finally {
      MDC.remove("rdt.peer");
    }
  }

  void onDatagram(Datagram datagram) {
    counters.increment(TransportCounters.SEGMENTS_RECEIVED);
    if (delivered.remainingCapacity() < config.windowSize()) {
      counters.increment(TransportCounters.DELIVERY_QUEUE_FULL);
      log.debug("Delivery queue full; dropping datagram from {}", datagram.address());
      return;
    }
    ReceiveResult result;
    lock.lock();
    try {
      result = process(datagram.bytes());
    } finally {
      lock.unlock();
    }
    counters.record(result.disposition());
    for (byte[] payload : result.delivered()) {
      counters.increment(TransportCounters.UNITS_DELIVERED);
      counters.add(TransportCounters.BYTES_DELIVERED, payload.length);
      if (log.isTraceEnabled()) {
        log.trace("Delivered {}", Logs.preview(payload, PREVIEW_BYTES));
      }
      delivered.add(payload);
    }
    if (result.disposition().isDiscard()) {
      log.debug("Data discarded: {}", result.disposition());
    }
    if (result.ack().isPresent()) {
      sendAck(datagram, result);
    }
  }

  private ReceiveResult process(byte[] bytes) {
    Segment segment;
    try {
      segment = SegmentCodec.decode(bytes);
    } catch (MalformedSegmentException ex) {
      log.debug("Malformed datagram: {}", ex.getMessage());
      return new ReceiveResult(SegmentDisposition.MALFORMED, Optional.empty(), null);
    }
    if (segment.isCorrupt()) {
      return window.onCorrupt();
    }
    if (segment.kind() != SegmentKind.DATA) {
      return new ReceiveResult(SegmentDisposition.ILLEGAL_TRANSITION, Optional.empty(), null);
    }
    return window.onData(segment);
  }

  private void sendAck(Datagram datagram, ReceiveResult result) {
    Segment ack = result.ack().orElseThrow();
    try {
      port.send(datagram.address(), SegmentCodec.encode(ack));
      counters.increment(TransportCounters.SEGMENTS_SENT);
      if (result.disposition().isDiscard()) {
        counters.increment(TransportCounters.ACK_DUPLICATE_SENT);
      }
    } catch (IOException ex) {
      counters.increment(TransportCounters.SEND_FAILED);
      log.debug("Acknowledgment {} to {} failed; treating as loss", ack.ack(), datagram.address(), ex);
    }
  }
}

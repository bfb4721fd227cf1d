package ca.gc.cra.rdt.application.connection;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.application.port.MetricsPort;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.application.window.OutstandingUnit;
import ca.gc.cra.rdt.config.TransportConfig;
import ca.gc.cra.rdt.domain.net.Datagram;
import ca.gc.cra.rdt.domain.segment.MalformedSegmentException;
import ca.gc.cra.rdt.domain.segment.Segment;
import ca.gc.cra.rdt.domain.segment.SegmentCodec;
import ca.gc.cra.rdt.domain.segment.SegmentKind;
import ca.gc.cra.rdt.domain.segment.SequenceNumbers;
import ca.gc.cra.rdt.domain.transport.ConnectionAbortedException;
import ca.gc.cra.rdt.domain.transport.SegmentDisposition;
import ca.gc.cra.rdt.domain.transport.SendTimeoutException;
import ca.gc.cra.rdt.domain.transport.TransportException;
import ca.gc.cra.rdt.domain.transport.TransportStatistics;
import ca.gc.cra.rdt.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rdt.infrastructure.timer.ScheduledTimerService;
import ca.gc.cra.rdt.logging.Logs;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketAddress;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Connection-oriented, flow-controlled byte stream over a datagram port.
 * <p><strong>Why:</strong> Adds handshake, teardown, byte sequencing, adaptive retransmission timing and
 * receiver-advertised flow control on top of the cumulative send window.</p>
 * <p><strong>Role:</strong> Application endpoint. The application thread calls {@link #connect},
 * {@link #accept}, {@link #write}, {@link #read} and {@link #close}; a reader thread processes arrivals;
 * timer callbacks drive retransmission, zero-window probes and the TIME_WAIT grace period.</p>
 * <p><strong>Thread-safety:</strong> One {@link ReentrantLock} guards the state machine, windows, buffers and
 * RTT estimate; timer callbacks run under it.</p>
 * <p><strong>Observability:</strong> State transitions at INFO, discards and retransmissions at DEBUG, fatal
 * aborts at ERROR; counters under {@code connection.*}; reader logs carry MDC {@code rdt.peer}.</p>
 *
 * @since 0.1.0
 */
public final class ReliableConnection implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ReliableConnection.class);
  private static final String METRIC_PREFIX = "connection";
  private static final int PREVIEW_BYTES = 32;

  private final DatagramPort port;
  private final TransportConfig config;
  private final ClockPort clock;
  private final LongSupplier isnSupplier;
  private final TransportCounters counters;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition stateChanged = lock.newCondition();
  private final ScheduledTimerService<Long> retransmitTimers;
  private final ScheduledTimerService<ConnectionTimer> timers;
  private final RttEstimator rtt;

  private ConnectionState state = ConnectionState.CLOSED;
  private boolean opened;
  private boolean released;
  private TransportException failure;
  private Thread reader;
  private volatile boolean running;

  private SocketAddress peer;
  private ByteStreamSendWindow sendWindow;
  private ByteStreamReceiveBuffer receiveBuffer;
  private long iss;
  private long peerIss;
  private long finSeq = -1L;
  private boolean peerFinConsumed;
  private boolean deferredFin;
  private int pendingWriters;

  /**
   * Creates a connection endpoint with a random initial sequence number source.
   *
   * @param port datagram port; owned by the connection from now on
   * @param config transport configuration
   * @param scheduler shared timer scheduler
   * @param metrics metrics sink
   * @param clock monotonic clock
   */
  public ReliableConnection(
      DatagramPort port,
      TransportConfig config,
      ScheduledExecutorService scheduler,
      MetricsPort metrics,
      ClockPort clock) {
    this(port, config, scheduler, metrics, clock, randomIsn());
  }

  /**
   * Creates a connection endpoint.
   *
   * @param port datagram port; owned by the connection from now on
   * @param config transport configuration
   * @param scheduler shared timer scheduler
   * @param metrics metrics sink
   * @param clock monotonic clock
   * @param isnSupplier source of 32-bit initial sequence numbers
   */
  public ReliableConnection(
      DatagramPort port,
      TransportConfig config,
      ScheduledExecutorService scheduler,
      MetricsPort metrics,
      ClockPort clock,
      LongSupplier isnSupplier) {
    this.port = Objects.requireNonNull(port, "port");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.isnSupplier = Objects.requireNonNull(isnSupplier, "isnSupplier");
    this.counters = new TransportCounters(metrics, METRIC_PREFIX);
    this.retransmitTimers = new ScheduledTimerService<>(lock, scheduler);
    this.timers = new ScheduledTimerService<>(lock, scheduler);
    this.rtt = new RttEstimator(config.initialRto(), config.minRto(), config.maxRto());
  }

  /**
   * Opens passively: the connection waits for a SYN from any peer.
   *
   * @throws IllegalStateException if the connection is not fresh
   */
  public void listen() {
    lock.lock();
    try {
      requireFresh();
      opened = true;
      fireLocally(ConnectionEvent.LISTEN);
      startReader();
      log.info("Listening on {}", port.localAddress());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for a listening connection to complete the handshake.
   *
   * @param timeout maximum wait
   * @throws SendTimeoutException when no peer completes the handshake in time; the connection keeps listening
   * @throws TransportException when the connection failed or was aborted
   * @throws InterruptedException if the caller is interrupted
   * @throws IllegalStateException if {@link #listen()} was not called
   */
  public void accept(Duration timeout) throws TransportException, InterruptedException {
    lock.lock();
    try {
      if (!opened) {
        throw new IllegalStateException("accept requires listen()");
      }
      awaitStateLeaving(timeout, "accept", ConnectionState.LISTEN, ConnectionState.SYN_RCVD);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Opens actively and waits for the three-way handshake to complete.
   *
   * @param remote peer address
   * @param timeout maximum wait; on expiry the connection is aborted
   * @throws SendTimeoutException when the handshake does not complete in time
   * @throws TransportException when the SYN exhausts its retries or the connection is aborted
   * @throws InterruptedException if the caller is interrupted
   * @throws IllegalStateException if the connection is not fresh
   */
  public void connect(SocketAddress remote, Duration timeout) throws TransportException, InterruptedException {
    lock.lock();
    try {
      requireFresh();
      opened = true;
      peer = Objects.requireNonNull(remote, "remote");
      iss = SequenceNumbers.toWire(isnSupplier.getAsLong());
      sendWindow = newSendWindow(iss);
      startReader();
      log.info("Connecting {} -> {} (iss={})", port.localAddress(), peer, iss);
      fire(ConnectionEvent.CONNECT);
      try {
        awaitStateLeaving(timeout, "connect", ConnectionState.SYN_SENT);
      } catch (SendTimeoutException ex) {
        abortWith(new ConnectionAbortedException("connect timed out"));
        throw ex;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Writes bytes using the configured write timeout.
   *
   * @param data bytes to send
   * @throws TransportException when the deadline elapses or the connection failed
   * @throws InterruptedException if the caller is interrupted
   */
  public void write(byte[] data) throws TransportException, InterruptedException {
    write(data, config.writeTimeout());
  }

  /**
   * Splits {@code data} into segments of at most MSS bytes and queues them, waiting while the
   * effective window {@code min(localCap, peerWindow)} is full. Returns once every byte has been
   * transmitted at least once; delivery is confirmed asynchronously.
   *
   * @param data bytes to send
   * @param timeout deadline for the whole write
   * @throws SendTimeoutException when the deadline elapses; bytes already queued stay queued
   * @throws TransportException when the connection failed or was aborted
   * @throws InterruptedException if the caller is interrupted
   * @throws IllegalStateException if the connection is not in a writable state
   */
  public void write(byte[] data, Duration timeout) throws TransportException, InterruptedException {
    Objects.requireNonNull(data, "data");
    long deadline = System.nanoTime() + timeout.toNanos();
    lock.lock();
    try {
      requireWritable();
      pendingWriters++;
      try {
        int offset = 0;
        while (offset < data.length) {
          maybeArmPersist();
          long remaining = deadline - System.nanoTime();
          long available;
          try {
            available = sendWindow.awaitCapacity(Duration.ofNanos(Math.max(0L, remaining)));
          } catch (SendTimeoutException ex) {
            throw new SendTimeoutException("write", timeout);
          }
          throwIfFailed();
          requireWritable();
          int length = (int) Math.min(Math.min(config.mss(), available), data.length - offset);
          byte[] chunk = new byte[length];
          System.arraycopy(data, offset, chunk, 0, length);
          sendWindow.transmitChunk(chunk);
          offset += length;
        }
      } finally {
        pendingWriters--;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads delivered bytes into {@code buffer}.
   *
   * @param buffer destination
   * @param timeout maximum wait for bytes
   * @return bytes read; {@code 0} on timeout; {@code -1} once the peer's FIN was consumed and the stream drained
   * @throws TransportException when the connection failed or was aborted before end of stream
   * @throws InterruptedException if the caller is interrupted
   */
  public int read(byte[] buffer, Duration timeout) throws TransportException, InterruptedException {
    Objects.requireNonNull(buffer, "buffer");
    lock.lock();
    try {
      long remaining = timeout.toNanos();
      while (true) {
        if (receiveBuffer != null && receiveBuffer.readableBytes() > 0) {
          int n = receiveBuffer.read(buffer, 0, buffer.length);
          if (receiveBuffer.needsWindowUpdate() && !released) {
            log.debug("Window reopened to {} bytes; sending update", receiveBuffer.free());
            sendAck(false);
          }
          return n;
        }
        if (peerFinConsumed) {
          return -1;
        }
        throwIfFailed();
        if (released) {
          return -1;
        }
        if (buffer.length == 0 || remaining <= 0L) {
          return 0;
        }
        remaining = stateChanged.awaitNanos(remaining);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Initiates teardown and waits until the connection reaches TIME_WAIT or CLOSED.
   *
   * @param timeout maximum wait; on expiry the connection is aborted
   * @throws SendTimeoutException when teardown does not complete in time
   * @throws TransportException when the FIN exhausts its retries
   * @throws InterruptedException if the caller is interrupted
   */
  public void close(Duration timeout) throws TransportException, InterruptedException {
    lock.lock();
    try {
      switch (state) {
        case ESTABLISHED, CLOSE_WAIT -> fire(ConnectionEvent.CLOSE);
        case CLOSED, LISTEN, SYN_SENT, SYN_RCVD -> {
          release("closed before establishment");
          return;
        }
        default -> {
          // teardown already in progress
        }
      }
      try {
        awaitStateLeaving(timeout, "close",
            ConnectionState.ESTABLISHED, ConnectionState.FIN_WAIT_1, ConnectionState.FIN_WAIT_2,
            ConnectionState.CLOSE_WAIT, ConnectionState.LAST_ACK);
      } catch (SendTimeoutException ex) {
        abortWith(new ConnectionAbortedException("close timed out"));
        throw ex;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes with the configured close timeout.
   *
   * @throws IOException when teardown fails or times out
   */
  @Override
  public void close() throws IOException {
    try {
      close(config.closeTimeout());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      abort();
      throw new InterruptedIOException("interrupted while closing");
    }
  }

  /** Releases the connection immediately without teardown. */
  public void abort() {
    lock.lock();
    try {
      if (!released) {
        log.info("Connection {} <-> {} aborted in {}", port.localAddress(), peer, state);
      }
      abortWith(new ConnectionAbortedException("connection aborted"));
    } finally {
      lock.unlock();
    }
  }

  public ConnectionState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the remote address once known.
   *
   * @return peer address, or empty before a SYN was sent or received
   */
  public Optional<SocketAddress> peer() {
    lock.lock();
    try {
      return Optional.ofNullable(peer);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a statistics snapshot including the smoothed RTT and current retransmission timeout.
   *
   * @return counters accumulated since creation
   */
  public TransportStatistics statistics() {
    lock.lock();
    try {
      return counters.snapshot(rtt.estimatedRtt(), rtt.retransmissionTimeout());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the peer window last advertised to this side.
   *
   * @return window in bytes; zero before the handshake
   */
  public int peerWindow() {
    lock.lock();
    try {
      return sendWindow == null ? 0 : sendWindow.peerWindow();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of bytes sent but not yet acknowledged, SYN and FIN included.
   *
   * @return bytes in flight
   */
  public long bytesInFlight() {
    lock.lock();
    try {
      return sendWindow == null ? 0L : sendWindow.nextSeq() - sendWindow.base();
    } finally {
      lock.unlock();
    }
  }

  // ---------------------------------------------------------------------------------------------
  // inbound

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
        log.error("Connection reader on {} stopped", port.localAddress(), ex);
        lock.lock();
        try {
          abortWith(new TransportException("datagram port failed", ex));
        } finally {
          lock.unlock();
        }
      }
    } finally {
      MDC.remove("rdt.peer");
    }
  }

  void onDatagram(Datagram datagram) {
    lock.lock();
    try {
      if (released) {
        return;
      }
      counters.increment(TransportCounters.SEGMENTS_RECEIVED);
      SegmentDisposition disposition;
      try {
        disposition = process(datagram);
      } catch (MalformedSegmentException ex) {
        log.debug("Malformed datagram from {}: {}", datagram.address(), ex.getMessage());
        disposition = SegmentDisposition.MALFORMED;
      } catch (TransportException ex) {
        log.debug("Segment from {} not processed: {}", datagram.address(), ex.getMessage());
        disposition = SegmentDisposition.ILLEGAL_TRANSITION;
      }
      counters.record(disposition);
      if (disposition.isDiscard()) {
        log.debug("Segment from {} discarded in {}: {}", datagram.address(), state, disposition);
      }
    } finally {
      lock.unlock();
    }
  }

  private SegmentDisposition process(Datagram datagram) throws MalformedSegmentException, TransportException {
    Segment segment = SegmentCodec.decode(datagram.bytes());
    if (segment.isCorrupt()) {
      if (receiveBuffer != null && datagram.address().equals(peer)) {
        // repeat the last cumulative acknowledgment
        sendAck(true);
      }
      return SegmentDisposition.CORRUPT;
    }
    if (log.isTraceEnabled()) {
      log.trace("Received {} {}", segment, Logs.preview(segment.payload(), PREVIEW_BYTES));
    }
    if (peer != null && !peer.equals(datagram.address())) {
      return SegmentDisposition.OUT_OF_WINDOW;
    }
    SegmentKind kind = segment.kind();
    if (kind == SegmentKind.SYN) {
      return onSyn(segment, datagram.address());
    }
    if (kind == SegmentKind.SYN_ACK) {
      return onSynAck(segment);
    }
    if (receiveBuffer == null) {
      return SegmentDisposition.ILLEGAL_TRANSITION;
    }
    SegmentDisposition ackDisposition = SegmentDisposition.ACKNOWLEDGED;
    if (segment.hasAck()) {
      ackDisposition = onAck(segment);
      if (released) {
        return ackDisposition;
      }
    }
    if (segment.length() > 0) {
      return onData(segment);
    }
    if (kind.isFin()) {
      return onFin(segment);
    }
    long seq = SequenceNumbers.unwrap(receiveBuffer.rcvNext(), segment.seq());
    if (seq < receiveBuffer.rcvNext()) {
      // zero-window probe or stale acknowledgment: answer with the current window
      sendAck(true);
      return SegmentDisposition.DUPLICATE;
    }
    return ackDisposition;
  }

  private SegmentDisposition onSyn(Segment segment, SocketAddress from) throws TransportException {
    if (state == ConnectionState.LISTEN) {
      peer = from;
      peerIss = segment.seq();
      receiveBuffer = new ByteStreamReceiveBuffer(config.receiveBufferBytes(), peerIss + 1);
      iss = SequenceNumbers.toWire(isnSupplier.getAsLong());
      sendWindow = newSendWindow(iss);
      sendWindow.setPeerWindow(segment.window());
      log.info("SYN from {} (peer iss={}, iss={})", peer, peerIss, iss);
      fire(ConnectionEvent.RECV_SYN);
      return SegmentDisposition.ACKNOWLEDGED;
    }
    if (state == ConnectionState.SYN_RCVD && segment.seq() == peerIss) {
      // our SYN-ACK is still outstanding and will be retransmitted by its timer
      return SegmentDisposition.DUPLICATE;
    }
    log.debug("Ignoring SYN from {} in {}", from, state);
    return SegmentDisposition.ILLEGAL_TRANSITION;
  }

  private SegmentDisposition onSynAck(Segment segment) throws TransportException {
    if (state == ConnectionState.SYN_SENT) {
      if (SequenceNumbers.unwrap(iss, segment.ack()) != iss + 1) {
        return SegmentDisposition.OUT_OF_WINDOW;
      }
      peerIss = segment.seq();
      receiveBuffer = new ByteStreamReceiveBuffer(config.receiveBufferBytes(), peerIss + 1);
      sendWindow.onAcknowledgment(segment.ack(), segment.window());
      fire(ConnectionEvent.RECV_SYN_ACK);
      return SegmentDisposition.ACKNOWLEDGED;
    }
    if (receiveBuffer != null && segment.seq() == peerIss) {
      counters.increment(TransportCounters.ACK_DUPLICATE_SENT);
      return fire(ConnectionEvent.RECV_SYN_ACK) ? SegmentDisposition.DUPLICATE : SegmentDisposition.ILLEGAL_TRANSITION;
    }
    return SegmentDisposition.ILLEGAL_TRANSITION;
  }

  private SegmentDisposition onAck(Segment segment) throws TransportException {
    SegmentDisposition disposition = sendWindow.onAcknowledgment(segment.ack(), segment.window());
    if (state == ConnectionState.SYN_RCVD && sendWindow.base() > iss) {
      fire(ConnectionEvent.RECV_ACK);
    } else if ((state == ConnectionState.FIN_WAIT_1 || state == ConnectionState.LAST_ACK)
        && finSeq >= 0 && sendWindow.base() > finSeq) {
      fire(ConnectionEvent.RECV_ACK);
    }
    if (!released) {
      maybeArmPersist();
    }
    return disposition;
  }

  private SegmentDisposition onData(Segment segment) {
    long seq = SequenceNumbers.unwrap(receiveBuffer.rcvNext(), segment.seq());
    long before = receiveBuffer.rcvNext();
    SegmentDisposition disposition;
    if (state.acceptsData()) {
      disposition = receiveBuffer.offer(seq, segment.payload());
    } else {
      disposition = SegmentDisposition.DUPLICATE;
    }
    if (disposition == SegmentDisposition.DELIVERED) {
      counters.increment(TransportCounters.UNITS_DELIVERED);
      counters.add(TransportCounters.BYTES_DELIVERED, receiveBuffer.rcvNext() - before);
      stateChanged.signalAll();
    }
    sendAck(disposition.isDiscard());
    return disposition;
  }

  private SegmentDisposition onFin(Segment segment) throws TransportException {
    long seq = SequenceNumbers.unwrap(receiveBuffer.rcvNext(), segment.seq());
    if (!peerFinConsumed && seq == receiveBuffer.rcvNext() && state.acceptsData()) {
      receiveBuffer.consumeFin();
      peerFinConsumed = true;
      log.debug("FIN from {} at {}", peer, seq);
      fire(ConnectionEvent.RECV_FIN);
      stateChanged.signalAll();
      return SegmentDisposition.ACKNOWLEDGED;
    }
    if (peerFinConsumed && seq == receiveBuffer.rcvNext() - 1) {
      counters.increment(TransportCounters.ACK_DUPLICATE_SENT);
      return fire(ConnectionEvent.RECV_FIN) ? SegmentDisposition.DUPLICATE : SegmentDisposition.ILLEGAL_TRANSITION;
    }
    // FIN ahead of missing data: drop it, the peer retransmits it
    sendAck(true);
    return SegmentDisposition.OUT_OF_WINDOW;
  }

  // ---------------------------------------------------------------------------------------------
  // state machine

  private boolean fire(ConnectionEvent event) throws TransportException {
    Optional<TransitionTable.Transition> transition = TransitionTable.lookup(state, event);
    if (transition.isEmpty()) {
      log.debug("Ignoring {} in {}", event, state);
      return false;
    }
    ConnectionState previous = state;
    state = transition.get().next();
    if (previous != state) {
      log.info("{} -> {} on {} ({} <-> {})", previous, state, event, port.localAddress(), peer);
    }
    perform(transition.get().action());
    stateChanged.signalAll();
    if (previous == ConnectionState.FIN_WAIT_1 && state == ConnectionState.FIN_WAIT_2 && deferredFin) {
      deferredFin = false;
      fire(ConnectionEvent.RECV_FIN);
    }
    return true;
  }

  private void fireLocally(ConnectionEvent event) {
    try {
      fire(event);
    } catch (TransportException ex) {
      throw new IllegalStateException("local transition " + event + " failed", ex);
    }
  }

  private void perform(TransitionTable.Action action) throws TransportException {
    switch (action) {
      case NONE -> {
        // state change only
      }
      case SEND_SYN, SEND_SYN_ACK -> sendWindow.sendControl(SegmentKind.FLAG_SYN);
      case SEND_ACK -> sendAck(false);
      case SEND_FIN -> finSeq = sendWindow.sendControl(SegmentKind.FLAG_FIN);
      case SEND_ACK_AND_WAIT -> {
        sendAck(false);
        timers.start(ConnectionTimer.TIME_WAIT, config.timeWait(), this::onTimeWaitExpired);
      }
      case RELEASE -> release("teardown complete");
      case DEFER_FIN -> {
        sendAck(false);
        deferredFin = true;
      }
    }
  }

  private void onTimeWaitExpired() {
    try {
      fire(ConnectionEvent.TIMEOUT);
    } catch (TransportException ex) {
      log.warn("TIME_WAIT expiry failed; aborting", ex);
      abortWith(ex);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // outbound

  private ByteStreamSendWindow newSendWindow(long initialSeq) {
    ByteStreamSendWindow window = new ByteStreamSendWindow(
        lock, retransmitTimers, this::transmit, clock, counters, config.maxRetries(), initialSeq,
        config.sendWindowBytes(), rtt);
    window.setFailureListener(this::onSendFailure);
    return window;
  }

  private void transmit(OutstandingUnit unit, boolean retransmission) {
    int flags = unit.flags();
    long ack = 0L;
    int window = config.receiveBufferBytes();
    if (receiveBuffer != null) {
      flags |= SegmentKind.FLAG_ACK;
      ack = receiveBuffer.rcvNext();
      window = receiveBuffer.advertise();
    }
    Segment segment = Segment.of(flags, unit.seq(), ack, window, unit.payload());
    if (retransmission) {
      log.debug("Retransmitting {} (transmission {}, rto {} ms)",
          segment, unit.transmissions(), rtt.retransmissionTimeout().toMillis());
    }
    emit(segment);
  }

  private void sendAck(boolean duplicate) {
    if (sendWindow == null || receiveBuffer == null) {
      return;
    }
    Segment ack = Segment.of(
        SegmentKind.FLAG_ACK, sendWindow.nextSeq(), receiveBuffer.rcvNext(), receiveBuffer.advertise(), null);
    counters.increment(TransportCounters.SEGMENTS_SENT);
    if (duplicate) {
      counters.increment(TransportCounters.ACK_DUPLICATE_SENT);
    }
    emit(ack);
  }

  private void emit(Segment segment) {
    try {
      port.send(peer, SegmentCodec.encode(segment));
      if (log.isTraceEnabled()) {
        log.trace("Sent {}", segment);
      }
    } catch (IOException ex) {
      counters.increment(TransportCounters.SEND_FAILED);
      log.debug("Send of {} failed; treating as loss", segment, ex);
    }
  }

  private void maybeArmPersist() {
    if (sendWindow == null) {
      return;
    }
    boolean stalled = sendWindow.peerWindow() == 0 && sendWindow.isDrained() && pendingWriters > 0;
    if (stalled) {
      if (!timers.isActive(ConnectionTimer.PERSIST)) {
        timers.start(ConnectionTimer.PERSIST, rtt.retransmissionTimeout(), this::onPersist);
      }
    } else if (sendWindow.peerWindow() > 0) {
      timers.cancel(ConnectionTimer.PERSIST);
    }
  }

  private void onPersist() {
    if (released || sendWindow.peerWindow() > 0 || pendingWriters == 0) {
      return;
    }
    Segment probe = Segment.of(
        SegmentKind.FLAG_ACK, sendWindow.base() - 1, receiveBuffer.rcvNext(), receiveBuffer.advertise(), null);
    counters.increment(TransportCounters.PROBE_SENT);
    counters.increment(TransportCounters.SEGMENTS_SENT);
    log.debug("Peer window closed; sending probe");
    emit(probe);
    timers.start(ConnectionTimer.PERSIST, rtt.retransmissionTimeout(), this::onPersist);
  }

  // ---------------------------------------------------------------------------------------------
  // lifecycle

  private void startReader() {
    running = true;
    reader = ExecutorFactories.newReaderThread("rdt-connection", this::readLoop, null);
    reader.start();
  }

  private void onSendFailure(TransportException cause) {
    log.error("Connection {} <-> {} failed in {}: {}", port.localAddress(), peer, state, cause.getMessage());
    abortWith(cause);
  }

  private void abortWith(TransportException cause) {
    if (released) {
      return;
    }
    failure = cause;
    release(cause.getMessage());
  }

  private void release(String reason) {
    if (released) {
      return;
    }
    released = true;
    ConnectionState previous = state;
    state = ConnectionState.CLOSED;
    timers.cancelAll();
    retransmitTimers.cancelAll();
    if (sendWindow != null) {
      sendWindow.release(reason);
    }
    running = false;
    if (reader != null && reader != Thread.currentThread()) {
      reader.interrupt();
    }
    port.close();
    stateChanged.signalAll();
    if (previous != ConnectionState.CLOSED) {
      log.info("{} -> CLOSED ({})", previous, reason);
    }
  }

  private void awaitStateLeaving(Duration timeout, String operation, ConnectionState... waiting)
      throws TransportException, InterruptedException {
    long remaining = timeout.toNanos();
    while (isOneOf(state, waiting) && !released) {
      if (remaining <= 0L) {
        throw new SendTimeoutException(operation, timeout);
      }
      remaining = stateChanged.awaitNanos(remaining);
    }
    throwIfFailed();
  }

  private static boolean isOneOf(ConnectionState state, ConnectionState... candidates) {
    for (ConnectionState candidate : candidates) {
      if (candidate == state) {
        return true;
      }
    }
    return false;
  }

  private void throwIfFailed() throws TransportException {
    if (failure == null) {
      return;
    }
    if (failure instanceof ConnectionAbortedException) {
      throw new ConnectionAbortedException(failure.getMessage(), failure);
    }
    throw failure;
  }

  private void requireFresh() {
    if (opened) {
      throw new IllegalStateException("connection already opened (state " + state + ")");
    }
  }

  private void requireWritable() throws TransportException {
    throwIfFailed();
    if (!state.canWrite()) {
      throw new IllegalStateException("cannot write in state " + state);
    }
  }

  private static LongSupplier randomIsn() {
    SecureRandom random = new SecureRandom();
    return () -> random.nextInt() & 0xFFFF_FFFFL;
  }
}

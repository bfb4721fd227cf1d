package ca.gc.cra.rdt.infrastructure.net;

import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.domain.net.Datagram;
import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DatagramPort} decorator that impairs outbound datagrams.
 * <p><strong>Why:</strong> Exercises retransmission paths over a real socket with reproducible loss,
 * corruption, duplication and delay.</p>
 * <p><strong>Role:</strong> Adapter wrapping another port. Inbound traffic is passed through untouched.</p>
 * <p><strong>Thread-safety:</strong> Impairment decisions are drawn under a private monitor so a seeded
 * profile yields a deterministic decision sequence for a deterministic send order.</p>
 * <p><strong>Observability:</strong> Each impairment is logged at DEBUG; totals via {@link #statistics()}.</p>
 *
 * @since 0.1.0
 */
public final class UnreliableDatagramPort implements DatagramPort {
  private static final Logger log = LoggerFactory.getLogger(UnreliableDatagramPort.class);
  private static final int MAX_CORRUPTED_BYTES = 5;

  private final DatagramPort delegate;
  private final ChannelProfile profile;
  private final ScheduledExecutorService scheduler;
  private final Random random;
  private final AtomicLong sent = new AtomicLong();
  private final AtomicLong lost = new AtomicLong();
  private final AtomicLong corrupted = new AtomicLong();
  private final AtomicLong duplicated = new AtomicLong();
  private final AtomicLong totalDelayNanos = new AtomicLong();

  /**
   * Creates the decorator.
   *
   * @param delegate port that carries the surviving datagrams
   * @param profile impairment profile
   * @param scheduler executor used to deliver delayed datagrams; may be {@code null} when the profile has no delay
   */
  public UnreliableDatagramPort(DatagramPort delegate, ChannelProfile profile, ScheduledExecutorService scheduler) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.profile = Objects.requireNonNull(profile, "profile");
    if (profile.delays() && scheduler == null) {
      throw new IllegalArgumentException("scheduler required when the profile delays datagrams");
    }
    this.scheduler = scheduler;
    this.random = new Random(profile.seed());
  }

  @Override
  public void send(SocketAddress address, byte[] bytes) throws IOException {
    long index = sent.incrementAndGet();
    byte[] outbound = bytes;
    boolean duplicate;
    long delayNanos;
    synchronized (random) {
      if (random.nextDouble() < profile.lossRate()) {
        lost.incrementAndGet();
        log.debug("Channel dropped datagram #{} to {}", index, address);
        return;
      }
      if (random.nextDouble() < profile.corruptRate()) {
        outbound = corrupt(bytes);
        corrupted.incrementAndGet();
        log.debug("Channel corrupted datagram #{} to {}", index, address);
      }
      duplicate = random.nextDouble() < profile.duplicateRate();
      delayNanos = nextDelayNanos();
    }
    totalDelayNanos.addAndGet(delayNanos);
    if (duplicate) {
      duplicated.incrementAndGet();
      log.debug("Channel duplicated datagram #{} to {}", index, address);
    }
    if (delayNanos == 0L) {
      delegate.send(address, outbound);
      if (duplicate) {
        delegate.send(address, outbound);
      }
      return;
    }
    byte[] delayed = outbound;
    int copies = duplicate ? 2 : 1;
    try {
      scheduler.schedule(() -> deliver(address, delayed, copies), delayNanos, TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Channel scheduler shut down; datagram #{} lost", index);
    }
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

  /**
   * Returns what the channel did so far.
   *
   * @return statistics snapshot
   */
  public ChannelStatistics statistics() {
    return new ChannelStatistics(
        sent.get(), lost.get(), corrupted.get(), duplicated.get(), Duration.ofNanos(totalDelayNanos.get()));
  }

  private void deliver(SocketAddress address, byte[] bytes, int copies) {
    for (int i = 0; i < copies; i++) {
      try {
        delegate.send(address, bytes);
      } catch (IOException ex) {
        log.debug("Delayed send to {} failed; treating as loss", address, ex);
        return;
      }
    }
  }

  private byte[] corrupt(byte[] bytes) {
    byte[] copy = bytes.clone();
    if (copy.length == 0) {
      return copy;
    }
    int count = 1 + random.nextInt(Math.min(MAX_CORRUPTED_BYTES, copy.length));
    for (int i = 0; i < count; i++) {
      int index = random.nextInt(copy.length);
      copy[index] = (byte) (copy[index] ^ 0xFF);
    }
    return copy;
  }

  private long nextDelayNanos() {
    long min = profile.minDelay().toNanos();
    long max = profile.maxDelay().toNanos();
    if (max <= 0L) {
      return 0L;
    }
    if (max == min) {
      return min;
    }
    return min + (long) (random.nextDouble() * (max - min));
  }
}

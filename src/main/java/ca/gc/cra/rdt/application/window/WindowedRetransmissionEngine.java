package ca.gc.cra.rdt.application.window;

import ca.gc.cra.rdt.application.port.ClockPort;
import ca.gc.cra.rdt.application.port.DatagramPort;
import ca.gc.cra.rdt.application.port.MetricsPort;
import ca.gc.cra.rdt.application.port.TimerService;
import ca.gc.cra.rdt.application.stats.TransportCounters;
import ca.gc.cra.rdt.config.TransportConfig;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Creates packet-granular sender and receiver endpoints for the configured
 * acknowledgment policy.
 * <p><strong>Role:</strong> Application factory; the policy decides which send and receive windows are
 * paired, everything else is shared.</p>
 * <p><strong>Thread-safety:</strong> Immutable; endpoints it creates are independent.</p>
 * <p><strong>Observability:</strong> Senders count under {@code sender.*}, receivers under {@code receiver.*}.</p>
 *
 * @since 0.1.0
 */
public final class WindowedRetransmissionEngine {
  static final String SENDER_PREFIX = "sender";
  static final String RECEIVER_PREFIX = "receiver";

  private final TransportConfig config;
  private final ScheduledExecutorService scheduler;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the factory.
   *
   * @param config transport configuration; policy, window size, timeout and retry budget are used
   * @param scheduler shared timer scheduler
   * @param metrics metrics sink
   * @param clock monotonic clock
   */
  public WindowedRetransmissionEngine(
      TransportConfig config, ScheduledExecutorService scheduler, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Creates and starts a sender bound to {@code port} that transmits to {@code peer}.
   *
   * @param port datagram port; owned by the sender from now on
   * @param peer receiver address
   * @return started sender
   */
  public WindowedSender newSender(DatagramPort port, SocketAddress peer) {
    WindowedSender sender =
        new WindowedSender(port, peer, config, scheduler, new TransportCounters(metrics, SENDER_PREFIX), clock);
    sender.start();
    return sender;
  }

  /**
   * Creates and starts a receiver bound to {@code port}.
   *
   * @param port datagram port; owned by the receiver from now on
   * @return started receiver
   */
  public WindowedReceiver newReceiver(DatagramPort port) {
    WindowedReceiver receiver =
        new WindowedReceiver(port, config, newReceiveWindow(config), new TransportCounters(metrics, RECEIVER_PREFIX));
    receiver.start();
    return receiver;
  }

  static AbstractSendWindow newSendWindow(
      TransportConfig config,
      ReentrantLock lock,
      TimerService<Long> timers,
      UnitTransmitter transmitter,
      ClockPort clock,
      TransportCounters counters) {
    return switch (config.ackPolicy()) {
      case GO_BACK_N -> new GoBackNSendWindow(
          lock, timers, transmitter, clock, counters, config.windowSize(), config.initialRto(), config.maxRetries());
      case SELECTIVE_REPEAT -> new SelectiveRepeatSendWindow(
          lock, timers, transmitter, clock, counters, config.windowSize(), config.initialRto(), config.maxRetries());
    };
  }

  static ReceiveWindow newReceiveWindow(TransportConfig config) {
    return switch (config.ackPolicy()) {
      case GO_BACK_N -> new GoBackNReceiveWindow();
      case SELECTIVE_REPEAT -> new SelectiveRepeatReceiveWindow(config.windowSize());
    };
  }
}

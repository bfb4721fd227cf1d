package ca.gc.cra.rdt.application.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RttEstimatorTest {

  @Test
  void startsAtTheInitialTimeout() {
    RttEstimator rtt = new RttEstimator(Duration.ofSeconds(1), Duration.ofMillis(200), Duration.ofSeconds(60));

    assertEquals(Duration.ofSeconds(1), rtt.retransmissionTimeout());
    assertEquals(0L, rtt.samples());
  }

  @Test
  void deviationIsMeasuredAgainstTheUpdatedEstimate() {
    RttEstimator rtt = new RttEstimator(Duration.ofMillis(100), Duration.ofMillis(1), Duration.ofSeconds(60));

    rtt.addSample(Duration.ofMillis(50));

    // est = 0.875 * 100 + 0.125 * 50 = 93.75; dev = 0.25 * |50 - 93.75| = 10.9375
    assertEquals(Duration.ofNanos(93_750_000L), rtt.estimatedRtt());
    assertEquals(Duration.ofNanos(10_937_500L), rtt.deviation());
    assertEquals(Duration.ofNanos(137_500_000L), rtt.retransmissionTimeout());
    assertEquals(1L, rtt.samples());
  }

  @Test
  void convergesToTheTrueRoundTripAndStaysAboveIt() {
    RttEstimator rtt = new RttEstimator(Duration.ofSeconds(1), Duration.ofMillis(1), Duration.ofSeconds(60));
    Random random = new Random(3);

    for (int i = 0; i < 200; i++) {
      rtt.addSample(Duration.ofMillis(45 + random.nextInt(11)));
    }

    long estimate = rtt.estimatedRtt().toMillis();
    assertTrue(estimate >= 45 && estimate <= 55, "estimate " + estimate);
    assertTrue(rtt.retransmissionTimeout().compareTo(rtt.estimatedRtt()) > 0);
    assertTrue(rtt.deviation().toNanos() > 0);
  }

  @Test
  void timeoutIsClamped() {
    RttEstimator rtt = new RttEstimator(Duration.ofMillis(500), Duration.ofMillis(200), Duration.ofSeconds(2));

    for (int i = 0; i < 100; i++) {
      rtt.addSample(Duration.ofMillis(1));
    }
    assertEquals(Duration.ofMillis(200), rtt.retransmissionTimeout());

    rtt.addSample(Duration.ofSeconds(30));
    assertEquals(Duration.ofSeconds(2), rtt.retransmissionTimeout());
  }
}

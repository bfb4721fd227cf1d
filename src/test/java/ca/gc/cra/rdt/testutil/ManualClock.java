package ca.gc.cra.rdt.testutil;

import ca.gc.cra.rdt.application.port.ClockPort;
import java.time.Duration;

/** Clock advanced explicitly by tests. */
public final class ManualClock implements ClockPort {
  private long nanos;

  @Override
  public long nowNanos() {
    return nanos;
  }

  public void advance(Duration duration) {
    nanos += duration.toNanos();
  }
}

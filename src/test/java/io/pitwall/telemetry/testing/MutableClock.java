package io.pitwall.telemetry.testing;

import io.pitwall.telemetry.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock advanced explicitly by tests.
 */
public final class MutableClock implements ClockPort {
  private final AtomicLong now;

  public MutableClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  public void advance(long millis) {
    now.addAndGet(millis);
  }

  public void set(long millis) {
    now.set(millis);
  }
}

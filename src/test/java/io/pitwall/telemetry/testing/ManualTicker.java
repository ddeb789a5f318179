package io.pitwall.telemetry.testing;

import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.application.port.Ticker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ticker whose ticks are fired by the test thread.
 */
public final class ManualTicker implements Ticker {
  private final List<Scheduled> scheduled = new ArrayList<>();

  @Override
  public synchronized Subscription schedule(Duration interval, Runnable tick) {
    Scheduled entry = new Scheduled(interval, tick);
    scheduled.add(entry);
    return () -> entry.cancelled = true;
  }

  /**
   * Fires every active schedule {@code times} times.
   *
   * @param times tick count
   */
  public void tick(int times) {
    for (int i = 0; i < times; i++) {
      for (Scheduled entry : active()) {
        entry.tick.run();
      }
    }
  }

  public synchronized int activeCount() {
    return active().size();
  }

  public synchronized Duration lastInterval() {
    return scheduled.isEmpty() ? null : scheduled.get(scheduled.size() - 1).interval;
  }

  private synchronized List<Scheduled> active() {
    List<Scheduled> out = new ArrayList<>();
    for (Scheduled entry : scheduled) {
      if (!entry.cancelled) {
        out.add(entry);
      }
    }
    return out;
  }

  private static final class Scheduled {
    private final Duration interval;
    private final Runnable tick;
    private volatile boolean cancelled;

    private Scheduled(Duration interval, Runnable tick) {
      this.interval = interval;
      this.tick = tick;
    }
  }
}

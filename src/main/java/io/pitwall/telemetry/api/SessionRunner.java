package io.pitwall.telemetry.api;

import io.pitwall.telemetry.application.pipeline.AttachedSource;
import io.pitwall.telemetry.application.pipeline.TelemetryRuntime;
import io.pitwall.telemetry.application.port.ClockPort;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives an attached session until its deadline passes or its source stops, running pace trends periodically.
 */
final class SessionRunner {
  private static final Logger log = LoggerFactory.getLogger(SessionRunner.class);
  static final long POLL_MILLIS = 250L;

  private final ClockPort clock;
  private final Sleeper sleeper;

  SessionRunner(ClockPort clock, Sleeper sleeper) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  SessionRunner() {
    this(ClockPort.SYSTEM, Thread::sleep);
  }

  /**
   * Runs the session.
   *
   * @param runtime runtime owning the session
   * @param attached attached source
   * @param duration run length; zero runs until the source disconnects
   * @param trendInterval interval between trend passes
   * @return number of trend passes executed, including the final pass at exit
   * @throws InterruptedException when the waiting thread is interrupted
   */
  int run(TelemetryRuntime runtime, AttachedSource attached, Duration duration, Duration trendInterval)
      throws InterruptedException {
    long start = clock.nowMillis();
    long deadline = duration.isZero() ? Long.MAX_VALUE : start + duration.toMillis();
    long intervalMillis = trendInterval.toMillis();
    long nextTrend = start + intervalMillis;
    int passes = 0;
    while (attached.source().isConnected()) {
      long now = clock.nowMillis();
      if (now >= deadline) {
        log.info("Run duration {} reached for session {}", duration, attached.sessionId());
        break;
      }
      if (now >= nextTrend) {
        List<PaceTrend> trends = runtime.paceTrends(attached.sessionId());
        passes++;
        log.debug("Trend pass {} produced {} trends", passes, trends.size());
        nextTrend = now + intervalMillis;
      }
      sleeper.sleep(Math.max(1L, Math.min(POLL_MILLIS, Math.min(deadline, nextTrend) - now)));
    }
    if (!attached.source().isConnected()) {
      log.info("Source for session {} stopped", attached.sessionId());
    }
    runtime.paceTrends(attached.sessionId());
    return passes + 1;
  }

  /** Blocking wait, replaceable in tests. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }
}

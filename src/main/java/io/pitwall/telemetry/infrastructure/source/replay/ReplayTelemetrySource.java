package io.pitwall.telemetry.infrastructure.source.replay;

import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.application.port.Ticker;
import io.pitwall.telemetry.application.port.TimingHistoryStore;
import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.infrastructure.source.AbstractTelemetrySource;
import io.pitwall.telemetry.validation.Strings;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Plays recorded timing snapshots and frames back against a virtual clock.
 * <p><strong>Why:</strong> Post-session review needs the same listener contract as a live session, at
 * selectable speed and with seeking.</p>
 * <p><strong>Role:</strong> Adapter behind the {@code TelemetrySource} port for {@code mode=replay}.</p>
 * <p><strong>Behavior:</strong> Each tick advances virtual time by {@code tickInterval * rate}. At most one
 * timing snapshot is emitted per 500 ms bucket and every buffered frame stamped inside the tick's span is
 * emitted. History is fetched in bounded chunks; the next chunk is requested on the fetch executor while
 * virtual time is within one chunk of the fetched horizon, so a tick never blocks on storage.</p>
 * <p><strong>Thread-safety:</strong> State is guarded by this instance's monitor; listeners are invoked
 * outside of it.</p>
 * <p><strong>Observability:</strong> Emits {@code replay.fetch.error}; logs playback start, seeks and end
 * of window at info.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class ReplayTelemetrySource extends AbstractTelemetrySource {
  private static final Logger log = LoggerFactory.getLogger(ReplayTelemetrySource.class);

  /** Default virtual clock interval. */
  public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(100);
  /** Width of a timing bucket; at most one snapshot is emitted per bucket. */
  public static final long TIMING_BUCKET_MILLIS = 500L;
  /** Largest span fetched from history in one request. */
  public static final long CHUNK_MILLIS = 60_000L;

  private final TimingHistoryStore store;
  private final ReplayWindow window;
  private final Ticker ticker;
  private final Executor fetchExecutor;
  private final long tickIntervalMillis;

  private final NavigableMap<Long, TimingSnapshot> timingByBucket = new TreeMap<>();
  private final NavigableMap<Long, List<ThinFrame>> framesByTimestamp = new TreeMap<>();

  private PlaybackRate rate;
  private String sessionId;
  private boolean connected;
  private Subscription tickSubscription = Subscription.NONE;
  private long virtualTimeMillis;
  private long fetchedFromMillis;
  private long fetchedToMillis;
  private Long lastEmittedBucket;
  private boolean fetchInFlight;
  private long generation;

  /**
   * Creates a replay source.
   *
   * @param store history store
   * @param window recorded range to play
   * @param rate initial playback rate
   * @param ticker fixed-interval clock driving playback
   * @param tickInterval interval between ticks
   * @param fetchExecutor executor for background chunk fetches
   * @param metrics metrics sink
   */
  public ReplayTelemetrySource(
      TimingHistoryStore store,
      ReplayWindow window,
      PlaybackRate rate,
      Ticker ticker,
      Duration tickInterval,
      Executor fetchExecutor,
      MetricsPort metrics) {
    super(metrics);
    this.store = Objects.requireNonNull(store, "store");
    this.window = Objects.requireNonNull(window, "window");
    this.rate = Objects.requireNonNull(rate, "rate");
    this.ticker = Objects.requireNonNull(ticker, "ticker");
    this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
    Objects.requireNonNull(tickInterval, "tickInterval");
    if (tickInterval.isNegative() || tickInterval.isZero()) {
      throw new IllegalArgumentException("tickInterval must be positive");
    }
    this.tickIntervalMillis = tickInterval.toMillis();
    this.virtualTimeMillis = window.startMillis();
  }

  @Override
  public SourceMode mode() {
    return SourceMode.REPLAY;
  }

  @Override
  public void connect(String sessionId) throws IOException {
    String id = Strings.requireNonBlank("sessionId", sessionId);
    synchronized (this) {
      if (connected && id.equals(this.sessionId)) {
        return;
      }
    }
    disconnect();

    long from = window.startMillis();
    long to = chunkEnd(from);
    List<TimingSnapshot> timing;
    List<ThinFrame> frames;
    try {
      timing = store.fetchTiming(id, from, to);
      frames = store.fetchFrames(id, from, to);
    } catch (IOException ex) {
      log.warn("Replay prefetch failed for session {} [{}, {}): {}", id, from, to, ex.getMessage());
      throw ex;
    }

    synchronized (this) {
      generation++;
      clearBuffers();
      this.sessionId = id;
      this.virtualTimeMillis = from;
      this.fetchedFromMillis = from;
      this.fetchedToMillis = from;
      this.lastEmittedBucket = null;
      this.fetchInFlight = false;
      merge(from, to, timing, frames);
      this.connected = true;
      this.tickSubscription = ticker.schedule(Duration.ofMillis(tickIntervalMillis), this::tick);
    }
    log.info("Replay of session {} started at {} ({}x, window {} ms)", id, from, rate.multiplier(),
        window.durationMillis());
  }

  @Override
  public void disconnect() {
    Subscription subscription;
    String id;
    synchronized (this) {
      if (!connected) {
        return;
      }
      connected = false;
      generation++;
      subscription = tickSubscription;
      tickSubscription = Subscription.NONE;
      id = sessionId;
      clearBuffers();
    }
    subscription.unsubscribe();
    log.info("Replay of session {} stopped at {}", id, currentTimeMillis());
  }

  @Override
  public synchronized boolean isConnected() {
    return connected;
  }

  /**
   * Advances playback by one tick. Invoked by the ticker.
   */
  void tick() {
    TimingSnapshot timing = null;
    List<ThinFrame> frames = List.of();
    boolean finished = false;
    FetchRequest fetch = null;
    synchronized (this) {
      if (!connected) {
        return;
      }
      long t = virtualTimeMillis;
      if (t >= window.endMillis()) {
        finished = true;
      } else {
        long bucket = bucketOf(t);
        if (lastEmittedBucket == null || lastEmittedBucket != bucket) {
          timing = timingByBucket.get(bucket);
          if (timing != null) {
            lastEmittedBucket = bucket;
          }
        }
        long step = tickIntervalMillis * rate.multiplier();
        frames = framesIn(t, t + step);
        virtualTimeMillis = t + step;
        prune(virtualTimeMillis);
        fetch = nextFetchIfDue();
      }
    }

    if (finished) {
      log.info("Replay reached end of window at {}", window.endMillis());
      disconnect();
      return;
    }
    if (timing != null) {
      emitTiming(timing);
    }
    for (ThinFrame frame : frames) {
      emitFrame(frame);
    }
    if (fetch != null) {
      submit(fetch);
    }
  }

  /**
   * Moves the virtual clock. Positions outside the window are clamped; positions outside the buffered
   * range trigger a bounded fetch at the new position.
   *
   * @param millis target virtual time
   */
  public void seek(long millis) {
    long target = window.clamp(millis);
    FetchRequest fetch = null;
    synchronized (this) {
      virtualTimeMillis = target;
      lastEmittedBucket = null;
      if (connected && (target < fetchedFromMillis || target >= fetchedToMillis)) {
        generation++;
        clearBuffers();
        fetchedFromMillis = target;
        fetchedToMillis = target;
        fetchInFlight = false;
        fetch = nextFetchIfDue();
      }
    }
    log.info("Replay seek to {}", target);
    if (fetch != null) {
      submit(fetch);
    }
  }

  /**
   * Changes the playback rate.
   *
   * @param multiplier one of {@link PlaybackRate#ALLOWED}
   * @throws IllegalArgumentException when the rate is not allowed
   */
  public void setPlaybackRate(int multiplier) {
    PlaybackRate next = PlaybackRate.of(multiplier);
    synchronized (this) {
      rate = next;
    }
  }

  /**
   * Returns the current playback rate.
   *
   * @return playback rate
   */
  public synchronized PlaybackRate playbackRate() {
    return rate;
  }

  /**
   * Returns the virtual clock.
   *
   * @return virtual time in epoch milliseconds
   */
  public synchronized long currentTimeMillis() {
    return virtualTimeMillis;
  }

  /**
   * Returns the replay window.
   *
   * @return window
   */
  public ReplayWindow window() {
    return window;
  }

  synchronized long fetchedToMillis() {
    return fetchedToMillis;
  }

  private List<ThinFrame> framesIn(long fromInclusive, long toExclusive) {
    NavigableMap<Long, List<ThinFrame>> span = framesByTimestamp.subMap(fromInclusive, true, toExclusive, false);
    if (span.isEmpty()) {
      return List.of();
    }
    List<ThinFrame> out = new ArrayList<>();
    span.values().forEach(out::addAll);
    return out;
  }

  private void prune(long virtualTime) {
    framesByTimestamp.headMap(virtualTime, false).clear();
    timingByBucket.headMap(bucketOf(virtualTime), false).clear();
    if (virtualTime > fetchedFromMillis) {
      fetchedFromMillis = Math.min(virtualTime, fetchedToMillis);
    }
  }

  private FetchRequest nextFetchIfDue() {
    if (fetchInFlight || fetchedToMillis >= window.endMillis()) {
      return null;
    }
    long horizon = Math.min(CHUNK_MILLIS, window.durationMillis());
    if (virtualTimeMillis + horizon < fetchedToMillis) {
      return null;
    }
    fetchInFlight = true;
    return new FetchRequest(generation, sessionId, fetchedToMillis, chunkEnd(fetchedToMillis));
  }

  private void submit(FetchRequest request) {
    try {
      fetchExecutor.execute(() -> fetch(request));
    } catch (RuntimeException ex) {
      metrics.increment("replay.fetch.error");
      log.warn("Replay fetch could not be scheduled: {}", ex.getMessage());
      release(request);
    }
  }

  private void fetch(FetchRequest request) {
    try {
      List<TimingSnapshot> timing = store.fetchTiming(request.sessionId(), request.from(), request.to());
      List<ThinFrame> frames = store.fetchFrames(request.sessionId(), request.from(), request.to());
      synchronized (this) {
        if (request.generation() == generation && connected) {
          merge(request.from(), request.to(), timing, frames);
        }
      }
    } catch (IOException | RuntimeException ex) {
      metrics.increment("replay.fetch.error");
      log.warn("Replay fetch [{}, {}) failed for session {}; retrying on a later tick: {}",
          request.from(), request.to(), request.sessionId(), ex.getMessage());
    } finally {
      release(request);
    }
  }

  private synchronized void release(FetchRequest request) {
    if (request.generation() == generation) {
      fetchInFlight = false;
    }
  }

  private void merge(long from, long to, List<TimingSnapshot> timing, List<ThinFrame> frames) {
    if (from != fetchedToMillis) {
      return;
    }
    for (TimingSnapshot snapshot : timing) {
      if (snapshot.timestampMillis() >= from && snapshot.timestampMillis() < to) {
        timingByBucket.put(bucketOf(snapshot.timestampMillis()), snapshot);
      }
    }
    for (ThinFrame frame : frames) {
      if (frame.timestampMillis() >= from && frame.timestampMillis() < to) {
        framesByTimestamp.computeIfAbsent(frame.timestampMillis(), k -> new ArrayList<>(1)).add(frame);
      }
    }
    fetchedToMillis = to;
  }

  private void clearBuffers() {
    timingByBucket.clear();
    framesByTimestamp.clear();
  }

  private long chunkEnd(long from) {
    return Math.min(window.endMillis(), from + CHUNK_MILLIS);
  }

  static long bucketOf(long millis) {
    return Math.floorDiv(millis, TIMING_BUCKET_MILLIS) * TIMING_BUCKET_MILLIS;
  }

  private record FetchRequest(long generation, String sessionId, long from, long to) {}
}

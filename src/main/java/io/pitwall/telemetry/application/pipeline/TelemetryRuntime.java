package io.pitwall.telemetry.application.pipeline;

import io.pitwall.telemetry.application.events.EventBus;
import io.pitwall.telemetry.application.events.GateDecision;
import io.pitwall.telemetry.application.events.RateLimitedListener;
import io.pitwall.telemetry.application.events.SubscriptionGate;
import io.pitwall.telemetry.application.events.SubscriptionRejectedException;
import io.pitwall.telemetry.application.events.SubscriptionRequest;
import io.pitwall.telemetry.application.parity.FrameClassification;
import io.pitwall.telemetry.application.parity.FrameParityTracker;
import io.pitwall.telemetry.application.parity.ParitySnapshot;
import io.pitwall.telemetry.application.port.ClockPort;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.application.port.TelemetrySource;
import io.pitwall.telemetry.application.segment.CyclicPositions;
import io.pitwall.telemetry.application.segment.SegmentSpeedDetector;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import io.pitwall.telemetry.domain.pace.SegmentSpeedResult;
import io.pitwall.telemetry.domain.telemetry.SessionScoped;
import io.pitwall.telemetry.domain.telemetry.SubStreams;
import io.pitwall.telemetry.domain.telemetry.TelemetrySample;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingEntry;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Registry and entry point that owns the parity tracker, segment detector, event
 * bus and subscription gate for every session in the process.
 * <p><strong>Why:</strong> Sessions are created lazily by the first frame or subscription and released
 * explicitly; one owner keeps that lifecycle in one place instead of in process-wide singletons.</p>
 * <p><strong>Role:</strong> Application service built by the composition root; sources attach to it and
 * viewers subscribe through it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Route every inbound frame through parity bookkeeping before segment detection.</li>
 *   <li>Translate timing snapshots and thin frames into position samples.</li>
 *   <li>Gate and rate-limit subscribers per session.</li>
 *   <li>Track session activity so an external policy can evict idle sessions.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All collaborators are thread-safe; activity times live in a
 * {@link ConcurrentHashMap}.</p>
 * <p><strong>Observability:</strong> Logs attach and release at info and tags ingestion logs with the
 * {@code sessionId} MDC key; listener faults are recorded as parity errors.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class TelemetryRuntime {
  private static final Logger log = LoggerFactory.getLogger(TelemetryRuntime.class);

  private final FrameParityTracker parity;
  private final SegmentSpeedDetector detector;
  private final EventBus bus;
  private final SubscriptionGate gate;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final RuntimeSettings settings;
  private final ConcurrentMap<String, Long> lastActivity = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ConcurrentMap<String, TrackConditions>> conditions =
      new ConcurrentHashMap<>();

  /**
   * Creates a runtime over explicit collaborators.
   *
   * @param parity frame parity tracker
   * @param detector segment speed detector; should publish to {@code bus}
   * @param bus event bus shared with subscribers
   * @param gate subscription gate
   * @param clock clock for activity and rate limiting
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when {@code null}
   * @param settings runtime tunables
   */
  public TelemetryRuntime(
      FrameParityTracker parity,
      SegmentSpeedDetector detector,
      EventBus bus,
      SubscriptionGate gate,
      ClockPort clock,
      MetricsPort metrics,
      RuntimeSettings settings) {
    this.parity = Objects.requireNonNull(parity, "parity");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Ingests a single position sample. Duplicates and out-of-order samples are counted but never reach
   * the detector.
   *
   * @param sample inbound sample
   * @return parity classification and any completed traversal
   */
  public IngestOutcome ingest(TelemetrySample sample) {
    Objects.requireNonNull(sample, "sample");
    FrameClassification classification = parity.recordFrameIn(
        sample.sessionId(), sample.subStream(), sample.timestampMillis(), sample.frameId());
    touch(sample.sessionId());
    if (!classification.isNovelInOrder() || !sample.hasVehicle()) {
      return new IngestOutcome(classification, Optional.empty());
    }
    return new IngestOutcome(classification, detector.processSample(sample));
  }

  /**
   * Records that an acknowledgment was sent for a sub-stream.
   *
   * @param sessionId session id
   * @param subStream sub-stream name
   */
  public void acknowledge(String sessionId, String subStream) {
    parity.recordAckSent(sessionId, subStream);
  }

  /**
   * Wires a source into this runtime and connects it.
   *
   * @param source telemetry source
   * @param sessionId session to connect to
   * @return handle that detaches and disconnects the source when closed
   * @throws IOException when the source cannot connect; listeners are removed again
   */
  public AttachedSource attach(TelemetrySource source, String sessionId) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(sessionId, "sessionId");
    parity.getOrCreate(sessionId);
    touch(sessionId);
    List<Subscription> subscriptions = new ArrayList<>(2);
    subscriptions.add(source.onTiming(snapshot -> handleTiming(sessionId, snapshot)));
    subscriptions.add(source.onFrame(frame -> handleFrame(sessionId, frame)));
    try {
      source.connect(sessionId);
    } catch (IOException | RuntimeException ex) {
      subscriptions.forEach(Subscription::unsubscribe);
      parity.recordError(sessionId, "connect failed: " + ex.getMessage());
      throw ex;
    }
    log.info("Attached {} source to session {}", source.mode().configName(), sessionId);
    return new AttachedSource(sessionId, source, subscriptions);
  }

  private void handleTiming(String sessionId, TimingSnapshot snapshot) {
    MDC.put("sessionId", sessionId);
    try {
      FrameClassification classification =
          parity.recordFrameIn(sessionId, SubStreams.COARSE_STATE, snapshot.timestampMillis(), null);
      touch(sessionId);
      bus.publish(snapshot);
      if (classification.isOutOfOrder()) {
        return;
      }
      List<TimingEntry> entries = snapshot.entries();
      ConcurrentMap<String, TrackConditions> byVehicle =
          conditions.computeIfAbsent(sessionId, id -> new ConcurrentHashMap<>());
      for (TimingEntry entry : entries) {
        TelemetrySample sample = toSample(sessionId, snapshot.timestampMillis(), entry, entries);
        byVehicle.put(entry.driverId(), TrackConditions.of(sample));
        detector.processSample(sample);
      }
    } catch (RuntimeException ex) {
      parity.recordError(sessionId, "timing: " + ex.getMessage());
      log.warn("Timing snapshot for session {} failed", sessionId, ex);
    } finally {
      MDC.remove("sessionId");
    }
  }

  private void handleFrame(String sessionId, ThinFrame frame) {
    MDC.put("sessionId", sessionId);
    try {
      FrameClassification classification =
          parity.recordFrameIn(sessionId, SubStreams.HIGH_FIDELITY, frame.timestampMillis(), frame.frameId());
      if (classification.shouldAck()) {
        parity.recordAckSent(sessionId, SubStreams.HIGH_FIDELITY);
      }
      touch(sessionId);
      if (classification.isDuplicate()) {
        return;
      }
      bus.publish(frame);
      if (!classification.isOutOfOrder() && frame.driverId() != null && !frame.driverId().isBlank()) {
        TrackConditions known = conditionsOf(sessionId, frame.driverId());
        detector.processSample(new TelemetrySample(
            sessionId,
            SubStreams.HIGH_FIDELITY,
            frame.driverId(),
            frame.frameId(),
            frame.timestampMillis(),
            CyclicPositions.normalize(frame.lapProgress()),
            frame.lap(),
            known.inPitLane(),
            known.onRacingSurface(),
            known.trafficOverlap()));
      }
    } catch (RuntimeException ex) {
      parity.recordError(sessionId, "frame: " + ex.getMessage());
      log.warn("Frame for session {} failed", sessionId, ex);
    } finally {
      MDC.remove("sessionId");
    }
  }

  private TrackConditions conditionsOf(String sessionId, String vehicleId) {
    Map<String, TrackConditions> byVehicle = conditions.get(sessionId);
    TrackConditions known = byVehicle == null ? null : byVehicle.get(vehicleId);
    return known == null ? TrackConditions.CLEAR : known;
  }

  TelemetrySample toSample(String sessionId, long timestampMillis, TimingEntry entry, List<TimingEntry> all) {
    double position = CyclicPositions.normalize(entry.lapDistPct());
    return new TelemetrySample(
        sessionId,
        SubStreams.COARSE_STATE,
        entry.driverId(),
        null,
        timestampMillis,
        position,
        entry.lapNumber(),
        entry.inPit(),
        !entry.retired(),
        hasTraffic(entry, position, all));
  }

  private boolean hasTraffic(TimingEntry subject, double position, List<TimingEntry> all) {
    for (TimingEntry other : all) {
      if (other == subject || other.retired() || other.driverId().equals(subject.driverId())) {
        continue;
      }
      double delta = CyclicPositions.wrapSafeDelta(position, CyclicPositions.normalize(other.lapDistPct()));
      if (Math.abs(delta) <= settings.trafficWindowPct()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Subscribes a viewer to one session's events of a given type.
   *
   * @param request gate request
   * @param type event type
   * @param listener callback receiving rate-limited events of the requested session
   * @param <E> event type
   * @return subscription handle
   * @throws SubscriptionRejectedException when the gate refuses the request
   */
  public <E> Subscription subscribe(SubscriptionRequest request, Class<E> type, Consumer<? super E> listener) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(listener, "listener");
    GateDecision decision = gate.admit(request);
    if (!decision.accepted()) {
      throw new SubscriptionRejectedException(request, decision);
    }
    String sessionId = request.sessionId();
    parity.getOrCreate(sessionId);
    touch(sessionId);
    RateLimitedListener<E> limited =
        new RateLimitedListener<>(listener, decision.effectiveRateHz(), clock, metrics);
    return bus.subscribe(type, event -> {
      if (event instanceof SessionScoped scoped && !sessionId.equals(scoped.sessionId())) {
        return;
      }
      limited.accept(event);
    });
  }

  /**
   * Installs a track map for a session.
   *
   * @param sessionId session id
   * @param map segment map
   */
  public void setTrackMap(String sessionId, TrackSegmentMap map) {
    detector.setTrackMap(sessionId, map);
    touch(sessionId);
  }

  /**
   * Computes and publishes a pace trend for one vehicle.
   *
   * @param sessionId session id
   * @param vehicleId vehicle id
   * @return trend, or empty when data is insufficient
   */
  public Optional<PaceTrend> analyzePaceTrend(String sessionId, String vehicleId) {
    return detector.analyzePaceTrend(sessionId, vehicleId);
  }

  /**
   * Computes and publishes pace trends for every tracked vehicle of a session.
   *
   * @param sessionId session id
   * @return trends ordered by vehicle id; vehicles with insufficient data are omitted
   */
  public List<PaceTrend> paceTrends(String sessionId) {
    List<PaceTrend> trends = new ArrayList<>();
    for (String vehicleId : new TreeSet<>(detector.trackedVehicles(sessionId))) {
      detector.analyzePaceTrend(sessionId, vehicleId).ifPresent(trends::add);
    }
    return trends;
  }

  /**
   * Returns a vehicle's retained segment results.
   *
   * @param sessionId session id
   * @param vehicleId vehicle id
   * @return immutable history
   */
  public List<SegmentSpeedResult> vehicleHistory(String sessionId, String vehicleId) {
    return detector.vehicleHistory(sessionId, vehicleId);
  }

  /**
   * Returns a session's parity diagnostics.
   *
   * @param sessionId session id
   * @return snapshot, or empty for unknown sessions
   */
  public Optional<ParitySnapshot> paritySnapshot(String sessionId) {
    return parity.snapshot(sessionId);
  }

  /**
   * Releases all per-session state.
   *
   * @param sessionId session id
   */
  public void endSession(String sessionId) {
    boolean parityRemoved = parity.cleanup(sessionId);
    boolean detectorRemoved = detector.cleanup(sessionId);
    boolean tracked = sessionId != null && lastActivity.remove(sessionId) != null;
    if (sessionId != null) {
      conditions.remove(sessionId);
    }
    if (parityRemoved || detectorRemoved || tracked) {
      log.info("Session {} released", sessionId);
    }
  }

  /**
   * Lists sessions without activity for at least {@code idleFor}.
   *
   * @param idleFor idle threshold
   * @return session ids, sorted
   */
  public List<String> idleSessions(Duration idleFor) {
    long cutoff = clock.nowMillis() - idleFor.toMillis();
    List<String> idle = new ArrayList<>();
    for (Map.Entry<String, Long> entry : lastActivity.entrySet()) {
      if (entry.getValue() <= cutoff) {
        idle.add(entry.getKey());
      }
    }
    idle.sort(null);
    return idle;
  }

  /**
   * Lists sessions known to the parity tracker.
   *
   * @return session ids
   */
  public List<String> sessionIds() {
    return parity.listSessionIds();
  }

  /**
   * Returns the event bus subscribers and sinks attach to.
   *
   * @return event bus
   */
  public EventBus bus() {
    return bus;
  }

  private void touch(String sessionId) {
    lastActivity.put(sessionId, clock.nowMillis());
  }

  /** Environment flags from a vehicle's latest timing entry; frames carry position only. */
  private record TrackConditions(boolean inPitLane, boolean onRacingSurface, boolean trafficOverlap) {
    static final TrackConditions CLEAR = new TrackConditions(false, true, false);

    static TrackConditions of(TelemetrySample sample) {
      return new TrackConditions(sample.inPitLane(), sample.onRacingSurface(), sample.trafficOverlap());
    }
  }
}

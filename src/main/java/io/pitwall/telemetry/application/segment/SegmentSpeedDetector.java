package io.pitwall.telemetry.application.segment;

import io.pitwall.telemetry.application.port.ClockPort;
import io.pitwall.telemetry.application.port.EventPublisher;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.domain.confidence.SegmentQuality;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import io.pitwall.telemetry.domain.pace.SegmentPaceUpdate;
import io.pitwall.telemetry.domain.pace.SegmentSpeedResult;
import io.pitwall.telemetry.domain.pace.TrackConfigured;
import io.pitwall.telemetry.domain.telemetry.TelemetrySample;
import io.pitwall.telemetry.domain.track.TrackSegment;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Times each vehicle across fixed track segments ("virtual speed traps") and
 * derives average segment speed from segment length over elapsed time.
 * <p><strong>Why:</strong> Opponent speed is never transmitted; only lap position and time are, so speed
 * must be derived and every derived number must carry confidence and quality tags.</p>
 * <p><strong>Role:</strong> Application service owned by {@code TelemetryRuntime}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold one immutable {@link TrackSegmentMap} per session.</li>
 *   <li>Detect segment transitions per vehicle and grade each completed traversal.</li>
 *   <li>Retain a bounded result history per vehicle for trend analysis.</li>
 *   <li>Publish {@link SegmentPaceUpdate}, {@link PaceTrend} and {@link TrackConfigured} events.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Session and vehicle indexes are concurrent. Installing a map swaps
 * the whole session context atomically. Each vehicle state is locked while a sample is applied.</p>
 * <p><strong>Performance:</strong> O(segments) lookup per sample; no allocation unless a segment
 * completes.</p>
 * <p><strong>Observability:</strong> Emits {@code segment.completed}, {@code segment.quality.<Q>},
 * {@code segment.noTrackMap}, {@code segment.trend.emitted} and {@code segment.trend.insufficient}.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class SegmentSpeedDetector {
  private static final Logger log = LoggerFactory.getLogger(SegmentSpeedDetector.class);

  private final ConcurrentMap<String, TrackContext> sessions = new ConcurrentHashMap<>();
  private final DetectorSettings settings;
  private final SegmentQualityClassifier classifier;
  private final PaceTrendAnalyzer trendAnalyzer;
  private final EventPublisher publisher;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a detector with explicit collaborators.
   *
   * @param settings thresholds
   * @param publisher sink for pace events; {@link EventPublisher#NO_OP} when {@code null}
   * @param clock clock used to stamp trends
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when {@code null}
   */
  public SegmentSpeedDetector(
      DetectorSettings settings, EventPublisher publisher, ClockPort clock, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.classifier = new SegmentQualityClassifier(settings);
    this.trendAnalyzer = new PaceTrendAnalyzer(settings);
    this.publisher = publisher == null ? EventPublisher.NO_OP : publisher;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Creates a detector with default settings that publishes nowhere.
   */
  public SegmentSpeedDetector() {
    this(DetectorSettings.defaults(), EventPublisher.NO_OP, ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Installs a track map for a session and discards all of its vehicle states.
   *
   * @param sessionId session id
   * @param map validated segment map
   */
  public void setTrackMap(String sessionId, TrackSegmentMap map) {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(map, "map");
    sessions.put(sessionId, new TrackContext(map));
    log.info("Track {} ({} segments, {} m) configured for session {}",
        map.trackId(), map.segments().size(), map.trackLengthMeters(), sessionId);
    publisher.publish(new TrackConfigured(sessionId, map));
  }

  /**
   * Returns the session's active map.
   *
   * @param sessionId session id
   * @return map, or empty when none is installed
   */
  public Optional<TrackSegmentMap> trackMap(String sessionId) {
    TrackContext context = sessionId == null ? null : sessions.get(sessionId);
    return context == null ? Optional.empty() : Optional.of(context.map);
  }

  /**
   * Applies one position sample.
   *
   * @param sample sample carrying a vehicle id
   * @return the traversal completed by this sample, if any
   */
  public Optional<SegmentSpeedResult> processSample(TelemetrySample sample) {
    Objects.requireNonNull(sample, "sample");
    if (!sample.hasVehicle()) {
      return Optional.empty();
    }
    TrackContext context = sessions.get(sample.sessionId());
    if (context == null) {
      metrics.increment("segment.noTrackMap");
      return Optional.empty();
    }

    VehicleSegmentState fresh = null;
    VehicleSegmentState state = context.vehicles.get(sample.vehicleId());
    if (state == null) {
      fresh = new VehicleSegmentState(sample.vehicleId(), sample.cyclicPosition(), sample.lap(),
          sample.timestampMillis(), settings.historyCapacity());
      state = context.vehicles.putIfAbsent(sample.vehicleId(), fresh);
      if (state == null) {
        return Optional.empty();
      }
    }

    SegmentSpeedResult result;
    synchronized (state) {
      result = apply(context.map, state, sample);
    }
    if (result != null) {
      record(sample.sessionId(), result);
    }
    return Optional.ofNullable(result);
  }

  private SegmentSpeedResult apply(TrackSegmentMap map, VehicleSegmentState state, TelemetrySample sample) {
    state.inPitLane = sample.inPitLane();
    state.onRacingSurface = sample.onRacingSurface();
    state.trafficOverlap = sample.trafficOverlap();

    long now = sample.timestampMillis();
    Optional<TrackSegment> current = map.findSegment(sample.cyclicPosition());
    SegmentSpeedResult result = null;
    if (current.isPresent() && !current.get().segmentId().equals(state.currentSegmentId)) {
      if (state.currentSegmentId != null) {
        Optional<TrackSegment> previous = map.segment(state.currentSegmentId);
        if (previous.isPresent()) {
          result = complete(state, previous.get(), now);
          state.append(result);
        }
      }
      state.enterSegment(current.get().segmentId(), now);
    }
    state.updatePosition(sample.cyclicPosition(), sample.lap(), now);
    return result;
  }

  private SegmentSpeedResult complete(VehicleSegmentState state, TrackSegment segment, long exitMillis) {
    long segmentTimeMs = exitMillis - state.segmentEntryMillis;
    SegmentQualityClassifier.Assessment assessment = classifier.assess(
        state.inPitLane,
        state.onRacingSurface,
        state.trafficOverlap,
        segmentTimeMs,
        segment.lengthMeters(),
        exitMillis);
    return new SegmentSpeedResult(
        state.vehicleId(),
        segment.segmentId(),
        segment.segmentType(),
        segmentTimeMs,
        state.segmentEntryMillis,
        exitMillis,
        assessment.avgSpeed(),
        assessment.quality(),
        assessment.reasons(),
        state.lastLap);
  }

  private void record(String sessionId, SegmentSpeedResult result) {
    metrics.increment("segment.completed");
    metrics.increment("segment.quality." + result.quality().name());
    metrics.observe("segment.timeMs", result.segmentTimeMs());
    if (log.isDebugEnabled()) {
      log.debug("Segment {} completed by {} in {}ms quality={} reasons={}", result.segmentId(),
          result.vehicleId(), result.segmentTimeMs(), result.quality(), result.reasons());
    }
    if (result.quality() == SegmentQuality.CLEAN || result.quality() == SegmentQuality.TRAFFIC_AFFECTED) {
      publisher.publish(SegmentPaceUpdate.from(sessionId, result));
    }
  }

  /**
   * Computes and publishes a pace trend for one vehicle.
   *
   * @param sessionId session id
   * @param vehicleId vehicle id
   * @return trend, or empty when the vehicle is unknown or lacks clean samples
   */
  public Optional<PaceTrend> analyzePaceTrend(String sessionId, String vehicleId) {
    List<SegmentSpeedResult> history = vehicleHistory(sessionId, vehicleId);
    if (history.isEmpty()) {
      metrics.increment("segment.trend.insufficient");
      return Optional.empty();
    }
    Optional<PaceTrend> trend = trendAnalyzer.analyze(sessionId, vehicleId, history, clock.nowMillis());
    if (trend.isEmpty()) {
      metrics.increment("segment.trend.insufficient");
      return trend;
    }
    metrics.increment("segment.trend.emitted");
    publisher.publish(trend.get());
    return trend;
  }

  /**
   * Returns a copy of a vehicle's completed results.
   *
   * @param sessionId session id
   * @param vehicleId vehicle id
   * @return immutable history, oldest first; empty when unknown
   */
  public List<SegmentSpeedResult> vehicleHistory(String sessionId, String vehicleId) {
    if (sessionId == null || vehicleId == null) {
      return List.of();
    }
    TrackContext context = sessions.get(sessionId);
    VehicleSegmentState state = context == null ? null : context.vehicles.get(vehicleId);
    if (state == null) {
      return List.of();
    }
    synchronized (state) {
      return state.historySnapshot();
    }
  }

  /**
   * Lists vehicles with traversal state in a session.
   *
   * @param sessionId session id
   * @return immutable set of vehicle ids
   */
  public Set<String> trackedVehicles(String sessionId) {
    TrackContext context = sessionId == null ? null : sessions.get(sessionId);
    return context == null ? Set.of() : Set.copyOf(context.vehicles.keySet());
  }

  /**
   * Drops a session's map and vehicle states.
   *
   * @param sessionId session id
   * @return {@code true} when the session had state
   */
  public boolean cleanup(String sessionId) {
    if (sessionId == null) {
      return false;
    }
    boolean removed = sessions.remove(sessionId) != null;
    if (removed) {
      log.debug("Segment state released for session {}", sessionId);
    }
    return removed;
  }

  private static final class TrackContext {
    final TrackSegmentMap map;
    final ConcurrentMap<String, VehicleSegmentState> vehicles = new ConcurrentHashMap<>();

    TrackContext(TrackSegmentMap map) {
      this.map = map;
    }
  }
}

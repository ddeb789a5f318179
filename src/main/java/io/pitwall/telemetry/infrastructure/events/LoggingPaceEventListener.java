package io.pitwall.telemetry.infrastructure.events;

import io.pitwall.telemetry.application.events.EventBus;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.domain.confidence.ConfidenceValue;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import io.pitwall.telemetry.domain.pace.SegmentPaceUpdate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs pace updates and trends as structured lines and counts them.
 *
 * @since PITWALL 0.1.0
 */
public final class LoggingPaceEventListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingPaceEventListener.class);

  private final MetricsPort metrics;

  /**
   * Creates a listener.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingPaceEventListener(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Subscribes to both pace event types.
   *
   * @param bus event bus
   * @return handle removing both registrations
   */
  public Subscription attach(EventBus bus) {
    Objects.requireNonNull(bus, "bus");
    List<Subscription> registrations = List.of(
        bus.subscribe(SegmentPaceUpdate.class, this::onUpdate),
        bus.subscribe(PaceTrend.class, this::onTrend));
    return () -> registrations.forEach(Subscription::unsubscribe);
  }

  /**
   * Logs one pace update at DEBUG; updates arrive per segment and per vehicle.
   *
   * @param update update
   */
  public void onUpdate(SegmentPaceUpdate update) {
    Objects.requireNonNull(update, "update");
    metrics.increment("pace.update.logged");
    if (!log.isDebugEnabled()) {
      return;
    }
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("session=" + update.sessionId());
    joiner.add("vehicle=" + update.vehicleId());
    joiner.add("segment=" + update.segmentId());
    joiner.add("lap=" + update.lapNumber());
    joiner.add("timeMs=" + update.segmentTimeMs());
    joiner.add("speed=" + format(update.avgSpeed()));
    joiner.add("quality=" + update.qualityFlag());
    joiner.add("confidence=" + String.format(Locale.ROOT, "%.2f", update.confidenceScore()));
    log.debug("pace.update {}", joiner);
  }

  /**
   * Logs one pace trend at INFO.
   *
   * @param trend trend
   */
  public void onTrend(PaceTrend trend) {
    Objects.requireNonNull(trend, "trend");
    metrics.increment("pace.trend.logged");
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("session=" + trend.sessionId());
    joiner.add("vehicle=" + trend.vehicleId());
    joiner.add("straight=" + format(trend.straightPace()));
    joiner.add("corner=" + format(trend.cornerPace()));
    joiner.add("overall=" + format(trend.overallPace()));
    joiner.add("slope=" + format(trend.paceSlope()));
    joiner.add("degradation=" + trend.degradationType().wireName());
    joiner.add("samples=" + trend.cleanSampleCount() + '/' + trend.totalSampleCount());
    joiner.add("quality=" + trend.dataQualitySummary());
    log.info("pace.trend {}", joiner);
  }

  static String format(ConfidenceValue value) {
    if (!value.isDefined()) {
      return "n/a";
    }
    return String.format(Locale.ROOT, "%.2f@%.2f", value.value().getAsDouble(), value.confidence());
  }
}

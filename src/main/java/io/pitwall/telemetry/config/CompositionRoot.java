package io.pitwall.telemetry.config;

import io.pitwall.telemetry.adapter.kafka.KafkaLiveTransport;
import io.pitwall.telemetry.adapter.kafka.KafkaPaceEventSink;
import io.pitwall.telemetry.application.events.EventBus;
import io.pitwall.telemetry.application.events.SubscriptionGate;
import io.pitwall.telemetry.application.parity.FrameParityTracker;
import io.pitwall.telemetry.application.pipeline.TelemetryRuntime;
import io.pitwall.telemetry.application.port.ClockPort;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.application.port.TelemetrySource;
import io.pitwall.telemetry.application.port.Ticker;
import io.pitwall.telemetry.application.segment.DefaultSegmentMaps;
import io.pitwall.telemetry.application.segment.SegmentSpeedDetector;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import io.pitwall.telemetry.infrastructure.events.LoggingPaceEventListener;
import io.pitwall.telemetry.infrastructure.exec.ExecutorFactories;
import io.pitwall.telemetry.infrastructure.history.NdjsonTimingHistoryStore;
import io.pitwall.telemetry.infrastructure.json.TelemetryJsonCodec;
import io.pitwall.telemetry.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.pitwall.telemetry.infrastructure.source.demo.DemoTelemetrySource;
import io.pitwall.telemetry.infrastructure.source.live.LiveTelemetrySource;
import io.pitwall.telemetry.infrastructure.source.replay.ReplayTelemetrySource;
import io.pitwall.telemetry.infrastructure.time.ScheduledTicker;
import io.pitwall.telemetry.infrastructure.track.TrackMapLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the telemetry runtime and the configured source from a {@link PipelineConfig}.
 * <p><strong>Why:</strong> Keeps construction and ownership of executors, clients and exporters in one place;
 * every component receives its collaborators through its constructor.</p>
 * <p><strong>Role:</strong> Composition root for the {@code run} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the parity tracker, detector, event bus, gate and runtime exactly once.</li>
 *   <li>Build the mode-specific source with its ticker and fetch pool.</li>
 *   <li>Release schedulers, Kafka clients and the metrics exporter on {@link #close()} in reverse order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use from the CLI thread.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final TelemetryJsonCodec codec = new TelemetryJsonCodec();
  private final Deque<AutoCloseable> owned = new ArrayDeque<>();
  private TelemetryRuntime runtime;

  /**
   * Creates a root with the metrics adapter selected by the configuration.
   *
   * @param config validated configuration
   */
  public CompositionRoot(PipelineConfig config) {
    this(config, OpenTelemetryMetricsAdapter.create(config.metrics()), ClockPort.SYSTEM);
    if (metrics instanceof AutoCloseable closeable) {
      owned.push(closeable);
    }
  }

  /**
   * Creates a root with explicit metrics and clock, for tests.
   *
   * @param config validated configuration
   * @param metrics metrics adapter; not closed by this root
   * @param clock wall clock
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the metrics port shared by all components.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the runtime, building it on first use.
   *
   * @return telemetry runtime
   */
  public TelemetryRuntime telemetryRuntime() {
    if (runtime == null) {
      EventBus bus = new EventBus(metrics);
      runtime = new TelemetryRuntime(
          new FrameParityTracker(config.parity(), metrics, clock),
          new SegmentSpeedDetector(config.detector(), bus, clock, metrics),
          bus,
          new SubscriptionGate(config.gate(), metrics),
          clock,
          metrics,
          config.runtime());
    }
    return runtime;
  }

  /**
   * Loads the configured track map, or generates an equal-segment map when no file is configured.
   *
   * @return track map
   * @throws IOException when the map file cannot be read
   */
  public TrackSegmentMap trackMap() throws IOException {
    TrackSettings track = config.track();
    Optional<Path> file = track.mapFile();
    if (file.isPresent()) {
      return TrackMapLoader.load(file.get());
    }
    return DefaultSegmentMaps.equalSegments(track.trackId(), track.trackName(), track.trackLengthMeters());
  }

  /**
   * Builds the source for the configured mode.
   *
   * @return unconnected source
   */
  public TelemetrySource telemetrySource() {
    return switch (config.mode()) {
      case LIVE -> liveSource(config.live().orElseThrow());
      case REPLAY -> replaySource(config.replay().orElseThrow());
      case DEMO -> demoSource(config.demo().orElseThrow());
    };
  }

  /**
   * Subscribes the configured pace consumers (log listener and optional Kafka sink) to the runtime bus.
   */
  public void attachPaceConsumers() {
    EventBus bus = telemetryRuntime().bus();
    owned.push(new LoggingPaceEventListener(metrics).attach(bus));
    config.paceSink().ifPresent(sinkConfig -> {
      KafkaPaceEventSink sink = new KafkaPaceEventSink(sinkConfig.kafkaBootstrap(), sinkConfig.topic(), metrics);
      owned.push(sink);
      owned.push(sink.attach(bus));
      log.info("Publishing pace events to Kafka topic {}", sinkConfig.topic());
    });
  }

  private TelemetrySource liveSource(LiveSourceConfig live) {
    KafkaLiveTransport transport =
        new KafkaLiveTransport(live.kafkaBootstrap(), live.timingTopic(), live.frameTopic(), metrics);
    return new LiveTelemetrySource(transport, live.updateRateHz(), metrics);
  }

  private TelemetrySource replaySource(ReplaySourceConfig replay) {
    ExecutorService fetchPool = ExecutorFactories.newFetchPool(replay.fetchThreads(), 4, "pitwall-replay-fetch");
    owned.push(() -> shutdown(fetchPool));
    return new ReplayTelemetrySource(
        new NdjsonTimingHistoryStore(replay.historyDir(), codec),
        replay.window(),
        replay.rate(),
        ticker("pitwall-replay-tick"),
        replay.tickInterval(),
        fetchPool,
        metrics);
  }

  private TelemetrySource demoSource(DemoSourceConfig demo) {
    return new DemoTelemetrySource(
        ticker("pitwall-demo-tick"), demo.tickInterval(), demo.seed(), demo.carCount(), clock, metrics);
  }

  private Ticker ticker(String threadPrefix) {
    ScheduledExecutorService scheduler = ExecutorFactories.newTickScheduler(threadPrefix);
    owned.push(() -> shutdown(scheduler));
    return new ScheduledTicker(scheduler);
  }

  /**
   * Releases everything this root created, newest first.
   */
  @Override
  public void close() {
    while (!owned.isEmpty()) {
      AutoCloseable resource = owned.pop();
      try {
        resource.close();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while releasing {}", resource, ex);
      } catch (Exception ex) {
        log.warn("Failed to release {}", resource, ex);
      }
    }
  }

  private static void shutdown(ExecutorService executor) throws InterruptedException {
    executor.shutdownNow();
    if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
      log.warn("Executor did not terminate within 2s");
    }
  }
}

package io.pitwall.telemetry.api;

import io.pitwall.telemetry.application.parity.ParitySnapshot;
import io.pitwall.telemetry.application.pipeline.AttachedSource;
import io.pitwall.telemetry.application.pipeline.TelemetryRuntime;
import io.pitwall.telemetry.application.port.TelemetrySource;
import io.pitwall.telemetry.config.CompositionRoot;
import io.pitwall.telemetry.config.ConfigMerger;
import io.pitwall.telemetry.config.DefaultsForMode;
import io.pitwall.telemetry.config.PipelineConfig;
import io.pitwall.telemetry.config.YamlConfigLoader;
import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import io.pitwall.telemetry.infrastructure.json.TelemetryJsonCodec;
import io.pitwall.telemetry.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * {@code run} command: attaches one session to a live, replay or demo source and prints parity diagnostics at exit.
 *
 * @since PITWALL 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: run mode=live|replay|demo sessionId=ID [config=PATH] [durationSec=N] [trendIntervalSec=N] "
          + "[source options] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      PITWALL run

      Usage:
        run mode=live|replay|demo sessionId=ID [options]

      Common options:
        config=PATH                 YAML file with common and per-mode sections
        durationSec=N               Stop after N seconds (0 = until the source stops)
        trendIntervalSec=N          Seconds between pace trend passes (default 10)
        trackMap=PATH               YAML track map; otherwise a 10-segment map is generated
        trackId=ID trackName=NAME trackLengthMeters=M   Generated map parameters
        metricsExporter=otlp|none   OpenTelemetry export (default none)
        kafkaPaceTopic=TOPIC        Publish pace events to Kafka (requires kafkaBootstrap)

      Live:
        kafkaBootstrap=HOST:PORT    Relay brokers (required)
        kafkaTimingTopic=TOPIC kafkaFrameTopic=TOPIC updateRateHz=N

      Replay:
        historyDir=PATH             NDJSON history root (<dir>/<sessionId>/timing.ndjson)
        replayStart=T replayEnd=T   Epoch millis or ISO-8601 instants (required)
        playbackRate=1|2|5|10 tickIntervalMs=N

      Demo:
        seed=TEXT carCount=2..99 tickIntervalMs=N

      Flags:
        --dry-run                   Validate configuration and print the plan
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private RunCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run command");
    }

    Map<String, String> cli;
    SourceMode mode;
    try {
      cli = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      mode = SourceMode.fromString(cli.get("mode"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--dry-run")) {
      cli.put("dryRun", "true");
    }
    if (input.verbose()) {
      cli.put("verbose", "true");
    }

    PipelineConfig config;
    try {
      Optional<Map<String, String>> yaml = loadYaml(cli.remove("config"), mode);
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          mode.configName(), yaml, cli, DefaultsForMode.asFlatMap(mode.configName()), log::warn);
      config = PipelineConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }
    if (config.verbose() && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    if (config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    MDC.put("sessionId", config.sessionId());
    try (CompositionRoot root = new CompositionRoot(config)) {
      return execute(root, config);
    } catch (IOException ex) {
      log.error("Session I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Session configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Run interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      MDC.remove("sessionId");
    }
  }

  static ExitCode execute(CompositionRoot root, PipelineConfig config) throws IOException, InterruptedException {
    String sessionId = config.sessionId();
    TelemetryRuntime runtime = root.telemetryRuntime();
    TrackSegmentMap map = root.trackMap();
    runtime.setTrackMap(sessionId, map);
    root.attachPaceConsumers();
    TelemetrySource source = root.telemetrySource();
    log.info("Starting {} session {} on track {}", config.mode().configName(), sessionId, map.trackId());
    try (AttachedSource attached = runtime.attach(source, sessionId)) {
      new SessionRunner().run(runtime, attached, config.duration(), config.trendInterval());
    } finally {
      printParity(runtime, sessionId);
      runtime.endSession(sessionId);
    }
    return ExitCode.SUCCESS;
  }

  private static void printParity(TelemetryRuntime runtime, String sessionId) {
    Optional<ParitySnapshot> snapshot = runtime.paritySnapshot(sessionId);
    if (snapshot.isEmpty()) {
      log.warn("No parity data recorded for session {}", sessionId);
      return;
    }
    CliPrinter.println(new TelemetryJsonCodec().encodeParity(snapshot.get()));
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, SourceMode mode) throws IOException {
    if (configPath == null || configPath.isBlank()) {
      return Optional.empty();
    }
    Path path = Path.of(configPath.trim());
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("config file not found: " + path);
    }
    return YamlConfigLoader.load(path, mode.configName());
  }

  private static void printDryRunPlan(PipelineConfig config) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Mode", config.mode().configName());
    rows.put("Session", config.sessionId());
    rows.put("Duration", config.duration().isZero() ? "until source stops" : config.duration().toString());
    rows.put("Trend interval", config.trendInterval().toString());
    rows.put("Track", config.track().mapFile().map(Path::toString)
        .orElse("generated " + config.track().trackId() + " (" + config.track().trackLengthMeters() + " m)"));
    rows.put("Metrics exporter", config.metrics().exporter().name().toLowerCase(Locale.ROOT));
    rows.put("Pace sink", config.paceSink().map(sink -> sink.topic() + " @ " + sink.kafkaBootstrap()).orElse(null));
    config.live().ifPresent(live -> {
      rows.put("Kafka bootstrap", live.kafkaBootstrap());
      rows.put("Topics", live.timingTopic() + ", " + live.frameTopic());
      rows.put("Update rate", live.updateRateHz() + " Hz");
    });
    config.replay().ifPresent(replay -> {
      rows.put("History", replay.historyDir().toString());
      rows.put("Window", replay.window().startMillis() + " .. " + replay.window().endMillis());
      rows.put("Playback rate", replay.rate().multiplier() + "x");
    });
    config.demo().ifPresent(demo -> {
      rows.put("Seed", demo.seed());
      rows.put("Cars", demo.carCount() == null ? "derived from seed" : demo.carCount().toString());
    });
    CliPrinter.printPlan("Run dry-run: no source will be connected.", rows);
  }
}

package io.pitwall.telemetry.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.pitwall.telemetry.application.port.MetricsPort;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards counters and observations to OpenTelemetry.
 * <p><strong>Behavior:</strong> Each distinct key lazily creates one counter or histogram whose name is
 * the sanitized key; the original key travels as the {@code pitwall.metric.key} attribute.</p>
 * <p><strong>Thread-safety:</strong> Instrument caches are concurrent; safe for use from any thread.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("pitwall.metric.key");
  private static final String FALLBACK_METRIC_NAME = "pitwall.metric";

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
  }

  /**
   * Creates the metrics port selected by the settings.
   *
   * @param settings export settings
   * @return an exporting adapter, or {@link MetricsPort#NO_OP} when export is disabled or fails to start
   */
  public static MetricsPort create(MetricsSettings settings) {
    if (settings.exporter() == MetricsSettings.Exporter.NONE) {
      log.info("Metrics export disabled (metricsExporter=none)");
      return MetricsPort.NO_OP;
    }
    try {
      return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.start(settings));
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return MetricsPort.NO_OP;
    }
  }

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter).add();
  }

  @Override
  public void observe(String key, long value) {
    histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram).record(value);
  }

  /** Pushes buffered metrics to the exporter. */
  public void flush() {
    handle.forceFlush();
  }

  @Override
  public void close() {
    handle.close();
  }

  private Counter createCounter(String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("PITWALL counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram createHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("PITWALL observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    String trimmed = key == null ? "" : key.trim();
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = trimmed.toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private record Counter(LongCounter counter, Attributes attributes) {
    void add() {
      counter.add(1, attributes);
    }
  }

  private record Histogram(LongHistogram histogram, Attributes attributes) {
    void record(long value) {
      histogram.record(value, attributes);
    }
  }
}

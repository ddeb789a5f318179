package io.pitwall.telemetry.infrastructure.metrics;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics export configuration resolved from the effective pipeline configuration.
 *
 * @param exporter exporter selection
 * @param endpoint OTLP gRPC endpoint; used only when {@code exporter} is {@link Exporter#OTLP}
 * @param resourceAttributes extra resource attributes attached to every metric
 * @param exportInterval interval between periodic exports
 * @since PITWALL 0.1.0
 */
public record MetricsSettings(
    Exporter exporter, String endpoint, Map<String, String> resourceAttributes, Duration exportInterval) {
  private static final Logger log = LoggerFactory.getLogger(MetricsSettings.class);

  /** Endpoint used when none is configured. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public MetricsSettings {
    exporter = Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = Map.copyOf(Objects.requireNonNull(resourceAttributes, "resourceAttributes"));
    exportInterval = exportInterval == null ? Duration.ofSeconds(30) : exportInterval;
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /**
   * Settings with export disabled.
   *
   * @return disabled settings
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings(Exporter.NONE, DEFAULT_ENDPOINT, Map.of(), Duration.ofSeconds(30));
  }

  /**
   * Builds settings from raw configuration strings.
   *
   * @param exporter {@code otlp} or {@code none}
   * @param endpoint OTLP endpoint; default when blank
   * @param resourceAttributes comma-separated {@code key=value} pairs; may be blank
   * @return settings
   * @throws IllegalArgumentException when the exporter value is unknown
   */
  public static MetricsSettings fromValues(String exporter, String endpoint, String resourceAttributes) {
    return new MetricsSettings(
        Exporter.from(exporter), endpoint, parseResourceAttributes(resourceAttributes), Duration.ofSeconds(30));
  }

  static Map<String, String> parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Map.of();
    }
    Map<String, String> out = new LinkedHashMap<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      String key = idx <= 0 ? "" : trimmed.substring(0, idx).trim();
      String value = idx <= 0 ? "" : trimmed.substring(idx + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        continue;
      }
      out.put(key, value);
    }
    return out;
  }

  /** Exporter selection. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive; blank means {@code otlp}
     * @return exporter
     * @throws IllegalArgumentException for any other value
     */
    public static Exporter from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + raw + ")");
      };
    }
  }
}

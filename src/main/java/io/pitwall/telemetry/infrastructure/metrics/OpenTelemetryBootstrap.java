package io.pitwall.telemetry.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for PITWALL metrics.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.pitwall.telemetry";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Starts a provider exporting over OTLP gRPC.
   *
   * @param settings export settings; exporter must be OTLP
   * @return provider handle
   */
  static MeterHandle start(MetricsSettings settings) {
    Objects.requireNonNull(settings, "settings");
    OtlpGrpcMetricExporter exporter =
        OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
    MetricReader reader = PeriodicMetricReader.builder(exporter)
        .setInterval(settings.exportInterval())
        .build();
    MeterHandle handle = build(reader, settings.resourceAttributes());
    log.info("OpenTelemetry metrics exporting to {} every {}s", settings.endpoint(),
        settings.exportInterval().toSeconds());
    return handle;
  }

  /**
   * Builds a provider over a caller-supplied reader, such as an in-memory reader in tests.
   *
   * @param reader metric reader
   * @return provider handle
   */
  static MeterHandle forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Map.of());
  }

  private static MeterHandle build(MetricReader reader, Map<String, String> extraAttributes) {
    String version = detectServiceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version, extraAttributes))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new MeterHandle(provider, meter);
  }

  private static Resource buildResource(String version, Map<String, String> extraAttributes) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "pitwall")
        .put(SERVICE_NAMESPACE, "io.pitwall")
        .put(SERVICE_VERSION, version)
        .put(SERVICE_INSTANCE_ID, ManagementFactory.getRuntimeMXBean().getName());
    extraAttributes.forEach((key, value) -> builder.put(AttributeKey.stringKey(key), value));
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null && !pkg.getImplementationVersion().isBlank()) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/io.pitwall/pitwall-telemetry/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  /** Owns a meter provider and the meter created from it. */
  static final class MeterHandle implements AutoCloseable {
    private final SdkMeterProvider provider;
    private final Meter meter;

    MeterHandle(SdkMeterProvider provider, Meter meter) {
      this.provider = provider;
      this.meter = meter;
    }

    Meter meter() {
      return meter;
    }

    void forceFlush() {
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      CompletableResultCode shutdown = provider.shutdown();
      shutdown.join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}

package io.pitwall.telemetry.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import io.pitwall.telemetry.application.port.MetricsPort;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTR = AttributeKey.stringKey("pitwall.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementExportsLowerCasedCounterWithOriginalKey() {
    adapter.increment("parity.outOfOrder");
    adapter.increment("parity.outOfOrder");
    adapter.flush();

    MetricData counter = find(reader.collectAllMetrics(), "parity.outoforder").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("parity.outOfOrder", point.getAttributes().get(KEY_ATTR));
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("segment.timeMs", 20_000L);
    adapter.observe("segment.timeMs", 22_000L);
    adapter.flush();

    MetricData histogram = find(reader.collectAllMetrics(), "segment.timems").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(42_000.0, point.getSum());
  }

  @Test
  void sanitizeNameReplacesIllegalCharacters() {
    assertEquals("segment.quality.traffic_affected",
        OpenTelemetryMetricsAdapter.sanitizeName("segment.quality.TRAFFIC_AFFECTED"));
    assertEquals("m1st_metric", OpenTelemetryMetricsAdapter.sanitizeName("1st metric"));
    assertEquals("pitwall.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  @Test
  void exporterNoneYieldsNoOpPort() {
    MetricsPort port = OpenTelemetryMetricsAdapter.create(MetricsSettings.disabled());

    assertSame(MetricsPort.NO_OP, port);
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(m -> m.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match;
  }
}

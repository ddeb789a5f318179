package io.pitwall.telemetry.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsSettingsTest {

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    MetricsSettings settings = MetricsSettings.fromValues("otlp", " http://collector:4317 ",
        "deployment.environment=test, broken, =x, team = pit");

    assertEquals(MetricsSettings.Exporter.OTLP, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals(Map.of("deployment.environment", "test", "team", "pit"), settings.resourceAttributes());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    MetricsSettings settings = MetricsSettings.fromValues("none", "", null);

    assertEquals(MetricsSettings.Exporter.NONE, settings.exporter());
    assertEquals(MetricsSettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals(Duration.ofSeconds(30), settings.exportInterval());
  }

  @Test
  void rejectsUnknownExporter() {
    assertThrows(IllegalArgumentException.class, () -> MetricsSettings.Exporter.from("prometheus"));
  }
}

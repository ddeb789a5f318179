package io.pitwall.telemetry.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void commonDefaultsApplyToEveryMode() {
    for (String mode : new String[] {"live", "replay", "demo"}) {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
      assertEquals("none", defaults.get("metricsExporter"), mode);
      assertEquals("1000", defaults.get("parity.identityWindow"), mode);
      assertEquals("0", defaults.get("gate.maxRateHz.anonymous"), mode);
      assertEquals("10", defaults.get("gate.maxRateHz.driver"), mode);
    }
  }

  @Test
  void liveDefaultsNameBothTopics() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("LIVE");

    assertEquals("pitwall.timing", defaults.get("kafkaTimingTopic"));
    assertEquals("pitwall.frames", defaults.get("kafkaFrameTopic"));
    assertFalse(defaults.containsKey("historyDir"));
  }

  @Test
  void replayDefaultsPointAtUserHome() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("replay");

    assertTrue(defaults.get("historyDir").contains(".pitwall"));
    assertEquals("1", defaults.get("playbackRate"));
  }

  @Test
  void demoDefaultsProvideSession() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("demo");

    assertEquals("demo", defaults.get("sessionId"));
    assertEquals("default", defaults.get("seed"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("warmup"));
  }
}

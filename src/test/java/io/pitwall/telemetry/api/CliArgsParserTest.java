package io.pitwall.telemetry.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"mode=demo", " sessionId = race-1 ", "seed="});

    assertEquals(Map.of("mode", "demo", "sessionId", "race-1", "seed", ""), map);
    assertEquals("mode", map.keySet().iterator().next());
  }

  @Test
  void valueMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=a=1,b=2"});

    assertEquals("a=1,b=2", map.get("otelResourceAttributes"));
  }

  @Test
  void laterDuplicatesWin() {
    assertEquals("2", CliArgsParser.toMap(new String[] {"playbackRate=1", "playbackRate=2"}).get("playbackRate"));
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }

  @Test
  void rejectsMissingSeparatorAndBadKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"demo"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=demo"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"mo de=demo"}));
  }
}

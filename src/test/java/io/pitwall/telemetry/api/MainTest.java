package io.pitwall.telemetry.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter out;

  @BeforeEach
  void setUp() {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(null));
  }

  @Test
  void unknownCommandIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"qualify"}));
    assertTrue(out.toString().contains("usage: pitwall"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("trackmap"));
  }

  @Test
  void dispatchesToSubcommandsCaseInsensitively() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"RUN", "mode=demo", "--dry-run"}));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"trackmap", "segments=4"}));
  }
}

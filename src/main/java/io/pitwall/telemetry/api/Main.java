package io.pitwall.telemetry.api;

import io.pitwall.telemetry.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Command dispatcher for the {@code pitwall} CLI.
 * <p><strong>Responsibilities:</strong> Handle global {@code --help}/{@code --verbose} and route to
 * {@code run} or {@code trackmap}.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: pitwall <run|trackmap> [options]";
  private static final String HELP_TEXT = """
      PITWALL telemetry core

      Usage:
        pitwall <command> [options]

      Commands:
        run        Attach a live, replay or demo session (run --help for details)
        trackmap   Print a generated or YAML track map as JSON

      Global flags:
        --help     Show this message
        --verbose  Enable DEBUG logging before dispatching
      """;

  private Main() {}

  /**
   * Entry point; exits the JVM with the command's {@link ExitCode}.
   *
   * @param args command followed by its arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    if (safeArgs.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = safeArgs[0] == null ? "" : safeArgs[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, 1, safeArgs.length);
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "trackmap" -> TrackMapCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(delegateArgs);
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}

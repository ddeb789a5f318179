package io.pitwall.telemetry.api;

/**
 * Process exit codes returned by the CLI commands.
 *
 * @since PITWALL 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments could not be parsed or were rejected. */
  INVALID_ARGS(2),
  /** A file, history store or transport failed. */
  IO_ERROR(3),
  /** Configuration was readable but invalid. */
  CONFIG_ERROR(4),
  /** Unexpected failure while running. */
  RUNTIME_FAILURE(5),
  /** The run was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process exit code.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}

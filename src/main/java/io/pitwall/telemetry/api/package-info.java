/**
 * <strong>Purpose:</strong> Command line entry points: {@code run} and {@code trackmap}.
 * <p><strong>Errors:</strong> Failures map to {@link io.pitwall.telemetry.api.ExitCode}; stack traces go to the log,
 * results go to stdout through {@link io.pitwall.telemetry.api.CliPrinter}.</p>
 *
 * @since PITWALL 0.1.0
 */
package io.pitwall.telemetry.api;

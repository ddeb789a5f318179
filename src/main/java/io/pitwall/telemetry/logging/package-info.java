/**
 * Logging utilities: verbosity control for the CLI and bounded rendering of external strings.
 *
 * @since PITWALL 0.1.0
 */
package io.pitwall.telemetry.logging;

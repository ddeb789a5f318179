/**
 * <strong>Purpose:</strong> Configuration for the {@code run} command: YAML loading, per-mode defaults, precedence
 * merging, typed settings and the composition root.
 * <p><strong>Precedence:</strong> CLI arguments override YAML, YAML overrides {@link
 * io.pitwall.telemetry.config.DefaultsForMode}.</p>
 * <p><strong>Errors:</strong> Invalid values raise {@link IllegalArgumentException} before any source connects.</p>
 *
 * @since PITWALL 0.1.0
 */
package io.pitwall.telemetry.config;

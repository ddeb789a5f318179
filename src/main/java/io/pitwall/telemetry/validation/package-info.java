/**
 * <strong>Purpose:</strong> Input validation for CLI arguments, YAML configuration and settings records.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 * <p><strong>Security:</strong> Rejects control characters in identifiers that reach brokers or paths.</p>
 */
package io.pitwall.telemetry.validation;

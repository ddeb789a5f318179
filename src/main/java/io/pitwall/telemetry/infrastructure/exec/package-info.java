/**
 * Executor construction helpers with named daemon threads.
 */
package io.pitwall.telemetry.infrastructure.exec;

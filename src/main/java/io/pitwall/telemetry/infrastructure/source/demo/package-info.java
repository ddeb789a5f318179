/**
 * Seeded synthetic race used for demos and tests; identical seeds produce identical sessions.
 */
package io.pitwall.telemetry.infrastructure.source.demo;

/**
 * Segment speed derivation: virtual speed traps, quality grading and pace trend analysis.
 * <p><strong>Concurrency:</strong> Per-session contexts are swapped atomically; vehicle states lock
 * themselves while a sample is applied.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code segment.*}.</p>
 */
package io.pitwall.telemetry.application.segment;

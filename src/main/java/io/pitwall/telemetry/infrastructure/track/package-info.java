/**
 * YAML loading of hand-authored track segment maps.
 */
package io.pitwall.telemetry.infrastructure.track;

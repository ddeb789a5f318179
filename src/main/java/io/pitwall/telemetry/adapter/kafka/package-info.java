/**
 * Kafka adapters: the live relay transport (consumer) and the pace event sink (producer).
 */
package io.pitwall.telemetry.adapter.kafka;

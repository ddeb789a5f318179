/**
 * JSON encoding and decoding built on the Jackson streaming API.
 */
package io.pitwall.telemetry.infrastructure.json;

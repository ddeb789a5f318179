package io.pitwall.telemetry.adapter.kafka;

import io.pitwall.telemetry.application.events.EventBus;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import io.pitwall.telemetry.domain.pace.SegmentPaceUpdate;
import io.pitwall.telemetry.infrastructure.json.TelemetryJsonCodec;
import io.pitwall.telemetry.validation.Strings;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Publishes pace updates and pace trends to a Kafka topic as JSON.
 * <p><strong>Why:</strong> Strategy dashboards consume pace events off-host without linking the runtime.</p>
 * <p><strong>Role:</strong> Adapter on the sink side (event bus to Kafka).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Subscribe to {@link SegmentPaceUpdate} and {@link PaceTrend} on an {@link EventBus}.</li>
 *   <li>Key records by {@code sessionId:vehicleId} so each vehicle stays ordered within a partition.</li>
 *   <li>Flush and close the producer on shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer} is
 * thread-safe.</p>
 * <p><strong>Observability:</strong> Emits {@code sink.kafka.sent} and {@code sink.kafka.error}.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class KafkaPaceEventSink implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(KafkaPaceEventSink.class);

  private final Producer<String, String> producer;
  private final String topic;
  private final TelemetryJsonCodec codec;
  private final MetricsPort metrics;

  /**
   * Creates a sink backed by a {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic topic receiving pace events
   * @param metrics metrics sink
   */
  public KafkaPaceEventSink(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, new TelemetryJsonCodec(), metrics);
  }

  KafkaPaceEventSink(Producer<String, String> producer, String topic, TelemetryJsonCodec codec,
      MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("topic", topic);
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Subscribes this sink to pace events on the bus.
   *
   * @param bus event bus to listen on
   * @return handle removing both registrations
   */
  public Subscription attach(EventBus bus) {
    Objects.requireNonNull(bus, "bus");
    List<Subscription> registrations = List.of(
        bus.subscribe(SegmentPaceUpdate.class, this::publish),
        bus.subscribe(PaceTrend.class, this::publish));
    return () -> registrations.forEach(Subscription::unsubscribe);
  }

  /**
   * Sends one pace update.
   *
   * @param update update to send; {@code null} is ignored
   */
  public void publish(SegmentPaceUpdate update) {
    if (update == null) {
      return;
    }
    send(recordKey(update.sessionId(), update.vehicleId()), codec.encodePaceUpdate(update));
  }

  /**
   * Sends one pace trend.
   *
   * @param trend trend to send; {@code null} is ignored
   */
  public void publish(PaceTrend trend) {
    if (trend == null) {
      return;
    }
    send(recordKey(trend.sessionId(), trend.vehicleId()), codec.encodePaceTrend(trend));
  }

  /** Flushes outstanding sends. */
  public void flush() {
    producer.flush();
  }

  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private void send(String key, String json) {
    producer.send(new ProducerRecord<>(topic, key, json), (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("sink.kafka.error");
        log.warn("Failed to publish pace event {} to {}", key, topic, ex);
      } else {
        metrics.increment("sink.kafka.sent");
      }
    });
  }

  static String recordKey(String sessionId, String vehicleId) {
    return sessionId + ':' + vehicleId;
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}

package io.pitwall.telemetry.adapter.kafka;

import io.pitwall.telemetry.application.port.LiveTransport;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.infrastructure.exec.ExecutorFactories;
import io.pitwall.telemetry.infrastructure.json.TelemetryJsonCodec;
import io.pitwall.telemetry.validation.Strings;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link LiveTransport} that consumes timing snapshots and frames from Kafka.
 * <p><strong>Why:</strong> Relay agents publish simulator output to Kafka; the live source only needs the
 * records of the session it is attached to.</p>
 * <p><strong>Role:</strong> Adapter on the inbound side (relay topics to live source).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Subscribe to one timing topic and one frame topic.</li>
 *   <li>Keep records keyed by the attached session id and decode them as JSON.</li>
 *   <li>Run the poll loop on a dedicated thread and close the consumer on that thread.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@code open} creates its own consumer and poll loop; once the
 * loop runs, {@link #close()} only signals it through {@link Consumer#wakeup()} and the loop closes its
 * own consumer. Records still in a polled batch are dropped after close.</p>
 * <p><strong>Observability:</strong> Emits {@code live.kafka.records} and {@code live.kafka.decode.error};
 * logs consumer failures at error and marks the transport {@link Status#FAILED}.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class KafkaLiveTransport implements LiveTransport {
  private static final Logger log = LoggerFactory.getLogger(KafkaLiveTransport.class);

  private final Supplier<Consumer<String, String>> consumerFactory;
  private final String timingTopic;
  private final String frameTopic;
  private final Executor pollExecutor;
  private final TelemetryJsonCodec codec;
  private final MetricsPort metrics;

  private volatile Status status = Status.IDLE;
  private Connection current;

  /**
   * Creates a transport backed by a {@link KafkaConsumer}.
   *
   * @param bootstrapServers comma-separated bootstrap servers; must not be blank
   * @param timingTopic topic carrying timing snapshots
   * @param frameTopic topic carrying thin frames
   * @param metrics metrics sink
   */
  public KafkaLiveTransport(String bootstrapServers, String timingTopic, String frameTopic, MetricsPort metrics) {
    this(consumerFactory(bootstrapServers), timingTopic, frameTopic,
        runnable -> ExecutorFactories.daemonFactory("pitwall-live-kafka", "pitwall-live-kafka")
            .newThread(runnable).start(),
        new TelemetryJsonCodec(), metrics);
  }

  KafkaLiveTransport(
      Supplier<Consumer<String, String>> consumerFactory,
      String timingTopic,
      String frameTopic,
      Executor pollExecutor,
      TelemetryJsonCodec codec,
      MetricsPort metrics) {
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
    this.timingTopic = Strings.sanitizeTopic("timingTopic", timingTopic);
    this.frameTopic = Strings.sanitizeTopic("frameTopic", frameTopic);
    if (this.timingTopic.equals(this.frameTopic)) {
      throw new IllegalArgumentException("timingTopic and frameTopic must differ");
    }
    this.pollExecutor = Objects.requireNonNull(pollExecutor, "pollExecutor");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public synchronized void open(String sessionId, int updateRateHz, Handler handler) throws IOException {
    Objects.requireNonNull(handler, "handler");
    if (updateRateHz <= 0) {
      throw new IllegalArgumentException("updateRateHz must be positive (was " + updateRateHz + ")");
    }
    if (status == Status.CONNECTED || status == Status.CONNECTING) {
      throw new IllegalStateException("transport already open for session " + current.sessionId);
    }
    status = Status.CONNECTING;
    Consumer<String, String> created;
    try {
      created = consumerFactory.get();
      created.subscribe(List.of(timingTopic, frameTopic));
    } catch (KafkaException ex) {
      status = Status.FAILED;
      throw new IOException("Unable to subscribe to " + timingTopic + "," + frameTopic, ex);
    }
    Connection connection = new Connection(created, sessionId, handler,
        Duration.ofMillis(Math.max(1L, 1000L / updateRateHz)));
    current = connection;
    status = Status.CONNECTED;
    log.info("Kafka live transport subscribed to {} and {} for session {}", timingTopic, frameTopic, sessionId);
    pollExecutor.execute(() -> pollLoop(connection));
  }

  private void pollLoop(Connection connection) {
    connection.loopActive = true;
    try {
      while (connection.running) {
        connection.pollOnce();
      }
    } catch (WakeupException ex) {
      if (connection.running) {
        failed(connection);
        log.error("Kafka live transport woken up unexpectedly", ex);
      }
    } catch (KafkaException ex) {
      failed(connection);
      log.error("Kafka live transport failed for session {}", connection.sessionId, ex);
    } finally {
      connection.loopActive = false;
      connection.closeConsumer();
    }
  }

  private synchronized void failed(Connection connection) {
    connection.running = false;
    if (current == connection) {
      status = Status.FAILED;
    }
  }

  /**
   * Polls the current connection once and dispatches matching records.
   *
   * @return number of records delivered to the handler
   */
  int pollOnce() {
    Connection connection;
    synchronized (this) {
      connection = current;
    }
    return connection == null ? 0 : connection.pollOnce();
  }

  @Override
  public Status status() {
    return status;
  }

  @Override
  public void close() {
    Connection connection;
    synchronized (this) {
      connection = current;
      current = null;
      status = Status.CLOSED;
    }
    if (connection == null) {
      return;
    }
    connection.running = false;
    if (connection.loopActive) {
      connection.consumer.wakeup();
    } else {
      connection.closeConsumer();
    }
    log.info("Kafka live transport closed for session {}", connection.sessionId);
  }

  /** One subscription; its consumer is closed only by its own loop or by {@link #close()}. */
  private final class Connection {
    private final Consumer<String, String> consumer;
    private final String sessionId;
    private final Handler handler;
    private final Duration pollTimeout;
    private volatile boolean running = true;
    private volatile boolean loopActive;
    private boolean closed;

    Connection(Consumer<String, String> consumer, String sessionId, Handler handler, Duration pollTimeout) {
      this.consumer = consumer;
      this.sessionId = sessionId;
      this.handler = handler;
      this.pollTimeout = pollTimeout;
    }

    int pollOnce() {
      synchronized (this) {
        if (closed) {
          return 0;
        }
      }
      ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
      int delivered = 0;
      for (ConsumerRecord<String, String> record : records) {
        if (!running) {
          break;
        }
        if (!sessionId.equals(record.key()) || record.value() == null) {
          continue;
        }
        try {
          if (timingTopic.equals(record.topic())) {
            handler.onTiming(codec.decodeTiming(record.value()));
          } else {
            handler.onFrame(codec.decodeFrame(record.value()));
          }
          delivered++;
        } catch (IllegalArgumentException ex) {
          metrics.increment("live.kafka.decode.error");
          log.warn("Skipping malformed record {}-{}@{}: {}", record.topic(), record.partition(), record.offset(),
              ex.getMessage());
        }
      }
      if (delivered > 0) {
        metrics.observe("live.kafka.records", delivered);
      }
      return delivered;
    }

    synchronized void closeConsumer() {
      if (closed) {
        return;
      }
      closed = true;
      try {
        consumer.close(Duration.ofSeconds(5));
      } catch (KafkaException ex) {
        log.warn("Kafka consumer did not close cleanly", ex);
      }
    }
  }

  private static Supplier<Consumer<String, String>> consumerFactory(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    return () -> {
      Properties props = new Properties();
      props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
      props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
      props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
      props.put(ConsumerConfig.GROUP_ID_CONFIG, "pitwall-live-" + UUID.randomUUID());
      props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
      props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
      props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 500);
      return new KafkaConsumer<>(props);
    };
  }
}

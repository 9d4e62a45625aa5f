package ca.gc.cra.courier.adapter.kafka;

import ca.gc.cra.courier.application.port.MessageWriter;
import ca.gc.cra.courier.application.port.PublishException;
import ca.gc.cra.courier.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MessageWriter} publishing to one Kafka topic.
 * <p><strong>Role:</strong> Sink-side adapter used for application publishes and for retry/dead-letter
 * republication.</p>
 * <p><strong>Thread-safety:</strong> Mirrors the {@link Producer}; the default {@link KafkaProducer} is thread-safe.</p>
 * <p><strong>Performance:</strong> Every write waits for the broker acknowledgement ({@code acks=all}).</p>
 * <p><strong>Observability:</strong> Logs publish coordinates at DEBUG; failures surface as {@link PublishException}.</p>
 *
 * @since 0.1.0
 */
public final class KafkaMessageWriter implements MessageWriter {
  private static final Logger log = LoggerFactory.getLogger(KafkaMessageWriter.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Producer<byte[], byte[]> producer;
  private final String topic;

  /**
   * Creates a writer with its own Kafka producer.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic destination topic; must be a valid topic name
   * @throws IllegalArgumentException if any parameter is blank or invalid
   */
  public KafkaMessageWriter(String bootstrapServers, String topic) {
    this(createProducer(bootstrapServers), topic);
  }

  KafkaMessageWriter(Producer<byte[], byte[]> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic(topic);
  }

  @Override
  public String topic() {
    return topic;
  }

  @Override
  public void writeWithRetryCounter(byte[] key, byte[] value, int retryCounter) throws PublishException {
    ProducerRecord<byte[], byte[]> record =
        new ProducerRecord<>(topic, null, key, value, KafkaRecords.retryHeaders(retryCounter));
    try {
      RecordMetadata metadata = producer.send(record).get();
      log.debug("Published to {} partition {} offset {} (retry {})",
          topic, metadata.partition(), metadata.offset(), retryCounter);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      throw new PublishException("publish to topic " + topic + " failed", cause);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new PublishException("publish to topic " + topic + " was interrupted", ex);
    } catch (KafkaException ex) {
      throw new PublishException("publish to topic " + topic + " failed", ex);
    }
  }

  @Override
  public void close() {
    try {
      producer.flush();
    } catch (KafkaException ex) {
      log.warn("Kafka producer flush for topic {} failed during shutdown", topic, ex);
    } finally {
      producer.close(CLOSE_TIMEOUT);
    }
  }

  private static Producer<byte[], byte[]> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("bootstrapServers", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}

package ca.gc.cra.courier.adapter.kafka;

import ca.gc.cra.courier.application.port.BrokerClient;
import ca.gc.cra.courier.application.port.BrokerClosedException;
import ca.gc.cra.courier.application.port.MessagingException;
import ca.gc.cra.courier.domain.msg.Message;
import ca.gc.cra.courier.validation.Strings;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link BrokerClient} backed by a Kafka consumer group member.
 * <p><strong>Why:</strong> Gives the consume loop blocking single-message fetches and explicit commits on top of
 * Kafka's batch polling API.</p>
 * <p><strong>Role:</strong> Source-side adapter owned by one reader.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Subscribe to one topic with auto-commit disabled.</li>
 *   <li>Buffer polled batches and hand them out one message at a time.</li>
 *   <li>Commit {@code offset + 1} per partition, synchronously.</li>
 *   <li>Wake and close the consumer when {@link #close()} is called from another thread.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The consumer is only touched under an internal lock; {@link #close()}
 * uses {@link Consumer#wakeup()} when a fetch holds the lock.</p>
 * <p><strong>Performance:</strong> Relies on Kafka fetch batching; each poll waits at most the configured
 * poll timeout before the fetch loops.</p>
 *
 * @since 0.1.0
 */
public final class KafkaBrokerClient implements BrokerClient {
  private static final Logger log = LoggerFactory.getLogger(KafkaBrokerClient.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Consumer<byte[], byte[]> consumer;
  private final String topic;
  private final Duration pollTimeout;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean();

  private Iterator<ConsumerRecord<byte[], byte[]>> buffered = Collections.emptyIterator();
  private boolean consumerClosed;

  /**
   * Creates a client that joins {@code groupId} and subscribes to {@code topic}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param groupId consumer group id; must not be blank
   * @param topic topic to consume; must be a valid topic name
   * @param fetchMinBytes Kafka {@code fetch.min.bytes}
   * @param fetchMaxBytes Kafka {@code fetch.max.bytes}
   * @param pollTimeout maximum wait of a single poll inside {@link #fetchMessage()}
   * @throws IllegalArgumentException if any identifier is blank or invalid
   */
  public KafkaBrokerClient(
      String bootstrapServers,
      String groupId,
      String topic,
      int fetchMinBytes,
      int fetchMaxBytes,
      Duration pollTimeout) {
    this(createConsumer(bootstrapServers, groupId, fetchMinBytes, fetchMaxBytes), topic, pollTimeout);
  }

  KafkaBrokerClient(Consumer<byte[], byte[]> consumer, String topic, Duration pollTimeout) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.topic = Strings.sanitizeTopic(topic);
    this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    if (pollTimeout.isNegative() || pollTimeout.isZero()) {
      throw new IllegalArgumentException("pollTimeout must be positive");
    }
    this.consumer.subscribe(List.of(this.topic));
  }

  @Override
  public Message fetchMessage() throws MessagingException {
    lock.lock();
    try {
      while (true) {
        if (closed.get()) {
          closeConsumer();
          throw new BrokerClosedException(topic);
        }
        if (buffered.hasNext()) {
          return KafkaRecords.toMessage(buffered.next());
        }
        try {
          buffered = consumer.poll(pollTimeout).iterator();
        } catch (WakeupException ex) {
          if (closed.get()) {
            closeConsumer();
            throw new BrokerClosedException(topic);
          }
          throw new MessagingException("fetch on topic " + topic + " was woken up unexpectedly", ex);
        } catch (KafkaException | IllegalStateException ex) {
          throw new MessagingException("fetch on topic " + topic + " failed", ex);
        }
      }
    } finally {
      lock.unlock();
      closeIfRequested();
    }
  }

  @Override
  public void commitMessages(Message... messages) throws MessagingException {
    if (messages == null || messages.length == 0) {
      return;
    }
    Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
    for (Message message : messages) {
      Objects.requireNonNull(message, "message");
      offsets.merge(
          new TopicPartition(message.topic(), message.partition()),
          new OffsetAndMetadata(message.offset() + 1),
          (current, candidate) -> current.offset() >= candidate.offset() ? current : candidate);
    }
    lock.lock();
    try {
      if (closed.get()) {
        throw new BrokerClosedException(topic);
      }
      consumer.commitSync(offsets);
      log.debug("Committed offsets {} on topic {}", offsets, topic);
    } catch (WakeupException ex) {
      throw new BrokerClosedException(topic);
    } catch (KafkaException | IllegalStateException ex) {
      throw new MessagingException("commit on topic " + topic + " failed for " + offsets, ex);
    } finally {
      lock.unlock();
      closeIfRequested();
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (lock.tryLock()) {
      try {
        closeConsumer();
      } finally {
        lock.unlock();
      }
    } else {
      consumer.wakeup();
    }
  }

  private void closeIfRequested() {
    if (closed.get() && lock.tryLock()) {
      try {
        closeConsumer();
      } finally {
        lock.unlock();
      }
    }
  }

  private void closeConsumer() {
    if (consumerClosed) {
      return;
    }
    consumerClosed = true;
    try {
      consumer.close(CLOSE_TIMEOUT);
      log.info("Kafka consumer for topic {} closed", topic);
    } catch (KafkaException ex) {
      log.warn("Kafka consumer for topic {} did not close cleanly", topic, ex);
    }
  }

  private static Consumer<byte[], byte[]> createConsumer(
      String bootstrapServers, String groupId, int fetchMinBytes, int fetchMaxBytes) {
    String servers = Strings.requireNonBlank("bootstrapServers", bootstrapServers);
    String group = Strings.requireNonBlank("groupId", groupId);
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, group);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, fetchMinBytes);
    props.put(ConsumerConfig.FETCH_MAX_BYTES_CONFIG, fetchMaxBytes);
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
    return new KafkaConsumer<>(props);
  }
}

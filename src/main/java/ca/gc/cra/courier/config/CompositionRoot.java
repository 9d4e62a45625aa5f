package ca.gc.cra.courier.config;

import ca.gc.cra.courier.adapter.kafka.KafkaBrokerClient;
import ca.gc.cra.courier.adapter.kafka.KafkaMessageWriter;
import ca.gc.cra.courier.application.port.BrokerClient;
import ca.gc.cra.courier.application.port.MessageWriter;
import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.pipeline.RetryingMessageReader;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires readers and writers onto the Kafka adapters.
 *
 * <p>Every reader gets its own consumer and two producers, one for retries on the source topic and one
 * for the dead-letter topic. Nothing is shared between readers.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final Function<ReaderConfig, BrokerClient> clientFactory;
  private final BiFunction<String, String, MessageWriter> writerFactory;

  /**
   * Creates a composition root.
   *
   * @param metrics metrics sink handed to every reader; {@code null} disables metrics
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, CompositionRoot::kafkaClient, KafkaMessageWriter::new);
  }

  CompositionRoot(
      MetricsPort metrics,
      Function<ReaderConfig, BrokerClient> clientFactory,
      BiFunction<String, String, MessageWriter> writerFactory) {
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.writerFactory = Objects.requireNonNull(writerFactory, "writerFactory");
  }

  /**
   * Builds a reader for {@code config}. The caller owns the reader and must close it.
   *
   * @param config reader settings
   * @return reader that has not started reading yet
   */
  public RetryingMessageReader reader(ReaderConfig config) {
    Objects.requireNonNull(config, "config");
    BrokerClient client = clientFactory.apply(config);
    MessageWriter retryWriter = null;
    MessageWriter deadLetterWriter = null;
    try {
      retryWriter = writer(config.bootstrapServers(), config.topic());
      deadLetterWriter = writer(config.bootstrapServers(), config.deadLetterTopic());
      RetryingMessageReader reader = new RetryingMessageReader(
          config.topic(), client, retryWriter, deadLetterWriter, config.retryCeiling(), metrics);
      log.info("Reader wired for topic {} (group {}, retries {}, dead letters to {})",
          config.topic(), config.groupId(), config.retryCeiling(), config.deadLetterTopic());
      return reader;
    } catch (RuntimeException ex) {
      releaseAfterFailure(deadLetterWriter, ex);
      releaseAfterFailure(retryWriter, ex);
      releaseAfterFailure(client, ex);
      throw ex;
    }
  }

  /**
   * Builds a standalone writer. The caller owns the writer and must close it.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic destination topic
   * @return writer with its own producer
   */
  public MessageWriter writer(String bootstrapServers, String topic) {
    return writerFactory.apply(bootstrapServers, topic);
  }

  /**
   * Returns the metrics sink used by readers built here.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  private static BrokerClient kafkaClient(ReaderConfig config) {
    return new KafkaBrokerClient(
        config.bootstrapServers(),
        config.groupId(),
        config.topic(),
        config.fetchMinBytes(),
        config.fetchMaxBytes(),
        config.pollTimeout());
  }

  private static void releaseAfterFailure(AutoCloseable resource, RuntimeException primary) {
    if (resource == null) {
      return;
    }
    try {
      resource.close();
    } catch (Exception closeFailure) {
      primary.addSuppressed(closeFailure);
    }
  }
}

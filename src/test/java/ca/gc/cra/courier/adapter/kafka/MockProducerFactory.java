package ca.gc.cra.courier.adapter.kafka;

import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.serialization.ByteArraySerializer;

/**
 * Builds byte-array {@link MockProducer} instances that route every record to partition 0.
 */
final class MockProducerFactory {
  private static final Partitioner PARTITION_ZERO = new Partitioner() {
    @Override
    public void configure(Map<String, ?> configs) {
      // stateless
    }

    @Override
    public int partition(
        String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes, Cluster cluster) {
      return 0;
    }

    @Override
    public void close() {
      // stateless
    }
  };

  private MockProducerFactory() {}

  static MockProducer<byte[], byte[]> autoCompleting() {
    return new MockProducer<>(true, PARTITION_ZERO, new ByteArraySerializer(), new ByteArraySerializer());
  }
}

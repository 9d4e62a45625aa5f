package ca.gc.cra.courier.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.application.port.PublishException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;

class KafkaMessageWriterTest {

  @Test
  void writeCarriesZeroRetryHeader() throws Exception {
    MockProducer<byte[], byte[]> producer = MockProducerFactory.autoCompleting();
    KafkaMessageWriter writer = new KafkaMessageWriter(producer, "orders");

    writer.write(bytes("K"), bytes("V"));

    List<ProducerRecord<byte[], byte[]>> history = producer.history();
    assertEquals(1, history.size());
    ProducerRecord<byte[], byte[]> record = history.get(0);
    assertEquals("orders", record.topic());
    assertArrayEquals(bytes("K"), record.key());
    assertArrayEquals(bytes("V"), record.value());
    assertEquals("0", retryHeader(record));
  }

  @Test
  void writeWithRetryCounterCarriesCounter() throws Exception {
    MockProducer<byte[], byte[]> producer = MockProducerFactory.autoCompleting();
    KafkaMessageWriter writer = new KafkaMessageWriter(producer, "orders.dlq");

    writer.writeWithRetryCounter(null, bytes("V"), 4);

    ProducerRecord<byte[], byte[]> record = producer.history().get(0);
    assertEquals("orders.dlq", record.topic());
    assertNull(record.key());
    assertEquals("4", retryHeader(record));
  }

  @Test
  void sendFailureSurfacesAsPublishException() {
    MockProducer<byte[], byte[]> producer = MockProducerFactory.autoCompleting();
    producer.sendException = new KafkaException("not enough replicas");
    KafkaMessageWriter writer = new KafkaMessageWriter(producer, "orders");

    PublishException ex = assertThrows(PublishException.class, () -> writer.write(bytes("K"), bytes("V")));
    assertTrue(ex.getMessage().contains("orders"));
  }

  @Test
  void negativeRetryCounterIsRejected() {
    KafkaMessageWriter writer = new KafkaMessageWriter(MockProducerFactory.autoCompleting(), "orders");

    assertThrows(IllegalArgumentException.class, () -> writer.writeWithRetryCounter(null, bytes("V"), -1));
  }

  @Test
  void invalidTopicIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new KafkaMessageWriter(MockProducerFactory.autoCompleting(), "bad topic"));
  }

  @Test
  void closeFlushesAndClosesProducer() {
    MockProducer<byte[], byte[]> producer = MockProducerFactory.autoCompleting();
    KafkaMessageWriter writer = new KafkaMessageWriter(producer, "orders");

    writer.close();

    assertTrue(producer.closed());
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static String retryHeader(ProducerRecord<byte[], byte[]> record) {
    Header header = record.headers().lastHeader(KafkaRecords.RETRY_COUNT_HEADER);
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}

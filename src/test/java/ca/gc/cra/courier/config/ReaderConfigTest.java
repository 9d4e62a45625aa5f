package ca.gc.cra.courier.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.application.pipeline.RetryingMessageReader;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReaderConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    ReaderConfig config = ReaderConfig.fromMap(base());

    assertEquals(List.of("kafka-1:9092", "kafka-2:9093"), config.brokers());
    assertEquals("kafka-1:9092,kafka-2:9093", config.bootstrapServers());
    assertEquals("billing", config.groupId());
    assertEquals("orders", config.topic());
    assertEquals("orders.dlq", config.deadLetterTopic());
    assertEquals(RetryingMessageReader.DEFAULT_RETRY_CEILING, config.retryCeiling());
    assertEquals(ReaderConfig.DEFAULT_FETCH_MIN_BYTES, config.fetchMinBytes());
    assertEquals(ReaderConfig.DEFAULT_FETCH_MAX_BYTES, config.fetchMaxBytes());
    assertEquals(Duration.ofMillis(500), config.pollTimeout());
  }

  @Test
  void fromMapReadsOverrides() {
    Map<String, String> settings = base();
    settings.put("number.of.retries", "2");
    settings.put("fetchMinBytes", "1");
    settings.put("fetchMaxBytes", "1048576");
    settings.put("pollTimeoutMs", "50");

    ReaderConfig config = ReaderConfig.fromMap(settings);

    assertEquals(2, config.retryCeiling());
    assertEquals(1, config.fetchMinBytes());
    assertEquals(1_048_576, config.fetchMaxBytes());
    assertEquals(Duration.ofMillis(50), config.pollTimeout());
  }

  @Test
  void retryCeilingFallsBackToDefault() {
    assertEquals(5, ReaderConfig.resolveRetryCeiling(null));
    assertEquals(5, ReaderConfig.resolveRetryCeiling(" "));
    assertEquals(5, ReaderConfig.resolveRetryCeiling("lots"));
    assertEquals(5, ReaderConfig.resolveRetryCeiling("-3"));
    assertEquals(0, ReaderConfig.resolveRetryCeiling("0"));
    assertEquals(7, ReaderConfig.resolveRetryCeiling(" 7 "));
  }

  @Test
  void missingRequiredKeysNameTheKey() {
    for (String key : List.of("brokers", "groupId", "topic")) {
      Map<String, String> settings = base();
      settings.remove(key);
      IllegalArgumentException ex =
          assertThrows(IllegalArgumentException.class, () -> ReaderConfig.fromMap(settings));
      assertTrue(ex.getMessage().contains(key), ex.getMessage());
    }
  }

  @Test
  void rejectsInvalidValues() {
    Map<String, String> badTopic = base();
    badTopic.put("topic", "orders/eu");
    assertThrows(IllegalArgumentException.class, () -> ReaderConfig.fromMap(badTopic));

    Map<String, String> badBroker = base();
    badBroker.put("brokers", "kafka-1");
    assertThrows(IllegalArgumentException.class, () -> ReaderConfig.fromMap(badBroker));

    Map<String, String> inverted = base();
    inverted.put("fetchMinBytes", "100");
    inverted.put("fetchMaxBytes", "10");
    assertThrows(IllegalArgumentException.class, () -> ReaderConfig.fromMap(inverted));
  }

  @Test
  void withTopicKeepsOtherSettings() {
    Map<String, String> settings = base();
    settings.put("number.of.retries", "3");
    ReaderConfig config = ReaderConfig.fromMap(settings);

    ReaderConfig redrive = config.withTopic(config.deadLetterTopic());

    assertEquals("orders.dlq", redrive.topic());
    assertEquals("orders.dlq.dlq", redrive.deadLetterTopic());
    assertEquals(3, redrive.retryCeiling());
    assertEquals(config.groupId(), redrive.groupId());
  }

  private static Map<String, String> base() {
    Map<String, String> settings = new HashMap<>();
    settings.put("brokers", "kafka-1:9092, kafka-2:9093");
    settings.put("groupId", "billing");
    settings.put("topic", "orders");
    return settings;
  }
}

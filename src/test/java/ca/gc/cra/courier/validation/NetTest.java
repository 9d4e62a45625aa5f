package ca.gc.cra.courier.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void acceptsHostnamesAndBracketedIpv6() {
    assertEquals("kafka-1.internal:9092", Net.validateHostPort("kafka-1.internal:9092"));
    assertEquals("[::1]:9092", Net.validateHostPort("[::1]:9092"));
    assertEquals("10.0.0.5:29092", Net.validateHostPort(" 10.0.0.5:29092 "));
  }

  @Test
  void rejectsMalformedEndpoints() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("kafka"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("kafka:0"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("kafka:70000"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("::1:9092"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("bad_host:9092"));
  }

  @Test
  void parsesBrokerListSkippingEmptyEntries() {
    assertEquals(List.of("a:1", "b:2"), Net.parseBrokerList("a:1,,b:2,"));
    assertThrows(IllegalArgumentException.class, () -> Net.parseBrokerList(",,"));
  }

  @Test
  void numbersParseWithinRange() {
    assertEquals(5, Numbers.parseInt("number.of.retries", " 5 ", 0, 10));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("number.of.retries", "five", 0, 10));
    assertEquals("number.of.retries must be numeric (was five)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("port", "11", 0, 10));
  }
}

package ca.gc.cra.courier.api;

import ca.gc.cra.courier.domain.msg.Message;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;

/**
 * Renders a {@link Message} as a single-line JSON object.
 *
 * <p>Key and value are decoded as UTF-8; a missing key or value renders as JSON {@code null}.</p>
 */
final class MessageJsonFormatter {
  private static final JsonFactory JSON = new JsonFactory();

  private MessageJsonFormatter() {}

  static String format(Message message) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("topic", message.topic());
      gen.writeNumberField("partition", message.partition());
      gen.writeNumberField("offset", message.offset());
      gen.writeNumberField("retryCounter", message.retryCounter());
      gen.writeStringField("time", message.time().toString());
      gen.writeStringField("key", message.keyAsString());
      gen.writeStringField("value", message.valueAsString());
      gen.writeEndObject();
    }
    return out.toString();
  }
}

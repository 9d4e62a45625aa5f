package ca.gc.cra.courier.api;

import ca.gc.cra.courier.application.port.MessageWriter;
import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.port.PublishException;
import ca.gc.cra.courier.config.CompositionRoot;
import ca.gc.cra.courier.logging.LoggingConfigurator;
import ca.gc.cra.courier.validation.Net;
import ca.gc.cra.courier.validation.Numbers;
import ca.gc.cra.courier.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes one message, optionally carrying a retry counter.
 *
 * @since 0.1.0
 */
public final class ProduceCli {
  private static final Logger log = LoggerFactory.getLogger(ProduceCli.class);
  private static final String SUMMARY_USAGE =
      "usage: produce brokers=HOST:PORT[,HOST:PORT] topic=NAME value=TEXT [key=TEXT] [retryCount=N] "
          + "[config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      courier produce

      Usage:
        produce brokers=HOST:PORT topic=NAME value=TEXT [options]

      Required:
        brokers=LIST              Comma-separated Kafka bootstrap servers (host:port)
        topic=NAME                Destination topic ([A-Za-z0-9._-])
        value=TEXT                Message value (UTF-8)

      Options:
        key=TEXT                  Message key (UTF-8); omitted means no key
        retryCount=N              Retry counter header (default 0)
        config=PATH               YAML file with 'common' and 'produce' sections
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ProduceCli() {}

  /**
   * Executes the produce command against Kafka.
   *
   * @param args command arguments (without the command name)
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, (brokers, topic) -> new CompositionRoot(MetricsPort.NO_OP).writer(brokers, topic));
  }

  static ExitCode run(String[] args, BiFunction<String, String, MessageWriter> writers) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for produce CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String brokers;
    String topic;
    byte[] key;
    byte[] value;
    int retryCount;
    try {
      Map<String, String> settings = ConfigCliUtils.effectiveSettings("produce", kv);
      brokers = String.join(",", Net.parseBrokerList(required(settings, "brokers")));
      topic = Strings.sanitizeTopic(required(settings, "topic"));
      value = required(settings, "value").getBytes(StandardCharsets.UTF_8);
      String rawKey = settings.get("key");
      key = rawKey == null || rawKey.isEmpty() ? null : rawKey.getBytes(StandardCharsets.UTF_8);
      String rawRetry = settings.get("retryCount");
      retryCount = rawRetry == null || rawRetry.isBlank()
          ? 0
          : Numbers.parseInt("retryCount", rawRetry, 0, Integer.MAX_VALUE);
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid produce configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    try (MessageWriter writer = writers.apply(brokers, topic)) {
      writer.writeWithRetryCounter(key, value, retryCount);
      log.info("Published {} bytes to {} with retry counter {}", value.length, topic, retryCount);
      return ExitCode.SUCCESS;
    } catch (PublishException ex) {
      log.error("Failed to publish to {}", topic, ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while publishing to {}", topic, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static String required(Map<String, String> settings, String key) {
    String value = settings.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }
}

package ca.gc.cra.courier.api;

import ca.gc.cra.courier.application.pipeline.RedriveHandler;
import ca.gc.cra.courier.application.pipeline.RetryingMessageReader;
import ca.gc.cra.courier.application.port.MessageWriter;
import ca.gc.cra.courier.config.CompositionRoot;
import ca.gc.cra.courier.config.ReaderConfig;
import ca.gc.cra.courier.domain.msg.Topics;
import ca.gc.cra.courier.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.courier.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.courier.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves dead-lettered messages from {@code <topic>.dlq} back to {@code <topic>} with a fresh retry budget.
 *
 * @since 0.1.0
 */
public final class RedriveCli {
  private static final Logger log = LoggerFactory.getLogger(RedriveCli.class);
  private static final String SUMMARY_USAGE =
      "usage: redrive brokers=HOST:PORT[,HOST:PORT] groupId=ID topic=NAME [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      courier redrive

      Usage:
        redrive brokers=HOST:PORT groupId=ID topic=NAME [options]

      Consumes NAME.dlq and republishes every message to NAME with retry counter 0.
      Messages that cannot be republished follow the usual retry policy on NAME.dlq.

      Required:
        brokers=LIST              Comma-separated Kafka bootstrap servers (host:port)
        groupId=ID                Consumer group id for the dead-letter topic
        topic=NAME                Source topic (not the .dlq name)

      Options:
        number.of.retries=N       Republications before dead-lettering (default 5)
        config=PATH               YAML file with 'common' and 'redrive' sections
        metricsExporter=otlp|none OpenTelemetry metrics exporter (default none)
        otelEndpoint=URL          OTLP collector endpoint
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private RedriveCli() {}

  /**
   * Executes the redrive command.
   *
   * @param args command arguments (without the command name)
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for redrive CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    TelemetrySettings telemetry;
    ReaderConfig source;
    try {
      Map<String, String> settings = new LinkedHashMap<>(ConfigCliUtils.effectiveSettings("redrive", kv));
      telemetry = TelemetryConfigurator.fromArgs(settings);
      source = ReaderConfig.fromMap(settings);
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid redrive configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }
    if (Topics.isDeadLetterTopic(source.topic())) {
      log.error("topic must name the source topic, not its dead-letter topic (was {})", source.topic());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    ReaderConfig deadLetters = source.withTopic(source.deadLetterTopic());
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      CompositionRoot root = new CompositionRoot(metrics);
      try (MessageWriter target = root.writer(source.bootstrapServers(), source.topic())) {
        RetryingMessageReader reader = root.reader(deadLetters);
        log.info("Redriving {} into {}", deadLetters.topic(), source.topic());
        return ReaderCliSupport.readUntilStopped(reader, new RedriveHandler(target), metrics::forceFlush);
      }
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while redriving {}", deadLetters.topic(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}

package ca.gc.cra.courier.api;

import ca.gc.cra.courier.application.pipeline.RetryingMessageReader;
import ca.gc.cra.courier.application.port.MessageHandler;
import ca.gc.cra.courier.config.CompositionRoot;
import ca.gc.cra.courier.config.ReaderConfig;
import ca.gc.cra.courier.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.courier.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.courier.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes a topic and prints every message as one JSON line on stdout.
 *
 * <p>Processing never fails, so every fetched message is committed. Stop with SIGINT.</p>
 *
 * @since 0.1.0
 */
public final class ConsumeCli {
  private static final Logger log = LoggerFactory.getLogger(ConsumeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: consume brokers=HOST:PORT[,HOST:PORT] groupId=ID topic=NAME [number.of.retries=N] "
          + "[config=PATH] [metricsExporter=otlp|none] [otelEndpoint=URL] [--verbose]";
  private static final String HELP_TEXT = """
      courier consume

      Usage:
        consume brokers=HOST:PORT groupId=ID topic=NAME [options]

      Required:
        brokers=LIST              Comma-separated Kafka bootstrap servers (host:port)
        groupId=ID                Consumer group id
        topic=NAME                Topic to consume ([A-Za-z0-9._-])

      Options:
        number.of.retries=N       Republications before dead-lettering (default 5)
        fetchMinBytes=N           Kafka fetch.min.bytes (default 10000)
        fetchMaxBytes=N           Kafka fetch.max.bytes (default 10000000)
        pollTimeoutMs=N           Wait of one Kafka poll (default 500)
        config=PATH               YAML file with 'common' and 'consume' sections
        metricsExporter=otlp|none OpenTelemetry metrics exporter (default none)
        otelEndpoint=URL          OTLP collector endpoint
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ConsumeCli() {}

  /**
   * Executes the consume command.
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
      log.debug("Verbose logging enabled for consume CLI");
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
    ReaderConfig config;
    try {
      Map<String, String> settings = new LinkedHashMap<>(ConfigCliUtils.effectiveSettings("consume", kv));
      telemetry = TelemetryConfigurator.fromArgs(settings);
      config = ReaderConfig.fromMap(settings);
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid consume configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      RetryingMessageReader reader = new CompositionRoot(metrics).reader(config);
      MessageHandler printer = message -> CliPrinter.println(MessageJsonFormatter.format(message));
      return ReaderCliSupport.readUntilStopped(reader, printer, metrics::forceFlush);
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while consuming {}", config.topic(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}

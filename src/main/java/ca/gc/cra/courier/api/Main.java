package ca.gc.cra.courier.api;

import ca.gc.cra.courier.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * courier command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: courier <consume|produce|redrive> [options]";
  private static final String HELP_TEXT = """
      courier command dispatcher

      Usage:
        courier <command> [key=value ...]

      Commands:
        consume     Read a topic with retry and dead-letter handling, printing JSON lines
        produce     Publish one message
        redrive     Move dead-lettered messages back to their source topic

      Global flags:
        --help      Show this message (or '<command> --help' for command options)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches to a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] positional = input.keyValueArgs();
    if (positional.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String command = positional[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = withoutFirst(args, positional[0]);
    return switch (command) {
      case "consume" -> ConsumeCli.run(delegateArgs);
      case "produce" -> ProduceCli.run(delegateArgs);
      case "redrive" -> RedriveCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String command) {
    String[] copy = Arrays.copyOf(args, args.length);
    for (int i = 0; i < copy.length; i++) {
      if (copy[i] != null && copy[i].trim().equals(command)) {
        copy[i] = null;
        break;
      }
    }
    return copy;
  }
}

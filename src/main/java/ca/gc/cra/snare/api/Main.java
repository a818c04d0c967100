package ca.gc.cra.snare.api;

import ca.gc.cra.snare.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SNARE CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: snare <serve> [options]";
  private static final String HELP_TEXT = """
      SNARE honeypot

      Usage:
        snare <command> [options]

      Commands:
        serve       Run the SSH, HTTP, and FTP decoys (serve --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * <p>Flags after the command name are passed through, so {@code snare serve --help} prints the serve help.</p>
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] != null && !raw[i].isBlank() && !raw[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }

    String[] leading = commandIndex < 0 ? raw : Arrays.copyOfRange(raw, 0, commandIndex);
    CliInput input = CliInput.parse(leading);
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex < 0 || input.help()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    if ("help".equals(command)) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);

    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}

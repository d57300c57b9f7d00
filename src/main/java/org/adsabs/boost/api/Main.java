package org.adsabs.boost.api;

import java.util.Arrays;
import java.util.Locale;
import org.adsabs.boost.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: boost <run|listen|query|export> [options]";
  private static final String HELP_TEXT = """
      Boost factor pipeline

      Usage:
        boost <command> [key=value ...] [--verbose] [--help] [--dry-run]

      Commands:
        run      Compute, store and publish boost factors for records in a file
        listen   Consume the Kafka stage topics until stopped
        query    Print stored boost factors for bibcodes or scix ids
        export   Write stored boost factors as CSV

      Global flags:
        --help      Show this message (or a command's help after the command)
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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the subcommand
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      if (safeArgs[i] != null && !safeArgs[i].isBlank() && !safeArgs[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    CliInput input;
    try {
      input = CliInput.parse(safeArgs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (commandIndex < 0 || "help".equalsIgnoreCase(safeArgs[commandIndex].trim())) {
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
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safeArgs, commandIndex + 1, delegateArgs, commandIndex, safeArgs.length - commandIndex - 1);

    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "listen" -> ListenCli.run(delegateArgs);
      case "query" -> QueryCli.run(delegateArgs);
      case "export" -> ExportCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        log.debug("Arguments: {}", Arrays.toString(delegateArgs));
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}

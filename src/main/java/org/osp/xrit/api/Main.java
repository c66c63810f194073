package org.osp.xrit.api;

import java.util.Locale;
import org.osp.xrit.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the reassembler tools.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: xrit <geo> [options]";
  private static final String HELP_TEXT = """
      XRIT reassembler tools

      Usage:
        xrit <command> [options]

      Commands:
        geo         Convert between pixel and latitude/longitude (geo --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
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

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = dropFirst(args, remainder[0]);

    try {
      return switch (command) {
        case "geo" -> GeoCli.run(delegateArgs);
        default -> {
          log.error("Unknown command: {}", command);
          CliPrinter.println(SUMMARY_USAGE);
          yield ExitCode.INVALID_ARGS;
        }
      };
    } catch (RuntimeException ex) {
      log.error("Command {} failed", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  // Flags such as --help must reach the command, so only the command token is removed.
  private static String[] dropFirst(String[] args, String token) {
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(token)) {
        String[] rest = new String[args.length - 1];
        System.arraycopy(args, 0, rest, 0, i);
        System.arraycopy(args, i + 1, rest, i, args.length - i - 1);
        return rest;
      }
    }
    return args;
  }
}

package ca.siteguard.api;

import ca.siteguard.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SiteGuard command dispatcher.
 *
 * @since SiteGuard 0.1
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: siteguard <analyze|taxonomy|health> [options]";
  private static final String HELP_TEXT = """
      SiteGuard hazard analysis

      Usage:
        siteguard <command> [key=value...] [--verbose]

      Commands:
        analyze     Analyze a photo and print hazards and tag recommendations
        taxonomy    List compliance tags and hazard mappings
        health      Print persisted backend health records

      Global flags:
        --help      Show this message (or a command's help after the command name)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      String arg = safeArgs[i] == null ? "" : safeArgs[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    if (global.help()) {
      delegateArgs = append(delegateArgs, "--help");
    }

    return switch (command) {
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      case "taxonomy" -> TaxonomyCli.run(delegateArgs);
      case "health" -> HealthCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] append(String[] args, String extra) {
    String[] result = Arrays.copyOf(args, args.length + 1);
    result[args.length] = extra;
    return result;
  }
}

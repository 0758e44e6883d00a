package ca.siteguard.api;

import ca.siteguard.application.port.PersistedHealth;
import ca.siteguard.config.AnalysisConfig;
import ca.siteguard.infrastructure.health.JsonFileBackendHealthStore;
import ca.siteguard.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code health} command: prints the backend health records persisted by previous runs.
 *
 * @since SiteGuard 0.1
 */
public final class HealthCli {
  private static final Logger log = LoggerFactory.getLogger(HealthCli.class);
  private static final String SUMMARY_USAGE = "usage: health [health.store=PATH] [config=PATH] [profile=NAME]";
  private static final String HELP_TEXT = """
      SiteGuard backend health

      Usage:
        health [health.store=PATH] [config=PATH] [profile=NAME]

      Options:
        health.store=PATH   Health file written by analysis runs (or set it in the YAML config)
        config=PATH         YAML configuration file
        profile=NAME        Profile section to apply (default field)
        --verbose           Enable DEBUG logging
        --help              Show this message
      """;

  private HealthCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Path> store;
    try {
      AnalysisConfig config = ConfigCliUtils.loadConfig(kv);
      store = config.healthStore();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }
    if (store.isEmpty()) {
      log.error("health.store is not configured");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<PersistedHealth> records;
    try {
      records = new JsonFileBackendHealthStore(store.get()).load();
    } catch (IOException ex) {
      log.error("Unable to read health store {}: {}", store.get(), ex.getMessage());
      return ExitCode.IO_ERROR;
    }
    if (records.isEmpty()) {
      CliPrinter.println("No backend health recorded in " + store.get());
      return ExitCode.SUCCESS;
    }
    CliPrinter.report()
        .section("Backend health", records, (PersistedHealth record) -> String.format(Locale.ROOT,
            "%-24s success=%5.1f%% lastFailure=%s",
            record.backendId(),
            record.rollingSuccessRate() * 100d,
            record.lastFailureAtMillis() == 0L
                ? "never"
                : Instant.ofEpochMilli(record.lastFailureAtMillis()).toString()))
        .print();
    return ExitCode.SUCCESS;
  }
}

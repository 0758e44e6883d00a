package ca.siteguard.api;

import ca.siteguard.domain.tag.ComplianceTag;
import ca.siteguard.domain.tag.HazardMapping;
import ca.siteguard.domain.tag.HazardTaxonomy;
import ca.siteguard.infrastructure.taxonomy.YamlHazardTaxonomyLoader;
import ca.siteguard.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code taxonomy} command: validates a taxonomy file (or the bundled one) and lists its tags and mappings.
 *
 * @since SiteGuard 0.1
 */
public final class TaxonomyCli {
  private static final Logger log = LoggerFactory.getLogger(TaxonomyCli.class);
  private static final String SUMMARY_USAGE = "usage: taxonomy [taxonomy.path=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      SiteGuard taxonomy listing

      Usage:
        taxonomy [taxonomy.path=PATH]

      Options:
        taxonomy.path=PATH   YAML taxonomy to validate and list (default: bundled taxonomy)
        --verbose            Enable DEBUG logging
        --help               Show this message
      """;

  private TaxonomyCli() {}

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
    String path = kv.remove("taxonomy.path");
    if (!kv.isEmpty()) {
      log.error("Unknown arguments: {}", kv.keySet());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    YamlHazardTaxonomyLoader loader = new YamlHazardTaxonomyLoader();
    HazardTaxonomy taxonomy;
    try {
      taxonomy = path == null ? loader.loadDefault() : loader.load(Path.of(path));
    } catch (IOException ex) {
      log.error("Unable to read taxonomy: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid taxonomy: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    print(taxonomy);
    return ExitCode.SUCCESS;
  }

  private static void print(HazardTaxonomy taxonomy) {
    CliPrinter.report()
        .section("Tags", taxonomy.tags(), (ComplianceTag tag) -> String.format(Locale.ROOT,
            "%-32s %4d %-16s %s %s",
            tag.id(), tag.priorityRank(), tag.category(), tag.displayName(), tag.regulatoryCodes()))
        .section("Hazards", taxonomy.mappings(), (HazardMapping mapping) -> String.format(Locale.ROOT,
            "%-28s %-8s %-16s -> %s%s",
            mapping.type().code(), mapping.severity(), mapping.category(), mapping.tagIds(),
            mapping.aliases().isEmpty() ? "" : " aliases=" + mapping.aliases()))
        .print();
  }
}

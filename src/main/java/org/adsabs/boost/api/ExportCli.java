package org.adsabs.boost.api;

import java.io.FilterWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.adsabs.boost.application.port.BoostFactorsRepository;
import org.adsabs.boost.config.CompositionRoot;
import org.adsabs.boost.domain.RecordKey;
import org.adsabs.boost.infrastructure.export.CsvBoostFactorsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Export mode: writes stored boost factors as CSV, either every row or the requested keys.
 *
 * @since 0.1.0
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  private static final String SUMMARY_USAGE =
      "usage: boost export [out=PATH] [bibcodes=A,B] [scixIds=X,Y] [config=PATH] [jdbcUrl=URL]";
  private static final String HELP_TEXT = """
      Boost factor CSV export

      Usage:
        boost export [out=PATH] [bibcodes=A,B] [scixIds=X,Y] [options]

      Writes a header row followed by one row per record. Without keys every stored row is exported.

      Options:
        out=PATH                  Output file; stdout when omitted
        config=PATH               YAML configuration (common + export sections)
        jdbcUrl=URL               Boost factor store
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ExportCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return new CommandRunner("export", SUMMARY_USAGE, HELP_TEXT).run(args, ExportCli::execute);
  }

  private static ExitCode execute(CompositionRoot root, Map<String, String> config) throws Exception {
    List<RecordKey> keys = QueryCli.requestedKeys(config);
    String out = config.get("out");
    try (BoostFactorsRepository repository = root.repository();
        CsvBoostFactorsExporter exporter = new CsvBoostFactorsExporter(open(out))) {
      if (keys.isEmpty()) {
        repository.forEach(exporter::write);
      } else {
        for (RecordKey key : keys) {
          repository.find(key).ifPresentOrElse(
              exporter::write, () -> log.warn("No boost factors stored for {}", key.display()));
        }
      }
      log.info("Exported {} rows to {}", exporter.rows(), out == null || out.isBlank() ? "stdout" : out);
    }
    return ExitCode.SUCCESS;
  }

  private static Writer open(String out) throws IOException {
    if (out == null || out.isBlank()) {
      return new FilterWriter(CliPrinter.writer()) {
        @Override
        public void close() throws IOException {
          flush();
        }
      };
    }
    Path path = Path.of(out.trim());
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
  }
}

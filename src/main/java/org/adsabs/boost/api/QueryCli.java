package org.adsabs.boost.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.adsabs.boost.application.codec.BoostFactorsCodec;
import org.adsabs.boost.application.port.BoostFactorsRepository;
import org.adsabs.boost.config.CompositionRoot;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.RecordKey;
import org.adsabs.boost.validation.Strings;

/**
 * Query mode: prints the stored boost factors of the given keys as JSON lines.
 *
 * @since 0.1.0
 */
public final class QueryCli {
  private static final String SUMMARY_USAGE =
      "usage: boost query bibcodes=A,B | scixIds=X,Y [config=PATH] [jdbcUrl=URL]";
  private static final String HELP_TEXT = """
      Boost factor lookup

      Usage:
        boost query bibcodes=A,B [scixIds=X,Y] [options]

      Prints one JSON object per found key; missing keys are listed as "not found".
      A bibcode is looked up first; a scix_id is used when the bibcode is unknown.

      Options:
        config=PATH               YAML configuration (common + query sections)
        jdbcUrl=URL               Boost factor store
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private QueryCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return new CommandRunner("query", SUMMARY_USAGE, HELP_TEXT).run(args, QueryCli::execute);
  }

  private static ExitCode execute(CompositionRoot root, Map<String, String> config) throws Exception {
    List<RecordKey> keys = requestedKeys(config);
    if (keys.isEmpty()) {
      throw new IllegalArgumentException("bibcodes or scixIds is required");
    }
    BoostFactorsCodec codec = new BoostFactorsCodec();
    try (BoostFactorsRepository repository = root.repository()) {
      for (RecordKey key : keys) {
        Optional<BoostFactors> found = repository.find(key);
        CliPrinter.println(found.map(codec::encode).orElse("not found: " + key.display()));
      }
    }
    return ExitCode.SUCCESS;
  }

  static List<RecordKey> requestedKeys(Map<String, String> config) {
    List<RecordKey> keys = new ArrayList<>();
    for (String bibcode : Strings.splitList(config.get("bibcodes"))) {
      keys.add(new RecordKey(bibcode, null));
    }
    for (String scixId : Strings.splitList(config.get("scixIds"))) {
      keys.add(new RecordKey(null, scixId));
    }
    return keys;
  }
}

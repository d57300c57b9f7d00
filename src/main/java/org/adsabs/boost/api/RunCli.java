package org.adsabs.boost.api;

import java.nio.file.Path;
import java.util.Map;
import org.adsabs.boost.application.pipeline.BatchOrchestrator;
import org.adsabs.boost.application.pipeline.BoostTaskChain;
import org.adsabs.boost.application.pipeline.SubmissionReport;
import org.adsabs.boost.application.port.BoostFactorsRepository;
import org.adsabs.boost.application.port.NotificationPort;
import org.adsabs.boost.application.port.RecordSource;
import org.adsabs.boost.application.port.StageScheduler;
import org.adsabs.boost.config.CompositionRoot;
import org.adsabs.boost.config.IoMode;
import org.adsabs.boost.config.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch mode: reads records from a file, computes, stores and publishes their boost factors.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: boost run file=PATH [config=PATH] [batchSize=N] [workers=N] [transport=local|kafka] "
          + "[notify=log|kafka] [--dry-run]";
  private static final String HELP_TEXT = """
      Boost factor batch run

      Usage:
        boost run file=PATH [options]

      Input:
        file=PATH                 JSON array of upstream messages, or CSV with header
                                  (bibcode,scix_id,refereed,doctype,pubdate,entry_date,collections)

      Options:
        config=PATH               YAML configuration (common + run sections)
        batchSize=N               Records per batch (default 100)
        progressEvery=N           Progress log cadence (default 100)
        workers=N                 Stage worker threads
        transport=local|kafka     local runs all stages in process; kafka dispatches to the compute topic
        notify=log|kafka          Where stored factors are announced (default log)
        jdbcUrl=URL               Boost factor store
        jdbcInitSchema=true       Create the boost_factors table when absent
        metricsExporter=otlp|none OpenTelemetry metrics exporter
        --dry-run                 Validate configuration and print it without processing
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private RunCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return new CommandRunner("run", SUMMARY_USAGE, HELP_TEXT).run(args, RunCli::execute);
  }

  private static ExitCode execute(CompositionRoot root, Map<String, String> config) throws Exception {
    String file = config.get("file");
    if (file == null || file.isBlank()) {
      throw new IllegalArgumentException("file is required");
    }
    PipelineSettings settings = root.settings();
    SubmissionReport report;
    if (settings.transport() == IoMode.KAFKA) {
      try (StageScheduler scheduler = root.kafkaScheduler();
          RecordSource source = root.recordSource(Path.of(file))) {
        report = submit(root.orchestrator(scheduler), source, settings);
      }
    } else {
      try (BoostFactorsRepository repository = root.repository();
          NotificationPort notifier = root.notifier()) {
        BoostTaskChain chain = root.taskChain(repository, notifier);
        try (StageScheduler scheduler = root.localScheduler(chain);
            RecordSource source = root.recordSource(Path.of(file))) {
          report = submit(root.orchestrator(scheduler), source, settings);
        }
      }
    }
    printSummary(report);
    return ExitCode.SUCCESS;
  }

  private static SubmissionReport submit(
      BatchOrchestrator orchestrator, RecordSource source, PipelineSettings settings) throws Exception {
    log.info("Submitting records in batches of {}", settings.batchSize());
    return orchestrator.submitAll(source, settings.batchSize());
  }

  static void printSummary(SubmissionReport report) {
    CliPrinter.printLines(
        "Boost run summary",
        " Batches                : " + report.batches().size(),
        " Records                : " + report.records(),
        " Succeeded              : " + report.succeeded(),
        " Dispatched             : " + report.dispatched(),
        " Failed                 : " + report.failed(),
        " Notification failures  : " + report.notificationFailures());
  }
}

package org.adsabs.boost.api;

import java.util.Map;
import org.adsabs.boost.adapter.kafka.KafkaPipelineListeners;
import org.adsabs.boost.application.port.BoostFactorsRepository;
import org.adsabs.boost.application.port.NotificationPort;
import org.adsabs.boost.config.CompositionRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listen mode: consumes the intake, compute, store and send topics until the process is stopped.
 *
 * @since 0.1.0
 */
public final class ListenCli {
  private static final Logger log = LoggerFactory.getLogger(ListenCli.class);
  private static final String SUMMARY_USAGE =
      "usage: boost listen kafkaBootstrap=HOST:PORT [config=PATH] [kafkaGroup=ID] [topics.intake=TOPIC]";
  private static final String HELP_TEXT = """
      Boost factor stage listeners

      Usage:
        boost listen kafkaBootstrap=HOST:PORT [options]

      Options:
        config=PATH               YAML configuration (common + listen sections)
        kafkaGroup=ID             Consumer group (default boost-pipeline)
        topics.intake=TOPIC       Upstream records (default boost.update-record)
        topics.compute=TOPIC      Validated records (default boost.compute-boost)
        topics.store=TOPIC        Computed factors (default boost.store-boost)
        topics.send=TOPIC         Stored factors (default boost.send-boost-response)
        topics.response=TOPIC     Published responses when notify=kafka (default master.boost-response)
        notify=log|kafka          Notification gateway (default kafka)
        workers=N                 Stage worker threads
        --dry-run                 Validate configuration and print it without consuming
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ListenCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return new CommandRunner("listen", SUMMARY_USAGE, HELP_TEXT).run(args, ListenCli::execute);
  }

  private static ExitCode execute(CompositionRoot root, Map<String, String> config) throws Exception {
    try (BoostFactorsRepository repository = root.repository();
        NotificationPort notifier = root.notifier();
        KafkaPipelineListeners listeners = root.listeners(root.taskChain(repository, notifier))) {
      Thread hook = new Thread(() -> {
        log.info("Shutdown requested; stopping listeners");
        listeners.close();
      }, "boost-listen-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      listeners.start();
      listeners.awaitTermination();
      log.info("Listeners stopped");
    }
    return ExitCode.SUCCESS;
  }
}

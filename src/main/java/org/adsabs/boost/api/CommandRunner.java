package org.adsabs.boost.api;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import org.adsabs.boost.config.BoostConfig;
import org.adsabs.boost.config.CompositionRoot;
import org.adsabs.boost.config.PipelineSettings;
import org.adsabs.boost.domain.error.ConfigurationException;
import org.adsabs.boost.domain.error.StageException;
import org.adsabs.boost.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.adsabs.boost.infrastructure.metrics.TelemetrySettings;
import org.adsabs.boost.logging.Logs;
import org.adsabs.boost.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Common flow of every subcommand: flags, configuration, dry run, wiring, exit code mapping.
 *
 * @since 0.1.0
 */
final class CommandRunner {
  private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

  /** Mode-specific work run against a fully wired composition root. */
  @FunctionalInterface
  interface Body {
    ExitCode run(CompositionRoot root, Map<String, String> config) throws Exception;
  }

  private final String mode;
  private final String usage;
  private final String help;

  CommandRunner(String mode, String usage, String help) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.usage = Objects.requireNonNull(usage, "usage");
    this.help = Objects.requireNonNull(help, "help");
  }

  ExitCode run(String[] args, Body body) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(help.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", mode);
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.settingsArray());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> config;
    BoostConfig boostConfig;
    PipelineSettings settings;
    try {
      config = ConfigCliUtils.effectiveConfig(mode, kv);
      boostConfig = BoostConfig.fromMap(config);
      settings = PipelineSettings.fromMap(config);
      boostConfig.newComputation(docType -> { });
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (input.dryRun() || Boolean.parseBoolean(config.get("dryRun"))) {
      printDryRun(config);
      return ExitCode.SUCCESS;
    }

    MDC.put("pipeline", mode);
    try (OpenTelemetryMetricsAdapter metrics =
        new OpenTelemetryMetricsAdapter(TelemetrySettings.fromMap(config))) {
      CompositionRoot root = new CompositionRoot(boostConfig, settings, metrics);
      return body.run(root, config);
    } catch (ConfigurationException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("{} I/O failure: {}", mode, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted", mode);
      return ExitCode.INTERRUPTED;
    } catch (StageException ex) {
      log.error("{} failed ({}): {}", mode, ex.kind(), ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected failure in {}", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void printDryRun(Map<String, String> config) {
    CliPrinter.println(mode + " dry-run: configuration is valid; effective settings follow.");
    Logs.redactSecrets(config).forEach((key, value) -> CliPrinter.println(" " + key + " = " + value));
  }
}

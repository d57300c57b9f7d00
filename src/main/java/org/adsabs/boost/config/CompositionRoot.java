package org.adsabs.boost.config;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.adsabs.boost.adapter.kafka.KafkaClients;
import org.adsabs.boost.adapter.kafka.KafkaNotificationAdapter;
import org.adsabs.boost.adapter.kafka.KafkaPipelineListeners;
import org.adsabs.boost.adapter.kafka.KafkaStageScheduler;
import org.adsabs.boost.application.codec.BoostFactorsCodec;
import org.adsabs.boost.application.codec.BoostRequestCodec;
import org.adsabs.boost.application.codec.UpstreamRecordParser;
import org.adsabs.boost.application.pipeline.BatchOrchestrator;
import org.adsabs.boost.application.pipeline.BoostTaskChain;
import org.adsabs.boost.application.pipeline.StageInvoker;
import org.adsabs.boost.application.pipeline.UnknownDoctypeLog;
import org.adsabs.boost.application.port.BoostFactorsRepository;
import org.adsabs.boost.application.port.ClockPort;
import org.adsabs.boost.application.port.MetricsPort;
import org.adsabs.boost.application.port.NotificationPort;
import org.adsabs.boost.application.port.RecordSource;
import org.adsabs.boost.application.port.StageScheduler;
import org.adsabs.boost.domain.compute.BoostComputation;
import org.adsabs.boost.infrastructure.exec.ExecutorFactories;
import org.adsabs.boost.infrastructure.exec.ExecutorStageScheduler;
import org.adsabs.boost.infrastructure.notify.LoggingNotificationAdapter;
import org.adsabs.boost.infrastructure.persistence.BoostFactorsSchema;
import org.adsabs.boost.infrastructure.persistence.ConnectionProvider;
import org.adsabs.boost.infrastructure.persistence.JdbcBoostFactorsRepository;
import org.adsabs.boost.infrastructure.source.RecordSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the pipeline to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate configuration into runnable
 * components for every CLI mode.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the scoring computation from the validated {@link BoostConfig}.</li>
 *   <li>Open the boost factor store and the notification gateway selected by
 *   {@link PipelineSettings}.</li>
 *   <li>Construct the in-process or Kafka scheduler, the orchestrator and the listen-mode
 *   workers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration references; factory methods
 * create new instances and are not synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final BoostConfig boostConfig;
  private final PipelineSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ConnectionProvider connections;

  /**
   * Creates a composition root backed by {@link java.sql.DriverManager} connections and the system
   * clock.
   *
   * @param boostConfig scoring configuration
   * @param settings pipeline settings
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(BoostConfig boostConfig, PipelineSettings settings, MetricsPort metrics) {
    this(boostConfig, settings, metrics, ClockPort.SYSTEM,
        ConnectionProvider.driverManager(settings.jdbcUrl(), settings.jdbcUser(), settings.jdbcPassword()));
  }

  CompositionRoot(
      BoostConfig boostConfig,
      PipelineSettings settings,
      MetricsPort metrics,
      ClockPort clock,
      ConnectionProvider connections) {
    this.boostConfig = Objects.requireNonNull(boostConfig, "boostConfig");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  public PipelineSettings settings() {
    return settings;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /** Scoring computation reporting unranked doctypes to the metrics sink. */
  public BoostComputation computation() {
    return boostConfig.newComputation(new UnknownDoctypeLog(metrics));
  }

  /**
   * Opens the boost factor store, creating the schema first when {@code jdbcInitSchema} is set.
   *
   * @return repository
   * @throws SQLException if schema creation fails
   */
  public BoostFactorsRepository repository() throws SQLException {
    if (settings.initSchema()) {
      BoostFactorsSchema.create(connections);
    }
    return new JdbcBoostFactorsRepository(connections);
  }

  /** Notification gateway selected by {@code notify}. */
  public NotificationPort notifier() {
    BoostFactorsCodec codec = new BoostFactorsCodec();
    if (settings.notifyMode() == IoMode.KAFKA) {
      log.info("Publishing boost responses to Kafka topic {}", settings.topics().response());
      return new KafkaNotificationAdapter(bootstrap(), settings.topics().response(), codec);
    }
    return new LoggingNotificationAdapter(codec);
  }

  /**
   * Assembles the compute, store and send stage bodies.
   *
   * @param repository boost factor store
   * @param notifier notification gateway
   * @return task chain
   */
  public BoostTaskChain taskChain(BoostFactorsRepository repository, NotificationPort notifier) {
    return new BoostTaskChain(computation(), repository, notifier, clock, metrics);
  }

  /**
   * Builds the in-process scheduler running compute, store and send on a worker pool.
   *
   * @param chain stage bodies
   * @return scheduler; the caller closes it
   */
  public StageScheduler localScheduler(BoostTaskChain chain) {
    return new ExecutorStageScheduler(chain, settings.retry(), settings.workers(), metrics);
  }

  /**
   * Builds a scheduler that dispatches validated records to the compute topic for the listen-mode
   * workers.
   *
   * @return scheduler; the caller closes it
   */
  public StageScheduler kafkaScheduler() {
    log.info("Dispatching records to Kafka topic {}", settings.topics().compute());
    return new KafkaStageScheduler(bootstrap(), settings.topics().compute(), new BoostRequestCodec());
  }

  public BatchOrchestrator orchestrator(StageScheduler scheduler) {
    return new BatchOrchestrator(scheduler, metrics, settings.progressEvery());
  }

  /**
   * Builds the listen-mode workers consuming the four stage topics.
   *
   * @param chain stage bodies
   * @return listeners, not yet started
   */
  public KafkaPipelineListeners listeners(BoostTaskChain chain) {
    String bootstrap = bootstrap();
    ExecutorService stagePool = ExecutorFactories.newStagePool(settings.workers(), "boost-listen-stage",
        (t, ex) -> log.error("Uncaught exception in {}", t.getName(), ex));
    return new KafkaPipelineListeners(
        settings.topics(),
        () -> KafkaClients.createConsumer(bootstrap, settings.kafkaGroup()),
        KafkaClients.createProducer(bootstrap),
        chain,
        new StageInvoker(settings.retry(), stagePool, metrics),
        stagePool,
        metrics);
  }

  /**
   * Opens a record file for the run mode.
   *
   * @param file JSON array or CSV file
   * @return record source; the caller closes it
   * @throws IOException if the file cannot be opened
   */
  public RecordSource recordSource(Path file) throws IOException {
    return RecordSources.open(file, new UpstreamRecordParser());
  }

  private String bootstrap() {
    return settings.kafkaBootstrap()
        .orElseThrow(() -> new IllegalStateException("kafkaBootstrap is not configured"));
  }
}

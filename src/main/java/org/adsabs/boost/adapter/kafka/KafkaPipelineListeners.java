package org.adsabs.boost.adapter.kafka;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.adsabs.boost.application.codec.BoostFactorsCodec;
import org.adsabs.boost.application.codec.BoostRequestCodec;
import org.adsabs.boost.application.codec.UpstreamRecordParser;
import org.adsabs.boost.application.pipeline.BoostTaskChain;
import org.adsabs.boost.application.pipeline.Stage;
import org.adsabs.boost.application.pipeline.StageInvoker;
import org.adsabs.boost.application.port.MetricsPort;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.BoostRequest;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.producer.Producer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one {@link KafkaStageWorker} per channel: intake, compute, store and
 * send.
 * <p><strong>Why:</strong> Implements the listen mode in which records arrive from the upstream
 * pipeline and flow through the stage topics.</p>
 * <ul>
 *   <li>intake: upstream message, validated and normalized, to the compute topic.</li>
 *   <li>compute: factors to the store topic.</li>
 *   <li>store: upsert, then the same factors to the send topic.</li>
 *   <li>send: publish the response.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class KafkaPipelineListeners implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(KafkaPipelineListeners.class);
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

  private final List<KafkaStageWorker> workers = new ArrayList<>();
  private final List<Thread> threads = new ArrayList<>();
  private final Producer<String, String> producer;
  private final ExecutorService stageExecutor;

  /**
   * Builds the workers.
   *
   * @param topics topic names
   * @param consumers creates one consumer per worker
   * @param producer shared forwarding producer
   * @param chain stage bodies
   * @param invoker retry and timeout runner
   * @param stageExecutor executor behind {@code invoker}; shut down on close
   * @param metrics metrics sink
   */
  public KafkaPipelineListeners(
      KafkaTopics topics,
      Supplier<Consumer<String, String>> consumers,
      Producer<String, String> producer,
      BoostTaskChain chain,
      StageInvoker invoker,
      ExecutorService stageExecutor,
      MetricsPort metrics) {
    Objects.requireNonNull(topics, "topics");
    Objects.requireNonNull(chain, "chain");
    this.producer = Objects.requireNonNull(producer, "producer");
    this.stageExecutor = Objects.requireNonNull(stageExecutor, "stageExecutor");
    UpstreamRecordParser parser = new UpstreamRecordParser();
    BoostRequestCodec requests = new BoostRequestCodec();
    BoostFactorsCodec factors = new BoostFactorsCodec();

    workers.add(new KafkaStageWorker(Stage.VALIDATE, consumers.get(), topics.intake(), producer, topics.compute(),
        payload -> {
          BoostRequest request = parser.parse(payload);
          request.key();
          metrics.increment("boost.records.submitted");
          return Optional.of(requests.encode(request));
        }, invoker, metrics, POLL_TIMEOUT));
    workers.add(new KafkaStageWorker(Stage.COMPUTE, consumers.get(), topics.compute(), producer, topics.store(),
        payload -> Optional.of(factors.encode(chain.compute(requests.decode(payload)))),
        invoker, metrics, POLL_TIMEOUT));
    workers.add(new KafkaStageWorker(Stage.STORE, consumers.get(), topics.store(), producer, topics.send(),
        payload -> {
          BoostFactors stored = chain.store(factors.decode(payload));
          metrics.increment("boost.records.succeeded");
          return Optional.of(factors.encode(stored));
        }, invoker, metrics, POLL_TIMEOUT));
    workers.add(new KafkaStageWorker(Stage.SEND, consumers.get(), topics.send(), null, null,
        payload -> {
          chain.send(factors.decode(payload));
          return Optional.empty();
        }, invoker, metrics, POLL_TIMEOUT));
  }

  /** Starts one thread per worker. */
  public void start() {
    for (KafkaStageWorker worker : workers) {
      Thread thread = new Thread(worker, "boost-listen-" + threads.size());
      thread.setUncaughtExceptionHandler((t, ex) -> log.error("Listener {} terminated", t.getName(), ex));
      threads.add(thread);
      thread.start();
    }
    log.info("Started {} stage listeners", threads.size());
  }

  /**
   * Blocks until every worker thread exits.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitTermination() throws InterruptedException {
    for (Thread thread : threads) {
      thread.join();
    }
  }

  List<KafkaStageWorker> workers() {
    return workers;
  }

  @Override
  public void close() {
    workers.forEach(KafkaStageWorker::close);
    try {
      for (Thread thread : threads) {
        thread.join(TimeUnit.SECONDS.toMillis(10));
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    stageExecutor.shutdownNow();
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }
}

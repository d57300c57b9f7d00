package org.adsabs.boost.adapter.kafka;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.adsabs.boost.application.pipeline.Stage;
import org.adsabs.boost.application.pipeline.StageInvoker;
import org.adsabs.boost.application.port.MetricsPort;
import org.adsabs.boost.domain.error.StageException;
import org.adsabs.boost.logging.Logs;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Consumes one stage topic, runs the stage for each message and forwards the
 * result to the next topic.
 * <p><strong>Why:</strong> Lets each stage scale independently across processes while keeping
 * at-least-once delivery.</p>
 * <p><strong>Delivery:</strong> offsets are committed only after the stage finished and its output
 * was acknowledged by the next topic. When forwarding fails the consumer rewinds to the first
 * unforwarded message and commits only what was handed off. Messages that fail the stage itself
 * (invalid, permanent, or out of retries) are logged, counted and skipped.</p>
 * <p><strong>Thread-safety:</strong> {@link #run()} owns the consumer; {@link #close()} may be
 * called from any thread.</p>
 *
 * @since 0.1.0
 */
public final class KafkaStageWorker implements Runnable, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(KafkaStageWorker.class);
  private static final Duration FORWARD_TIMEOUT = Duration.ofSeconds(10);
  private static final int MAX_LOGGED_PAYLOAD = 512;

  /** Stage body applied to one message. */
  @FunctionalInterface
  public interface Handler {
    /**
     * Processes a message.
     *
     * @param payload message value
     * @return payload for the next topic, or empty when nothing is forwarded
     * @throws StageException if the stage fails
     */
    Optional<String> handle(String payload) throws Exception;
  }

  private final Stage stage;
  private final Consumer<String, String> consumer;
  private final String topic;
  private final Producer<String, String> producer;
  private final String nextTopic;
  private final Handler handler;
  private final StageInvoker invoker;
  private final MetricsPort metrics;
  private final Duration pollTimeout;
  private final AtomicBoolean running = new AtomicBoolean(true);

  /**
   * Creates a worker.
   *
   * @param stage stage run by this worker
   * @param consumer consumer owned by this worker
   * @param topic topic to consume
   * @param producer producer for forwarding; may be {@code null} when {@code nextTopic} is
   *     {@code null}
   * @param nextTopic topic receiving handler output; {@code null} for the last stage
   * @param handler stage body
   * @param invoker retry and timeout runner
   * @param metrics metrics sink
   * @param pollTimeout consumer poll timeout
   */
  public KafkaStageWorker(
      Stage stage,
      Consumer<String, String> consumer,
      String topic,
      Producer<String, String> producer,
      String nextTopic,
      Handler handler,
      StageInvoker invoker,
      MetricsPort metrics,
      Duration pollTimeout) {
    this.stage = Objects.requireNonNull(stage, "stage");
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.topic = KafkaClients.sanitizeTopic(topic);
    this.nextTopic = nextTopic == null ? null : KafkaClients.sanitizeTopic(nextTopic);
    if (this.nextTopic != null) {
      Objects.requireNonNull(producer, "producer");
    }
    this.producer = producer;
    this.handler = Objects.requireNonNull(handler, "handler");
    this.invoker = Objects.requireNonNull(invoker, "invoker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
  }

  @Override
  public void run() {
    MDC.put("pipeline", "listen");
    try {
      consumer.subscribe(List.of(topic));
      log.info("Stage {} consuming {}{}", stage.label(), topic, nextTopic == null ? "" : " -> " + nextTopic);
      while (running.get()) {
        pollOnce();
      }
    } catch (WakeupException ex) {
      if (running.get()) {
        throw ex;
      }
    } finally {
      consumer.close(Duration.ofSeconds(5));
      log.info("Stage {} worker stopped", stage.label());
      MDC.remove("pipeline");
    }
  }

  /**
   * Polls once, processes every returned message and commits what was handed off.
   *
   * @return number of messages committed
   */
  int pollOnce() {
    ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
    if (records.isEmpty()) {
      return 0;
    }
    Map<TopicPartition, OffsetAndMetadata> done = new HashMap<>();
    int committed = 0;
    for (ConsumerRecord<String, String> record : records) {
      TopicPartition partition = new TopicPartition(record.topic(), record.partition());
      if (!process(record)) {
        rewind(records, done);
        break;
      }
      done.put(partition, new OffsetAndMetadata(record.offset() + 1));
      committed++;
    }
    if (!done.isEmpty()) {
      consumer.commitSync(done);
    }
    return committed;
  }

  private boolean process(ConsumerRecord<String, String> record) {
    String label = record.key() == null ? topic + "@" + record.offset() : record.key();
    Optional<String> output;
    try {
      output = invoker.invoke(stage, label, () -> handler.handle(record.value()));
    } catch (StageException ex) {
      metrics.increment("boost.records.failed");
      log.warn("Record {} failed at stage {} ({}): {}", label, stage.label(), ex.kind(), ex.getMessage());
      log.debug("Skipped payload of {}: {}", label, Logs.truncate(record.value(), MAX_LOGGED_PAYLOAD));
      return true;
    }
    if (output.isEmpty() || nextTopic == null) {
      return true;
    }
    try {
      producer.send(new ProducerRecord<>(nextTopic, record.key(), output.get()))
          .get(FORWARD_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (ExecutionException | TimeoutException | KafkaException ex) {
      metrics.increment(stage.metric("forward.failed"));
      log.warn("Could not forward {} to {}; will redeliver: {}", label, nextTopic, ex.getMessage());
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      running.set(false);
      return false;
    }
  }

  private void rewind(ConsumerRecords<String, String> records, Map<TopicPartition, OffsetAndMetadata> done) {
    for (TopicPartition partition : records.partitions()) {
      List<ConsumerRecord<String, String>> partitionRecords = records.records(partition);
      OffsetAndMetadata processed = done.get(partition);
      long next = processed == null ? partitionRecords.get(0).offset() : processed.offset();
      long last = partitionRecords.get(partitionRecords.size() - 1).offset();
      if (next <= last) {
        consumer.seek(partition, next);
      }
    }
  }

  @Override
  public void close() {
    running.set(false);
    consumer.wakeup();
  }
}

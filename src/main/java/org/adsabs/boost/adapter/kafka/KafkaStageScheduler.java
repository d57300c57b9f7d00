package org.adsabs.boost.adapter.kafka;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.adsabs.boost.application.codec.BoostRequestCodec;
import org.adsabs.boost.application.pipeline.ChainOutcome;
import org.adsabs.boost.application.pipeline.Stage;
import org.adsabs.boost.application.port.StageScheduler;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.ErrorKind;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StageScheduler} that hands each record to the compute topic, where remote stage workers
 * pick it up.
 *
 * <p>The outcome completes as {@code DISPATCHED} once the broker acknowledges the record, or as a
 * retryable compute failure when the hand-off fails.</p>
 *
 * @since 0.1.0
 */
public final class KafkaStageScheduler implements StageScheduler {
  private static final Logger log = LoggerFactory.getLogger(KafkaStageScheduler.class);

  private final Producer<String, String> producer;
  private final String topic;
  private final BoostRequestCodec codec;

  public KafkaStageScheduler(String bootstrapServers, String topic, BoostRequestCodec codec) {
    this(KafkaClients.createProducer(bootstrapServers), topic, codec);
  }

  KafkaStageScheduler(Producer<String, String> producer, String topic, BoostRequestCodec codec) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = KafkaClients.sanitizeTopic(topic);
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public CompletableFuture<ChainOutcome> schedule(BoostRequest request) {
    String label = request.label();
    CompletableFuture<ChainOutcome> outcome = new CompletableFuture<>();
    producer.send(new ProducerRecord<>(topic, label, codec.encode(request)), (metadata, ex) -> {
      if (ex == null) {
        outcome.complete(ChainOutcome.dispatched(label));
      } else {
        log.warn("Failed to hand off {} to {}: {}", label, topic, ex.getMessage());
        outcome.complete(ChainOutcome.failed(label, Stage.COMPUTE, ErrorKind.RETRYABLE));
      }
    });
    return outcome;
  }

  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }
}

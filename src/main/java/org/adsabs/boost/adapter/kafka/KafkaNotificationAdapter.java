package org.adsabs.boost.adapter.kafka;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.adsabs.boost.application.codec.BoostFactorsCodec;
import org.adsabs.boost.application.port.NotificationPort;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.error.RetryableStageException;
import org.adsabs.boost.domain.error.StageException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;

/**
 * Publishes boost factor responses to the downstream response topic.
 *
 * <p>Each send waits for the broker acknowledgement so the stage result reflects delivery;
 * transport failures surface as retryable.</p>
 *
 * @since 0.1.0
 */
public final class KafkaNotificationAdapter implements NotificationPort {
  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

  private final Producer<String, String> producer;
  private final String topic;
  private final BoostFactorsCodec codec;

  public KafkaNotificationAdapter(String bootstrapServers, String topic, BoostFactorsCodec codec) {
    this(KafkaClients.createProducer(bootstrapServers), topic, codec);
  }

  KafkaNotificationAdapter(Producer<String, String> producer, String topic, BoostFactorsCodec codec) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = KafkaClients.sanitizeTopic(topic);
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public void publish(BoostFactors factors) throws StageException {
    ProducerRecord<String, String> message =
        new ProducerRecord<>(topic, factors.key().display(), codec.encodeResponse(factors));
    try {
      producer.send(message).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException | TimeoutException ex) {
      Throwable cause = ex instanceof ExecutionException ? ex.getCause() : ex;
      throw new RetryableStageException("publish to " + topic + " failed: " + cause.getMessage(), cause);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RetryableStageException("publish to " + topic + " interrupted", ex);
    }
  }

  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }
}

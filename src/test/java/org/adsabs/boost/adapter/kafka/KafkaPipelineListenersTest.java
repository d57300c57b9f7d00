package org.adsabs.boost.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import org.adsabs.boost.application.pipeline.BoostTaskChain;
import org.adsabs.boost.application.pipeline.StageInvoker;
import org.adsabs.boost.application.pipeline.StageRetryPolicy;
import org.adsabs.boost.config.BoostConfig;
import org.adsabs.boost.testutil.InMemoryBoostFactorsRepository;
import org.adsabs.boost.testutil.RecordingMetricsPort;
import org.adsabs.boost.testutil.RecordingNotificationPort;
import org.adsabs.boost.testutil.Records;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaPipelineListenersTest {

  @Test
  void recordTravelsThroughEveryStageTopic() {
    KafkaTopics topics = KafkaTopics.defaults();
    List<MockConsumer<String, String>> consumers = new ArrayList<>();
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    InMemoryBoostFactorsRepository repository = new InMemoryBoostFactorsRepository();
    RecordingNotificationPort notifier = new RecordingNotificationPort();
    BoostTaskChain chain = new BoostTaskChain(
        BoostConfig.defaults().newComputation(docType -> {}),
        repository, notifier, () -> Records.NOW.toEpochMilli(), metrics);
    var stageExecutor = Executors.newSingleThreadExecutor();
    StageInvoker invoker = new StageInvoker(StageRetryPolicy.defaults(), stageExecutor, metrics);

    try (KafkaPipelineListeners listeners = new KafkaPipelineListeners(topics, () -> {
      MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
      consumers.add(consumer);
      return consumer;
    }, producer, chain, invoker, stageExecutor, metrics)) {
      assertEquals(4, listeners.workers().size());

      String upstream = "{\"bibcode\": \"2024ApJ...777....1A\", "
          + "\"bib_data\": {\"doctype\": \"article\", \"refereed\": true, \"pubdate\": \"2024-05-00\"}, "
          + "\"classifications\": [\"Astrophysics\"]}";
      deliver(consumers.get(0), topics.intake(), "2024ApJ...777....1A", upstream);
      assertEquals(1, listeners.workers().get(0).pollOnce());

      for (int stage = 1; stage < 4; stage++) {
        ProducerRecord<String, String> forwarded = producer.history().get(stage - 1);
        deliver(consumers.get(stage), forwarded.topic(), forwarded.key(), forwarded.value());
        assertEquals(1, listeners.workers().get(stage).pollOnce());
      }
    }

    assertEquals(List.of(topics.compute(), topics.store(), topics.send()),
        producer.history().stream().map(ProducerRecord::topic).toList());
    assertTrue(repository.findByBibcode("2024ApJ...777....1A").isPresent());
    assertEquals(1, notifier.published().size());
    assertEquals(1, metrics.count("boost.records.submitted"));
    assertEquals(1, metrics.count("boost.records.succeeded"));
  }

  private static void deliver(MockConsumer<String, String> consumer, String topic, String key, String value) {
    TopicPartition partition = new TopicPartition(topic, 0);
    consumer.subscribe(List.of(topic));
    consumer.rebalance(List.of(partition));
    consumer.updateBeginningOffsets(Map.of(partition, 0L));
    consumer.addRecord(new ConsumerRecord<>(topic, 0, 0L, key, value));
  }
}

package org.adsabs.boost.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.concurrent.CompletableFuture;
import org.adsabs.boost.application.codec.BoostRequestCodec;
import org.adsabs.boost.application.pipeline.ChainOutcome;
import org.adsabs.boost.domain.error.ErrorKind;
import org.adsabs.boost.testutil.Records;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaStageSchedulerTest {
  private final BoostRequestCodec codec = new BoostRequestCodec();

  @Test
  void handOffCompletesAsDispatched() throws Exception {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    KafkaStageScheduler scheduler = new KafkaStageScheduler(producer, "boost.compute-boost", codec);

    ChainOutcome outcome = scheduler.schedule(Records.article("2024ApJ...001....1A")).get();

    assertEquals(ChainOutcome.Status.DISPATCHED, outcome.status());
    var record = producer.history().get(0);
    assertEquals("boost.compute-boost", record.topic());
    assertEquals("2024ApJ...001....1A", record.key());
    assertEquals(Records.article("2024ApJ...001....1A"), codec.decode(record.value()));
  }

  @Test
  void rejectedHandOffFailsTheRecord() throws Exception {
    MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
    KafkaStageScheduler scheduler = new KafkaStageScheduler(producer, "boost.compute-boost", codec);

    CompletableFuture<ChainOutcome> pending = scheduler.schedule(Records.article("2024ApJ...002....1A"));
    producer.errorNext(new IllegalStateException("topic missing"));
    ChainOutcome outcome = pending.get();

    assertEquals(ChainOutcome.Status.FAILED, outcome.status());
    assertEquals(ErrorKind.RETRYABLE, outcome.errorKind());
  }
}

package org.adsabs.boost.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.adsabs.boost.config.BoostConfig;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.ValidationException;
import org.adsabs.boost.testutil.InMemoryBoostFactorsRepository;
import org.adsabs.boost.testutil.RecordingMetricsPort;
import org.adsabs.boost.testutil.RecordingNotificationPort;
import org.adsabs.boost.testutil.Records;
import org.junit.jupiter.api.Test;

class BoostTaskChainTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final InMemoryBoostFactorsRepository repository = new InMemoryBoostFactorsRepository();
  private final RecordingNotificationPort notifier = new RecordingNotificationPort();
  private final BoostTaskChain chain = new BoostTaskChain(
      BoostConfig.defaults().newComputation(docType -> {}),
      repository,
      notifier,
      () -> Records.NOW.toEpochMilli(),
      metrics);

  @Test
  void computeStampsTheClockTime() throws Exception {
    BoostFactors factors = chain.compute(Records.article("2024ApJ...999....1A"));

    assertEquals(Records.NOW, factors.created());
    assertEquals("2024ApJ...999....1A", factors.key().bibcode());
    assertTrue(metrics.hasObservation("boost.stage.compute.latencyNanos"));
  }

  @Test
  void storeAndSendHandTheSameFactorsOn() throws Exception {
    BoostFactors factors = chain.compute(Records.article("2024ApJ...998....1A"));

    assertSame(factors, chain.store(factors));
    chain.send(factors);

    assertEquals(1, repository.size());
    assertEquals(1, metrics.count("boost.store.upserted"));
    assertEquals(factors, notifier.published().get(0));
  }

  @Test
  void computeRejectsRecordsWithoutIdentifiers() {
    assertThrows(ValidationException.class,
        () -> chain.compute(new BoostRequest(null, null, true, "article", null, null)));
  }
}

package org.adsabs.boost.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.adsabs.boost.application.port.RecordSource;
import org.adsabs.boost.application.port.StageScheduler;
import org.adsabs.boost.domain.Batch;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.ErrorKind;
import org.adsabs.boost.testutil.RecordingMetricsPort;
import org.adsabs.boost.testutil.Records;
import org.junit.jupiter.api.Test;

class BatchOrchestratorTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<String> scheduled = Collections.synchronizedList(new ArrayList<>());

  private final StageScheduler succeeding = request -> {
    scheduled.add(request.label());
    return CompletableFuture.completedFuture(ChainOutcome.succeeded(request.label()));
  };

  @Test
  void partitionsRecordsIntoBatchesOfAtMostBatchSize() {
    List<BoostRequest> records = Records.articles(250);

    List<Batch> batches = Batch.partition(records, 100);

    assertEquals(List.of(100, 100, 50), batches.stream().map(Batch::size).toList());
    Set<BoostRequest> seen = new HashSet<>();
    batches.forEach(batch -> seen.addAll(batch.records()));
    assertEquals(250, seen.size());
  }

  @Test
  void submitReportsEveryRecordOnce() {
    BatchOrchestrator orchestrator = new BatchOrchestrator(succeeding, metrics, 100);

    SubmissionReport report = orchestrator.submit(Records.articles(250), 100);

    assertEquals(3, report.batches().size());
    assertEquals(List.of(100, 100, 50), report.batches().stream().map(BatchReport::size).toList());
    assertEquals(250, report.succeeded());
    assertFalse(report.hasFailures());
    assertEquals(250, scheduled.size());
    assertEquals(250, metrics.count("boost.records.submitted"));
    assertEquals(List.of(100L, 100L, 50L), metrics.observed("boost.batch.size"));
    assertEquals(List.of(100L, 200L), metrics.observed("boost.progress.processed"));
  }

  @Test
  void invalidRecordsFailValidationWithoutReachingTheScheduler() {
    BatchOrchestrator orchestrator = new BatchOrchestrator(succeeding, metrics, 100);
    List<BoostRequest> records = new ArrayList<>(Records.articles(3));
    records.add(new BoostRequest(null, " ", true, "article", LocalDate.of(2020, 1, 1), Set.of()));

    SubmissionReport report = orchestrator.submit(records, 10);

    assertEquals(3, report.succeeded());
    assertEquals(1, report.failed());
    assertEquals(3, scheduled.size());
    assertEquals(1, metrics.count("boost.records.invalid"));
  }

  @Test
  void schedulerFailuresBecomeFailedOutcomes() {
    StageScheduler flaky = request -> {
      if (request.label().endsWith("001....1A")) {
        throw new IllegalStateException("pool closed");
      }
      if (request.label().endsWith("002....1A")) {
        return CompletableFuture.failedFuture(new IllegalStateException("lost"));
      }
      return CompletableFuture.completedFuture(ChainOutcome.succeeded(request.label()));
    };
    BatchOrchestrator orchestrator = new BatchOrchestrator(flaky, metrics, 100);

    SubmissionReport report = orchestrator.submit(Records.articles(5), 5);

    assertEquals(3, report.succeeded());
    assertEquals(2, report.failed());
    assertEquals(2, metrics.count("boost.records.failed"));
  }

  @Test
  void notificationFailuresCountAsSucceededButAreReported() {
    StageScheduler noNotify = request ->
        CompletableFuture.completedFuture(ChainOutcome.storedWithoutNotification(request.label()));
    BatchOrchestrator orchestrator = new BatchOrchestrator(noNotify, metrics, 100);

    SubmissionReport report = orchestrator.submit(Records.articles(4), 2);

    assertEquals(4, report.succeeded());
    assertEquals(4, report.notificationFailures());
    assertEquals(4, metrics.count("boost.notify.failed"));
  }

  @Test
  void submitAllPagesThroughTheSource() throws Exception {
    Deque<List<BoostRequest>> pages = new ArrayDeque<>(List.of(Records.articles(3), Records.articles(2)));
    List<Integer> requestedSizes = new ArrayList<>();
    RecordSource source = max -> {
      requestedSizes.add(max);
      return pages.isEmpty() ? List.of() : pages.poll();
    };
    StageScheduler dispatching = request ->
        CompletableFuture.completedFuture(ChainOutcome.dispatched(request.label()));
    BatchOrchestrator orchestrator = new BatchOrchestrator(dispatching, metrics, 100);

    SubmissionReport report = orchestrator.submitAll(source, 3);

    assertEquals(2, report.batches().size());
    assertEquals(5, report.dispatched());
    assertEquals(List.of(3, 3, 3), requestedSizes);
  }

  @Test
  void failedOutcomeCarriesStageAndKind() {
    ChainOutcome outcome = ChainOutcome.failed("x", Stage.STORE, ErrorKind.PERMANENT);

    assertEquals(Stage.STORE, outcome.failedStage());
    assertTrue(outcome.status() == ChainOutcome.Status.FAILED);
  }
}

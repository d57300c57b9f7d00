package org.adsabs.boost.application.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.adsabs.boost.application.port.MetricsPort;
import org.adsabs.boost.application.port.RecordSource;
import org.adsabs.boost.application.port.StageScheduler;
import org.adsabs.boost.domain.Batch;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.ErrorKind;
import org.adsabs.boost.domain.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Splits input into batches and submits every record's stage chain.
 * <p><strong>Why:</strong> Bounds the unit of submission and reporting while letting records run in
 * parallel on the scheduler.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate identifiers before scheduling; invalid records count as failed.</li>
 *   <li>Dispatch all batches without waiting on earlier ones.</li>
 *   <li>Report per-batch outcomes and periodic progress.</li>
 * </ul>
 * <p>A failing record never stops its batch or other batches.</p>
 * <p><strong>Observability:</strong> {@code boost.records.*} counters and
 * {@code boost.batch.size} histogram; MDC key {@code pipeline=batch}.</p>
 *
 * @since 0.1.0
 */
public final class BatchOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

  private final StageScheduler scheduler;
  private final MetricsPort metrics;
  private final int progressEvery;

  public BatchOrchestrator(StageScheduler scheduler, MetricsPort metrics, int progressEvery) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (progressEvery <= 0) {
      throw new IllegalArgumentException("progressEvery must be positive");
    }
    this.progressEvery = progressEvery;
  }

  /**
   * Submits all records and waits for every outcome.
   *
   * @param records input records
   * @param batchSize maximum batch size
   * @return per-batch report
   */
  public SubmissionReport submit(List<BoostRequest> records, int batchSize) {
    return submitAsync(records, batchSize).join();
  }

  /**
   * Dispatches every batch and returns without waiting for stage completion.
   *
   * @param records input records
   * @param batchSize maximum batch size
   * @return future completed once every record reaches a terminal outcome
   */
  public CompletableFuture<SubmissionReport> submitAsync(List<BoostRequest> records, int batchSize) {
    List<Batch> batches = Batch.partition(records, batchSize);
    ProgressTracker progress = new ProgressTracker(progressEvery, metrics);
    log.info("Submitting {} records in {} batches of up to {}", records.size(), batches.size(), batchSize);
    List<CompletableFuture<BatchReport>> pending = new ArrayList<>(batches.size());
    for (Batch batch : batches) {
      pending.add(dispatch(batch, progress));
    }
    return CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> summarize(pending.stream().map(CompletableFuture::join).toList()));
  }

  /**
   * Pages through a source, submitting one batch per page and waiting for it before reading the
   * next, so memory stays bounded by the batch size.
   *
   * @param source record source
   * @param batchSize page and batch size
   * @return per-batch report
   * @throws Exception if the source cannot be read
   */
  public SubmissionReport submitAll(RecordSource source, int batchSize) throws Exception {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    ProgressTracker progress = new ProgressTracker(progressEvery, metrics);
    List<BatchReport> reports = new ArrayList<>();
    int index = 0;
    while (true) {
      List<BoostRequest> page = source.nextPage(batchSize);
      if (page.isEmpty()) {
        break;
      }
      reports.add(dispatch(new Batch(index++, page), progress).join());
    }
    return summarize(reports);
  }

  private CompletableFuture<BatchReport> dispatch(Batch batch, ProgressTracker progress) {
    MDC.put("pipeline", "batch");
    try {
      metrics.observe("boost.batch.size", batch.size());
      List<CompletableFuture<ChainOutcome>> outcomes = new ArrayList<>(batch.size());
      for (BoostRequest request : batch.records()) {
        metrics.increment("boost.records.submitted");
        outcomes.add(schedule(request).whenComplete((outcome, ex) -> {
          if (outcome != null) {
            progress.record(outcome);
          }
        }));
      }
      log.debug("Dispatched batch {} with {} records", batch.index(), batch.size());
      return CompletableFuture.allOf(outcomes.toArray(CompletableFuture[]::new))
          .thenApply(ignored -> tally(batch, outcomes));
    } finally {
      MDC.remove("pipeline");
    }
  }

  private CompletableFuture<ChainOutcome> schedule(BoostRequest request) {
    String label = request.label();
    try {
      request.key();
    } catch (ValidationException ex) {
      metrics.increment("boost.records.invalid");
      log.warn("Skipping invalid record at stage {}: {}", Stage.VALIDATE.label(), ex.getMessage());
      return CompletableFuture.completedFuture(ChainOutcome.failed(label, Stage.VALIDATE, ErrorKind.VALIDATION));
    }
    try {
      return scheduler.schedule(request)
          .exceptionally(ex -> {
            log.error("Scheduler failed for {}", label, ex);
            return ChainOutcome.failed(label, Stage.COMPUTE, StageFailures.classify(Stage.COMPUTE, ex).kind());
          });
    } catch (RuntimeException ex) {
      log.error("Could not schedule {}", label, ex);
      return CompletableFuture.completedFuture(
          ChainOutcome.failed(label, Stage.COMPUTE, StageFailures.classify(Stage.COMPUTE, ex).kind()));
    }
  }

  private static BatchReport tally(Batch batch, List<CompletableFuture<ChainOutcome>> outcomes) {
    int succeeded = 0;
    int failed = 0;
    int dispatched = 0;
    int notificationFailures = 0;
    for (CompletableFuture<ChainOutcome> future : outcomes) {
      ChainOutcome outcome = future.join();
      switch (outcome.status()) {
        case SUCCEEDED -> {
          succeeded++;
          if (outcome.notificationFailed()) {
            notificationFailures++;
          }
        }
        case FAILED -> failed++;
        case DISPATCHED -> dispatched++;
      }
    }
    BatchReport report = new BatchReport(
        batch.index(), batch.size(), succeeded, failed, dispatched, notificationFailures);
    log.info("Batch {} finished: {} succeeded, {} failed, {} dispatched, {} notification failures",
        report.index(), succeeded, failed, dispatched, notificationFailures);
    return report;
  }

  private static SubmissionReport summarize(List<BatchReport> reports) {
    SubmissionReport report = new SubmissionReport(reports);
    log.info("Submission finished: {} records, {} succeeded, {} failed, {} dispatched",
        report.records(), report.succeeded(), report.failed(), report.dispatched());
    return report;
  }
}

package org.adsabs.boost.application.pipeline;

import java.util.List;

/**
 * Aggregate of all batch reports of one submission.
 *
 * @param batches reports in batch order
 * @since 0.1.0
 */
public record SubmissionReport(List<BatchReport> batches) {
  public SubmissionReport {
    batches = List.copyOf(batches);
  }

  public long records() {
    return batches.stream().mapToLong(BatchReport::size).sum();
  }

  public long succeeded() {
    return batches.stream().mapToLong(BatchReport::succeeded).sum();
  }

  public long failed() {
    return batches.stream().mapToLong(BatchReport::failed).sum();
  }

  public long dispatched() {
    return batches.stream().mapToLong(BatchReport::dispatched).sum();
  }

  public long notificationFailures() {
    return batches.stream().mapToLong(BatchReport::notificationFailures).sum();
  }

  public boolean hasFailures() {
    return failed() > 0;
  }
}

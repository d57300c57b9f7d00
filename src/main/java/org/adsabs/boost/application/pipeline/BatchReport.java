package org.adsabs.boost.application.pipeline;

/**
 * Per-batch tally of record outcomes.
 *
 * @param index batch index
 * @param size records in the batch
 * @param succeeded records computed and stored
 * @param failed records that failed any stage, including validation
 * @param dispatched records handed to remote stage workers
 * @param notificationFailures stored records whose notification could not be delivered
 * @since 0.1.0
 */
public record BatchReport(
    int index, int size, int succeeded, int failed, int dispatched, int notificationFailures) {}

package org.adsabs.boost.application.port;

import java.util.concurrent.CompletableFuture;
import org.adsabs.boost.application.pipeline.ChainOutcome;
import org.adsabs.boost.domain.BoostRequest;

/**
 * <strong>What:</strong> Runs the compute, store and send stages for a record.
 * <p><strong>Why:</strong> The orchestrator submits work without knowing whether stages execute on a
 * local worker pool or travel through message topics.</p>
 * <p><strong>Contract:</strong> {@link #schedule(BoostRequest)} returns immediately. The returned
 * future never completes exceptionally; failures are reported as a failed {@link ChainOutcome}
 * naming the stage and error kind.</p>
 *
 * @since 0.1.0
 */
public interface StageScheduler extends AutoCloseable {
  /**
   * Schedules the stage chain for a validated record.
   *
   * @param request record with at least one identifier
   * @return outcome of the chain, or of its hand-off for distributed schedulers
   */
  CompletableFuture<ChainOutcome> schedule(BoostRequest request);

  @Override
  default void close() throws Exception {}
}

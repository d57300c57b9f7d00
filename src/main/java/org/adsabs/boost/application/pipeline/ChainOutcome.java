package org.adsabs.boost.application.pipeline;

import java.util.Objects;
import org.adsabs.boost.domain.error.ErrorKind;

/**
 * Result of running (or handing off) the stage chain for one record.
 *
 * @param label record label for logs
 * @param status terminal status
 * @param failedStage stage that failed; {@code null} unless {@code status == FAILED}
 * @param errorKind failure category; {@code null} unless {@code status == FAILED}
 * @param notificationFailed {@code true} when the record was stored but could not be published
 * @since 0.1.0
 */
public record ChainOutcome(
    String label, Status status, Stage failedStage, ErrorKind errorKind, boolean notificationFailed) {

  /** Terminal state of a record. */
  public enum Status {
    /** Computed and stored. */
    SUCCEEDED,
    /** A stage failed permanently or ran out of attempts. */
    FAILED,
    /** Handed to a remote stage worker; completion is tracked there. */
    DISPATCHED
  }

  public ChainOutcome {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(status, "status");
    if (status == Status.FAILED) {
      Objects.requireNonNull(failedStage, "failedStage");
      Objects.requireNonNull(errorKind, "errorKind");
    }
  }

  public static ChainOutcome succeeded(String label) {
    return new ChainOutcome(label, Status.SUCCEEDED, null, null, false);
  }

  public static ChainOutcome storedWithoutNotification(String label) {
    return new ChainOutcome(label, Status.SUCCEEDED, null, null, true);
  }

  public static ChainOutcome failed(String label, Stage stage, ErrorKind kind) {
    return new ChainOutcome(label, Status.FAILED, stage, kind, false);
  }

  public static ChainOutcome dispatched(String label) {
    return new ChainOutcome(label, Status.DISPATCHED, null, null, false);
  }
}

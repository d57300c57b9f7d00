package org.adsabs.boost.application.pipeline;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.adsabs.boost.domain.error.PermanentStageException;
import org.adsabs.boost.domain.error.RetryableStageException;
import org.adsabs.boost.domain.error.StageException;

/**
 * Maps arbitrary throwables raised while running a stage onto {@link StageException}.
 *
 * @since 0.1.0
 */
public final class StageFailures {
  private StageFailures() {}

  /**
   * Classifies a failure.
   *
   * <p>Stage exceptions keep their kind. Timeouts, interruptions and lost database connections are retryable. Anything else is
   * a programming or data error and is permanent.</p>
   *
   * @param stage failing stage
   * @param failure raised throwable, possibly wrapped by an executor
   * @return classified exception
   */
  public static StageException classify(Stage stage, Throwable failure) {
    Throwable cause = unwrap(failure);
    if (cause instanceof StageException stageException) {
      return stageException;
    }
    if (cause instanceof TimeoutException) {
      return new RetryableStageException(stage.label() + " stage timed out", cause);
    }
    if (cause instanceof InterruptedException || cause instanceof CancellationException) {
      return new RetryableStageException(stage.label() + " stage interrupted", cause);
    }
    if (cause instanceof SQLTransientException || cause instanceof SQLRecoverableException
        || (cause instanceof SQLException sql && isConnectionState(sql.getSQLState()))) {
      return new RetryableStageException(stage.label() + " stage lost its database connection", cause);
    }
    return new PermanentStageException(
        stage.label() + " stage failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage(),
        cause);
  }

  private static boolean isConnectionState(String sqlState) {
    return sqlState != null && sqlState.startsWith("08");
  }

  static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}

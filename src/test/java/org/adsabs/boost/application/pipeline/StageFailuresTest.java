package org.adsabs.boost.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import org.adsabs.boost.domain.error.ErrorKind;
import org.adsabs.boost.domain.error.ValidationException;
import org.junit.jupiter.api.Test;

class StageFailuresTest {

  @Test
  void stageExceptionsKeepTheirKindThroughWrappers() {
    ValidationException validation = new ValidationException("no identifier");

    assertSame(validation, StageFailures.classify(Stage.COMPUTE, new CompletionException(validation)));
  }

  @Test
  void timeoutsAndLostConnectionsAreRetryable() {
    assertEquals(ErrorKind.RETRYABLE, StageFailures.classify(Stage.STORE, new TimeoutException()).kind());
    assertEquals(ErrorKind.RETRYABLE,
        StageFailures.classify(Stage.STORE, new SQLTransientConnectionException("reset")).kind());
    assertEquals(ErrorKind.RETRYABLE,
        StageFailures.classify(Stage.STORE, new SQLException("closed", "08006")).kind());
  }

  @Test
  void dataErrorsArePermanent() {
    assertEquals(ErrorKind.PERMANENT,
        StageFailures.classify(Stage.STORE, new SQLException("too long", "22001")).kind());
    assertEquals(ErrorKind.PERMANENT,
        StageFailures.classify(Stage.COMPUTE, new ArithmeticException("nan")).kind());
  }
}

package org.adsabs.boost.infrastructure.persistence;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import org.adsabs.boost.domain.error.PermanentStageException;
import org.adsabs.boost.domain.error.RetryableStageException;
import org.adsabs.boost.domain.error.StageException;

/**
 * Classifies JDBC failures by exception type and SQLState class.
 *
 * <p>Retryable: transient and recoverable exceptions, connection errors (class {@code 08}),
 * transaction rollbacks such as deadlocks or serialization failures ({@code 40}), operator
 * intervention ({@code 57}) and driver errors without a SQLState. Everything else, notably data
 * exceptions ({@code 22}) and integrity violations ({@code 23}), is permanent.</p>
 *
 * @since 0.1.0
 */
final class SqlFailures {
  static final String UNIQUE_VIOLATION = "23505";

  private SqlFailures() {}

  static StageException classify(String operation, SQLException ex) {
    String message = operation + " failed: " + ex.getMessage() + " (SQLState " + ex.getSQLState() + ")";
    return isRetryable(ex)
        ? new RetryableStageException(message, ex)
        : new PermanentStageException(message, ex);
  }

  static boolean isRetryable(SQLException ex) {
    if (ex instanceof SQLTransientException
        || ex instanceof SQLRecoverableException
        || ex instanceof SQLNonTransientConnectionException) {
      return true;
    }
    String state = ex.getSQLState();
    if (state == null || state.length() < 2) {
      return true;
    }
    String stateClass = state.substring(0, 2);
    return stateClass.equals("08") || stateClass.equals("40") || stateClass.equals("57");
  }

  static boolean isUniqueViolation(SQLException ex) {
    return UNIQUE_VIOLATION.equals(ex.getSQLState());
  }
}

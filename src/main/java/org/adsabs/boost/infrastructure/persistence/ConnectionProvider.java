package org.adsabs.boost.infrastructure.persistence;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens JDBC connections for repository operations.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ConnectionProvider {
  /**
   * Opens a connection; the caller closes it.
   *
   * @return open connection
   * @throws SQLException if the database is unreachable
   */
  Connection open() throws SQLException;

  /**
   * Provider backed by {@link DriverManager}; the JDBC driver is discovered from the classpath.
   *
   * @param url JDBC URL
   * @param user user name; may be {@code null}
   * @param password password; may be {@code null}
   * @return provider
   */
  static ConnectionProvider driverManager(String url, String user, String password) {
    Objects.requireNonNull(url, "url");
    if (user == null || user.isBlank()) {
      return () -> DriverManager.getConnection(url);
    }
    return () -> DriverManager.getConnection(url, user, password == null ? "" : password);
  }
}

package org.adsabs.boost.infrastructure.persistence;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.adsabs.boost.domain.Discipline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table layout of {@code boost_factors}: one row per record, unique on bibcode and on scix_id.
 *
 * @since 0.1.0
 */
public final class BoostFactorsSchema {
  private static final Logger log = LoggerFactory.getLogger(BoostFactorsSchema.class);

  static final String TABLE = "boost_factors";
  static final int IDENTIFIER_LENGTH = 19;

  /** Value columns in write order; identifiers are handled separately. */
  static final List<String> VALUE_COLUMNS = valueColumns();

  private BoostFactorsSchema() {}

  private static List<String> valueColumns() {
    List<String> columns = new ArrayList<>();
    columns.add("created");
    columns.add("refereed_boost");
    columns.add("doctype_boost");
    columns.add("recency_boost");
    columns.add("boost_factor");
    for (Discipline discipline : Discipline.values()) {
      columns.add(discipline.tag() + "_weight");
    }
    for (Discipline discipline : Discipline.values()) {
      columns.add(discipline.tag() + "_final_boost");
    }
    return List.copyOf(columns);
  }

  static List<String> ddl() {
    StringBuilder table = new StringBuilder()
        .append("CREATE TABLE IF NOT EXISTS ").append(TABLE).append(" (")
        .append("id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, ")
        .append("bibcode VARCHAR(").append(IDENTIFIER_LENGTH).append("), ")
        .append("scix_id VARCHAR(").append(IDENTIFIER_LENGTH).append("), ")
        .append("created TIMESTAMP WITH TIME ZONE NOT NULL");
    for (String column : VALUE_COLUMNS.subList(1, VALUE_COLUMNS.size())) {
      table.append(", ").append(column).append(" DOUBLE PRECISION NOT NULL");
    }
    table.append(')');
    return List.of(
        table.toString(),
        "CREATE UNIQUE INDEX IF NOT EXISTS " + TABLE + "_bibcode_idx ON " + TABLE + " (bibcode)",
        "CREATE UNIQUE INDEX IF NOT EXISTS " + TABLE + "_scix_id_idx ON " + TABLE + " (scix_id)");
  }

  /**
   * Creates the table and unique indexes when absent.
   *
   * @param connections connection provider
   * @throws SQLException if DDL execution fails
   */
  public static void create(ConnectionProvider connections) throws SQLException {
    try (Connection connection = connections.open();
        Statement statement = connection.createStatement()) {
      for (String sql : ddl()) {
        statement.execute(sql);
      }
    }
    log.info("Ensured table {} and its unique indexes exist", TABLE);
  }
}

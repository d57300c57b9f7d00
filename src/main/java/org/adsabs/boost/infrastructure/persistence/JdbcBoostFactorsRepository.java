package org.adsabs.boost.infrastructure.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.adsabs.boost.application.port.BoostFactorsRepository;
import org.adsabs.boost.domain.BasicBoosts;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.Discipline;
import org.adsabs.boost.domain.DisciplineScores;
import org.adsabs.boost.domain.RecordKey;
import org.adsabs.boost.domain.error.PermanentStageException;
import org.adsabs.boost.domain.error.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> JDBC implementation of {@link BoostFactorsRepository} over the
 * {@code boost_factors} table.
 * <p><strong>Why:</strong> Portable across PostgreSQL in production and H2 in tests; no
 * vendor-specific upsert syntax.</p>
 * <p><strong>Upsert:</strong> within one transaction, update the row whose bibcode or scix_id
 * matches; when none matches, insert. A concurrent insert of the same key surfaces as a unique
 * violation and is resolved by updating the row that won. When bibcode and scix_id point at two
 * different rows, or disagree with an identifier already stored, the write is rejected as
 * permanent. Stored identifiers are filled in when missing and never replaced.</p>
 * <p><strong>Thread-safety:</strong> Each call uses its own connection.</p>
 *
 * @since 0.1.0
 */
public final class JdbcBoostFactorsRepository implements BoostFactorsRepository {
  private static final Logger log = LoggerFactory.getLogger(JdbcBoostFactorsRepository.class);

  private static final String TABLE = BoostFactorsSchema.TABLE;
  private static final String SELECT_COLUMNS =
      "bibcode, scix_id, " + String.join(", ", BoostFactorsSchema.VALUE_COLUMNS);
  private static final String UPDATE_SQL = "UPDATE " + TABLE
      + " SET bibcode = COALESCE(bibcode, ?), scix_id = COALESCE(scix_id, ?), "
      + BoostFactorsSchema.VALUE_COLUMNS.stream().map(c -> c + " = ?").collect(Collectors.joining(", "))
      + " WHERE bibcode = ? OR scix_id = ?";
  private static final String INSERT_SQL = "INSERT INTO " + TABLE + " (" + SELECT_COLUMNS + ") VALUES ("
      + "?, ?, " + BoostFactorsSchema.VALUE_COLUMNS.stream().map(c -> "?").collect(Collectors.joining(", "))
      + ")";
  private static final String SELECT_IDENTIFIERS =
      "SELECT bibcode, scix_id FROM " + TABLE + " WHERE bibcode = ? OR scix_id = ?";
  private static final String SELECT_BY_BIBCODE =
      "SELECT " + SELECT_COLUMNS + " FROM " + TABLE + " WHERE bibcode = ?";
  private static final String SELECT_BY_SCIX_ID =
      "SELECT " + SELECT_COLUMNS + " FROM " + TABLE + " WHERE scix_id = ?";
  private static final String SELECT_ALL = "SELECT " + SELECT_COLUMNS + " FROM " + TABLE + " ORDER BY id";

  private final ConnectionProvider connections;

  public JdbcBoostFactorsRepository(ConnectionProvider connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  @Override
  public void upsert(BoostFactors factors) throws StageException {
    RecordKey key = factors.key();
    try (Connection connection = connections.open()) {
      connection.setAutoCommit(false);
      try {
        int updated = update(connection, factors);
        if (updated == 0) {
          updated = insertOrUpdate(connection, factors);
        }
        if (updated > 1) {
          throw new PermanentStageException(
              "bibcode " + key.bibcode() + " and scix_id " + key.scixId() + " identify different rows", null);
        }
        connection.commit();
      } catch (SQLException | StageException | RuntimeException ex) {
        rollbackQuietly(connection, ex);
        throw ex;
      }
    } catch (SQLException ex) {
      throw SqlFailures.classify("upsert of " + key.display(), ex);
    }
  }

  private int insertOrUpdate(Connection connection, BoostFactors factors)
      throws SQLException, PermanentStageException {
    try (PreparedStatement insert = connection.prepareStatement(INSERT_SQL)) {
      bindIdentifiers(insert, 1, factors.key());
      bindValues(insert, 3, factors);
      return insert.executeUpdate();
    } catch (SQLException ex) {
      if (!SqlFailures.isUniqueViolation(ex)) {
        throw ex;
      }
      log.debug("Concurrent insert of {} detected; updating instead", factors.key().display());
      // PostgreSQL aborts the transaction on a failed statement; restart it.
      connection.rollback();
      int updated = update(connection, factors);
      if (updated == 0) {
        throw ex;
      }
      return updated;
    }
  }

  private int update(Connection connection, BoostFactors factors) throws SQLException, PermanentStageException {
    rejectIdentifierConflict(connection, factors.key());
    try (PreparedStatement update = connection.prepareStatement(UPDATE_SQL)) {
      int index = bindIdentifiers(update, 1, factors.key());
      index = bindValues(update, index, factors);
      bindIdentifiers(update, index, factors.key());
      return update.executeUpdate();
    }
  }

  /**
   * Rejects a write whose bibcode or scix_id disagrees with a non-null identifier already stored on
   * the matching row. Stored identifiers are only ever filled in, never replaced.
   */
  private static void rejectIdentifierConflict(Connection connection, RecordKey key)
      throws SQLException, PermanentStageException {
    try (PreparedStatement select = connection.prepareStatement(SELECT_IDENTIFIERS)) {
      bindIdentifiers(select, 1, key);
      try (ResultSet rows = select.executeQuery()) {
        int matched = 0;
        while (rows.next()) {
          if (++matched > 1) {
            throw new PermanentStageException(
                "bibcode " + key.bibcode() + " and scix_id " + key.scixId() + " identify different rows", null);
          }
          String storedBibcode = rows.getString(1);
          String storedScixId = rows.getString(2);
          if (differs(storedBibcode, key.bibcode()) || differs(storedScixId, key.scixId())) {
            throw new PermanentStageException("identifiers of " + key.display()
                + " conflict with stored row (bibcode " + storedBibcode + ", scix_id " + storedScixId + ")", null);
          }
        }
      }
    }
  }

  private static boolean differs(String stored, String incoming) {
    return stored != null && incoming != null && !stored.equals(incoming);
  }

  private static int bindIdentifiers(PreparedStatement statement, int start, RecordKey key) throws SQLException {
    setNullable(statement, start, key.bibcode());
    setNullable(statement, start + 1, key.scixId());
    return start + 2;
  }

  private static int bindValues(PreparedStatement statement, int start, BoostFactors factors) throws SQLException {
    int index = start;
    statement.setObject(index++, OffsetDateTime.ofInstant(factors.created(), ZoneOffset.UTC));
    statement.setDouble(index++, factors.basics().refereed());
    statement.setDouble(index++, factors.basics().doctype());
    statement.setDouble(index++, factors.basics().recency());
    statement.setDouble(index++, factors.combinedBoost());
    for (Discipline discipline : Discipline.values()) {
      statement.setDouble(index++, factors.disciplineWeights().get(discipline));
    }
    for (Discipline discipline : Discipline.values()) {
      statement.setDouble(index++, factors.finalBoosts().get(discipline));
    }
    return index;
  }

  private static void setNullable(PreparedStatement statement, int index, String value) throws SQLException {
    if (value == null) {
      statement.setNull(index, Types.VARCHAR);
    } else {
      statement.setString(index, value);
    }
  }

  @Override
  public Optional<BoostFactors> findByBibcode(String bibcode) throws StageException {
    return findOne(SELECT_BY_BIBCODE, bibcode);
  }

  @Override
  public Optional<BoostFactors> findByScixId(String scixId) throws StageException {
    return findOne(SELECT_BY_SCIX_ID, scixId);
  }

  private Optional<BoostFactors> findOne(String sql, String value) throws StageException {
    try (Connection connection = connections.open();
        PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, value);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() ? Optional.of(read(rs)) : Optional.empty();
      }
    } catch (SQLException ex) {
      throw SqlFailures.classify("lookup of " + value, ex);
    }
  }

  @Override
  public long forEach(Consumer<BoostFactors> sink) throws StageException {
    long count = 0;
    try (Connection connection = connections.open();
        PreparedStatement statement = connection.prepareStatement(SELECT_ALL)) {
      statement.setFetchSize(500);
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          sink.accept(read(rs));
          count++;
        }
      }
    } catch (SQLException ex) {
      throw SqlFailures.classify("scan of " + TABLE, ex);
    }
    return count;
  }

  private static BoostFactors read(ResultSet rs) throws SQLException {
    EnumMap<Discipline, Double> weights = new EnumMap<>(Discipline.class);
    EnumMap<Discipline, Double> finals = new EnumMap<>(Discipline.class);
    for (Discipline discipline : Discipline.values()) {
      weights.put(discipline, rs.getDouble(discipline.tag() + "_weight"));
      finals.put(discipline, rs.getDouble(discipline.tag() + "_final_boost"));
    }
    return new BoostFactors(
        new RecordKey(rs.getString("bibcode"), rs.getString("scix_id")),
        new BasicBoosts(rs.getDouble("refereed_boost"), rs.getDouble("doctype_boost"), rs.getDouble("recency_boost")),
        rs.getDouble("boost_factor"),
        DisciplineScores.of(weights),
        DisciplineScores.of(finals),
        rs.getObject("created", OffsetDateTime.class).toInstant());
  }

  private static void rollbackQuietly(Connection connection, Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException rollbackFailure) {
      cause.addSuppressed(rollbackFailure);
    }
  }
}

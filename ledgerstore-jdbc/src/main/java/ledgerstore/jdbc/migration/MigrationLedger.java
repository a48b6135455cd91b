package ledgerstore.jdbc.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import ledgerstore.Deadline;
import ledgerstore.jdbc.JdbcTemplate;
import ledgerstore.jdbc.spi.Dialect;

/**
 * Reads and appends rows of the {@code <service>_schema_migrations} table.
 *
 * <p>Rows are never updated. A failed execution is recorded with {@code success = false}
 * and does not count as applied, so the script runs again on the next attempt.
 */
final class MigrationLedger {
  private static final int MAX_ERROR_LENGTH = 1024;

  private static final JdbcTemplate.RowMapper<MigrationRecord> ROW_MAPPER = rs -> new MigrationRecord(
      rs.getInt("version"),
      rs.getString("name"),
      rs.getString("checksum"),
      JdbcTemplate.instant(rs, "executed_at"),
      rs.getLong("execution_time_ms"),
      rs.getString("applied_by"),
      rs.getBoolean("success"),
      rs.getString("error_message"));

  private final Dialect dialect;
  private final String table;
  private final String serviceName;

  MigrationLedger(Dialect dialect, String table, String serviceName) {
    this.dialect = dialect;
    this.table = table;
    this.serviceName = serviceName;
  }

  String table() {
    return table;
  }

  void ensureTable(Connection conn, Deadline deadline) throws SQLException {
    JdbcTemplate.execute(conn, deadline, dialect.migrationLedgerDdl(table));
  }

  /** Successful entries for this service, ascending by version. */
  List<MigrationRecord> applied(Connection conn, Deadline deadline) throws SQLException {
    return JdbcTemplate.query(conn, deadline,
        "SELECT version, name, checksum, executed_at, execution_time_ms, applied_by, success, error_message"
            + " FROM " + table + " WHERE service = ? AND success = ? ORDER BY version ASC, executed_at ASC",
        ROW_MAPPER, serviceName, Boolean.TRUE);
  }

  MigrationRecord append(Connection conn, Deadline deadline, Migration migration, Instant executedAt,
      long executionTimeMs, String appliedBy, String errorMessage) throws SQLException {
    boolean success = errorMessage == null;
    String error = errorMessage == null || errorMessage.length() <= MAX_ERROR_LENGTH
        ? errorMessage
        : errorMessage.substring(0, MAX_ERROR_LENGTH);
    JdbcTemplate.update(conn, deadline,
        "INSERT INTO " + table + " (id, version, name, service, checksum, executed_at, execution_time_ms,"
            + " applied_by, success, error_message) VALUES (?,?,?,?,?,?,?,?,?,?)",
        UUID.randomUUID().toString(), migration.version(), migration.name(), serviceName,
        migration.checksum(), executedAt, executionTimeMs, appliedBy, success, error);
    return new MigrationRecord(migration.version(), migration.name(), migration.checksum(), executedAt,
        executionTimeMs, appliedBy, success, error);
  }
}

package ledgerstore.jdbc.spi;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import ledgerstore.error.ErrorClassifier;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations describe how to select a logical database, how to probe liveness, how
 * the migration ledger table is declared, and how the driver's failures are classified.
 * Register custom dialects via {@code META-INF/services/ledgerstore.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: H2, PostgreSQL (including PostgreSQL wire-compatible append-only
 * stores), MySQL.
 *
 * @see ledgerstore.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles.
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Cheapest statement the store answers; used for health checks.
   */
  default String pingSql() {
    return "SELECT 1";
  }

  /**
   * Switches a freshly opened session to the given logical database.
   */
  void useDatabase(Connection conn, String database) throws SQLException;

  /**
   * Idempotent DDL for the migration ledger table.
   *
   * <p>Columns: id, version, name, service, checksum, executed_at, execution_time_ms,
   * applied_by, success, error_message.
   */
  String migrationLedgerDdl(String table);

  /**
   * Classifier for this driver's failures.
   */
  ErrorClassifier errorClassifier();

  /**
   * Whether DDL statements take part in transactions. When {@code false}, a failed migration
   * may leave the statements that ran before the failure in place.
   */
  boolean transactionalDdl();
}

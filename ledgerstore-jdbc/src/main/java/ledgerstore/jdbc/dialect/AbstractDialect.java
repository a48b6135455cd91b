package ledgerstore.jdbc.dialect;

import java.sql.Connection;
import java.sql.SQLException;

import ledgerstore.error.ErrorClassifier;
import ledgerstore.error.SqlStateErrorClassifier;
import ledgerstore.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL.
 *
 * <p>Subclasses override the column types and the database selection their store needs.
 */
public abstract class AbstractDialect implements Dialect {
  private final ErrorClassifier errorClassifier = createErrorClassifier();

  @Override
  public void useDatabase(Connection conn, String database) throws SQLException {
    conn.setSchema(database);
  }

  @Override
  public String migrationLedgerDdl(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " (" +
        "id VARCHAR(36) NOT NULL, " +
        "version INTEGER NOT NULL, " +
        "name VARCHAR(255) NOT NULL, " +
        "service VARCHAR(64) NOT NULL, " +
        "checksum VARCHAR(64) NOT NULL, " +
        "executed_at " + timestampType() + " NOT NULL, " +
        "execution_time_ms BIGINT NOT NULL, " +
        "applied_by VARCHAR(128) NOT NULL, " +
        "success " + booleanType() + " NOT NULL, " +
        "error_message VARCHAR(1024), " +
        "PRIMARY KEY (id))";
  }

  @Override
  public ErrorClassifier errorClassifier() {
    return errorClassifier;
  }

  protected ErrorClassifier createErrorClassifier() {
    return new SqlStateErrorClassifier();
  }

  protected String timestampType() {
    return "TIMESTAMP";
  }

  protected String booleanType() {
    return "BOOLEAN";
  }
}

package ledgerstore.jdbc.dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import ledgerstore.error.ErrorClassifier;
import ledgerstore.error.SqlStateErrorClassifier;

/**
 * MySQL. The logical database is selected as the connection catalog.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public void useDatabase(Connection conn, String database) throws SQLException {
    conn.setCatalog(database);
  }

  @Override
  public boolean transactionalDdl() {
    return false;
  }

  @Override
  protected String timestampType() {
    return "DATETIME(6)";
  }

  @Override
  protected ErrorClassifier createErrorClassifier() {
    return new SqlStateErrorClassifier().withSessionLostMarkers(List.of(
        "communications link failure",
        "server has gone away"));
  }
}

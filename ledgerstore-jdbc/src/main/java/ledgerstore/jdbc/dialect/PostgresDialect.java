package ledgerstore.jdbc.dialect;

import java.util.List;

import ledgerstore.error.ErrorClassifier;
import ledgerstore.error.SqlStateErrorClassifier;

/**
 * PostgreSQL and stores speaking its wire protocol.
 *
 * <p>Append-only stores reached through the PostgreSQL driver report expired or revoked
 * sessions in their own words; those phrases are classified as session loss here.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean transactionalDdl() {
    return true;
  }

  @Override
  protected ErrorClassifier createErrorClassifier() {
    return new SqlStateErrorClassifier().withSessionLostMarkers(List.of(
        "terminating connection",
        "invalid session",
        "no session"));
  }
}

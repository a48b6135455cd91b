package ledgerstore.jdbc.dialect;

import java.util.List;

/**
 * H2, used for tests and local development. {@code useDatabase} selects a schema.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public boolean transactionalDdl() {
    return false;
  }
}

package ledgerstore.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;

import javax.sql.DataSource;

import ledgerstore.jdbc.dialect.Dialects;
import ledgerstore.jdbc.spi.Dialect;
import ledgerstore.spi.SessionFactory;

/**
 * {@link SessionFactory} over JDBC, backed either by {@link DriverManager} or by a
 * {@link DataSource}.
 *
 * <p>Each session is opened in auto-commit mode and switched to the configured logical
 * database through the {@link Dialect}. A session whose database cannot be selected is closed
 * and the attempt fails.
 */
public final class JdbcSessionFactory implements SessionFactory {
  private final DataSource dataSource;
  private final String jdbcUrl;
  private final String username;
  private final String password;
  private final String database;
  private final Dialect dialect;

  private JdbcSessionFactory(Builder builder) {
    this.dataSource = builder.dataSource;
    this.jdbcUrl = builder.jdbcUrl;
    this.username = builder.username;
    this.password = builder.password;
    this.database = builder.database == null || builder.database.isBlank() ? null : builder.database;
    this.dialect = builder.dialect;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Connection open() throws SQLException {
    Connection conn = dataSource != null
        ? dataSource.getConnection()
        : DriverManager.getConnection(jdbcUrl, username, password);
    try {
      conn.setAutoCommit(true);
      if (database != null) {
        dialect.useDatabase(conn, database);
      }
      return conn;
    } catch (SQLException e) {
      try {
        conn.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  @Override
  public void ping(Connection session, Duration timeout) throws SQLException {
    try (Statement st = session.createStatement()) {
      long millis = Math.max(1L, timeout.toMillis());
      st.setQueryTimeout((int) Math.max(1L, Math.min(Integer.MAX_VALUE, (millis + 999) / 1000)));
      st.execute(dialect.pingSql());
    }
  }

  @Override
  public String target() {
    if (dataSource != null) {
      return "datasource:" + dataSource.getClass().getSimpleName()
          + (database == null ? "" : "/" + database);
    }
    int query = jdbcUrl.indexOf('?');
    String redacted = query < 0 ? jdbcUrl : jdbcUrl.substring(0, query);
    return database == null ? redacted : redacted + " (database " + database + ")";
  }

  public Dialect dialect() {
    return dialect;
  }

  public static final class Builder {
    private DataSource dataSource;
    private String jdbcUrl;
    private String username;
    private String password;
    private String database;
    private Dialect dialect;

    private Builder() {
    }

    public Builder jdbcUrl(String jdbcUrl) {
      this.jdbcUrl = jdbcUrl;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    /**
     * Uses the given data source instead of {@link DriverManager}.
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * Logical database selected on every new session; blank leaves the driver default.
     */
    public Builder database(String database) {
      this.database = database;
      return this;
    }

    /**
     * Dialect to use. Detected from the JDBC URL when omitted.
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    public JdbcSessionFactory build() {
      if (dataSource == null && (jdbcUrl == null || jdbcUrl.isBlank())) {
        throw new IllegalArgumentException("Either jdbcUrl or dataSource is required");
      }
      if (dialect == null) {
        if (jdbcUrl == null) {
          throw new IllegalArgumentException("dialect is required when using a dataSource");
        }
        dialect = Dialects.detect(jdbcUrl);
      }
      Objects.requireNonNull(dialect, "dialect");
      return new JdbcSessionFactory(this);
    }
  }
}

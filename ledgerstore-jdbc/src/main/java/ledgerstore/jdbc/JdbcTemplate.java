package ledgerstore.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import ledgerstore.Deadline;

/**
 * Lightweight JDBC helper shared by the repositories and the migration runner.
 *
 * <p>Every statement gets a query timeout derived from the caller's {@link Deadline}.
 * {@link SQLException}s propagate unchanged so that callers can classify them.
 *
 * <p>{@link Instant}s are stored in zone-less {@code TIMESTAMP} columns as UTC wall-clock
 * time, independent of the JVM default zone.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE, return the driver's update count. */
  public static int update(Connection conn, Deadline deadline, String sql, Object... params)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      applyTimeout(ps, deadline);
      bindParams(ps, params);
      return ps.executeUpdate();
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, Deadline deadline, String sql, RowMapper<T> mapper,
      Object... params) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      applyTimeout(ps, deadline);
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    }
  }

  /** Execute a single-column aggregate such as {@code COUNT(*)}. */
  public static long queryForLong(Connection conn, Deadline deadline, String sql, Object... params)
      throws SQLException {
    List<Long> values = query(conn, deadline, sql, rs -> rs.getLong(1), params);
    return values.isEmpty() ? 0L : values.get(0);
  }

  /** Execute an unparameterized statement such as DDL from a migration script. */
  public static void execute(Connection conn, Deadline deadline, String sql) throws SQLException {
    try (Statement st = conn.createStatement()) {
      applyTimeout(st, deadline);
      st.execute(sql);
    }
  }

  private static void applyTimeout(Statement st, Deadline deadline) throws SQLException {
    deadline.check("execute statement");
    int seconds = deadline.queryTimeoutSeconds();
    if (seconds > 0) {
      st.setQueryTimeout(seconds);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setNull(i + 1, Types.VARCHAR);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Instant instant) {
        ps.setObject(i + 1, LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else if (param instanceof Enum<?> e) {
        ps.setString(i + 1, e.name());
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  /** Reads a non-null timestamp column as an {@link Instant}. */
  public static Instant instant(ResultSet rs, String column) throws SQLException {
    LocalDateTime utc = rs.getObject(column, LocalDateTime.class);
    return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
  }

  private JdbcTemplate() {}
}

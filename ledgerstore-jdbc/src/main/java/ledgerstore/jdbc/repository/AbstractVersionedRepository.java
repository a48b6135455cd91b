package ledgerstore.jdbc.repository;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import ledgerstore.Deadline;
import ledgerstore.SessionLease;
import ledgerstore.error.ErrorClassifier;
import ledgerstore.error.ErrorKind;
import ledgerstore.error.StoreException;
import ledgerstore.jdbc.JdbcTemplate;
import ledgerstore.jdbc.TableNames;
import ledgerstore.model.EntityField;
import ledgerstore.model.Page;
import ledgerstore.model.VersionedEntity;
import ledgerstore.spi.MetricsExporter;
import ledgerstore.spi.SessionProvider;

/**
 * Versioned CRUD over one table of an append-only store.
 *
 * <p>Updates are conditional writes guarded by {@code WHERE id = ? AND version = ?}. The
 * store's update count is not trusted; instead the row is re-read after the write and the
 * update counts as applied only if the row now carries {@code expectedVersion + 1} and this
 * write's {@code updated_at}. Anything else means another writer passed the gate first and the
 * caller gets {@code ABORTED}.
 *
 * <p>The table must have {@code id}, {@code version}, {@code created_at} and
 * {@code updated_at} columns. Subclasses describe the remaining columns.
 *
 * @param <T> entity type
 * @param <F> updatable field type
 */
public abstract class AbstractVersionedRepository<T extends VersionedEntity, F extends Enum<F> & EntityField> {
  private static final Logger logger = Logger.getLogger(AbstractVersionedRepository.class.getName());

  public static final int DEFAULT_PAGE_SIZE = 50;
  public static final int MAX_PAGE_SIZE = 200;

  protected final SessionProvider sessions;
  protected final ErrorClassifier errorClassifier;
  protected final MetricsExporter metrics;
  protected final MonotonicClock clock;
  protected final String table;

  protected AbstractVersionedRepository(SessionProvider sessions, ErrorClassifier errorClassifier,
      String table, MetricsExporter metrics, MonotonicClock clock) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
    this.table = TableNames.validate(table);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Singular entity name used in messages, for example {@code "account"}. */
  protected abstract String entityName();

  /** All columns in select and insert order. */
  protected abstract List<String> columns();

  protected abstract JdbcTemplate.RowMapper<T> rowMapper();

  /** Values for {@link #columns()}, in the same order. */
  protected abstract Object[] insertValues(T entity);

  /**
   * Validates a single field change and converts it to its column value.
   *
   * @throws StoreException with kind {@code INVALID_ARGUMENT} for unacceptable values
   */
  protected abstract Object columnValue(F field, Object value);

  @FunctionalInterface
  protected interface SessionWork<R> {
    R run(Connection conn) throws SQLException;
  }

  /**
   * Runs {@code work} on a borrowed session, translating store failures through the
   * {@link ErrorClassifier}.
   */
  protected final <R> R withSession(Deadline deadline, String operation, SessionWork<R> work) {
    Objects.requireNonNull(deadline, "deadline");
    try (SessionLease lease = sessions.acquire(deadline)) {
      try {
        return work.run(lease.connection());
      } catch (SQLException e) {
        lease.reportFailure(e);
        StoreException translated = errorClassifier.translate(operation, e);
        if (translated.kind() == ErrorKind.INTERNAL) {
          logger.log(Level.SEVERE, "Unexpected store failure during " + operation, e);
        }
        throw translated;
      }
    }
  }

  protected final void insert(Connection conn, Deadline deadline, T entity) throws SQLException {
    List<String> columns = columns();
    String placeholders = String.join(",", Collections.nCopies(columns.size(), "?"));
    String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
    JdbcTemplate.update(conn, deadline, sql, insertValues(entity));
  }

  /**
   * Selects the oldest row whose {@code column} equals {@code value}.
   */
  protected final Optional<T> selectOne(Connection conn, Deadline deadline, String column, Object value)
      throws SQLException {
    String sql = "SELECT " + String.join(", ", columns()) + " FROM " + table
        + " WHERE " + column + " = ? ORDER BY created_at ASC, id ASC LIMIT 1";
    List<T> rows = JdbcTemplate.query(conn, deadline, sql, rowMapper(), value);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  protected final T requireOne(Deadline deadline, String column, Object value, String description) {
    return withSession(deadline, "get " + entityName(),
        conn -> selectOne(conn, deadline, column, value)
            .orElseThrow(() -> StoreException.notFound(entityName() + " not found: " + description)));
  }

  /**
   * Conditional update with read-after-write verification.
   *
   * <p>Immutable fields and invalid values are rejected before a session is borrowed, so no
   * write reaches the store for such requests.
   *
   * @return the entity as re-read after the write
   */
  protected final T conditionalUpdate(Deadline deadline, String id, Map<F, Object> changes, long expectedVersion) {
    if (id == null || id.isBlank()) {
      throw StoreException.invalidArgument(entityName() + " id is required");
    }
    if (expectedVersion < 1) {
      throw StoreException.invalidArgument("expected version must be >= 1, got: " + expectedVersion);
    }
    StringBuilder set = new StringBuilder();
    List<Object> params = new ArrayList<>();
    for (Map.Entry<F, Object> change : changes.entrySet()) {
      F field = change.getKey();
      if (!field.mutable()) {
        throw StoreException.invalidArgument(
            "field " + field.column() + " of " + entityName() + " is immutable and cannot be updated");
      }
      set.append(field.column()).append(" = ?, ");
      params.add(columnValue(field, change.getValue()));
    }

    long newVersion = expectedVersion + 1;
    Instant writtenAt = clock.next();
    set.append("version = ?, updated_at = ?");
    params.add(newVersion);
    params.add(writtenAt);
    params.add(id);
    params.add(expectedVersion);
    String sql = "UPDATE " + table + " SET " + set + " WHERE id = ? AND version = ?";

    return withSession(deadline, "update " + entityName(), conn -> {
      try {
        // The update count is deliberately ignored; the re-read below decides.
        JdbcTemplate.update(conn, deadline, sql, params.toArray());
      } catch (SQLException e) {
        if (errorClassifier.classify(e) != ErrorKind.ABORTED) {
          throw e;
        }
        if (selectOne(conn, deadline, "id", id).isEmpty()) {
          throw StoreException.notFound(entityName() + " not found: " + id);
        }
        throw conflict(id, expectedVersion, null);
      }

      T reread = selectOne(conn, deadline, "id", id)
          .orElseThrow(() -> StoreException.notFound(entityName() + " not found: " + id));
      if (reread.version() == newVersion && writtenAt.equals(reread.updatedAt())) {
        return reread;
      }
      throw conflict(id, expectedVersion, reread.version());
    });
  }

  /**
   * Counts matching rows, then reads one page ordered by {@code created_at DESC, id ASC}.
   */
  protected final Page<T> page(Deadline deadline, Criteria criteria, int pageSize, String pageToken) {
    int limit = normalizePageSize(pageSize);
    long offset = parsePageToken(pageToken);
    String where = criteria.toSql();
    String countSql = "SELECT COUNT(*) FROM " + table + where;
    String selectSql = "SELECT " + String.join(", ", columns()) + " FROM " + table + where
        + " ORDER BY created_at DESC, id ASC LIMIT ? OFFSET ?";

    return withSession(deadline, "list " + entityName() + "s", conn -> {
      long total = JdbcTemplate.queryForLong(conn, deadline, countSql, criteria.params());
      List<Object> params = new ArrayList<>(List.of(criteria.params()));
      params.add(limit);
      params.add(offset);
      List<T> items = JdbcTemplate.query(conn, deadline, selectSql, rowMapper(), params.toArray());
      String next = offset + limit < total ? Long.toString(offset + limit) : "";
      return new Page<>(items, next, total);
    });
  }

  static int normalizePageSize(int pageSize) {
    if (pageSize < 0) {
      throw StoreException.invalidArgument("page size must be >= 0, got: " + pageSize);
    }
    if (pageSize == 0) {
      return DEFAULT_PAGE_SIZE;
    }
    return Math.min(pageSize, MAX_PAGE_SIZE);
  }

  static long parsePageToken(String pageToken) {
    if (pageToken == null || pageToken.isEmpty()) {
      return 0L;
    }
    try {
      long offset = Long.parseLong(pageToken);
      if (offset < 0) {
        throw StoreException.invalidArgument("invalid page token: " + pageToken);
      }
      return offset;
    } catch (NumberFormatException e) {
      throw StoreException.invalidArgument("invalid page token: " + pageToken);
    }
  }

  private StoreException conflict(String id, long expectedVersion, Long foundVersion) {
    metrics.incrementVersionConflict();
    return StoreException.aborted(entityName() + " " + id + " was modified concurrently (expected version "
        + expectedVersion + (foundVersion == null ? "" : ", found " + foundVersion) + "); re-read and retry");
  }

  /**
   * Conjunction of optional predicates for listings.
   */
  protected static final class Criteria {
    private final List<String> clauses = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    /** Adds {@code column = value} unless {@code value} is {@code null}. */
    public Criteria eq(String column, Object value) {
      if (value != null) {
        clauses.add(column + " = ?");
        params.add(value);
      }
      return this;
    }

    /** Adds a case-insensitive substring match unless {@code fragment} is {@code null}. */
    public Criteria containsIgnoreCase(String column, String fragment) {
      if (fragment != null) {
        clauses.add("LOWER(" + column + ") LIKE ?");
        params.add("%" + escapeLike(fragment.toLowerCase(Locale.ROOT)) + "%");
      }
      return this;
    }

    String toSql() {
      return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    Object[] params() {
      return params.toArray();
    }

    private static String escapeLike(String value) {
      return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
  }
}

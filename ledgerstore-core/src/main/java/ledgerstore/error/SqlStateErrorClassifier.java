package ledgerstore.error;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Default {@link ErrorClassifier} driven by SQLState classes, JDBC exception subtypes and a
 * short list of message markers.
 *
 * <p>Message markers are lower-cased substrings. Dialects extend the defaults with
 * {@link #withSessionLostMarkers(Collection)} when their driver reports session loss in
 * its own words.
 */
public final class SqlStateErrorClassifier implements ErrorClassifier {

  static final List<String> DEFAULT_SESSION_LOST_MARKERS = List.of(
      "session not found",
      "session expired",
      "permissiondenied",
      "permission denied",
      "connection is closed",
      "connection has been closed",
      "object is already closed",
      "database is already closed");

  static final List<String> DUPLICATE_MARKERS = List.of("duplicate", "unique");

  static final List<String> CONFLICT_MARKERS = List.of("version mismatch", "concurrent update",
      "could not serialize");

  private final List<String> sessionLostMarkers;

  public SqlStateErrorClassifier() {
    this(DEFAULT_SESSION_LOST_MARKERS);
  }

  private SqlStateErrorClassifier(List<String> sessionLostMarkers) {
    this.sessionLostMarkers = List.copyOf(sessionLostMarkers);
  }

  /**
   * Returns a classifier that also treats the given message markers as session loss.
   */
  public SqlStateErrorClassifier withSessionLostMarkers(Collection<String> markers) {
    List<String> merged = new ArrayList<>(sessionLostMarkers);
    for (String marker : markers) {
      String normalized = marker.toLowerCase(Locale.ROOT);
      if (!merged.contains(normalized)) {
        merged.add(normalized);
      }
    }
    return new SqlStateErrorClassifier(merged);
  }

  @Override
  public ErrorKind classify(SQLException e) {
    if (isSessionLost(e) || isTimeout(e)) {
      return ErrorKind.UNAVAILABLE;
    }
    String state = sqlState(e);
    String message = message(e);
    if (e instanceof SQLIntegrityConstraintViolationException
        || "23505".equals(state)
        || containsAny(message, DUPLICATE_MARKERS)) {
      return ErrorKind.ALREADY_EXISTS;
    }
    if (e instanceof SQLTransactionRollbackException
        || state.startsWith("40")
        || containsAny(message, CONFLICT_MARKERS)) {
      return ErrorKind.ABORTED;
    }
    if (state.startsWith("22")) {
      return ErrorKind.INVALID_ARGUMENT;
    }
    return ErrorKind.INTERNAL;
  }

  @Override
  public boolean isSessionLost(SQLException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLRecoverableException
          || t instanceof SQLNonTransientConnectionException
          || t instanceof SQLTransientConnectionException) {
        return true;
      }
      if (t instanceof SQLException sql && sqlState(sql).startsWith("08")) {
        return true;
      }
      if (t.getMessage() != null && containsAny(t.getMessage().toLowerCase(Locale.ROOT),
          sessionLostMarkers)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isTimeout(SQLException e) {
    String state = sqlState(e);
    return e instanceof SQLTimeoutException
        || "57014".equals(state)
        || "HYT00".equals(state)
        || "HYT01".equals(state);
  }

  private static String sqlState(SQLException e) {
    return e.getSQLState() == null ? "" : e.getSQLState();
  }

  private static String message(SQLException e) {
    return e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
  }

  private static boolean containsAny(String haystack, List<String> needles) {
    for (String needle : needles) {
      if (haystack.contains(needle)) {
        return true;
      }
    }
    return false;
  }
}

package ledgerstore.error;

import java.sql.SQLException;

/**
 * Maps low-level store failures onto {@link ErrorKind}.
 *
 * <p>All error-code and message matching against the store lives behind this interface so
 * that repositories and the connection manager never inspect error text themselves.
 *
 * @see SqlStateErrorClassifier
 */
public interface ErrorClassifier {

  /**
   * Classifies a failure raised by a store call.
   */
  ErrorKind classify(SQLException e);

  /**
   * Returns {@code true} when the failure means the session itself is gone (expired, revoked,
   * closed) and a fresh session would likely succeed.
   */
  boolean isSessionLost(SQLException e);

  /**
   * Wraps a failure into a {@link StoreException} of the classified kind.
   *
   * @param operation short description used as the message prefix
   */
  default StoreException translate(String operation, SQLException e) {
    ErrorKind kind = classify(e);
    return new StoreException(kind, operation + ": " + e.getMessage(), e);
  }
}

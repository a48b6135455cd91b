package ledgerstore.error;

import java.util.Objects;

/**
 * Unchecked exception thrown by connection and repository operations.
 *
 * <p>The {@link #kind()} is the only part callers should branch on; the message is for logs.
 */
public class StoreException extends RuntimeException {
  private final ErrorKind kind;

  public StoreException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public StoreException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }

  public static StoreException invalidArgument(String message) {
    return new StoreException(ErrorKind.INVALID_ARGUMENT, message);
  }

  public static StoreException notFound(String message) {
    return new StoreException(ErrorKind.NOT_FOUND, message);
  }

  public static StoreException alreadyExists(String message, Throwable cause) {
    return new StoreException(ErrorKind.ALREADY_EXISTS, message, cause);
  }

  public static StoreException aborted(String message) {
    return new StoreException(ErrorKind.ABORTED, message);
  }

  public static StoreException unavailable(String message) {
    return new StoreException(ErrorKind.UNAVAILABLE, message);
  }

  public static StoreException unavailable(String message, Throwable cause) {
    return new StoreException(ErrorKind.UNAVAILABLE, message, cause);
  }

  @Override
  public String toString() {
    return "StoreException[" + kind.code() + "]: " + getMessage();
  }
}

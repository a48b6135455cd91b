package ledgerstore.error;

/**
 * Failure classes surfaced by the store layer.
 *
 * <p>Each kind carries a stable code that transport layers can map onto their own status
 * vocabulary without inspecting exception messages.
 */
public enum ErrorKind {
  /** Malformed input or an attempt to change an immutable field. Never retried. */
  INVALID_ARGUMENT("INVALID_ARGUMENT", false),
  NOT_FOUND("NOT_FOUND", false),
  ALREADY_EXISTS("ALREADY_EXISTS", false),
  /** Optimistic-lock conflict. Safe to retry after re-reading the entity. */
  ABORTED("ABORTED", true),
  /** Store unreachable, session lost, or deadline exceeded. */
  UNAVAILABLE("UNAVAILABLE", true),
  INTERNAL("INTERNAL", false);

  private final String code;
  private final boolean retryable;

  ErrorKind(String code, boolean retryable) {
    this.code = code;
    this.retryable = retryable;
  }

  public String code() {
    return code;
  }

  public boolean isRetryable() {
    return retryable;
  }
}

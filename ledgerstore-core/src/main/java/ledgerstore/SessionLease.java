package ledgerstore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A borrowed store session. Closing the lease returns it; the underlying connection stays
 * open and remains owned by whoever issued the lease.
 *
 * <p>Leases are not thread-safe and should be used by the borrowing thread only, inside a
 * try-with-resources block.
 */
public final class SessionLease implements AutoCloseable {
  private final Connection connection;
  private final Runnable onRelease;
  private final Consumer<SQLException> onFailure;
  private final AtomicBoolean released = new AtomicBoolean();

  /**
   * @param connection the session being lent
   * @param onRelease  invoked once when the lease is closed
   * @param onFailure  invoked for each failure reported through {@link #reportFailure}
   */
  public SessionLease(Connection connection, Runnable onRelease, Consumer<SQLException> onFailure) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.onRelease = Objects.requireNonNull(onRelease, "onRelease");
    this.onFailure = Objects.requireNonNull(onFailure, "onFailure");
  }

  public Connection connection() {
    if (released.get()) {
      throw new IllegalStateException("Session lease already released");
    }
    return connection;
  }

  /**
   * Tells the issuer that a call on this session failed, so it can account for the error.
   */
  public void reportFailure(SQLException e) {
    onFailure.accept(e);
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      onRelease.run();
    }
  }
}

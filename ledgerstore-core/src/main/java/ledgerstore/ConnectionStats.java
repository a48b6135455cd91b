package ledgerstore;

import java.time.Instant;

/**
 * Point-in-time snapshot of the connection manager.
 *
 * @param state           lifecycle state when the snapshot was taken
 * @param active          sessions currently lent out
 * @param idle            remaining capacity ({@code total - active}), zero when disconnected
 * @param total           configured connection capacity
 * @param errorCount      errors since the last successful connect
 * @param connectedAt     when the current session was opened, or {@code null}
 * @param lastHealthCheck when the last health check finished, or {@code null}
 * @param lastError       message of the most recent error, or {@code null}
 * @param lastErrorAt     when the most recent error happened, or {@code null}
 */
public record ConnectionStats(
    ConnectionState state,
    int active,
    int idle,
    int total,
    long errorCount,
    Instant connectedAt,
    Instant lastHealthCheck,
    String lastError,
    Instant lastErrorAt
) {
  public boolean connected() {
    return state == ConnectionState.CONNECTED;
  }
}

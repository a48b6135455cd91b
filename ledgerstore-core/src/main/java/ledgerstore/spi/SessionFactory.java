package ledgerstore.spi;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Opens authenticated sessions to the store and probes their liveness.
 *
 * <p>Implementations must hand back a session that already has its logical database
 * selected. The connection manager owns every session it receives and closes it.
 */
public interface SessionFactory {

    /**
     * Opens a new session and selects the configured logical database.
     *
     * @throws SQLException if the store is unreachable, rejects the credentials, or the
     *                      database cannot be selected
     */
    Connection open() throws SQLException;

    /**
     * Runs a lightweight liveness call on the given session.
     *
     * @param timeout upper bound for the call
     */
    void ping(Connection session, Duration timeout) throws SQLException;

    /**
     * Human-readable target description (no credentials), used in logs and health reports.
     */
    String target();
}

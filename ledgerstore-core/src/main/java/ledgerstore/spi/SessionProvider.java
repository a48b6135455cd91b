package ledgerstore.spi;

import ledgerstore.Deadline;
import ledgerstore.SessionLease;

/**
 * Source of store sessions for repositories and the migration runner.
 *
 * @see ledgerstore.ConnectionManager
 */
public interface SessionProvider {

    /**
     * Borrows the current session.
     *
     * @throws ledgerstore.error.StoreException with kind {@code UNAVAILABLE} when no session
     *                                          is established or the deadline has passed
     */
    SessionLease acquire(Deadline deadline);

    /**
     * Whether a session is currently established. Callers use this to disable
     * entity-mutating features while the store is unavailable.
     */
    boolean isAvailable();
}

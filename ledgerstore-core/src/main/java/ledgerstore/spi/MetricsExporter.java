package ledgerstore.spi;

/**
 * Observability hook for exporting store counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of session open attempts (initial connects and reconnects).
     */
    void incrementConnectAttempt();

    /**
     * Increments the count of session open attempts that failed.
     */
    void incrementConnectFailure();

    /**
     * Increments the count of health checks that found the session lost.
     */
    void incrementSessionLost();

    /**
     * Records the outcome and latency of one health check.
     *
     * @param healthy    whether the check reported {@code HEALTHY}
     * @param durationMs time spent in the check, including any reconnect
     */
    void recordHealthCheck(boolean healthy, long durationMs);

    /**
     * Records the number of sessions currently lent out to callers.
     */
    default void recordActiveSessions(int active) {
    }

    /**
     * Increments the count of updates rejected by the optimistic version check.
     */
    default void incrementVersionConflict() {
    }

    /**
     * Increments the count of migration scripts applied successfully.
     */
    default void incrementMigrationApplied() {
    }

    /**
     * Increments the count of migration scripts that failed.
     */
    default void incrementMigrationFailed() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementConnectAttempt() {
        }

        @Override
        public void incrementConnectFailure() {
        }

        @Override
        public void incrementSessionLost() {
        }

        @Override
        public void recordHealthCheck(boolean healthy, long durationMs) {
        }
    }
}

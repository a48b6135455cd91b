package ledgerstore.spring.boot;

import ledgerstore.ConnectionManager;
import ledgerstore.Deadline;
import ledgerstore.SessionLease;
import ledgerstore.error.StoreException;
import ledgerstore.jdbc.migration.MigrationException;
import ledgerstore.jdbc.migration.MigrationRun;
import ledgerstore.jdbc.migration.MigrationRunner;
import ledgerstore.spi.SessionProvider;

import org.springframework.beans.factory.InitializingBean;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Session provider for entity traffic that holds sessions back until the schema is current.
 *
 * <p>With {@code ledgerstore.migration.run-on-boot} enabled, pending migrations are applied
 * while the context starts and a failure aborts startup. If the store was unreachable at
 * that point, the migrations run on the first session request made after the store comes
 * back; until they succeed, requests fail with {@code UNAVAILABLE}.
 *
 * <p>Without run-on-boot the gate passes sessions straight through. Pending migrations then
 * show up as a degraded migration health check.
 */
public class MigrationGate implements SessionProvider, InitializingBean {

    private static final Logger logger = Logger.getLogger(MigrationGate.class.getName());

    private final ConnectionManager connectionManager;
    private final MigrationRunner runner;
    private final boolean runOnBoot;

    private volatile boolean schemaCurrent;

    public MigrationGate(ConnectionManager connectionManager, MigrationRunner runner, boolean runOnBoot) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.runOnBoot = runOnBoot;
        this.schemaCurrent = !runOnBoot;
    }

    @Override
    public void afterPropertiesSet() {
        if (!runOnBoot) {
            logger.info("Boot migrations disabled; apply pending migrations with the migrate CLI");
            return;
        }
        if (!connectionManager.isAvailable()) {
            logger.warning("Store unavailable at startup; migrations deferred until it is reachable");
            return;
        }
        migrate(Deadline.none());
    }

    @Override
    public SessionLease acquire(Deadline deadline) {
        if (!schemaCurrent) {
            ensureSchemaCurrent(deadline);
        }
        return connectionManager.acquire(deadline);
    }

    @Override
    public boolean isAvailable() {
        return schemaCurrent && connectionManager.isAvailable();
    }

    public boolean isSchemaCurrent() {
        return schemaCurrent;
    }

    private synchronized void ensureSchemaCurrent(Deadline deadline) {
        if (schemaCurrent) {
            return;
        }
        if (!connectionManager.isAvailable()) {
            throw StoreException.unavailable("Store not connected");
        }
        try {
            migrate(deadline);
        } catch (MigrationException e) {
            logger.log(Level.SEVERE, "Deferred migrations failed; refusing entity traffic", e);
            throw StoreException.unavailable("Schema migrations failed: " + e.getMessage(), e);
        }
    }

    private void migrate(Deadline deadline) {
        MigrationRun run = runner.run(deadline);
        schemaCurrent = true;
        logger.info("Schema current: " + run.applied().size() + " migration(s) applied at startup");
    }
}

package ledgerstore.spring.boot;

import ledgerstore.ConnectionManager;
import ledgerstore.ConnectionState;
import ledgerstore.Deadline;
import ledgerstore.account.Account;
import ledgerstore.account.AccountRepository;
import ledgerstore.account.AccountType;
import ledgerstore.error.ErrorKind;
import ledgerstore.error.StoreException;
import ledgerstore.health.ConnectionHealthChecker;
import ledgerstore.health.DependencyHealth;
import ledgerstore.health.HealthMonitor;
import ledgerstore.health.HealthStatus;
import ledgerstore.jdbc.migration.MigrationHealthChecker;
import ledgerstore.jdbc.migration.MigrationRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LedgerStoreAutoConfigurationTest {

    private static final String ACCOUNTS_DDL = "CREATE TABLE IF NOT EXISTS accounts ("
            + "id VARCHAR(36) NOT NULL, name VARCHAR(255) NOT NULL, external_id VARCHAR(255) NOT NULL, "
            + "external_group_id VARCHAR(255), currency_code VARCHAR(3) NOT NULL, "
            + "account_type VARCHAR(32) NOT NULL, created_at TIMESTAMP(6) NOT NULL, "
            + "updated_at TIMESTAMP(6) NOT NULL, version BIGINT NOT NULL, PRIMARY KEY (id));\n";

    @TempDir
    Path migrations;

    private ApplicationContextRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(migrations.resolve("001_create_accounts_table.sql"), ACCOUNTS_DDL);
        runner = new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(LedgerStoreAutoConfiguration.class))
                .withPropertyValues(
                        "ledgerstore.connection.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                        "ledgerstore.migration.path=" + migrations);
    }

    @Test
    void connectsAndCreatesBeans() {
        runner.run(ctx -> {
            assertNotNull(ctx.getBean(MigrationRunner.class));
            assertNotNull(ctx.getBean(AccountRepository.class));
            assertNotNull(ctx.getBean(ConnectionHealthChecker.class));
            assertNotNull(ctx.getBean(MigrationHealthChecker.class));
            ConnectionManager manager = ctx.getBean(ConnectionManager.class);
            assertEquals(ConnectionState.CONNECTED, manager.state());
            assertEquals("ledgerstore-primary", manager.name());
        });
    }

    @Test
    void withoutRunOnBootPendingMigrationsDegradeHealth() {
        runner.run(ctx -> {
            assertEquals(1, ctx.getBean(MigrationRunner.class).status(Deadline.none()).pendingCount());
            DependencyHealth health = ctx.getBean(MigrationHealthChecker.class).check(Deadline.none());
            assertEquals(HealthStatus.DEGRADED, health.status());
            assertTrue(health.message().contains("manual migration required"));
        });
    }

    @Test
    void runOnBootAppliesMigrationsBeforeRepositoryIsUsed() {
        runner.withPropertyValues("ledgerstore.migration.run-on-boot=true").run(ctx -> {
            assertTrue(ctx.getBean(MigrationRunner.class).status(Deadline.none()).isUpToDate());
            assertTrue(ctx.getBean(MigrationGate.class).isSchemaCurrent());

            AccountRepository accounts = ctx.getBean(AccountRepository.class);
            Account created = accounts.create(Deadline.after(Duration.ofSeconds(5)),
                    Account.newAccount("Cash", "ext-1", null, "USD", AccountType.ASSET));
            assertEquals(1L, created.version());
            assertEquals("Cash", accounts.getByExternalId(Deadline.none(), "ext-1").name());
        });
    }

    @Test
    void failingBootMigrationAbortsStartup() throws IOException {
        Files.writeString(migrations.resolve("002_broken.sql"), "CREATE TABLE broken (id NOT_A_TYPE);\n");
        runner.withPropertyValues("ledgerstore.migration.run-on-boot=true").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
        });
    }

    @Test
    void unreachableStoreDegradesGracefully() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(LedgerStoreAutoConfiguration.class))
                .withPropertyValues(
                        "ledgerstore.connection.url=jdbc:h2:tcp://127.0.0.1:1/mem:unreachable",
                        "ledgerstore.connection.max-attempts=2",
                        "ledgerstore.connection.base-delay=10ms",
                        "ledgerstore.connection.max-delay=10ms",
                        "ledgerstore.connection.reconnect-timeout=1s",
                        "ledgerstore.migration.run-on-boot=true",
                        "ledgerstore.migration.path=" + migrations)
                .run(ctx -> {
                    assertFalse(ctx.getBean(ConnectionManager.class).isAvailable());
                    assertFalse(ctx.getBean(MigrationGate.class).isSchemaCurrent());

                    DependencyHealth health = ctx.getBean(ConnectionHealthChecker.class).check(Deadline.none());
                    assertEquals(HealthStatus.UNHEALTHY, health.status());

                    StoreException e = assertThrows(StoreException.class, () ->
                            ctx.getBean(AccountRepository.class).getById(Deadline.none(), "missing"));
                    assertEquals(ErrorKind.UNAVAILABLE, e.kind());
                });
    }

    @Test
    void storeDownAtBootRecoversThroughHealthCheck(@TempDir Path dataDir) {
        String dbUrl = "jdbc:h2:file:" + dataDir.resolve("ledger").toAbsolutePath();
        storeRunner(dbUrl)
                .withPropertyValues("ledgerstore.connection.health-check-enabled=false")
                .run(ctx -> {
                    ConnectionManager manager = ctx.getBean(ConnectionManager.class);
                    MigrationGate gate = ctx.getBean(MigrationGate.class);
                    assertFalse(ctx.containsBean("ledgerStoreHealthMonitor"));
                    assertFalse(manager.isAvailable());
                    assertFalse(gate.isSchemaCurrent());

                    startStore(dbUrl);
                    DependencyHealth health = ctx.getBean(ConnectionHealthChecker.class)
                            .check(Deadline.after(Duration.ofSeconds(5)));

                    assertEquals(HealthStatus.HEALTHY, health.status());
                    assertTrue(manager.isAvailable());

                    AccountRepository accounts = ctx.getBean(AccountRepository.class);
                    Account created = accounts.create(Deadline.after(Duration.ofSeconds(5)),
                            Account.newAccount("Cash", "ext-boot", null, "USD", AccountType.ASSET));
                    assertEquals(1L, created.version());
                    assertTrue(gate.isSchemaCurrent());
                    assertTrue(ctx.getBean(MigrationRunner.class).status(Deadline.none()).isUpToDate());
                });
    }

    @Test
    void healthMonitorReconnectsInBackground(@TempDir Path dataDir) {
        String dbUrl = "jdbc:h2:file:" + dataDir.resolve("ledger").toAbsolutePath();
        storeRunner(dbUrl)
                .withPropertyValues("ledgerstore.connection.health-check-interval=50ms")
                .run(ctx -> {
                    ConnectionManager manager = ctx.getBean(ConnectionManager.class);
                    HealthMonitor monitor = ctx.getBean(HealthMonitor.class);
                    assertFalse(manager.isAvailable());

                    startStore(dbUrl);

                    long waitUntil = System.nanoTime() + Duration.ofSeconds(10).toNanos();
                    while (!isHealthy(monitor.latest()) && System.nanoTime() < waitUntil) {
                        Thread.sleep(20);
                    }
                    assertTrue(isHealthy(monitor.latest()));
                    assertTrue(manager.isAvailable());
                });
    }

    // IFEXISTS keeps the store "down" until startStore creates the database file.
    private ApplicationContextRunner storeRunner(String dbUrl) {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(LedgerStoreAutoConfiguration.class))
                .withPropertyValues(
                        "ledgerstore.connection.url=" + dbUrl + ";IFEXISTS=TRUE",
                        "ledgerstore.connection.max-attempts=1",
                        "ledgerstore.connection.connect-timeout=2s",
                        "ledgerstore.connection.reconnect-timeout=2s",
                        "ledgerstore.migration.run-on-boot=true",
                        "ledgerstore.migration.path=" + migrations);
    }

    private static boolean isHealthy(DependencyHealth health) {
        return health != null && health.status() == HealthStatus.HEALTHY;
    }

    private static void startStore(String dbUrl) throws SQLException {
        try (Connection ignored = DriverManager.getConnection(dbUrl)) {
            // creating the database is enough
        }
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("ledgerstore.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("ledgerStoreConnectionManager"));
            assertFalse(ctx.containsBean("accountRepository"));
        });
    }

    @Test
    void customAccountTableName() {
        runner.withPropertyValues("ledgerstore.accounts.table-name=ledger_accounts").run(ctx -> {
            StoreException e = assertThrows(StoreException.class, () ->
                    ctx.getBean(AccountRepository.class).getById(Deadline.none(), "missing"));
            // table does not exist yet
            assertEquals(ErrorKind.INTERNAL, e.kind());
        });
    }
}

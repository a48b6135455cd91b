package ledgerstore.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LedgerStorePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(LedgerStoreProperties.class);
            assertTrue(props.isEnabled());
            assertNull(props.getConnection().getUrl());
            assertEquals("ledgerstore-primary", props.getConnection().getName());
            assertEquals(5, props.getConnection().getMaxAttempts());
            assertEquals(Duration.ofSeconds(1), props.getConnection().getBaseDelay());
            assertEquals(Duration.ofSeconds(30), props.getConnection().getMaxDelay());
            assertEquals(Duration.ofSeconds(5), props.getConnection().getPingTimeout());
            assertEquals(Duration.ofSeconds(5), props.getConnection().getReconnectTimeout());
            assertEquals(25, props.getConnection().getMaxConnections());
            assertTrue(props.getConnection().isHealthCheckEnabled());
            assertEquals(Duration.ofSeconds(30), props.getConnection().getHealthCheckInterval());
            assertEquals("migrations", props.getMigration().getPath());
            assertEquals("ledger", props.getMigration().getServiceName());
            assertFalse(props.getMigration().isRunOnBoot());
            assertEquals(Duration.ofSeconds(30), props.getMigration().getTimeout());
            assertTrue(props.getMigration().isVerifyIndexTargetsEmpty());
            assertFalse(props.getMigration().isAllowDestructive());
            assertEquals("accounts", props.getAccounts().getTableName());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("ledgerstore", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "ledgerstore.connection.url=jdbc:postgresql://db:5432/defaultdb",
                "ledgerstore.connection.username=svc",
                "ledgerstore.connection.database=ledger",
                "ledgerstore.connection.max-attempts=3",
                "ledgerstore.connection.base-delay=250ms",
                "ledgerstore.connection.reconnect-timeout=PT2S",
                "ledgerstore.connection.max-connections=10",
                "ledgerstore.connection.health-check-interval=10s",
                "ledgerstore.migration.path=/opt/ledger/migrations",
                "ledgerstore.migration.service-name=payments",
                "ledgerstore.migration.run-on-boot=true",
                "ledgerstore.migration.timeout=2m",
                "ledgerstore.migration.allow-destructive=true",
                "ledgerstore.accounts.table-name=ledger_accounts",
                "ledgerstore.metrics.name-prefix=payments.store"
        ).run(ctx -> {
            var props = ctx.getBean(LedgerStoreProperties.class);
            assertEquals("jdbc:postgresql://db:5432/defaultdb", props.getConnection().getUrl());
            assertEquals("svc", props.getConnection().getUsername());
            assertEquals("ledger", props.getConnection().getDatabase());
            assertEquals(3, props.getConnection().getMaxAttempts());
            assertEquals(Duration.ofMillis(250), props.getConnection().getBaseDelay());
            assertEquals(Duration.ofSeconds(2), props.getConnection().getReconnectTimeout());
            assertEquals(10, props.getConnection().getMaxConnections());
            assertEquals(Duration.ofSeconds(10), props.getConnection().getHealthCheckInterval());
            assertEquals("/opt/ledger/migrations", props.getMigration().getPath());
            assertEquals("payments", props.getMigration().getServiceName());
            assertTrue(props.getMigration().isRunOnBoot());
            assertEquals(Duration.ofMinutes(2), props.getMigration().getTimeout());
            assertTrue(props.getMigration().isAllowDestructive());
            assertEquals("ledger_accounts", props.getAccounts().getTableName());
            assertEquals("payments.store", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(LedgerStoreProperties.class)
    static class PropsConfig {
    }
}

package ledgerstore.spring.boot;

import ledgerstore.ConnectionManager;
import ledgerstore.Deadline;
import ledgerstore.account.AccountRepository;
import ledgerstore.error.StoreException;
import ledgerstore.health.ConnectionHealthChecker;
import ledgerstore.health.HealthMonitor;
import ledgerstore.jdbc.JdbcSessionFactory;
import ledgerstore.jdbc.dialect.Dialects;
import ledgerstore.jdbc.migration.MigrationConfig;
import ledgerstore.jdbc.migration.MigrationHealthChecker;
import ledgerstore.jdbc.migration.MigrationRunner;
import ledgerstore.jdbc.repository.JdbcAccountRepository;
import ledgerstore.jdbc.spi.Dialect;
import ledgerstore.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.Logger;

/**
 * Auto-configuration for ledgerstore.
 *
 * <p>Connects to the store named by {@code ledgerstore.connection.url}, or through the
 * application's {@link DataSource} when no URL is set. An unreachable store does not stop
 * the application: the connection manager comes up disconnected, health checks report it,
 * and storage calls fail with {@code UNAVAILABLE} until a health check reconnects. The
 * {@link HealthMonitor} bean runs that check every
 * {@code ledgerstore.connection.health-check-interval}.
 *
 * <p>Each bean backs off when the application defines its own.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnProperty(prefix = "ledgerstore", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LedgerStoreProperties.class)
public class LedgerStoreAutoConfiguration {

    private static final Logger logger = Logger.getLogger(LedgerStoreAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public Dialect ledgerStoreDialect(LedgerStoreProperties props, ObjectProvider<DataSource> dataSource) {
        LedgerStoreProperties.Connection conn = props.getConnection();
        if (hasText(conn.getDialect()) || hasText(conn.getUrl())) {
            return Dialects.resolve(conn.getDialect(), conn.getUrl());
        }
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            throw new IllegalStateException(
                    "ledgerstore.connection.url must be set when no DataSource bean is available");
        }
        return Dialects.detect(ds);
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcSessionFactory ledgerStoreSessionFactory(LedgerStoreProperties props, Dialect dialect,
                                                        ObjectProvider<DataSource> dataSource) {
        LedgerStoreProperties.Connection conn = props.getConnection();
        JdbcSessionFactory.Builder builder = JdbcSessionFactory.builder()
                .dialect(dialect)
                .database(conn.getDatabase());
        if (hasText(conn.getUrl())) {
            builder.jdbcUrl(conn.getUrl())
                    .username(conn.getUsername())
                    .password(conn.getPassword());
        } else {
            builder.dataSource(dataSource.getObject());
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ConnectionManager ledgerStoreConnectionManager(LedgerStoreProperties props,
                                                          JdbcSessionFactory sessionFactory,
                                                          ObjectProvider<MetricsExporter> metricsExporter) {
        LedgerStoreProperties.Connection conn = props.getConnection();
        ConnectionManager manager = ConnectionManager.builder()
                .sessionFactory(sessionFactory)
                .errorClassifier(sessionFactory.dialect().errorClassifier())
                .metrics(metricsExporter.getIfAvailable(() -> MetricsExporter.NOOP))
                .name(conn.getName())
                .maxAttempts(conn.getMaxAttempts())
                .baseDelay(conn.getBaseDelay())
                .maxDelay(conn.getMaxDelay())
                .pingTimeout(conn.getPingTimeout())
                .reconnectTimeout(conn.getReconnectTimeout())
                .maxConnections(conn.getMaxConnections())
                .build();
        try {
            manager.connect(Deadline.after(conn.getConnectTimeout()));
        } catch (StoreException e) {
            logger.warning("Store unavailable at startup, continuing without storage: " + e.getMessage());
        }
        return manager;
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationRunner ledgerStoreMigrationRunner(LedgerStoreProperties props, ConnectionManager connectionManager,
                                                      Dialect dialect, ObjectProvider<MetricsExporter> metricsExporter) {
        LedgerStoreProperties.Migration migration = props.getMigration();
        MigrationConfig.Builder config = MigrationConfig.builder()
                .directory(Path.of(migration.getPath()))
                .serviceName(migration.getServiceName())
                .timeout(migration.getTimeout())
                .runOnBoot(migration.isRunOnBoot())
                .verifyIndexTargetsEmpty(migration.isVerifyIndexTargetsEmpty())
                .allowDestructive(migration.isAllowDestructive());
        if (hasText(migration.getTableName())) {
            config.tableName(migration.getTableName());
        }
        if (hasText(migration.getAppliedBy())) {
            config.appliedBy(migration.getAppliedBy());
        }
        return new MigrationRunner(connectionManager, dialect, config.build(),
                metricsExporter.getIfAvailable(() -> MetricsExporter.NOOP), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationGate ledgerStoreMigrationGate(LedgerStoreProperties props, ConnectionManager connectionManager,
                                                  MigrationRunner migrationRunner) {
        return new MigrationGate(connectionManager, migrationRunner, props.getMigration().isRunOnBoot());
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountRepository accountRepository(LedgerStoreProperties props, MigrationGate migrationGate,
                                               ConnectionManager connectionManager,
                                               ObjectProvider<MetricsExporter> metricsExporter) {
        return new JdbcAccountRepository(migrationGate, connectionManager.errorClassifier(),
                props.getAccounts().getTableName(), metricsExporter.getIfAvailable(() -> MetricsExporter.NOOP));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionHealthChecker ledgerStoreConnectionHealthChecker(ConnectionManager connectionManager) {
        return new ConnectionHealthChecker(connectionManager);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "ledgerstore.connection", name = "health-check-enabled", matchIfMissing = true)
    public HealthMonitor ledgerStoreHealthMonitor(LedgerStoreProperties props,
                                                  ConnectionHealthChecker connectionHealthChecker) {
        LedgerStoreProperties.Connection conn = props.getConnection();
        return new HealthMonitor(connectionHealthChecker, conn.getHealthCheckInterval(),
                conn.getPingTimeout().plus(conn.getReconnectTimeout()).plus(conn.getPingTimeout()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationHealthChecker ledgerStoreMigrationHealthChecker(LedgerStoreProperties props,
                                                                    MigrationRunner migrationRunner) {
        return new MigrationHealthChecker(migrationRunner, props.getMigration().isRunOnBoot(), Clock.systemUTC());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

package ledgerstore.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for ledgerstore.
 *
 * @see LedgerStoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "ledgerstore")
public class LedgerStoreProperties {

    /**
     * Whether to auto-configure ledgerstore at all.
     */
    private boolean enabled = true;

    private final Connection connection = new Connection();
    private final Migration migration = new Migration();
    private final Accounts accounts = new Accounts();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Connection getConnection() {
        return connection;
    }

    public Migration getMigration() {
        return migration;
    }

    public Accounts getAccounts() {
        return accounts;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Connection {
        /**
         * JDBC URL of the store. When blank, the application's DataSource is used.
         */
        private String url;
        private String username;
        private String password;

        /**
         * Logical database selected on every session.
         */
        private String database;

        /**
         * Dialect name (h2, postgresql, mysql). Detected from the URL when blank.
         */
        private String dialect;

        /**
         * Name of the dependency in health reports.
         */
        private String name = "ledgerstore-primary";

        private int maxAttempts = 5;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);

        /**
         * Overall time allowed for the startup connect, retries included.
         */
        private Duration connectTimeout = Duration.ofSeconds(60);

        private Duration pingTimeout = Duration.ofSeconds(5);

        /**
         * Bound for the reconnect made inside a health check.
         */
        private Duration reconnectTimeout = Duration.ofSeconds(5);

        private int maxConnections = 25;

        /**
         * Whether to run the connection health check in the background. The background check
         * is what reconnects a store that was down at startup.
         */
        private boolean healthCheckEnabled = true;

        private Duration healthCheckInterval = Duration.ofSeconds(30);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getDialect() {
            return dialect;
        }

        public void setDialect(String dialect) {
            this.dialect = dialect;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getPingTimeout() {
            return pingTimeout;
        }

        public void setPingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
        }

        public Duration getReconnectTimeout() {
            return reconnectTimeout;
        }

        public void setReconnectTimeout(Duration reconnectTimeout) {
            this.reconnectTimeout = reconnectTimeout;
        }

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public boolean isHealthCheckEnabled() {
            return healthCheckEnabled;
        }

        public void setHealthCheckEnabled(boolean healthCheckEnabled) {
            this.healthCheckEnabled = healthCheckEnabled;
        }

        public Duration getHealthCheckInterval() {
            return healthCheckInterval;
        }

        public void setHealthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
        }
    }

    public static class Migration {
        /**
         * Directory holding NNN_description.sql scripts.
         */
        private String path = "migrations";

        /**
         * Service owning the ledger table {@code <service>_schema_migrations}.
         */
        private String serviceName = "ledger";

        /**
         * Overrides the derived ledger table name.
         */
        private String tableName;

        /**
         * Apply pending migrations during startup. A failure aborts startup.
         */
        private boolean runOnBoot = false;

        /**
         * Time allowed for each script.
         */
        private Duration timeout = Duration.ofSeconds(30);

        private boolean verifyIndexTargetsEmpty = true;
        private boolean allowDestructive = false;

        /**
         * Recorded in the ledger's applied_by column. Defaults to the OS user.
         */
        private String appliedBy;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getServiceName() {
            return serviceName;
        }

        public void setServiceName(String serviceName) {
            this.serviceName = serviceName;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public boolean isRunOnBoot() {
            return runOnBoot;
        }

        public void setRunOnBoot(boolean runOnBoot) {
            this.runOnBoot = runOnBoot;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isVerifyIndexTargetsEmpty() {
            return verifyIndexTargetsEmpty;
        }

        public void setVerifyIndexTargetsEmpty(boolean verifyIndexTargetsEmpty) {
            this.verifyIndexTargetsEmpty = verifyIndexTargetsEmpty;
        }

        public boolean isAllowDestructive() {
            return allowDestructive;
        }

        public void setAllowDestructive(boolean allowDestructive) {
            this.allowDestructive = allowDestructive;
        }

        public String getAppliedBy() {
            return appliedBy;
        }

        public void setAppliedBy(String appliedBy) {
            this.appliedBy = appliedBy;
        }
    }

    public static class Accounts {
        private String tableName = "accounts";

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }
    }

    public static class Metrics {
        /**
         * Whether to register Micrometer meters when Micrometer is on the classpath.
         */
        private boolean enabled = true;

        private String namePrefix = "ledgerstore";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

package ledgerstore;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import ledgerstore.error.ErrorClassifier;
import ledgerstore.error.ErrorKind;
import ledgerstore.error.SqlStateErrorClassifier;
import ledgerstore.error.StoreException;
import ledgerstore.health.DependencyHealth;
import ledgerstore.health.DependencyType;
import ledgerstore.health.PoolInfo;
import ledgerstore.retry.ExponentialBackoffRetryPolicy;
import ledgerstore.retry.RetryPolicy;
import ledgerstore.spi.MetricsExporter;
import ledgerstore.spi.SessionFactory;
import ledgerstore.spi.SessionProvider;

/**
 * Owns the single session to the store.
 *
 * <p>{@link #connect(Deadline)} opens the session with exponential backoff. A failed connect
 * leaves the previous state untouched, so callers can keep running without storage and
 * treat {@link #isAvailable()} as the switch for entity-mutating features. The manager keeps
 * the failed connect pending: every later health check makes one open attempt bounded by the
 * reconnect timeout until the session is established or {@link #disconnect()} is called.
 *
 * <p>{@link #checkHealth(Deadline)} pings the store. When the ping fails because the session
 * expired or was revoked, the manager makes exactly one reconnect attempt bounded by the
 * reconnect timeout and pings again; only a second failure is reported as unhealthy.
 *
 * <p>The session handle and its lifecycle state are guarded by a read/write lock: health
 * checks, stats reads and {@link #acquire(Deadline)} take the read lock, while connect,
 * reconnect and disconnect take the write lock. Row-level races are left to the store.
 *
 * <p>Usage:
 * <pre>{@code
 * ConnectionManager manager = ConnectionManager.builder()
 *     .sessionFactory(sessionFactory)
 *     .errorClassifier(dialect.errorClassifier())
 *     .build();
 * try {
 *   manager.connect(Deadline.after(Duration.ofSeconds(30)));
 * } catch (StoreException e) {
 *   // continue in degraded mode
 * }
 * }</pre>
 */
public final class ConnectionManager implements SessionProvider, AutoCloseable {
    private static final Logger logger = Logger.getLogger(ConnectionManager.class.getName());

    public static final String DEFAULT_NAME = "ledgerstore-primary";

    private final SessionFactory sessionFactory;
    private final ErrorClassifier errorClassifier;
    private final RetryPolicy retryPolicy;
    private final MetricsExporter metrics;
    private final String name;
    private final boolean critical;
    private final int maxAttempts;
    private final Duration pingTimeout;
    private final Duration reconnectTimeout;
    private final int maxConnections;
    private final Clock clock;
    private final ExecutorService connectExecutor;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicInteger activeLeases = new AtomicInteger();
    private final AtomicLong errorCount = new AtomicLong();

    // Guarded by lock.
    private Connection session;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private Instant connectedAt;
    private boolean sessionLost;
    private boolean connectPending;

    private volatile boolean closed;
    private volatile boolean healthy;
    private volatile Instant lastHealthCheck;
    private volatile Instant lastSuccess;
    private volatile String lastError;
    private volatile Instant lastErrorAt;

    private ConnectionManager(Builder builder) {
        this.sessionFactory = Objects.requireNonNull(builder.sessionFactory, "sessionFactory");
        this.errorClassifier = builder.errorClassifier;
        this.metrics = builder.metrics;
        this.name = builder.name;
        this.critical = builder.critical;
        this.maxAttempts = builder.maxAttempts;
        this.pingTimeout = builder.pingTimeout;
        this.reconnectTimeout = builder.reconnectTimeout;
        this.maxConnections = builder.maxConnections;
        this.clock = builder.clock;
        this.retryPolicy = builder.retryPolicy != null
            ? builder.retryPolicy
            : new ExponentialBackoffRetryPolicy(builder.baseDelay.toMillis(), builder.maxDelay.toMillis());

        AtomicInteger threadCounter = new AtomicInteger(1);
        this.connectExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "ledgerstore-connect-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Opens the session, retrying with exponential backoff up to the configured attempt count.
     * Does nothing when already connected.
     *
     * @throws StoreException with kind {@code UNAVAILABLE} when every attempt failed, the
     *                        deadline passed, or the calling thread was interrupted; the
     *                        previous session state is left untouched in all three cases
     */
    public void connect(Deadline deadline) {
        Objects.requireNonNull(deadline, "deadline");
        ensureOpen();
        Lock writeLock = lockWrite(deadline, "connect");
        ConnectionState previousState = state;
        try {
            if (session != null && state == ConnectionState.CONNECTED) {
                logger.fine("Store session already established; connect is a no-op");
                return;
            }
            state = ConnectionState.CONNECTING;
            StoreException last = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (attempt > 1) {
                    long delayMs = retryPolicy.computeDelayMs(attempt - 1);
                    logger.log(Level.INFO, "Retrying store connection to {0} in {1} ms (attempt {2}/{3})",
                        new Object[]{sessionFactory.target(), delayMs, attempt, maxAttempts});
                    sleep(deadline, delayMs);
                }
                try {
                    install(openWithin(deadline));
                    logger.log(Level.INFO, "Connected to store {0} (attempt {1}/{2})",
                        new Object[]{sessionFactory.target(), attempt, maxAttempts});
                    return;
                } catch (StoreException e) {
                    last = e;
                    metrics.incrementConnectFailure();
                    recordError(e.getMessage());
                    logger.log(Level.WARNING, "Store connection attempt " + attempt + "/" + maxAttempts
                        + " failed: " + e.getMessage());
                    if (deadline.isExpired() || Thread.currentThread().isInterrupted()) {
                        throw e;
                    }
                }
            }
            throw StoreException.unavailable("failed to connect to " + sessionFactory.target()
                + " after " + maxAttempts + " attempts", last);
        } finally {
            if (state == ConnectionState.CONNECTING) {
                state = previousState;
            }
            if (session == null) {
                connectPending = true;
            }
            writeLock.unlock();
        }
    }

    /**
     * Closes the session if one is open. Safe to call repeatedly.
     *
     * @throws StoreException with kind {@code INTERNAL} if the driver failed to close the
     *                        session; the manager is disconnected regardless
     */
    public void disconnect() {
        lock.writeLock().lock();
        try {
            Connection current = session;
            session = null;
            state = ConnectionState.DISCONNECTED;
            connectedAt = null;
            sessionLost = false;
            connectPending = false;
            healthy = false;
            if (current == null) {
                return;
            }
            try {
                current.close();
                logger.log(Level.INFO, "Disconnected from store {0}", sessionFactory.target());
            } catch (SQLException e) {
                recordError(e.getMessage());
                throw new StoreException(ErrorKind.INTERNAL, "failed to close store session: " + e.getMessage(), e);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Pings the store and reports the result, reconnecting once if the session was lost or
     * the last connect failed. Never throws for store failures; they are reported in the
     * returned value.
     */
    public DependencyHealth checkHealth(Deadline deadline) {
        Objects.requireNonNull(deadline, "deadline");
        long startNanos = System.nanoTime();
        Connection checked;
        SQLException failure;
        boolean retryingConnect = false;

        lock.readLock().lock();
        try {
            if (session == null) {
                if (closed || !(sessionLost || connectPending)) {
                    return report(startNanos, null, "Store not connected", "session not established");
                }
                retryingConnect = !sessionLost;
                checked = null;
                failure = null;
            } else {
                checked = session;
                failure = ping(checked, deadline);
                if (failure == null) {
                    return report(startNanos, "Store healthy", null, null);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (failure != null) {
            recordError(failure.getMessage());
            if (!isSessionLost(failure, checked)) {
                return report(startNanos, null, "Store ping failed", failure.getMessage());
            }
        }

        if (retryingConnect) {
            logger.log(Level.INFO, "Store not connected since the last failed connect; attempting one reconnect");
        } else {
            metrics.incrementSessionLost();
            logger.log(Level.WARNING, "Store session lost ({0}); attempting one reconnect",
                failure == null ? "previous reconnect failed" : failure.getMessage());
        }
        try {
            reconnect(checked, deadline.atMost(reconnectTimeout));
        } catch (StoreException e) {
            logger.log(Level.WARNING, "Store reconnect failed: " + e.getMessage());
            return report(startNanos, null,
                retryingConnect ? "Store not connected and reconnect failed" : "Store session lost and reconnect failed",
                "reconnection failed: " + e.getMessage());
        }

        lock.readLock().lock();
        try {
            if (session == null) {
                return report(startNanos, null, "Store not connected", "session closed during reconnect");
            }
            SQLException second = ping(session, deadline);
            if (second != null) {
                recordError(second.getMessage());
                return report(startNanos, null, "Store ping failed after reconnect", second.getMessage());
            }
            return report(startNanos, "Store healthy (session re-established)", null, null);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ConnectionStats stats() {
        lock.readLock().lock();
        try {
            int active = activeLeases.get();
            boolean connected = state == ConnectionState.CONNECTED;
            return new ConnectionStats(state, active, connected ? Math.max(0, maxConnections - active) : 0,
                maxConnections, errorCount.get(), connectedAt, lastHealthCheck, lastError, lastErrorAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public SessionLease acquire(Deadline deadline) {
        Objects.requireNonNull(deadline, "deadline");
        deadline.check("acquire session");
        lock.readLock().lock();
        try {
            if (session == null || state != ConnectionState.CONNECTED) {
                throw StoreException.unavailable("store session not established (state=" + state + ")");
            }
            metrics.recordActiveSessions(activeLeases.incrementAndGet());
            return new SessionLease(session, this::release, this::recordFailure);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isAvailable() {
        lock.readLock().lock();
        try {
            return session != null && state == ConnectionState.CONNECTED;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ConnectionState state() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Result of the most recent health check; {@code false} before the first one.
     */
    public boolean isHealthy() {
        return healthy;
    }

    public String name() {
        return name;
    }

    public ErrorClassifier errorClassifier() {
        return errorClassifier;
    }

    /**
     * Disconnects and releases the connect executor. The manager cannot be reused.
     */
    @Override
    public void close() {
        closed = true;
        try {
            disconnect();
        } finally {
            connectExecutor.shutdownNow();
        }
    }

    private void reconnect(Connection stale, Deadline deadline) {
        Lock writeLock = lockWrite(deadline, "reconnect");
        try {
            if (session != null && session != stale) {
                logger.fine("Store session already replaced by a concurrent reconnect");
                return;
            }
            ensureOpen();
            state = ConnectionState.DEGRADED;
            Connection fresh;
            try {
                fresh = openWithin(deadline);
            } catch (StoreException e) {
                metrics.incrementConnectFailure();
                recordError(e.getMessage());
                closeQuietly(stale);
                session = null;
                connectedAt = null;
                sessionLost = !connectPending;
                state = ConnectionState.DISCONNECTED;
                throw e;
            }
            closeQuietly(stale);
            install(fresh);
            logger.log(Level.INFO, "Re-established store session to {0}", sessionFactory.target());
        } finally {
            writeLock.unlock();
        }
    }

    // Caller holds the write lock.
    private void install(Connection fresh) {
        Connection previous = session;
        session = fresh;
        state = ConnectionState.CONNECTED;
        connectedAt = clock.instant();
        sessionLost = false;
        connectPending = false;
        errorCount.set(0);
        if (previous != null && previous != fresh) {
            closeQuietly(previous);
        }
    }

    private Connection openWithin(Deadline deadline) {
        deadline.check("open session");
        metrics.incrementConnectAttempt();
        CompletableFuture<Connection> future;
        try {
            future = CompletableFuture.supplyAsync(this::openSession, connectExecutor);
        } catch (RejectedExecutionException e) {
            throw StoreException.unavailable("connection manager is closed", e);
        }
        try {
            return deadline.isBounded()
                ? future.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS)
                : future.get();
        } catch (TimeoutException e) {
            abandon(future);
            throw StoreException.unavailable("timed out opening session to " + sessionFactory.target(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(future);
            throw StoreException.unavailable("interrupted while opening session", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof SQLException sql) {
                throw StoreException.unavailable("failed to open session to " + sessionFactory.target()
                    + ": " + sql.getMessage(), sql);
            }
            throw new StoreException(ErrorKind.INTERNAL, "unexpected failure opening session: " + cause, cause);
        }
    }

    private Connection openSession() {
        try {
            return sessionFactory.open();
        } catch (SQLException e) {
            throw new CompletionException(e);
        }
    }

    // A session that arrives after its caller gave up is closed rather than leaked.
    private void abandon(CompletableFuture<Connection> future) {
        future.whenComplete((connection, error) -> {
            if (connection != null) {
                closeQuietly(connection);
            }
        });
    }

    private SQLException ping(Connection connection, Deadline deadline) {
        if (deadline.isExpired()) {
            return new SQLTimeoutException("health check deadline exceeded before ping");
        }
        Duration timeout = deadline.isBounded() && deadline.remaining().compareTo(pingTimeout) < 0
            ? deadline.remaining()
            : pingTimeout;
        try {
            sessionFactory.ping(connection, timeout);
            return null;
        } catch (SQLException e) {
            return e;
        }
    }

    private boolean isSessionLost(SQLException failure, Connection connection) {
        if (errorClassifier.isSessionLost(failure)) {
            return true;
        }
        try {
            return connection != null && connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    private DependencyHealth report(long startNanos, String healthyMessage, String failureMessage, String error) {
        Instant now = clock.instant();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        boolean ok = healthyMessage != null;
        healthy = ok;
        lastHealthCheck = now;
        if (ok) {
            lastSuccess = now;
        }
        metrics.recordHealthCheck(ok, elapsedMs);

        int active = activeLeases.get();
        DependencyHealth.Builder builder = DependencyHealth.builder(name, DependencyType.DATABASE)
            .critical(critical)
            .poolInfo(new PoolInfo(maxConnections, active, ok ? Math.max(0, maxConnections - active) : 0))
            .lastSuccess(lastSuccess)
            .lastCheck(now)
            .responseTimeMs(elapsedMs);
        return ok ? builder.healthy(healthyMessage).build() : builder.unhealthy(failureMessage, error).build();
    }

    private void release() {
        metrics.recordActiveSessions(activeLeases.decrementAndGet());
    }

    private void recordFailure(SQLException e) {
        recordError(e.getMessage());
        if (errorClassifier.isSessionLost(e)) {
            logger.log(Level.FINE, "Store call failed with a lost session: {0}", e.getMessage());
        }
    }

    private void recordError(String message) {
        errorCount.incrementAndGet();
        lastError = message;
        lastErrorAt = clock.instant();
    }

    private Lock lockWrite(Deadline deadline, String operation) {
        Lock writeLock = lock.writeLock();
        try {
            boolean acquired = deadline.isBounded()
                ? writeLock.tryLock(deadline.remainingMillis(), TimeUnit.MILLISECONDS)
                : lockInterruptibly(writeLock);
            if (!acquired) {
                throw StoreException.unavailable(operation + ": deadline exceeded waiting for session lock");
            }
            return writeLock;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StoreException.unavailable(operation + ": interrupted waiting for session lock", e);
        }
    }

    private static boolean lockInterruptibly(Lock lock) throws InterruptedException {
        lock.lockInterruptibly();
        return true;
    }

    private static void sleep(Deadline deadline, long delayMs) {
        try {
            deadline.sleep(delayMs, "connect");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StoreException.unavailable("connect: interrupted while backing off", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ConnectionManager is closed");
        }
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            logger.log(Level.FINE, "Ignoring failure while closing stale store session", e);
        }
    }

    public static final class Builder {
        private SessionFactory sessionFactory;
        private ErrorClassifier errorClassifier = new SqlStateErrorClassifier();
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics = MetricsExporter.NOOP;
        private String name = DEFAULT_NAME;
        private boolean critical = true;
        private int maxAttempts = 5;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Duration pingTimeout = Duration.ofSeconds(5);
        private Duration reconnectTimeout = Duration.ofSeconds(5);
        private int maxConnections = 25;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder sessionFactory(SessionFactory sessionFactory) {
            this.sessionFactory = sessionFactory;
            return this;
        }

        public Builder errorClassifier(ErrorClassifier errorClassifier) {
            this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
            return this;
        }

        /**
         * Overrides the backoff derived from {@link #baseDelay} and {@link #maxDelay}.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        /**
         * Dependency name used in health reports. Defaults to {@value ConnectionManager#DEFAULT_NAME}.
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        public Builder pingTimeout(Duration pingTimeout) {
            this.pingTimeout = Objects.requireNonNull(pingTimeout, "pingTimeout");
            return this;
        }

        /**
         * Upper bound for the reconnect made inside a health check.
         */
        public Builder reconnectTimeout(Duration reconnectTimeout) {
            this.reconnectTimeout = Objects.requireNonNull(reconnectTimeout, "reconnectTimeout");
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ConnectionManager build() {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
            }
            if (maxConnections < 1) {
                throw new IllegalArgumentException("maxConnections must be >= 1, got: " + maxConnections);
            }
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelay);
            }
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= baseDelay");
            }
            if (pingTimeout.isNegative() || pingTimeout.isZero()) {
                throw new IllegalArgumentException("pingTimeout must be > 0, got: " + pingTimeout);
            }
            if (reconnectTimeout.isNegative() || reconnectTimeout.isZero()) {
                throw new IllegalArgumentException("reconnectTimeout must be > 0, got: " + reconnectTimeout);
            }
            return new ConnectionManager(this);
        }
    }
}

package ledgerstore;

import java.sql.SQLException;
import java.time.Duration;

import ledgerstore.error.ErrorKind;
import ledgerstore.error.StoreException;
import ledgerstore.health.DependencyHealth;
import ledgerstore.health.DependencyType;
import ledgerstore.health.HealthStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

  private FlakySessionFactory sessions;
  private ConnectionManager manager;

  @BeforeEach
  void setUp() {
    sessions = new FlakySessionFactory();
    manager = ConnectionManager.builder()
        .sessionFactory(sessions)
        .baseDelay(Duration.ofMillis(5))
        .maxDelay(Duration.ofMillis(20))
        .reconnectTimeout(Duration.ofSeconds(2))
        .build();
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  @Test
  void connectsOnFirstAttempt() {
    manager.connect(Deadline.after(Duration.ofSeconds(5)));

    assertEquals(ConnectionState.CONNECTED, manager.state());
    assertTrue(manager.isAvailable());
    assertEquals(1, sessions.opens.get());

    ConnectionStats stats = manager.stats();
    assertTrue(stats.connected());
    assertEquals(25, stats.total());
    assertEquals(25, stats.idle());
    assertNotNull(stats.connectedAt());
  }

  @Test
  void connectIsNoOpWhenAlreadyConnected() {
    manager.connect(Deadline.none());
    manager.connect(Deadline.none());

    assertEquals(1, sessions.opens.get());
  }

  @Test
  void retriesWithBackoffAndClearsErrorsOnSuccess() {
    sessions.failNextOpens.set(2);

    manager.connect(Deadline.after(Duration.ofSeconds(5)));

    assertEquals(3, sessions.opens.get());
    assertEquals(ConnectionState.CONNECTED, manager.state());
    assertEquals(0, manager.stats().errorCount());
  }

  @Test
  void givesUpAfterFiveAttempts() {
    sessions.refuseConnections = true;

    StoreException e = assertThrows(StoreException.class,
        () -> manager.connect(Deadline.after(Duration.ofSeconds(5))));

    assertEquals(ErrorKind.UNAVAILABLE, e.kind());
    assertEquals(5, sessions.opens.get());
    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    ConnectionStats stats = manager.stats();
    assertEquals(5, stats.errorCount());
    assertNotNull(stats.lastError());
    assertNotNull(stats.lastErrorAt());
  }

  @Test
  void deadlineCutsBackoffShort() {
    sessions.refuseConnections = true;
    ConnectionManager slowRetry = ConnectionManager.builder()
        .sessionFactory(sessions)
        .baseDelay(Duration.ofSeconds(10))
        .build();
    try {
      long start = System.nanoTime();
      assertThrows(StoreException.class, () -> slowRetry.connect(Deadline.after(Duration.ofMillis(200))));
      assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 5000);
      assertEquals(1, sessions.opens.get());
    } finally {
      slowRetry.close();
    }
  }

  @Test
  void hungOpenIsAbandonedAtDeadline() {
    sessions.openDelayMs = 2000;

    long start = System.nanoTime();
    StoreException e = assertThrows(StoreException.class,
        () -> manager.connect(Deadline.after(Duration.ofMillis(200))));

    assertEquals(ErrorKind.UNAVAILABLE, e.kind());
    assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 1500);
    assertFalse(manager.isAvailable());
  }

  @Test
  void degradedManagerRefusesSessions() {
    StoreException e = assertThrows(StoreException.class, () -> manager.acquire(Deadline.none()));

    assertEquals(ErrorKind.UNAVAILABLE, e.kind());
  }

  @Test
  void healthyCheckReportsPool() {
    manager.connect(Deadline.none());

    DependencyHealth health = manager.checkHealth(Deadline.after(Duration.ofSeconds(5)));

    assertEquals(HealthStatus.HEALTHY, health.status());
    assertEquals("Store healthy", health.message());
    assertEquals(ConnectionManager.DEFAULT_NAME, health.name());
    assertEquals(DependencyType.DATABASE, health.type());
    assertTrue(health.critical());
    assertEquals(25, health.poolInfo().maxConnections());
    assertNotNull(health.lastSuccess());
    assertTrue(manager.isHealthy());
    assertNotNull(manager.stats().lastHealthCheck());
  }

  @Test
  void notConnectedCheckDoesNotOpen() {
    DependencyHealth health = manager.checkHealth(Deadline.none());

    assertEquals(HealthStatus.UNHEALTHY, health.status());
    assertEquals("Store not connected", health.message());
    assertEquals(0, sessions.opens.get());
    assertFalse(manager.isHealthy());
  }

  @Test
  void storeDownAtBootIsConnectedByLaterHealthCheck() {
    ConnectionManager oneShot = ConnectionManager.builder()
        .sessionFactory(sessions)
        .maxAttempts(1)
        .reconnectTimeout(Duration.ofSeconds(2))
        .build();
    try {
      sessions.refuseConnections = true;
      assertThrows(StoreException.class, () -> oneShot.connect(Deadline.after(Duration.ofSeconds(5))));

      DependencyHealth stillDown = oneShot.checkHealth(Deadline.after(Duration.ofSeconds(5)));
      assertEquals(HealthStatus.UNHEALTHY, stillDown.status());
      assertEquals("Store not connected and reconnect failed", stillDown.message());
      assertEquals(2, sessions.opens.get());
      assertFalse(oneShot.isAvailable());

      sessions.refuseConnections = false;
      DependencyHealth recovered = oneShot.checkHealth(Deadline.after(Duration.ofSeconds(5)));

      assertEquals(HealthStatus.HEALTHY, recovered.status());
      assertEquals("Store healthy (session re-established)", recovered.message());
      assertEquals(3, sessions.opens.get());
      assertTrue(oneShot.isAvailable());
      assertEquals(ConnectionState.CONNECTED, oneShot.state());

      oneShot.checkHealth(Deadline.after(Duration.ofSeconds(5)));
      assertEquals(3, sessions.opens.get());
    } finally {
      oneShot.close();
    }
  }

  @Test
  void disconnectCancelsPendingConnect() {
    sessions.refuseConnections = true;
    assertThrows(StoreException.class, () -> manager.connect(Deadline.after(Duration.ofSeconds(5))));
    manager.disconnect();
    sessions.refuseConnections = false;

    DependencyHealth health = manager.checkHealth(Deadline.none());

    assertEquals("Store not connected", health.message());
    assertEquals(5, sessions.opens.get());
  }

  @Test
  void lostSessionIsReestablishedOnce() {
    manager.connect(Deadline.none());
    sessions.nextPingFailure = new SQLException("rpc error: code = Unauthenticated desc = session not found");

    DependencyHealth health = manager.checkHealth(Deadline.after(Duration.ofSeconds(5)));

    assertEquals(HealthStatus.HEALTHY, health.status());
    assertEquals("Store healthy (session re-established)", health.message());
    assertEquals(2, sessions.opens.get());
    assertEquals(ConnectionState.CONNECTED, manager.state());
  }

  @Test
  void closedUnderlyingSessionCountsAsLost() throws SQLException {
    manager.connect(Deadline.none());
    try (SessionLease lease = manager.acquire(Deadline.none())) {
      lease.connection().close();
    }

    DependencyHealth health = manager.checkHealth(Deadline.after(Duration.ofSeconds(5)));

    assertEquals(HealthStatus.HEALTHY, health.status());
    assertEquals(2, sessions.opens.get());
  }

  @Test
  void failedReconnectReportsUnhealthyAndRetriesOnNextCheck() {
    manager.connect(Deadline.none());
    sessions.nextPingFailure = new SQLException("session expired");
    sessions.refuseConnections = true;

    DependencyHealth failed = manager.checkHealth(Deadline.after(Duration.ofSeconds(5)));

    assertEquals(HealthStatus.UNHEALTHY, failed.status());
    assertEquals("Store session lost and reconnect failed", failed.message());
    assertTrue(failed.error().startsWith("reconnection failed:"));
    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertEquals(2, sessions.opens.get());

    sessions.refuseConnections = false;
    DependencyHealth recovered = manager.checkHealth(Deadline.after(Duration.ofSeconds(5)));

    assertEquals(HealthStatus.HEALTHY, recovered.status());
    assertEquals(3, sessions.opens.get());
    assertTrue(manager.isAvailable());
  }

  @Test
  void ordinaryPingFailureDoesNotReconnect() {
    manager.connect(Deadline.none());
    sessions.nextPingFailure = new SQLException("syntax error", "42601");

    DependencyHealth health = manager.checkHealth(Deadline.none());

    assertEquals(HealthStatus.UNHEALTHY, health.status());
    assertEquals("Store ping failed", health.message());
    assertEquals(1, sessions.opens.get());
    assertEquals(ConnectionState.CONNECTED, manager.state());
  }

  @Test
  void leasesAreCountedInStats() {
    manager.connect(Deadline.none());

    SessionLease lease = manager.acquire(Deadline.none());
    assertEquals(1, manager.stats().active());
    assertEquals(24, manager.stats().idle());

    lease.close();
    lease.close();
    assertEquals(0, manager.stats().active());
    assertThrows(IllegalStateException.class, lease::connection);
  }

  @Test
  void disconnectIsIdempotent() {
    manager.connect(Deadline.none());

    manager.disconnect();
    manager.disconnect();

    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertFalse(manager.isAvailable());
    assertNull(manager.stats().connectedAt());
  }

  @Test
  void closedManagerCannotReconnect() {
    manager.close();

    assertThrows(IllegalStateException.class, () -> manager.connect(Deadline.none()));
  }

  @Test
  void builderValidatesArguments() {
    assertThrows(NullPointerException.class, () -> ConnectionManager.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> ConnectionManager.builder().sessionFactory(sessions).maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> ConnectionManager.builder().sessionFactory(sessions).maxConnections(0).build());
    assertThrows(IllegalArgumentException.class, () -> ConnectionManager.builder().sessionFactory(sessions)
        .baseDelay(Duration.ofSeconds(5)).maxDelay(Duration.ofSeconds(1)).build());
  }
}

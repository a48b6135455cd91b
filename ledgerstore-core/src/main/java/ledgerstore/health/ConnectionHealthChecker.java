package ledgerstore.health;

import java.time.Clock;
import java.util.Objects;

import ledgerstore.ConnectionManager;
import ledgerstore.Deadline;

/**
 * Health probe for the primary store connection.
 *
 * <p>A missing manager (storage never configured) is reported as {@code UNHEALTHY} instead of
 * failing the caller.
 */
public final class ConnectionHealthChecker implements DependencyChecker {
  private final ConnectionManager manager;
  private final String name;
  private final Clock clock;

  public ConnectionHealthChecker(ConnectionManager manager) {
    this(manager, manager == null ? ConnectionManager.DEFAULT_NAME : manager.name(),
        Clock.systemUTC());
  }

  ConnectionHealthChecker(ConnectionManager manager, String name, Clock clock) {
    this.manager = manager;
    this.name = Objects.requireNonNull(name, "name");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public DependencyHealth check(Deadline deadline) {
    if (manager == null) {
      return DependencyHealth.builder(name, DependencyType.DATABASE)
          .critical(true)
          .lastCheck(clock.instant())
          .unhealthy("Store connection manager not initialized", "manager not initialized")
          .build();
    }
    return manager.checkHealth(deadline);
  }
}

package ledgerstore.jdbc.migration;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import ledgerstore.Deadline;
import ledgerstore.health.DependencyChecker;
import ledgerstore.health.DependencyHealth;
import ledgerstore.health.DependencyType;
import ledgerstore.health.HealthStatus;

/**
 * Reports schema migration state as a non-critical dependency.
 *
 * <p>Pending migrations are {@code HEALTHY} when the service applies them on boot and
 * {@code DEGRADED} otherwise, since an operator has to run them. A status read that fails is
 * also {@code DEGRADED}; the connection probe is the one that reports the store as down.
 */
public final class MigrationHealthChecker implements DependencyChecker {
  public static final String NAME = "database-migrations";

  private static final int PENDING_SHOWN = 3;
  private static final int RECENT_SHOWN = 2;

  private final MigrationRunner runner;
  private final boolean runOnBoot;
  private final Clock clock;

  public MigrationHealthChecker(MigrationRunner runner) {
    this(runner, runner.config().runOnBoot(), Clock.systemUTC());
  }

  public MigrationHealthChecker(MigrationRunner runner, boolean runOnBoot, Clock clock) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.runOnBoot = runOnBoot;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public DependencyHealth check(Deadline deadline) {
    long startNanos = System.nanoTime();
    Instant now = clock.instant();
    DependencyHealth.Builder builder = DependencyHealth.builder(NAME, DependencyType.DATABASE)
        .critical(false)
        .lastCheck(now);

    MigrationStatus status;
    try {
      status = runner.status(deadline);
    } catch (RuntimeException e) {
      return builder
          .status(HealthStatus.DEGRADED)
          .message("Failed to check migration status")
          .error(e.getMessage())
          .responseTimeMs(elapsedMs(startNanos))
          .build();
    }

    HealthStatus health;
    String verdict;
    if (status.isUpToDate()) {
      health = HealthStatus.HEALTHY;
      verdict = status.summary();
    } else if (runOnBoot) {
      health = HealthStatus.HEALTHY;
      verdict = status.summary() + " (auto-migration enabled)";
    } else {
      health = HealthStatus.DEGRADED;
      verdict = status.summary() + " (manual migration required)";
    }

    StringBuilder message = new StringBuilder(verdict)
        .append(" | Applied: ").append(status.appliedCount())
        .append(", Pending: ").append(status.pendingCount())
        .append(", Total: ").append(status.total());
    if (!status.pending().isEmpty()) {
      message.append(" | Pending: ").append(status.pending().stream()
          .limit(PENDING_SHOWN)
          .map(Migration::id)
          .collect(Collectors.joining(", ")));
      if (status.pendingCount() > PENDING_SHOWN) {
        message.append(" (+").append(status.pendingCount() - PENDING_SHOWN).append(" more)");
      }
    }
    if (!status.applied().isEmpty()) {
      List<MigrationRecord> applied = status.applied();
      message.append(" | Recent: ").append(applied.subList(Math.max(0, applied.size() - RECENT_SHOWN), applied.size())
          .stream()
          .map(MigrationRecord::id)
          .collect(Collectors.joining(", ")));
    }
    if (!status.drifted().isEmpty()) {
      message.append(" | Drift: ").append(String.join(", ", status.drifted()));
    }

    return builder
        .status(health)
        .message(message.toString())
        .lastSuccess(health == HealthStatus.HEALTHY ? now : null)
        .responseTimeMs(elapsedMs(startNanos))
        .build();
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}

package ledgerstore.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import ledgerstore.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code ledgerstore.connect.attempts} / {@code ledgerstore.connect.failures}</li>
 *   <li>{@code ledgerstore.session.lost}: health checks that found the session gone</li>
 *   <li>{@code ledgerstore.health.checks} tagged {@code outcome=healthy|unhealthy}</li>
 *   <li>{@code ledgerstore.update.conflicts}: updates that lost the version race</li>
 *   <li>{@code ledgerstore.migrations.applied} / {@code ledgerstore.migrations.failed}</li>
 * </ul>
 *
 * <h3>Gauges and summaries</h3>
 * <ul>
 *   <li>{@code ledgerstore.sessions.active}: leases currently held</li>
 *   <li>{@code ledgerstore.health.duration.ms}: health check latency, reconnects included</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter connectAttempts;
  private final Counter connectFailures;
  private final Counter sessionLost;
  private final Counter healthChecksHealthy;
  private final Counter healthChecksUnhealthy;
  private final Counter updateConflicts;
  private final Counter migrationsApplied;
  private final Counter migrationsFailed;
  private final DistributionSummary healthDuration;
  private final Gauge activeSessionsGauge;

  private final AtomicInteger activeSessions = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "ledgerstore");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "payments.ledgerstore"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.connectAttempts = Counter.builder(namePrefix + ".connect.attempts")
        .description("Store session open attempts")
        .register(registry);
    this.connectFailures = Counter.builder(namePrefix + ".connect.failures")
        .description("Store session open attempts that failed")
        .register(registry);
    this.sessionLost = Counter.builder(namePrefix + ".session.lost")
        .description("Health checks that found the store session lost")
        .register(registry);
    this.healthChecksHealthy = Counter.builder(namePrefix + ".health.checks")
        .tag("outcome", "healthy")
        .description("Store health checks")
        .register(registry);
    this.healthChecksUnhealthy = Counter.builder(namePrefix + ".health.checks")
        .tag("outcome", "unhealthy")
        .description("Store health checks")
        .register(registry);
    this.updateConflicts = Counter.builder(namePrefix + ".update.conflicts")
        .description("Updates rejected by the optimistic version check")
        .register(registry);
    this.migrationsApplied = Counter.builder(namePrefix + ".migrations.applied")
        .description("Migration scripts applied")
        .register(registry);
    this.migrationsFailed = Counter.builder(namePrefix + ".migrations.failed")
        .description("Migration scripts that failed")
        .register(registry);
    this.healthDuration = DistributionSummary.builder(namePrefix + ".health.duration.ms")
        .description("Store health check duration")
        .baseUnit("milliseconds")
        .register(registry);
    this.activeSessionsGauge = Gauge.builder(namePrefix + ".sessions.active", activeSessions, AtomicInteger::get)
        .description("Store session leases currently held")
        .register(registry);
  }

  @Override
  public void incrementConnectAttempt() {
    if (closed) return;
    connectAttempts.increment();
  }

  @Override
  public void incrementConnectFailure() {
    if (closed) return;
    connectFailures.increment();
  }

  @Override
  public void incrementSessionLost() {
    if (closed) return;
    sessionLost.increment();
  }

  @Override
  public void recordHealthCheck(boolean healthy, long durationMs) {
    if (closed) return;
    (healthy ? healthChecksHealthy : healthChecksUnhealthy).increment();
    healthDuration.record(Math.max(0L, durationMs));
  }

  @Override
  public void recordActiveSessions(int active) {
    if (closed) return;
    activeSessions.set(Math.max(0, active));
  }

  @Override
  public void incrementVersionConflict() {
    if (closed) return;
    updateConflicts.increment();
  }

  @Override
  public void incrementMigrationApplied() {
    if (closed) return;
    migrationsApplied.increment();
  }

  @Override
  public void incrementMigrationFailed() {
    if (closed) return;
    migrationsFailed.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(connectAttempts, connectFailures, sessionLost,
        healthChecksHealthy, healthChecksUnhealthy, updateConflicts,
        migrationsApplied, migrationsFailed, healthDuration, activeSessionsGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

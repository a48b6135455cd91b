package ledgerstore.health;

import java.time.Instant;
import java.util.Objects;

/**
 * Health report for one dependency, shaped for the external health service.
 *
 * @param name           dependency name, for example {@code ledgerstore-primary}
 * @param type           dependency category
 * @param critical       whether the service is unusable without this dependency
 * @param status         current status
 * @param message        human-readable summary
 * @param poolInfo       connection pool snapshot, or {@code null} when not applicable
 * @param lastSuccess    last time the dependency was seen healthy, or {@code null}
 * @param lastCheck      when this report was produced
 * @param responseTimeMs time spent producing this report
 * @param error          failure text, {@code null} unless the check failed
 */
public record DependencyHealth(
    String name,
    DependencyType type,
    boolean critical,
    HealthStatus status,
    String message,
    PoolInfo poolInfo,
    Instant lastSuccess,
    Instant lastCheck,
    long responseTimeMs,
    String error
) {
  public DependencyHealth {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(lastCheck, "lastCheck");
    message = message == null ? "" : message;
  }

  public static Builder builder(String name, DependencyType type) {
    return new Builder(name, type);
  }

  public static final class Builder {
    private final String name;
    private final DependencyType type;
    private boolean critical;
    private HealthStatus status = HealthStatus.UNHEALTHY;
    private String message;
    private PoolInfo poolInfo;
    private Instant lastSuccess;
    private Instant lastCheck;
    private long responseTimeMs;
    private String error;

    private Builder(String name, DependencyType type) {
      this.name = Objects.requireNonNull(name, "name");
      this.type = Objects.requireNonNull(type, "type");
    }

    public Builder critical(boolean critical) {
      this.critical = critical;
      return this;
    }

    public Builder status(HealthStatus status) {
      this.status = status;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder poolInfo(PoolInfo poolInfo) {
      this.poolInfo = poolInfo;
      return this;
    }

    public Builder lastSuccess(Instant lastSuccess) {
      this.lastSuccess = lastSuccess;
      return this;
    }

    public Builder lastCheck(Instant lastCheck) {
      this.lastCheck = lastCheck;
      return this;
    }

    public Builder responseTimeMs(long responseTimeMs) {
      this.responseTimeMs = responseTimeMs;
      return this;
    }

    public Builder error(String error) {
      this.error = error;
      return this;
    }

    public Builder healthy(String message) {
      this.status = HealthStatus.HEALTHY;
      this.message = message;
      this.error = null;
      return this;
    }

    public Builder unhealthy(String message, String error) {
      this.status = HealthStatus.UNHEALTHY;
      this.message = message;
      this.error = error == null || error.isEmpty() ? message : error;
      return this;
    }

    public DependencyHealth build() {
      return new DependencyHealth(name, type, critical, status, message, poolInfo, lastSuccess,
          lastCheck == null ? Instant.now() : lastCheck, responseTimeMs, error);
    }
  }
}
